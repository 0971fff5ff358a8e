package com.bit.account.account;

import com.bit.account.account.execution.ExecutionCodec;
import com.bit.account.account.impl.SmartAccountCallTarget;
import com.bit.account.account.impl.SmartAccountImpl;
import com.bit.account.common.Address;
import com.bit.account.config.SmartAccountProperties;
import com.bit.account.module.ModuleRegistryGate;
import com.bit.account.module.impl.ModuleDirectory;
import com.bit.account.module.spi.Module;
import com.bit.account.util.SignatureRecoverer;
import com.bit.account.vm.CallTarget;
import com.bit.account.vm.impl.LocalChainVm;
import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 账户与模块的装配入口：创建账户并把账户代码部署到执行原语
 */
@Slf4j
@Component
public class SmartAccountFactory {

    private final Map<Address, SmartAccount> accounts = new ConcurrentHashMap<>();

    private final LocalChainVm vm;

    private final ModuleDirectory directory;

    private final ModuleRegistryGate gate;

    private final SignatureRecoverer recoverer;

    private final ExecutionCodec codec;

    private final Address entryPoint;

    private final String accountId;

    @Autowired
    public SmartAccountFactory(LocalChainVm vm, ModuleDirectory directory, ModuleRegistryGate gate,
                               SignatureRecoverer recoverer, ExecutionCodec codec, SmartAccountProperties properties) {
        this(vm, directory, gate, recoverer, codec, Address.fromHex(properties.getEntryPoint()), properties.getAccountId());
    }

    public SmartAccountFactory(LocalChainVm vm, ModuleDirectory directory, ModuleRegistryGate gate,
                               SignatureRecoverer recoverer, ExecutionCodec codec, Address entryPoint, String accountId) {
        this.vm = vm;
        this.directory = directory;
        this.gate = gate;
        this.recoverer = recoverer;
        this.codec = codec;
        this.entryPoint = entryPoint;
        this.accountId = accountId;
    }

    /**
     * 在地址上创建账户（地址即账户密钥派生的 EOA 地址）
     */
    public SmartAccount create(Address address) {
        Preconditions.checkArgument(!address.isZero(), "账户地址不能为零地址");
        SmartAccount account = new SmartAccountImpl(address, entryPoint, accountId, vm, directory, gate, recoverer, codec);
        // 先占位再部署，并发创建同一地址时只有一个成功
        Preconditions.checkState(accounts.putIfAbsent(address, account) == null, "地址 %s 上已存在账户", address);
        vm.deploy(address, new SmartAccountCallTarget(account));
        log.info("创建智能账户 {}，协调者 {}", address, entryPoint);
        return account;
    }

    public Optional<SmartAccount> find(Address address) {
        return Optional.ofNullable(accounts.get(address));
    }

    /**
     * 登记模块；模块本身可被调用时（如回退处理器）同时部署到执行原语
     */
    public void registerModule(Address address, Module module) {
        directory.register(address, module);
        if (module instanceof CallTarget) {
            vm.deploy(address, (CallTarget) module);
        }
    }

    public Address getEntryPoint() {
        return entryPoint;
    }

    public LocalChainVm getVm() {
        return vm;
    }
}
