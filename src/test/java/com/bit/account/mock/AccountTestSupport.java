package com.bit.account.mock;

import com.bit.account.account.Invocation;
import com.bit.account.account.SmartAccount;
import com.bit.account.account.SmartAccountFactory;
import com.bit.account.account.execution.PackedExecutionCodec;
import com.bit.account.common.Address;
import com.bit.account.module.ModuleRegistryGate;
import com.bit.account.module.impl.ModuleDirectory;
import com.bit.account.module.spi.Module;
import com.bit.account.structure.module.ModuleType;
import com.bit.account.util.Secp256k1SignatureRecoverer;
import com.bit.account.util.Secp256k1Signer;
import com.bit.account.vm.impl.LocalChainVm;
import org.bitcoinj.core.ECKey;

import java.math.BigInteger;

/**
 * 账户测试夹具：内存执行原语 + 模块目录 + 以 ownerKey 地址创建的账户
 */
public class AccountTestSupport {

    public static final Address ENTRY_POINT = Address.fromHex("0x0000000071727De22E5E9d8BAf0edAc6f37da032");

    public static final String ACCOUNT_ID = "bit.smart-account.test";

    public final LocalChainVm vm = new LocalChainVm();

    public final ModuleDirectory directory = new ModuleDirectory();

    public final ECKey ownerKey = ECKey.fromPrivate(new BigInteger("4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318", 16));

    public final Address accountAddress = Secp256k1Signer.toAddress(ownerKey);

    public final PackedExecutionCodec codec = new PackedExecutionCodec();

    public final SmartAccountFactory factory;

    public final SmartAccount account;

    public AccountTestSupport() {
        this(ModuleRegistryGate.ALLOW_ALL);
    }

    public AccountTestSupport(ModuleRegistryGate gate) {
        this.factory = new SmartAccountFactory(vm, directory, gate, new Secp256k1SignatureRecoverer(100, 1),
                codec, ENTRY_POINT, ACCOUNT_ID);
        this.account = factory.create(accountAddress);
    }

    /**
     * 测试地址：0xaa 前缀 + 序号
     */
    public static Address address(int n) {
        byte[] bytes = new byte[Address.LENGTH];
        bytes[0] = (byte) 0xAA;
        bytes[18] = (byte) (n >> 8);
        bytes[19] = (byte) n;
        return Address.fromBytes(bytes);
    }

    public static Invocation fromEntryPoint() {
        return Invocation.of(ENTRY_POINT);
    }

    public Invocation fromSelf() {
        return Invocation.of(accountAddress);
    }

    public <T extends Module> T register(Address address, T module) {
        factory.registerModule(address, module);
        return module;
    }

    public void install(ModuleType type, Address module, byte[] initData) {
        account.installModule(fromEntryPoint(), type.getId(), module, initData);
    }

    public void install(ModuleType type, Address module) {
        install(type, module, new byte[0]);
    }

    /**
     * 账户密钥对32字节哈希签名
     */
    public byte[] signAsOwner(byte[] hash32) {
        return Secp256k1Signer.sign(ownerKey.getPrivKeyBytes(), hash32);
    }
}
