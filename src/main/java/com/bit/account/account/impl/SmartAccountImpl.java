package com.bit.account.account.impl;

import com.bit.account.account.AccountCallData;
import com.bit.account.account.AccountState;
import com.bit.account.account.AccountStateView;
import com.bit.account.account.FallbackBinding;
import com.bit.account.account.Invocation;
import com.bit.account.account.SmartAccount;
import com.bit.account.account.auth.AuthorizationEngine;
import com.bit.account.account.execution.ExecutionCodec;
import com.bit.account.account.execution.ExecutionDispatchEngine;
import com.bit.account.account.hook.HookWrapper;
import com.bit.account.account.module.ModuleLifecycleRouter;
import com.bit.account.account.redelegation.RedelegationGuard;
import com.bit.account.common.Address;
import com.bit.account.common.FunctionSelector;
import com.bit.account.common.Hash32;
import com.bit.account.exception.AccountException;
import com.bit.account.exception.ErrorType;
import com.bit.account.module.ModuleLocator;
import com.bit.account.module.ModuleRegistryGate;
import com.bit.account.structure.event.ModuleInstalledEvent;
import com.bit.account.structure.event.ModuleUninstalledEvent;
import com.bit.account.structure.mode.CallType;
import com.bit.account.structure.mode.ExecutionMode;
import com.bit.account.structure.module.ModuleRecord;
import com.bit.account.structure.module.ModuleType;
import com.bit.account.structure.userop.PackedUserOperation;
import com.bit.account.util.ByteUtils;
import com.bit.account.util.SignatureRecoverer;
import com.bit.account.vm.CallResult;
import com.bit.account.vm.ChainVm;
import com.bit.account.vm.RevertException;
import com.google.common.collect.ImmutableSet;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

@Slf4j
public class SmartAccountImpl implements SmartAccount {

    // 未绑定回退处理器时，代币回调默认接受
    private static final Set<FunctionSelector> TOKEN_RECEIVERS = ImmutableSet.of(
            FunctionSelector.of("onERC721Received(address,address,uint256,bytes)"),
            FunctionSelector.of("onERC1155Received(address,address,uint256,uint256,bytes)"),
            FunctionSelector.of("onERC1155BatchReceived(address,address,uint256[],uint256[],bytes)"));

    private final AccountState state;

    private final Address entryPoint;

    private final String accountId;

    private final ChainVm vm;

    private final ModuleRegistryGate gate;

    private final HookWrapper hookWrapper;

    private final ModuleLifecycleRouter router;

    private final AuthorizationEngine authorizationEngine;

    private final ExecutionDispatchEngine dispatchEngine;

    private final RedelegationGuard redelegationGuard;

    public SmartAccountImpl(Address account, Address entryPoint, String accountId, ChainVm vm,
                            ModuleLocator locator, ModuleRegistryGate gate,
                            SignatureRecoverer recoverer, ExecutionCodec codec) {
        this.state = new AccountState(account);
        this.entryPoint = entryPoint;
        this.accountId = accountId;
        this.vm = vm;
        this.gate = gate;
        this.hookWrapper = new HookWrapper(locator);
        this.router = new ModuleLifecycleRouter(locator, gate);
        this.authorizationEngine = new AuthorizationEngine(locator, recoverer);
        this.dispatchEngine = new ExecutionDispatchEngine(vm, codec);
        this.redelegationGuard = new RedelegationGuard(vm, router);
    }

    @Override
    public Address getAddress() {
        return state.getAccount();
    }

    @Override
    public String accountId() {
        return accountId;
    }

    // ------------------------------ 执行 ------------------------------

    @Override
    public void execute(Invocation invocation, ExecutionMode mode, byte[] payload) {
        requireEntryPointOrSelf(invocation);
        byte[] msgData = AccountCallData.encodeExecute(mode, ByteUtils.nullToEmpty(payload));
        atomically(() -> hookWrapper.withHook(state, invocation.getSender(), invocation.getValue(), msgData,
                () -> dispatchEngine.execute(getAddress(), invocation.getSender(), mode, payload)));
    }

    @Override
    public List<byte[]> executeFromExecutor(Invocation invocation, ExecutionMode mode, byte[] payload) {
        Address executor = invocation.getSender();
        if (!state.isModuleInstalled(ModuleType.EXECUTOR, executor)) {
            throw new AccountException(ErrorType.INVALID_MODULE, "调用方 " + executor + " 不是已安装的执行器");
        }
        if (!gate.authorize(executor, ModuleType.EXECUTOR)) {
            throw new AccountException(ErrorType.MODULE_NOT_ATTESTED, "执行器 " + executor + " 未获得证明");
        }
        byte[] msgData = AccountCallData.encodeExecuteFromExecutor(mode, ByteUtils.nullToEmpty(payload));
        return atomically(() -> hookWrapper.withHook(state, executor, invocation.getValue(), msgData,
                () -> dispatchEngine.execute(getAddress(), executor, mode, payload)));
    }

    @Override
    public void executeUserOp(Invocation invocation, PackedUserOperation userOp, Hash32 userOpHash) {
        requireEntryPoint(invocation);
        byte[] inner = ByteUtils.tail(userOp.getCallData(), FunctionSelector.LENGTH);
        atomically(() -> {
            CallResult result = vm.delegateCall(getAddress(), invocation.getSender(), getAddress(), inner);
            if (!result.isSuccess()) {
                throw new AccountException(ErrorType.EXECUTION_FAILED,
                        "userOp " + userOpHash + " 执行失败，回滚数据 " + ByteUtils.toHex(result.getReturnData()));
            }
            return null;
        });
    }

    @Override
    public boolean supportsExecutionMode(ExecutionMode mode) {
        return mode.isSupported();
    }

    // ------------------------------ 模块 ------------------------------

    @Override
    public void installModule(Invocation invocation, long moduleTypeId, Address module, byte[] initData) {
        requireEntryPointOrSelf(invocation);
        byte[] msgData = AccountCallData.encodeInstallModule(moduleTypeId, module == null ? Address.ZERO : module, initData);
        atomically(() -> hookWrapper.withHook(state, invocation.getSender(), invocation.getValue(), msgData, () -> {
            installAndEmit(moduleTypeId, module, initData);
            return null;
        }));
    }

    @Override
    public void uninstallModule(Invocation invocation, long moduleTypeId, Address module, byte[] deInitData) {
        requireEntryPointOrSelf(invocation);
        byte[] msgData = AccountCallData.encodeUninstallModule(moduleTypeId, module == null ? Address.ZERO : module, deInitData);
        atomically(() -> hookWrapper.withHook(state, invocation.getSender(), invocation.getValue(), msgData, () -> {
            ModuleType type = router.uninstall(state, moduleTypeId, module, deInitData);
            vm.emit(getAddress(), new ModuleUninstalledEvent(type.getId(), module));
            return null;
        }));
    }

    @Override
    public boolean isModuleInstalled(long moduleTypeId, Address module, byte[] additionalContext) {
        return router.isModuleInstalled(state, moduleTypeId, module, additionalContext);
    }

    @Override
    public boolean supportsModule(long moduleTypeId) {
        return router.supportsModule(moduleTypeId);
    }

    // ------------------------------ 授权 ------------------------------

    @Override
    public BigInteger validateUserOp(Invocation invocation, PackedUserOperation userOp, Hash32 userOpHash,
                                     BigInteger missingAccountFunds) {
        requireEntryPoint(invocation);
        return atomically(() -> {
            payPrefund(missingAccountFunds);
            return authorizationEngine.validateUserOp(state, userOp, userOpHash, missingAccountFunds);
        });
    }

    @Override
    public int isValidSignature(Address sender, Hash32 hash, byte[] signature) {
        return authorizationEngine.isValidSignature(state, sender, hash, signature);
    }

    // ------------------------------ 生命周期 ------------------------------

    @Override
    public void initializeAccount(Invocation invocation, List<ModuleRecord> modules) {
        requireEntryPointOrSelf(invocation);
        if (state.isInitialized()) {
            throw new AccountException(ErrorType.ACCOUNT_ALREADY_INITIALIZED, "账户 " + getAddress() + " 已初始化");
        }
        atomically(() -> {
            for (ModuleRecord record : modules) {
                installAndEmit(record.getModuleTypeId(), record.getModule(), record.getInitData());
            }
            redelegationGuard.record(state);
            state.markInitialized();
            return null;
        });
        if (!state.hasValidators()) {
            log.warn("账户 {} 初始化时未安装任何验证器，引导回退已不可用", getAddress());
        }
        log.info("账户 {} 初始化完成，安装模块 {} 个，委托实现 {}", getAddress(), modules.size(),
                state.getDelegate().orElse(null));
    }

    @Override
    public boolean onRedelegation(Invocation invocation) {
        requireEntryPointOrSelf(invocation);
        return atomically(() -> redelegationGuard.checkAndPurge(state));
    }

    @Override
    public byte[] fallback(Invocation invocation, byte[] callData) {
        byte[] data = ByteUtils.nullToEmpty(callData);
        FunctionSelector selector = FunctionSelector.fromCallData(data);
        return atomically(() -> hookWrapper.withHook(state, invocation.getSender(), invocation.getValue(), data,
                () -> route(invocation, selector, data)));
    }

    @Override
    public boolean isInitialized() {
        return state.isInitialized();
    }

    @Override
    public AccountStateView getState() {
        return state;
    }

    // ------------------------------ 内部 ------------------------------

    private byte[] route(Invocation invocation, FunctionSelector selector, byte[] data) {
        FallbackBinding binding = state.getFallback(selector).orElse(null);
        if (binding == null) {
            if (TOKEN_RECEIVERS.contains(selector)) {
                return ByteUtils.headPadded(selector.toBytes(), 32);
            }
            throw new AccountException(ErrorType.MISSING_FALLBACK_HANDLER, "选择器 " + selector);
        }
        // ERC-2771：末尾追加原始调用方
        byte[] forwarded = ByteUtils.concat(data, invocation.getSender().toBytes());
        CallResult result = binding.getCallType() == CallType.STATIC
                ? vm.staticCall(getAddress(), binding.getHandler(), forwarded)
                : vm.call(getAddress(), binding.getHandler(), BigInteger.ZERO, forwarded);
        if (!result.isSuccess()) {
            throw new RevertException(result.getReturnData());
        }
        return result.getReturnData();
    }

    private void installAndEmit(long moduleTypeId, Address module, byte[] initData) {
        router.install(state, moduleTypeId, module, initData);
        vm.emit(getAddress(), new ModuleInstalledEvent(moduleTypeId, module));
    }

    private void payPrefund(BigInteger missingAccountFunds) {
        if (missingAccountFunds == null || missingAccountFunds.signum() <= 0) {
            return;
        }
        CallResult result = vm.call(getAddress(), entryPoint, missingAccountFunds, ByteUtils.EMPTY);
        if (!result.isSuccess()) {
            log.warn("账户 {} 预付 {} 给协调者失败，由协调者判定", getAddress(), missingAccountFunds);
        }
    }

    /**
     * 状态副本 + 执行原语快照，异常时两者一起回滚后原样抛出
     */
    private <T> T atomically(Supplier<T> body) {
        AccountState backup = state.copy();
        int snapshot = vm.snapshot();
        try {
            T result = body.get();
            vm.discardSnapshot(snapshot);
            return result;
        } catch (RuntimeException e) {
            vm.revertToSnapshot(snapshot);
            state.restore(backup);
            log.debug("账户 {} 操作中止并回滚：{}", getAddress(), e.getMessage());
            throw e;
        }
    }

    private void requireEntryPoint(Invocation invocation) {
        if (!entryPoint.equals(invocation.getSender())) {
            throw new AccountException(ErrorType.UNAUTHORIZED_CALLER, "调用方 " + invocation.getSender() + " 不是协调者");
        }
    }

    private void requireEntryPointOrSelf(Invocation invocation) {
        Address sender = invocation.getSender();
        if (!entryPoint.equals(sender) && !getAddress().equals(sender)) {
            throw new AccountException(ErrorType.UNAUTHORIZED_CALLER, "调用方 " + sender + " 既不是协调者也不是账户自身");
        }
    }
}
