package com.bit.account.account;

import com.bit.account.common.Address;
import com.bit.account.common.Hash32;
import com.bit.account.structure.mode.ExecutionMode;
import com.bit.account.structure.module.ModuleRecord;
import com.bit.account.structure.userop.PackedUserOperation;

import java.math.BigInteger;
import java.util.List;

/**
 * 模块化智能账户
 * 所有修改状态的操作要么完整生效，要么抛出异常且不留下任何状态与事件
 */
public interface SmartAccount {

    Address getAddress();

    /**
     * 账户实现标识 vendor.variant.version
     */
    String accountId();

    // ------------------------------ 执行 ------------------------------

    /**
     * 协调者或账户自身发起的执行
     */
    void execute(Invocation invocation, ExecutionMode mode, byte[] payload);

    /**
     * 已安装执行器代表账户发起的执行
     * @return 每个执行单元的返回数据
     */
    List<byte[]> executeFromExecutor(Invocation invocation, ExecutionMode mode, byte[] payload);

    /**
     * 协调者专用：把 userOp.callData 去掉前4字节后委托调用回账户自身
     */
    void executeUserOp(Invocation invocation, PackedUserOperation userOp, Hash32 userOpHash);

    boolean supportsExecutionMode(ExecutionMode mode);

    // ------------------------------ 模块 ------------------------------

    void installModule(Invocation invocation, long moduleTypeId, Address module, byte[] initData);

    void uninstallModule(Invocation invocation, long moduleTypeId, Address module, byte[] deInitData);

    boolean isModuleInstalled(long moduleTypeId, Address module, byte[] additionalContext);

    boolean supportsModule(long moduleTypeId);

    // ------------------------------ 授权 ------------------------------

    /**
     * 协调者专用：先补足预付金额，再做交易授权
     * @return 原始 validationData
     */
    BigInteger validateUserOp(Invocation invocation, PackedUserOperation userOp, Hash32 userOpHash,
                              BigInteger missingAccountFunds);

    /**
     * 直接签名校验（ERC-1271），无访问限制、无副作用
     */
    int isValidSignature(Address sender, Hash32 hash, byte[] signature);

    // ------------------------------ 生命周期 ------------------------------

    /**
     * 一次性初始化：安装初始模块并记录当前委托实现
     */
    void initializeAccount(Invocation invocation, List<ModuleRecord> modules);

    /**
     * 委托实现变更检查
     * @return 发生清理时返回 true
     */
    boolean onRedelegation(Invocation invocation);

    /**
     * 账户未实现的选择器，转发给绑定的回退处理器
     */
    byte[] fallback(Invocation invocation, byte[] callData);

    boolean isInitialized();

    AccountStateView getState();
}
