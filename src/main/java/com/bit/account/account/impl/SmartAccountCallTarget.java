package com.bit.account.account.impl;

import com.bit.account.account.AccountCallData;
import com.bit.account.account.Invocation;
import com.bit.account.account.SmartAccount;
import com.bit.account.util.ByteUtils;
import com.bit.account.vm.CallFrame;
import com.bit.account.vm.CallTarget;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * 账户在执行原语中的代码：解码账户方法调用并转给账户门面
 * 非账户方法的选择器一律走回退路由
 */
@Slf4j
public class SmartAccountCallTarget implements CallTarget {

    private final SmartAccount account;

    public SmartAccountCallTarget(SmartAccount account) {
        this.account = account;
    }

    @Override
    public byte[] handle(CallFrame frame) {
        if (!account.getAddress().equals(frame.getSelf())) {
            throw new IllegalStateException("账户代码只能在账户 " + account.getAddress() + " 的上下文中执行");
        }
        Invocation invocation = Invocation.of(frame.getSender(), frame.getValue());
        Optional<AccountCallData.Decoded> decoded = AccountCallData.decode(frame.getData());
        if (decoded.isEmpty()) {
            return account.fallback(invocation, frame.getData());
        }
        AccountCallData.Decoded call = decoded.get();
        log.debug("账户 {} 收到调用 {}，调用方 {}", account.getAddress(), call.getMethod(), frame.getSender());
        switch (call.getMethod()) {
            case EXECUTE:
                account.execute(invocation, call.getMode(), call.getData());
                return ByteUtils.EMPTY;
            case EXECUTE_FROM_EXECUTOR:
                return AccountCallData.encodeResults(account.executeFromExecutor(invocation, call.getMode(), call.getData()));
            case INSTALL_MODULE:
                account.installModule(invocation, call.getModuleTypeId(), call.getModule(), call.getData());
                return ByteUtils.EMPTY;
            case UNINSTALL_MODULE:
                account.uninstallModule(invocation, call.getModuleTypeId(), call.getModule(), call.getData());
                return ByteUtils.EMPTY;
            case ON_REDELEGATION:
                return new byte[]{(byte) (account.onRedelegation(invocation) ? 1 : 0)};
            default:
                return account.fallback(invocation, frame.getData());
        }
    }
}
