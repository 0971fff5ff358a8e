package com.bit.account.account.hook;

import com.bit.account.account.AccountStateView;
import com.bit.account.common.Address;
import com.bit.account.exception.AccountException;
import com.bit.account.exception.ErrorType;
import com.bit.account.module.ModuleLocator;
import com.bit.account.module.spi.Hook;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 特权操作的钩子包装：preCheck -> 操作体 -> postCheck
 * 钩子在操作体执行前确定，操作体中卸载或更换钩子不影响本次的 postCheck 对象
 * 操作体抛出异常时整个调用中止，不执行 postCheck
 */
@Slf4j
public class HookWrapper {

    private final ModuleLocator locator;

    public HookWrapper(ModuleLocator locator) {
        this.locator = locator;
    }

    public <T> T withHook(AccountStateView state, Address msgSender, BigInteger msgValue, byte[] msgData, Supplier<T> body) {
        Optional<Address> hookAddress = state.getHook();
        if (hookAddress.isEmpty()) {
            return body.get();
        }
        Hook hook = resolve(hookAddress.get());
        Address account = state.getAccount();
        byte[] hookData = hook.preCheck(account, msgSender, msgValue, msgData);
        T result = body.get();
        hook.postCheck(account, hookData);
        log.debug("账户 {} 钩子 {} 前后置检查完成", account, hookAddress.get());
        return result;
    }

    private Hook resolve(Address address) {
        return locator.find(address)
                .filter(Hook.class::isInstance)
                .map(Hook.class::cast)
                .orElseThrow(() -> new AccountException(ErrorType.INVALID_MODULE, "钩子 " + address + " 无法解析"));
    }
}
