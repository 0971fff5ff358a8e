package com.bit.account.account.auth;

import com.bit.account.account.AccountStateView;
import com.bit.account.common.Address;
import com.bit.account.exception.AccountException;
import com.bit.account.exception.ErrorType;
import com.bit.account.module.ModuleLocator;
import com.bit.account.module.spi.PreValidationHook;
import com.bit.account.structure.auth.AuthorizationRequest;
import com.bit.account.structure.auth.PreValidationContext;
import com.bit.account.structure.module.ModuleType;
import lombok.extern.slf4j.Slf4j;

/**
 * 预校验管道：按安装顺序依次改写 (挑战值, 签名)
 */
@Slf4j
public class PreValidationPipeline {

    private final ModuleLocator locator;

    public PreValidationPipeline(ModuleLocator locator) {
        this.locator = locator;
    }

    public AuthorizationRequest apply(AccountStateView state, ModuleType surface,
                                      AuthorizationRequest request, PreValidationContext context) {
        if (!surface.isPreValidationHook()) {
            throw new IllegalArgumentException("不是预校验钩子类别: " + surface);
        }
        AuthorizationRequest current = request;
        for (Address address : state.listModules(surface)) {
            PreValidationHook hook = locator.find(address)
                    .filter(PreValidationHook.class::isInstance)
                    .map(PreValidationHook.class::cast)
                    .orElseThrow(() -> new AccountException(ErrorType.INVALID_MODULE,
                            "预校验钩子 " + address + " 无法解析"));
            current = hook.transform(state.getAccount(), surface, current, context);
            log.debug("预校验钩子 {} 改写后挑战值 {}", address, current.getChallenge());
        }
        return current;
    }
}
