package com.bit.account.module.spi;

import com.bit.account.common.Address;
import com.bit.account.structure.auth.AuthorizationRequest;
import com.bit.account.structure.auth.PreValidationContext;
import com.bit.account.structure.module.ModuleType;

/**
 * 预校验钩子：验证器调用前改写 (挑战值, 签名)
 */
public interface PreValidationHook extends Module {

    /**
     * @param surface {@link ModuleType#PRE_VALIDATION_HOOK_SIG} 或 {@link ModuleType#PRE_VALIDATION_HOOK_OP}
     */
    AuthorizationRequest transform(Address account, ModuleType surface,
                                   AuthorizationRequest request, PreValidationContext context);
}
