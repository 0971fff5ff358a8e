package com.bit.account.structure.module;

import lombok.Getter;

import java.util.Optional;

/**
 * 模块类别（封闭集合），未知编号一律视为不支持
 */
@Getter
public enum ModuleType {
    VALIDATOR(1, "验证器"),
    EXECUTOR(2, "执行器"),
    FALLBACK(3, "回退处理器"),
    HOOK(4, "钩子"),
    // 签名校验面（isValidSignature）的预校验钩子
    PRE_VALIDATION_HOOK_SIG(8, "签名预校验钩子"),
    // 交易授权面（validateUserOp）的预校验钩子
    PRE_VALIDATION_HOOK_OP(9, "交易预校验钩子");

    private final long id;
    private final String desc;

    ModuleType(long id, String desc) {
        this.id = id;
        this.desc = desc;
    }

    public static Optional<ModuleType> fromId(long id) {
        for (ModuleType e : values()) {
            if (e.id == id) {
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }

    public boolean isPreValidationHook() {
        return this == PRE_VALIDATION_HOOK_SIG || this == PRE_VALIDATION_HOOK_OP;
    }
}
