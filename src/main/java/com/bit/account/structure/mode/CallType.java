package com.bit.account.structure.mode;

import lombok.Getter;

import java.util.Optional;

/**
 * 调用类型（模式描述符第0字节）
 */
@Getter
public enum CallType {
    SINGLE((byte) 0x00),
    BATCH((byte) 0x01),
    // 仅用于回退处理器路由，不是可执行的调用类型
    STATIC((byte) 0xFE),
    DELEGATECALL((byte) 0xFF);

    private final byte code;

    CallType(byte code) {
        this.code = code;
    }

    /** 根据code反向查找枚举，未知编码返回空 */
    public static Optional<CallType> fromCode(byte code) {
        for (CallType e : values()) {
            if (e.code == code) {
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }

    /**
     * 是否为执行入口支持的调用类型
     */
    public boolean isExecutable() {
        return this != STATIC;
    }
}
