package com.bit.account.structure.mode;

import lombok.Getter;

import java.util.Optional;

/**
 * 执行类型（模式描述符第1字节）：DEFAULT 失败即中止，TRY 失败记事件后继续
 */
@Getter
public enum ExecType {
    DEFAULT((byte) 0x00),
    TRY((byte) 0x01);

    private final byte code;

    ExecType(byte code) {
        this.code = code;
    }

    public static Optional<ExecType> fromCode(byte code) {
        for (ExecType e : values()) {
            if (e.code == code) {
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }
}
