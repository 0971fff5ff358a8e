package com.bit.account.common;

import com.bit.account.util.ByteUtils;
import lombok.EqualsAndHashCode;

import java.util.Arrays;

/**
 * 32字节哈希（挑战值、userOpHash、消息摘要），不可变
 */
@EqualsAndHashCode(of = "value")
public final class Hash32 {
    public static final int HASH_LENGTH = 32;

    private final byte[] value;
    // 缓存十六进制字符串（避免重复计算）
    private final String hexValue;

    private Hash32(byte[] value) {
        if (value == null) {
            throw new NullPointerException("Hash value cannot be null");
        }
        if (value.length != HASH_LENGTH) {
            throw new IllegalArgumentException("Hash must be " + HASH_LENGTH + " bytes, got " + value.length);
        }
        this.value = Arrays.copyOf(value, HASH_LENGTH); // 防御性拷贝
        this.hexValue = ByteUtils.toHex(this.value);
    }

    public static Hash32 wrap(byte[] value) {
        return new Hash32(value);
    }

    public static Hash32 fromHex(String hex) {
        return new Hash32(ByteUtils.fromHex(hex));
    }

    /**
     * 获取原始字节数组（返回拷贝，确保不可变性）
     */
    public byte[] getBytes() {
        return Arrays.copyOf(value, HASH_LENGTH);
    }

    public String toHex() {
        return hexValue;
    }

    @Override
    public String toString() {
        return hexValue;
    }
}
