package com.bit.account.common;

import com.bit.account.util.ByteUtils;
import com.bit.account.util.Sha;
import lombok.EqualsAndHashCode;

import java.util.Arrays;

/**
 * 4字节函数/错误选择器：keccak256(签名) 的前4字节
 */
@EqualsAndHashCode
public final class FunctionSelector {
    public static final int LENGTH = 4;
    public static final FunctionSelector ZERO = new FunctionSelector(new byte[LENGTH]);

    private final byte[] value;

    private FunctionSelector(byte[] value) {
        this.value = value;
    }

    public static FunctionSelector of(String signature) {
        byte[] hash = Sha.keccak256(signature.getBytes(java.nio.charset.StandardCharsets.US_ASCII));
        return new FunctionSelector(Arrays.copyOf(hash, LENGTH));
    }

    public static FunctionSelector fromBytes(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("选择器必须为4字节");
        }
        return new FunctionSelector(Arrays.copyOf(bytes, LENGTH));
    }

    /**
     * 从调用数据头部读取选择器，不足4字节时右侧补零
     */
    public static FunctionSelector fromCallData(byte[] callData) {
        return new FunctionSelector(ByteUtils.headPadded(callData, LENGTH));
    }

    public byte[] toBytes() {
        return Arrays.copyOf(value, LENGTH);
    }

    public boolean isZero() {
        return Arrays.equals(value, ZERO.value);
    }

    @Override
    public String toString() {
        return ByteUtils.toHex(value);
    }
}
