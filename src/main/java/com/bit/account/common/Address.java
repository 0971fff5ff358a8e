package com.bit.account.common;

import com.bit.account.util.ByteUtils;
import lombok.EqualsAndHashCode;
import org.bouncycastle.util.BigIntegers;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * 20字节账户地址，统一账户/模块/目标合约的地址表示
 */
@EqualsAndHashCode
public final class Address implements Comparable<Address> {
    public static final int LENGTH = 20;
    public static final Address ZERO = new Address(new byte[LENGTH]);

    private final byte[] value;

    private Address(byte[] value) {
        if (value.length != LENGTH) {
            throw new IllegalArgumentException("地址必须为20字节，实际 " + value.length);
        }
        this.value = value;
    }

    public static Address fromBytes(byte[] bytes) {
        if (bytes == null) {
            throw new NullPointerException("地址字节不能为空");
        }
        return new Address(Arrays.copyOf(bytes, bytes.length));
    }

    public static Address fromHex(String hex) {
        return new Address(ByteUtils.fromHex(hex));
    }

    /**
     * 取 uint256 的高160位作为地址（nonce 携带验证器地址的约定）
     */
    public static Address fromHighBits(BigInteger uint256) {
        if (uint256.signum() < 0 || uint256.bitLength() > 256) {
            throw new IllegalArgumentException("数值超出 uint256 范围");
        }
        return new Address(BigIntegers.asUnsignedByteArray(LENGTH, uint256.shiftRight(96)));
    }

    /**
     * 取字节序列前20字节作为地址，不足部分补零
     */
    public static Address fromPrefix(byte[] data) {
        return new Address(ByteUtils.headPadded(data, LENGTH));
    }

    public byte[] toBytes() {
        return Arrays.copyOf(value, LENGTH);
    }

    /**
     * 放入 uint256 高160位，低96位由调用方填充（如 nonce 序号）
     */
    public BigInteger toHighBits() {
        return new BigInteger(1, value).shiftLeft(96);
    }

    public boolean isZero() {
        for (byte b : value) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }

    public String toHex() {
        return ByteUtils.toHex(value);
    }

    @Override
    public int compareTo(Address other) {
        return Arrays.compareUnsigned(value, other.value);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
