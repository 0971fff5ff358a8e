package com.bit.account.structure.auth;

import com.bit.account.common.Address;
import lombok.Getter;
import lombok.ToString;
import org.bouncycastle.util.BigIntegers;

import java.math.BigInteger;

/**
 * 交易授权面的验证结果（uint256）
 * +----------------------+----------------------+--------------------------+
 * | validAfter(48位)     | validUntil(48位)     | authorizer(160位)        |
 * +----------------------+----------------------+--------------------------+
 * authorizer 为0表示签名有效，为1表示签名失败，其他值为聚合器地址
 */
@Getter
@ToString
public class ValidationData {

    public static final BigInteger SUCCESS = BigInteger.ZERO;
    public static final BigInteger FAILURE = BigInteger.ONE;

    private static final BigInteger MASK_160 = BigInteger.ONE.shiftLeft(160).subtract(BigInteger.ONE);
    private static final long MASK_48 = (1L << 48) - 1;

    private final Address authorizer;

    // 0 表示无上限
    private final long validUntil;

    private final long validAfter;

    public ValidationData(Address authorizer, long validUntil, long validAfter) {
        if (validUntil < 0 || validUntil > MASK_48 || validAfter < 0 || validAfter > MASK_48) {
            throw new IllegalArgumentException("时间窗口必须在48位范围内");
        }
        this.authorizer = authorizer;
        this.validUntil = validUntil;
        this.validAfter = validAfter;
    }

    public static ValidationData parse(BigInteger packed) {
        Address authorizer = Address.fromBytes(BigIntegers.asUnsignedByteArray(Address.LENGTH, packed.and(MASK_160)));
        long validUntil = packed.shiftRight(160).longValue() & MASK_48;
        long validAfter = packed.shiftRight(208).longValue() & MASK_48;
        return new ValidationData(authorizer, validUntil, validAfter);
    }

    public static BigInteger pack(boolean signatureFailed, long validUntil, long validAfter) {
        Address authorizer = signatureFailed
                ? Address.fromBytes(BigIntegers.asUnsignedByteArray(Address.LENGTH, BigInteger.ONE))
                : Address.ZERO;
        return new ValidationData(authorizer, validUntil, validAfter).pack();
    }

    public BigInteger pack() {
        return new BigInteger(1, authorizer.toBytes())
                .or(BigInteger.valueOf(validUntil).shiftLeft(160))
                .or(BigInteger.valueOf(validAfter).shiftLeft(208));
    }

    public boolean isSignatureFailed() {
        return new BigInteger(1, authorizer.toBytes()).equals(BigInteger.ONE);
    }
}
