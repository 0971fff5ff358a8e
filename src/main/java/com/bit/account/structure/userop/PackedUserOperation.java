package com.bit.account.structure.userop;

import com.bit.account.common.Address;
import com.bit.account.util.ByteUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * ERC-4337 打包用户操作
 * nonce 高160位携带验证器地址，低96位为序号键
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PackedUserOperation {

    private Address sender;

    @Builder.Default
    private BigInteger nonce = BigInteger.ZERO;

    @Builder.Default
    private byte[] initCode = ByteUtils.EMPTY;

    @Builder.Default
    private byte[] callData = ByteUtils.EMPTY;

    // verificationGasLimit(16字节) | callGasLimit(16字节)
    @Builder.Default
    private byte[] accountGasLimits = new byte[32];

    @Builder.Default
    private BigInteger preVerificationGas = BigInteger.ZERO;

    // maxPriorityFeePerGas(16字节) | maxFeePerGas(16字节)
    @Builder.Default
    private byte[] gasFees = new byte[32];

    @Builder.Default
    private byte[] paymasterAndData = ByteUtils.EMPTY;

    @Builder.Default
    private byte[] signature = ByteUtils.EMPTY;

    /**
     * 以验证器地址和序号键组装 nonce
     */
    public static BigInteger nonceFor(Address validator, long sequence) {
        return validator.toHighBits().or(BigInteger.valueOf(sequence));
    }

    /**
     * 替换签名后的副本，原对象保持不变
     */
    public PackedUserOperation withSignature(byte[] newSignature) {
        return toBuilder().signature(ByteUtils.nullToEmpty(newSignature)).build();
    }
}
