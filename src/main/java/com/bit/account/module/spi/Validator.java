package com.bit.account.module.spi;

import com.bit.account.common.Address;
import com.bit.account.common.Hash32;
import com.bit.account.structure.userop.PackedUserOperation;

import java.math.BigInteger;

/**
 * 验证器模块：决定某种授权方案（单签、多签、策略）是否通过
 */
public interface Validator extends Module {

    /**
     * 交易授权，返回原始 validationData（可携带时间窗口等语义）
     */
    BigInteger validateUserOp(Address account, PackedUserOperation userOp, Hash32 userOpHash);

    /**
     * 直接签名校验，sender 为发起 isValidSignature 的原始调用方
     * @return 成功返回 {@link com.bit.account.structure.auth.Erc1271#MAGIC_VALUE}
     */
    int isValidSignatureWithSender(Address account, Address sender, Hash32 hash, byte[] signature);
}
