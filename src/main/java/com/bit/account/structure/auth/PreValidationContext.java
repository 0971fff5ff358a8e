package com.bit.account.structure.auth;

import com.bit.account.common.Address;
import com.bit.account.structure.userop.PackedUserOperation;
import lombok.Builder;
import lombok.Getter;

import java.math.BigInteger;

/**
 * 预校验钩子的附加上下文
 * 签名面携带原始调用方 sender；交易面携带 userOp 与预付金额
 */
@Getter
@Builder
public class PreValidationContext {

    private final Address sender;

    private final PackedUserOperation userOp;

    private final BigInteger missingAccountFunds;
}
