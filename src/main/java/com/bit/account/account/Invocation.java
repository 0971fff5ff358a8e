package com.bit.account.account;

import com.bit.account.common.Address;
import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;

/**
 * 一次账户调用的外部上下文：msg.sender 与随调用转入的金额
 */
@Getter
@ToString
public class Invocation {

    private final Address sender;

    private final BigInteger value;

    private Invocation(Address sender, BigInteger value) {
        if (sender == null) {
            throw new NullPointerException("调用方地址不能为空");
        }
        this.sender = sender;
        this.value = value == null ? BigInteger.ZERO : value;
    }

    public static Invocation of(Address sender) {
        return new Invocation(sender, BigInteger.ZERO);
    }

    public static Invocation of(Address sender, BigInteger value) {
        return new Invocation(sender, value);
    }
}
