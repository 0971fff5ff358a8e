package com.bit.account.structure.execution;

import com.bit.account.common.Address;
import com.bit.account.util.ByteUtils;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;

/**
 * 单个执行单元：(目标, 转账金额, 调用数据)
 */
@Getter
@ToString
@EqualsAndHashCode
public class Execution {

    private final Address target;

    private final BigInteger value;

    private final byte[] callData;

    public Execution(Address target, BigInteger value, byte[] callData) {
        this.target = target;
        this.value = value == null ? BigInteger.ZERO : value;
        this.callData = ByteUtils.nullToEmpty(callData);
    }

    public static Execution of(Address target, byte[] callData) {
        return new Execution(target, BigInteger.ZERO, callData);
    }
}
