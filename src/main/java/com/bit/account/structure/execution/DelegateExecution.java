package com.bit.account.structure.execution;

import com.bit.account.common.Address;
import com.bit.account.exception.AccountException;
import com.bit.account.exception.ErrorType;
import com.bit.account.util.ByteUtils;
import lombok.Getter;
import lombok.ToString;

import java.util.Arrays;

/**
 * 委托执行单元：载荷前20字节为委托目标地址，其余为调用数据
 */
@Getter
@ToString
public class DelegateExecution {

    private final Address delegate;

    private final byte[] callData;

    public DelegateExecution(Address delegate, byte[] callData) {
        this.delegate = delegate;
        this.callData = ByteUtils.nullToEmpty(callData);
    }

    public static DelegateExecution split(byte[] payload) {
        if (payload == null || payload.length < Address.LENGTH) {
            throw new AccountException(ErrorType.INVALID_EXECUTION_PAYLOAD,
                    "委托执行载荷不足20字节，实际 " + (payload == null ? 0 : payload.length));
        }
        return new DelegateExecution(
                Address.fromBytes(Arrays.copyOf(payload, Address.LENGTH)),
                ByteUtils.tail(payload, Address.LENGTH));
    }

    public byte[] encode() {
        return ByteUtils.concat(delegate.toBytes(), callData);
    }
}
