package com.bit.account.structure.event;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * TRY 模式下委托调用失败
 */
@Getter
@ToString
@EqualsAndHashCode
public class TryDelegateCallUnsuccessfulEvent {

    private final byte[] returnData;

    public TryDelegateCallUnsuccessfulEvent(byte[] returnData) {
        this.returnData = returnData;
    }
}
