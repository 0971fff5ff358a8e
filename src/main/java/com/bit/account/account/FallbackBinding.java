package com.bit.account.account;

import com.bit.account.common.Address;
import com.bit.account.structure.mode.CallType;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 选择器绑定的回退处理器及其调用方式（SINGLE 或 STATIC）
 */
@Getter
@ToString
@EqualsAndHashCode
public class FallbackBinding {

    private final Address handler;

    private final CallType callType;

    public FallbackBinding(Address handler, CallType callType) {
        this.handler = handler;
        this.callType = callType;
    }
}
