package com.bit.account.structure.event;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * TRY 模式下某个执行单元失败：携带单元序号与回滚数据
 */
@Getter
@ToString
@EqualsAndHashCode
public class TryExecuteUnsuccessfulEvent {

    private final int index;

    private final byte[] returnData;

    public TryExecuteUnsuccessfulEvent(int index, byte[] returnData) {
        this.index = index;
        this.returnData = returnData;
    }
}
