package com.bit.account.vm;

import com.bit.account.util.ByteUtils;
import lombok.Getter;
import lombok.ToString;

/**
 * 一次调用的结果：是否成功 + 返回数据（失败时为回滚数据）
 */
@Getter
@ToString
public class CallResult {

    private final boolean success;

    private final byte[] returnData;

    private CallResult(boolean success, byte[] returnData) {
        this.success = success;
        this.returnData = ByteUtils.nullToEmpty(returnData);
    }

    public static CallResult success(byte[] returnData) {
        return new CallResult(true, returnData);
    }

    public static CallResult failure(byte[] revertData) {
        return new CallResult(false, revertData);
    }
}
