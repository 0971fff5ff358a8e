package com.bit.account.vm;

import com.bit.account.util.ByteUtils;

import java.nio.charset.StandardCharsets;

/**
 * 被调用方回滚：携带原始回滚数据，逐层向上传递时不做包装
 */
public class RevertException extends RuntimeException {

    private final byte[] revertData;

    public RevertException(byte[] revertData) {
        super("调用回滚，回滚数据：" + ByteUtils.toHex(revertData));
        this.revertData = ByteUtils.nullToEmpty(revertData);
    }

    public RevertException(String reason) {
        super("调用回滚：" + reason);
        this.revertData = reason.getBytes(StandardCharsets.UTF_8);
    }

    public byte[] getRevertData() {
        return revertData.clone();
    }
}
