package com.bit.account.structure.mode;

import com.bit.account.util.ByteUtils;
import lombok.EqualsAndHashCode;

import java.util.Arrays;
import java.util.Optional;

/**
 * 32字节执行模式描述符
 * +-------------+-------------+-------------+------------------+-------------------+
 * | 调用类型(1) | 执行类型(1) | 保留(4)     | 模式选择器(4)    | 模式载荷(22)      |
 * +-------------+-------------+-------------+------------------+-------------------+
 * 解码对任意32字节都成立，未知的调用/执行类型由分发层显式拒绝
 */
@EqualsAndHashCode
public final class ExecutionMode {
    public static final int LENGTH = 32;
    private static final int SELECTOR_OFFSET = 6;
    private static final int PAYLOAD_OFFSET = 10;

    private final byte[] value;

    private ExecutionMode(byte[] value) {
        this.value = value;
    }

    public static ExecutionMode fromBytes(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("执行模式必须为32字节");
        }
        return new ExecutionMode(Arrays.copyOf(bytes, LENGTH));
    }

    public static ExecutionMode fromHex(String hex) {
        return fromBytes(ByteUtils.fromHex(hex));
    }

    public static ExecutionMode of(CallType callType, ExecType execType) {
        return of(callType.getCode(), execType.getCode());
    }

    /**
     * 按原始编码构造，允许不受支持的取值
     */
    public static ExecutionMode of(byte callTypeCode, byte execTypeCode) {
        byte[] bytes = new byte[LENGTH];
        bytes[0] = callTypeCode;
        bytes[1] = execTypeCode;
        return new ExecutionMode(bytes);
    }

    public byte getCallTypeCode() {
        return value[0];
    }

    public byte getExecTypeCode() {
        return value[1];
    }

    public Optional<CallType> callType() {
        return CallType.fromCode(value[0]);
    }

    public Optional<ExecType> execType() {
        return ExecType.fromCode(value[1]);
    }

    public byte[] getModeSelector() {
        return Arrays.copyOfRange(value, SELECTOR_OFFSET, PAYLOAD_OFFSET);
    }

    public byte[] getModePayload() {
        return Arrays.copyOfRange(value, PAYLOAD_OFFSET, LENGTH);
    }

    /**
     * 调用类型与执行类型均在可执行集合内
     */
    public boolean isSupported() {
        return callType().map(CallType::isExecutable).orElse(false) && execType().isPresent();
    }

    public byte[] toBytes() {
        return Arrays.copyOf(value, LENGTH);
    }

    @Override
    public String toString() {
        return ByteUtils.toHex(value);
    }
}
