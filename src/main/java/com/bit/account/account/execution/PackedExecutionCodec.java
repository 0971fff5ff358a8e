package com.bit.account.account.execution;

import com.bit.account.common.Address;
import com.bit.account.exception.AccountException;
import com.bit.account.exception.ErrorType;
import com.bit.account.structure.execution.Execution;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.bouncycastle.util.BigIntegers;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * 紧凑执行载荷编解码（大端）
 * 单个：
 * +----------------+----------------+------------------+
 * | 目标(20字节)   | 金额(32字节)   | 调用数据(剩余)   |
 * +----------------+----------------+------------------+
 * 批量：数量(4字节) + 每个单元：
 * +----------------+----------------+----------------+----------------+
 * | 目标(20字节)   | 金额(32字节)   | 数据长度(4字节) | 调用数据       |
 * +----------------+----------------+----------------+----------------+
 */
@Component
public class PackedExecutionCodec implements ExecutionCodec {

    private static final int VALUE_LENGTH = 32;
    private static final int SINGLE_HEADER = Address.LENGTH + VALUE_LENGTH;

    @Override
    public Execution decodeSingle(byte[] payload) {
        if (payload == null || payload.length < SINGLE_HEADER) {
            throw new AccountException(ErrorType.INVALID_EXECUTION_PAYLOAD,
                    "单个执行载荷不足" + SINGLE_HEADER + "字节");
        }
        ByteBuf buf = Unpooled.wrappedBuffer(payload);
        try {
            Address target = Address.fromBytes(readBytes(buf, Address.LENGTH));
            BigInteger value = new BigInteger(1, readBytes(buf, VALUE_LENGTH));
            return new Execution(target, value, readBytes(buf, buf.readableBytes()));
        } finally {
            buf.release();
        }
    }

    @Override
    public List<Execution> decodeBatch(byte[] payload) {
        if (payload == null) {
            throw new AccountException(ErrorType.INVALID_EXECUTION_PAYLOAD, "批量执行载荷为空");
        }
        ByteBuf buf = Unpooled.wrappedBuffer(payload);
        try {
            int count = buf.readInt();
            if (count < 0) {
                throw new AccountException(ErrorType.INVALID_EXECUTION_PAYLOAD, "批量数量非法: " + count);
            }
            List<Execution> executions = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                Address target = Address.fromBytes(readBytes(buf, Address.LENGTH));
                BigInteger value = new BigInteger(1, readBytes(buf, VALUE_LENGTH));
                int dataLength = buf.readInt();
                if (dataLength < 0 || dataLength > buf.readableBytes()) {
                    throw new AccountException(ErrorType.INVALID_EXECUTION_PAYLOAD,
                            "第" + i + "个执行单元数据长度非法: " + dataLength);
                }
                executions.add(new Execution(target, value, readBytes(buf, dataLength)));
            }
            if (buf.isReadable()) {
                throw new AccountException(ErrorType.INVALID_EXECUTION_PAYLOAD,
                        "批量执行载荷存在多余的 " + buf.readableBytes() + " 字节");
            }
            return executions;
        } catch (IndexOutOfBoundsException e) {
            throw new AccountException(ErrorType.INVALID_EXECUTION_PAYLOAD, "批量执行载荷被截断", e);
        } finally {
            buf.release();
        }
    }

    @Override
    public byte[] encodeSingle(Execution execution) {
        ByteBuf buf = Unpooled.buffer();
        try {
            writeHead(buf, execution);
            buf.writeBytes(execution.getCallData());
            return readBytes(buf, buf.readableBytes());
        } finally {
            buf.release();
        }
    }

    @Override
    public byte[] encodeBatch(List<Execution> executions) {
        ByteBuf buf = Unpooled.buffer();
        try {
            buf.writeInt(executions.size());
            for (Execution execution : executions) {
                writeHead(buf, execution);
                buf.writeInt(execution.getCallData().length);
                buf.writeBytes(execution.getCallData());
            }
            return readBytes(buf, buf.readableBytes());
        } finally {
            buf.release();
        }
    }

    private static void writeHead(ByteBuf buf, Execution execution) {
        buf.writeBytes(execution.getTarget().toBytes());
        buf.writeBytes(BigIntegers.asUnsignedByteArray(VALUE_LENGTH, execution.getValue()));
    }

    private static byte[] readBytes(ByteBuf buf, int length) {
        byte[] out = new byte[length];
        buf.readBytes(out);
        return out;
    }
}
