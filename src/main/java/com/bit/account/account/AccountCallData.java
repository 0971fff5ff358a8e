package com.bit.account.account;

import com.bit.account.common.Address;
import com.bit.account.common.FunctionSelector;
import com.bit.account.exception.AccountException;
import com.bit.account.exception.ErrorType;
import com.bit.account.structure.mode.ExecutionMode;
import com.bit.account.util.ByteUtils;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 账户方法的紧凑调用编码（大端）
 * execute / executeFromExecutor：
 * +----------------+------------------+------------------+
 * | 选择器(4字节)  | 执行模式(32字节) | 执行载荷(剩余)   |
 * +----------------+------------------+------------------+
 * installModule / uninstallModule：
 * +----------------+------------------+----------------+------------------+
 * | 选择器(4字节)  | 类别编号(8字节)  | 模块(20字节)   | 附加数据(剩余)   |
 * +----------------+------------------+----------------+------------------+
 * onRedelegation：仅选择器
 * 同一编码也作为钩子 preCheck 的 msgData
 */
public class AccountCallData {

    public enum Method {
        EXECUTE("execute(bytes32,bytes)"),
        EXECUTE_FROM_EXECUTOR("executeFromExecutor(bytes32,bytes)"),
        INSTALL_MODULE("installModule(uint256,address,bytes)"),
        UNINSTALL_MODULE("uninstallModule(uint256,address,bytes)"),
        ON_REDELEGATION("onRedelegation()");

        private final FunctionSelector selector;

        Method(String signature) {
            this.selector = FunctionSelector.of(signature);
        }

        public FunctionSelector getSelector() {
            return selector;
        }

        public static Optional<Method> fromSelector(FunctionSelector selector) {
            for (Method m : values()) {
                if (m.selector.equals(selector)) {
                    return Optional.of(m);
                }
            }
            return Optional.empty();
        }
    }

    /**
     * userOp.callData 的前4字节，executeUserOp 剥离后把剩余部分委托调用回账户
     */
    public static final FunctionSelector EXECUTE_USER_OP =
            FunctionSelector.of("executeUserOp((address,uint256,bytes,bytes,bytes32,uint256,bytes32,bytes,bytes),bytes32)");

    private AccountCallData() {
    }

    public static byte[] encodeExecute(ExecutionMode mode, byte[] payload) {
        return encodeExecution(Method.EXECUTE, mode, payload);
    }

    public static byte[] encodeExecuteFromExecutor(ExecutionMode mode, byte[] payload) {
        return encodeExecution(Method.EXECUTE_FROM_EXECUTOR, mode, payload);
    }

    public static byte[] encodeInstallModule(long moduleTypeId, Address module, byte[] initData) {
        return encodeModule(Method.INSTALL_MODULE, moduleTypeId, module, initData);
    }

    public static byte[] encodeUninstallModule(long moduleTypeId, Address module, byte[] deInitData) {
        return encodeModule(Method.UNINSTALL_MODULE, moduleTypeId, module, deInitData);
    }

    public static byte[] encodeOnRedelegation() {
        return Method.ON_REDELEGATION.getSelector().toBytes();
    }

    /**
     * userOp.callData：executeUserOp 选择器 + 内层账户调用
     */
    public static byte[] encodeUserOpCall(byte[] innerCall) {
        return ByteUtils.concat(EXECUTE_USER_OP.toBytes(), innerCall);
    }

    /**
     * 解码账户方法调用，选择器不属于账户方法时返回空（交给回退路由）
     * @throws AccountException INVALID_EXECUTION_PAYLOAD 已知方法但编码长度不足
     */
    public static Optional<Decoded> decode(byte[] callData) {
        byte[] data = ByteUtils.nullToEmpty(callData);
        if (data.length < FunctionSelector.LENGTH) {
            return Optional.empty();
        }
        Optional<Method> method = Method.fromSelector(FunctionSelector.fromCallData(data));
        if (method.isEmpty()) {
            return Optional.empty();
        }
        ByteBuf buf = Unpooled.wrappedBuffer(data);
        try {
            buf.skipBytes(FunctionSelector.LENGTH);
            Decoded decoded = new Decoded(method.get());
            switch (method.get()) {
                case EXECUTE:
                case EXECUTE_FROM_EXECUTOR:
                    decoded.mode = ExecutionMode.fromBytes(readBytes(buf, ExecutionMode.LENGTH));
                    decoded.data = readBytes(buf, buf.readableBytes());
                    break;
                case INSTALL_MODULE:
                case UNINSTALL_MODULE:
                    decoded.moduleTypeId = buf.readLong();
                    decoded.module = Address.fromBytes(readBytes(buf, Address.LENGTH));
                    decoded.data = readBytes(buf, buf.readableBytes());
                    break;
                default:
                    break;
            }
            return Optional.of(decoded);
        } catch (IndexOutOfBoundsException e) {
            throw new AccountException(ErrorType.INVALID_EXECUTION_PAYLOAD,
                    method.get() + " 调用编码长度不足: " + data.length, e);
        } finally {
            buf.release();
        }
    }

    /**
     * 多段返回数据：数量(4字节) + 每段 [长度(4字节) | 数据]
     */
    public static byte[] encodeResults(List<byte[]> results) {
        ByteBuf buf = Unpooled.buffer();
        try {
            buf.writeInt(results.size());
            for (byte[] r : results) {
                buf.writeInt(r.length);
                buf.writeBytes(r);
            }
            return readBytes(buf, buf.readableBytes());
        } finally {
            buf.release();
        }
    }

    public static List<byte[]> decodeResults(byte[] encoded) {
        ByteBuf buf = Unpooled.wrappedBuffer(encoded);
        try {
            int count = buf.readInt();
            if (count < 0) {
                throw new IndexOutOfBoundsException("返回数据段数非法: " + count);
            }
            List<byte[]> results = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                int length = buf.readInt();
                if (length < 0 || length > buf.readableBytes()) {
                    throw new IndexOutOfBoundsException("第" + i + "段返回数据长度非法: " + length);
                }
                results.add(readBytes(buf, length));
            }
            return results;
        } catch (IndexOutOfBoundsException e) {
            throw new AccountException(ErrorType.INVALID_EXECUTION_PAYLOAD, "返回数据编码长度不足", e);
        } finally {
            buf.release();
        }
    }

    private static byte[] encodeExecution(Method method, ExecutionMode mode, byte[] payload) {
        return ByteUtils.concat(method.getSelector().toBytes(), mode.toBytes(), payload);
    }

    private static byte[] encodeModule(Method method, long moduleTypeId, Address module, byte[] data) {
        ByteBuf buf = Unpooled.buffer();
        try {
            buf.writeBytes(method.getSelector().toBytes());
            buf.writeLong(moduleTypeId);
            buf.writeBytes(module.toBytes());
            buf.writeBytes(ByteUtils.nullToEmpty(data));
            return readBytes(buf, buf.readableBytes());
        } finally {
            buf.release();
        }
    }

    private static byte[] readBytes(ByteBuf buf, int length) {
        byte[] out = new byte[length];
        buf.readBytes(out);
        return out;
    }

    /**
     * 解码结果，未用到的字段为 null
     */
    @Getter
    public static class Decoded {
        private final Method method;
        private ExecutionMode mode;
        private long moduleTypeId;
        private Address module;
        private byte[] data = ByteUtils.EMPTY;

        private Decoded(Method method) {
            this.method = method;
        }
    }
}
