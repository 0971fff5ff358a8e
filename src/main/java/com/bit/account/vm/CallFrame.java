package com.bit.account.vm;

import com.bit.account.common.Address;
import lombok.Getter;

import java.math.BigInteger;

/**
 * 调用帧：self 为存储归属（委托调用时为调用方上下文），sender 为 msg.sender
 */
@Getter
public class CallFrame {

    private final Address self;

    private final Address sender;

    private final BigInteger value;

    private final byte[] data;

    // 静态调用禁止任何状态写入
    private final boolean readOnly;

    private final ChainVm vm;

    public CallFrame(Address self, Address sender, BigInteger value, byte[] data, boolean readOnly, ChainVm vm) {
        this.self = self;
        this.sender = sender;
        this.value = value;
        this.data = data;
        this.readOnly = readOnly;
        this.vm = vm;
    }

    public byte[] load(String key) {
        return vm.load(self, key);
    }

    public void store(String key, byte[] value) {
        if (readOnly) {
            throw new RevertException("静态调用中禁止写入状态");
        }
        vm.store(self, key, value);
    }

    public void emit(Object event) {
        if (readOnly) {
            throw new RevertException("静态调用中禁止产生事件");
        }
        vm.emit(self, event);
    }
}
