package com.bit.account.mock;

import com.bit.account.common.Address;
import com.bit.account.vm.CallFrame;
import com.bit.account.vm.CallTarget;
import com.bit.account.vm.ChainVm;
import com.bit.account.vm.RevertException;
import com.google.common.primitives.Longs;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 计数器合约：FAIL 回滚并返回 "boom"，其余调用数据使计数加一并返回新值
 */
public class CounterTarget implements CallTarget {

    public static final byte[] INCREMENT = "inc".getBytes(StandardCharsets.UTF_8);

    public static final byte[] FAIL = "fail".getBytes(StandardCharsets.UTF_8);

    public static final byte[] BOOM = "boom".getBytes(StandardCharsets.UTF_8);

    public static final String KEY = "counter";

    @Override
    public byte[] handle(CallFrame frame) {
        if (Arrays.equals(frame.getData(), FAIL)) {
            throw new RevertException(BOOM);
        }
        byte[] stored = frame.load(KEY);
        long next = (stored == null ? 0 : Longs.fromByteArray(stored)) + 1;
        frame.store(KEY, Longs.toByteArray(next));
        return Longs.toByteArray(next);
    }

    public static long read(ChainVm vm, Address owner) {
        byte[] stored = vm.load(owner, KEY);
        return stored == null ? 0 : Longs.fromByteArray(stored);
    }
}
