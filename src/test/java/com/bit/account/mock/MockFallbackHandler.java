package com.bit.account.mock;

import com.bit.account.common.Address;
import com.bit.account.module.spi.FallbackHandler;
import com.bit.account.structure.module.ModuleType;
import com.bit.account.util.ByteUtils;
import com.bit.account.vm.CallFrame;
import com.google.common.primitives.Longs;

/**
 * 回退处理器：累加调用次数并返回调用数据末尾追加的原始调用方
 * 设置 writes=false 时不写状态，可用于 STATIC 绑定
 */
public class MockFallbackHandler extends MockModule implements FallbackHandler {

    public static final String CALLS_KEY = "fallback.calls";

    private final boolean writes;

    public MockFallbackHandler(boolean writes) {
        super(ModuleType.FALLBACK.getId());
        this.writes = writes;
    }

    @Override
    public byte[] handle(CallFrame frame) {
        if (writes) {
            byte[] stored = frame.load(CALLS_KEY);
            long calls = stored == null ? 0 : Longs.fromByteArray(stored);
            frame.store(CALLS_KEY, Longs.toByteArray(calls + 1));
        }
        byte[] data = frame.getData();
        return ByteUtils.tail(data, data.length - Address.LENGTH);
    }
}
