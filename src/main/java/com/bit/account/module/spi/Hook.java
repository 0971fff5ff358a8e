package com.bit.account.module.spi;

import com.bit.account.common.Address;

import java.math.BigInteger;

/**
 * 钩子模块：在每个特权操作前后被调用
 */
public interface Hook extends Module {

    /**
     * 前置检查，返回的数据原样交给 postCheck
     */
    byte[] preCheck(Address account, Address msgSender, BigInteger msgValue, byte[] msgData);

    /**
     * 操作体成功后调用，仅接收 preCheck 的返回数据；操作体失败时整个调用中止，不会到达这里
     */
    void postCheck(Address account, byte[] hookData);
}
