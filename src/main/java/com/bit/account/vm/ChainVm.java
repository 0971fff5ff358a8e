package com.bit.account.vm;

import com.bit.account.common.Address;

import java.math.BigInteger;

/**
 * 执行原语：调用 / 委托调用并返回 (成功, 返回数据)，同时提供状态日志与快照能力
 * 账户核心把每次调用视为原子副作用；被调用方失败时其自身的状态改动已被撤销
 */
public interface ChainVm {

    /**
     * 普通调用，value 从 from 转入 to
     */
    CallResult call(Address from, Address to, BigInteger value, byte[] data);

    /**
     * 静态调用，被调用方不得写入状态
     */
    CallResult staticCall(Address from, Address to, byte[] data);

    /**
     * 委托调用：执行 code 处的代码，存储上下文为 context，msg.sender 保持为 sender
     */
    CallResult delegateCall(Address context, Address sender, Address code, byte[] data);

    /**
     * 创建状态快照，返回快照编号
     */
    int snapshot();

    /**
     * 回滚到指定快照（包括存储、余额与事件日志）
     */
    void revertToSnapshot(int snapshotId);

    /**
     * 丢弃快照，保留当前状态
     */
    void discardSnapshot(int snapshotId);

    void emit(Address emitter, Object event);

    byte[] load(Address owner, String key);

    void store(Address owner, String key, byte[] value);

    BigInteger balanceOf(Address account);

    /**
     * EIP-7702 委托指示：账户当前指向的实现地址，未委托时返回 null
     */
    Address delegateOf(Address account);
}
