package com.bit.account.vm;

import com.bit.account.common.Address;

import java.math.BigInteger;
import java.util.List;

//KV状态库 按账户地址分表 自带快照日志
public interface StateDb {

    /**
     * 读取 owner 名下的一条数据，不存在返回 null
     */
    byte[] get(Address owner, String key);

    // 存在则覆盖
    void put(Address owner, String key, byte[] value);

    BigInteger getBalance(Address account);

    /**
     * 转账，余额不足时返回 false 且不做任何修改
     */
    boolean transfer(Address from, Address to, BigInteger amount);

    void credit(Address account, BigInteger amount);

    void appendLog(LogEntry entry);

    List<LogEntry> getLogs();

    int snapshot();

    void revertToSnapshot(int snapshotId);

    void discardSnapshot(int snapshotId);
}
