package com.bit.account.vm.impl;

import com.bit.account.common.Address;
import com.bit.account.vm.LogEntry;
import com.bit.account.vm.StateDb;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 内存状态库：快照以整份拷贝压栈实现，编号即栈深度
 * 嵌套快照按栈语义使用：内层提交用 discard，任意层回滚会同时丢弃其后的所有快照
 */
@Slf4j
public class MemoryStateDb implements StateDb {

    private Map<Address, Map<String, byte[]>> storage = new HashMap<>();

    private Map<Address, BigInteger> balances = new HashMap<>();

    private final List<LogEntry> logs = new ArrayList<>();

    private final List<Snapshot> journal = new ArrayList<>();

    @Override
    public byte[] get(Address owner, String key) {
        Map<String, byte[]> table = storage.get(owner);
        if (table == null) {
            return null;
        }
        byte[] value = table.get(key);
        return value == null ? null : value.clone();
    }

    @Override
    public void put(Address owner, String key, byte[] value) {
        storage.computeIfAbsent(owner, k -> new HashMap<>()).put(key, value.clone());
    }

    @Override
    public BigInteger getBalance(Address account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    @Override
    public boolean transfer(Address from, Address to, BigInteger amount) {
        if (amount.signum() == 0) {
            return true;
        }
        BigInteger fromBalance = getBalance(from);
        if (amount.signum() < 0 || fromBalance.compareTo(amount) < 0) {
            return false;
        }
        balances.put(from, fromBalance.subtract(amount));
        balances.put(to, getBalance(to).add(amount));
        return true;
    }

    @Override
    public void credit(Address account, BigInteger amount) {
        balances.put(account, getBalance(account).add(amount));
    }

    @Override
    public void appendLog(LogEntry entry) {
        logs.add(entry);
    }

    @Override
    public List<LogEntry> getLogs() {
        return Collections.unmodifiableList(new ArrayList<>(logs));
    }

    @Override
    public int snapshot() {
        Map<Address, Map<String, byte[]>> storageCopy = new HashMap<>();
        storage.forEach((owner, table) -> storageCopy.put(owner, new HashMap<>(table)));
        journal.add(new Snapshot(storageCopy, new HashMap<>(balances), logs.size()));
        return journal.size() - 1;
    }

    @Override
    public void revertToSnapshot(int snapshotId) {
        checkSnapshot(snapshotId);
        Snapshot snapshot = journal.get(snapshotId);
        storage = snapshot.storage;
        balances = snapshot.balances;
        logs.subList(snapshot.logSize, logs.size()).clear();
        journal.subList(snapshotId, journal.size()).clear();
        log.debug("状态回滚到快照 {}", snapshotId);
    }

    @Override
    public void discardSnapshot(int snapshotId) {
        checkSnapshot(snapshotId);
        journal.subList(snapshotId, journal.size()).clear();
    }

    private void checkSnapshot(int snapshotId) {
        if (snapshotId < 0 || snapshotId >= journal.size()) {
            throw new IllegalStateException("快照不存在或已失效: " + snapshotId);
        }
    }

    private static final class Snapshot {
        private final Map<Address, Map<String, byte[]>> storage;
        private final Map<Address, BigInteger> balances;
        private final int logSize;

        private Snapshot(Map<Address, Map<String, byte[]>> storage, Map<Address, BigInteger> balances, int logSize) {
            this.storage = storage;
            this.balances = balances;
            this.logSize = logSize;
        }
    }
}
