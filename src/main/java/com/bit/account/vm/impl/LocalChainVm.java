package com.bit.account.vm.impl;

import com.bit.account.common.Address;
import com.bit.account.exception.AccountException;
import com.bit.account.util.ByteUtils;
import com.bit.account.vm.CallFrame;
import com.bit.account.vm.CallResult;
import com.bit.account.vm.CallTarget;
import com.bit.account.vm.ChainVm;
import com.bit.account.vm.LogEntry;
import com.bit.account.vm.RevertException;
import com.bit.account.vm.StateDb;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 本地执行环境，基于内存状态库
 * 每次调用前打快照，被调用方回滚时撤销其全部改动，并把异常折算为 (false, 回滚数据)
 */
@Slf4j
@Component
public class LocalChainVm implements ChainVm {

    // 地址 -> 代码
    private final Map<Address, CallTarget> targets = new ConcurrentHashMap<>();

    // 账户 -> EIP-7702 委托实现
    private final Map<Address, Address> delegations = new ConcurrentHashMap<>();

    private final StateDb stateDb;

    public LocalChainVm() {
        this(new MemoryStateDb());
    }

    public LocalChainVm(StateDb stateDb) {
        this.stateDb = stateDb;
    }

    /**
     * 在地址上部署代码
     */
    public void deploy(Address address, CallTarget target) {
        targets.put(address, target);
        log.debug("部署代码到地址 {}", address);
    }

    public void setDelegate(Address account, Address implementation) {
        if (implementation == null) {
            delegations.remove(account);
        } else {
            delegations.put(account, implementation);
        }
        log.info("账户 {} 委托实现变更为 {}", account, implementation);
    }

    public void credit(Address account, BigInteger amount) {
        stateDb.credit(account, amount);
    }

    public List<LogEntry> getLogs() {
        return stateDb.getLogs();
    }

    public <T> List<T> getEvents(Class<T> type) {
        return stateDb.getLogs().stream()
                .map(LogEntry::getEvent)
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }

    @Override
    public CallResult call(Address from, Address to, BigInteger value, byte[] data) {
        int snapshot = stateDb.snapshot();
        try {
            if (!stateDb.transfer(from, to, value)) {
                stateDb.revertToSnapshot(snapshot);
                log.debug("余额不足，调用失败 from={} to={} value={}", from, to, value);
                return CallResult.failure(ByteUtils.EMPTY);
            }
            CallTarget target = targets.get(to);
            // 无代码地址：仅转账
            byte[] result = target == null
                    ? ByteUtils.EMPTY
                    : target.handle(new CallFrame(to, from, value, ByteUtils.nullToEmpty(data), false, this));
            stateDb.discardSnapshot(snapshot);
            return CallResult.success(result);
        } catch (RuntimeException e) {
            stateDb.revertToSnapshot(snapshot);
            return CallResult.failure(revertDataOf(to, e));
        }
    }

    @Override
    public CallResult staticCall(Address from, Address to, byte[] data) {
        int snapshot = stateDb.snapshot();
        try {
            CallTarget target = targets.get(to);
            byte[] result = target == null
                    ? ByteUtils.EMPTY
                    : target.handle(new CallFrame(to, from, BigInteger.ZERO, ByteUtils.nullToEmpty(data), true, this));
            stateDb.discardSnapshot(snapshot);
            return CallResult.success(result);
        } catch (RuntimeException e) {
            stateDb.revertToSnapshot(snapshot);
            return CallResult.failure(revertDataOf(to, e));
        }
    }

    @Override
    public CallResult delegateCall(Address context, Address sender, Address code, byte[] data) {
        int snapshot = stateDb.snapshot();
        try {
            CallTarget target = targets.get(code);
            byte[] result = target == null
                    ? ByteUtils.EMPTY
                    : target.handle(new CallFrame(context, sender, BigInteger.ZERO, ByteUtils.nullToEmpty(data), false, this));
            stateDb.discardSnapshot(snapshot);
            return CallResult.success(result);
        } catch (RuntimeException e) {
            stateDb.revertToSnapshot(snapshot);
            return CallResult.failure(revertDataOf(code, e));
        }
    }

    @Override
    public int snapshot() {
        return stateDb.snapshot();
    }

    @Override
    public void revertToSnapshot(int snapshotId) {
        stateDb.revertToSnapshot(snapshotId);
    }

    @Override
    public void discardSnapshot(int snapshotId) {
        stateDb.discardSnapshot(snapshotId);
    }

    @Override
    public void emit(Address emitter, Object event) {
        stateDb.appendLog(new LogEntry(emitter, event));
    }

    @Override
    public byte[] load(Address owner, String key) {
        return stateDb.get(owner, key);
    }

    @Override
    public void store(Address owner, String key, byte[] value) {
        stateDb.put(owner, key, value);
    }

    @Override
    public BigInteger balanceOf(Address account) {
        return stateDb.getBalance(account);
    }

    @Override
    public Address delegateOf(Address account) {
        return delegations.get(account);
    }

    private byte[] revertDataOf(Address callee, RuntimeException e) {
        if (e instanceof RevertException) {
            return ((RevertException) e).getRevertData();
        }
        if (e instanceof AccountException) {
            log.debug("被调用方 {} 中止：{}", callee, e.getMessage());
            return ((AccountException) e).getRevertData();
        }
        log.warn("被调用方 {} 抛出未预期异常，按空回滚数据处理", callee, e);
        return ByteUtils.EMPTY;
    }
}
