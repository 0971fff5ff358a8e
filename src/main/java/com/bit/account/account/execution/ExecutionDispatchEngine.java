package com.bit.account.account.execution;

import com.bit.account.common.Address;
import com.bit.account.exception.AccountException;
import com.bit.account.exception.ErrorType;
import com.bit.account.structure.event.TryDelegateCallUnsuccessfulEvent;
import com.bit.account.structure.event.TryExecuteUnsuccessfulEvent;
import com.bit.account.structure.execution.DelegateExecution;
import com.bit.account.structure.execution.Execution;
import com.bit.account.structure.mode.CallType;
import com.bit.account.structure.mode.ExecType;
import com.bit.account.structure.mode.ExecutionMode;
import com.bit.account.util.ByteUtils;
import com.bit.account.vm.CallResult;
import com.bit.account.vm.ChainVm;
import com.bit.account.vm.RevertException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 按执行模式解码载荷并逐个执行
 * DEFAULT：任一单元失败即以目标的原始回滚数据中止
 * TRY：失败单元记录事件后继续，其返回数据槽位保存回滚数据
 */
@Slf4j
public class ExecutionDispatchEngine {

    private final ChainVm vm;

    private final ExecutionCodec codec;

    public ExecutionDispatchEngine(ChainVm vm, ExecutionCodec codec) {
        this.vm = vm;
        this.codec = codec;
    }

    /**
     * @param account 发起执行的账户
     * @param msgSender 委托调用时保留的原始调用方
     * @return 每个执行单元的返回数据，委托调用为单元素列表
     */
    public List<byte[]> execute(Address account, Address msgSender, ExecutionMode mode, byte[] payload) {
        CallType callType = mode.callType()
                .filter(CallType::isExecutable)
                .orElseThrow(() -> new AccountException(ErrorType.UNSUPPORTED_CALL_TYPE,
                        String.format("调用类型 0x%02x", mode.getCallTypeCode() & 0xFF)));
        ExecType execType = mode.execType()
                .orElseThrow(() -> new AccountException(ErrorType.UNSUPPORTED_EXEC_TYPE,
                        String.format("执行类型 0x%02x", mode.getExecTypeCode() & 0xFF)));
        byte[] data = ByteUtils.nullToEmpty(payload);
        switch (callType) {
            case SINGLE:
                return executeBatch(account, Collections.singletonList(codec.decodeSingle(data)), execType);
            case BATCH:
                return executeBatch(account, codec.decodeBatch(data), execType);
            case DELEGATECALL:
                return Collections.singletonList(executeDelegate(account, msgSender, DelegateExecution.split(data), execType));
            default:
                throw new AccountException(ErrorType.UNSUPPORTED_CALL_TYPE, "调用类型 " + callType);
        }
    }

    private List<byte[]> executeBatch(Address account, List<Execution> executions, ExecType execType) {
        List<byte[]> results = new ArrayList<>(executions.size());
        for (int i = 0; i < executions.size(); i++) {
            Execution execution = executions.get(i);
            CallResult result = vm.call(account, execution.getTarget(), execution.getValue(), execution.getCallData());
            if (!result.isSuccess()) {
                if (execType == ExecType.DEFAULT) {
                    log.debug("账户 {} 第{}个执行单元失败，整体中止", account, i);
                    throw new RevertException(result.getReturnData());
                }
                log.debug("账户 {} 第{}个执行单元失败（TRY），继续执行", account, i);
                vm.emit(account, new TryExecuteUnsuccessfulEvent(i, result.getReturnData()));
            }
            results.add(result.getReturnData());
        }
        return results;
    }

    private byte[] executeDelegate(Address account, Address msgSender, DelegateExecution execution, ExecType execType) {
        CallResult result = vm.delegateCall(account, msgSender, execution.getDelegate(), execution.getCallData());
        if (!result.isSuccess()) {
            if (execType == ExecType.DEFAULT) {
                throw new RevertException(result.getReturnData());
            }
            vm.emit(account, new TryDelegateCallUnsuccessfulEvent(result.getReturnData()));
        }
        return result.getReturnData();
    }
}
