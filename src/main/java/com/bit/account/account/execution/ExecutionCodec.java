package com.bit.account.account.execution;

import com.bit.account.structure.execution.Execution;

import java.util.List;

/**
 * 执行载荷编解码，格式错误抛出 INVALID_EXECUTION_PAYLOAD
 */
public interface ExecutionCodec {

    Execution decodeSingle(byte[] payload);

    List<Execution> decodeBatch(byte[] payload);

    byte[] encodeSingle(Execution execution);

    byte[] encodeBatch(List<Execution> executions);
}
