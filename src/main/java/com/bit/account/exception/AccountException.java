package com.bit.account.exception;

import com.bit.account.common.FunctionSelector;

/**
 * 账户层自定义异常：统一封装错误类型与错误信息
 * 抛出即代表整个调用中止，调用方不会看到任何部分提交的状态
 */
public class AccountException extends RuntimeException {

    private final ErrorType errorType;

    public AccountException(ErrorType errorType, String message) {
        super("[" + errorType.getDesc() + "]：" + message);
        this.errorType = errorType;
    }

    public AccountException(ErrorType errorType, String message, Throwable cause) {
        super("[" + errorType.getDesc() + "]：" + message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    /**
     * 以错误选择器作为回滚数据，经由调用原语向上传递时使用
     */
    public byte[] getRevertData() {
        return FunctionSelector.of(errorType.getSignature()).toBytes();
    }
}
