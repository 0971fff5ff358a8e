package com.bit.account.exception;

/**
 * 账户层错误类型，每一项对应一个 Solidity 风格的错误签名
 * 回滚数据取签名 keccak256 的前4字节，与链上错误选择器一致
 */
public enum ErrorType {
    UNSUPPORTED_CALL_TYPE("UnsupportedCallType(bytes1)", "不支持的调用类型"),
    UNSUPPORTED_EXEC_TYPE("UnsupportedExecType(bytes1)", "不支持的执行类型"),
    UNSUPPORTED_MODULE_TYPE("UnsupportedModuleType(uint256)", "不支持的模块类型"),
    MISMATCH_MODULE_TYPE_ID("MismatchModuleTypeId(uint256)", "模块自报类型与安装类型不一致"),
    INVALID_MODULE("InvalidModule(address)", "无效模块"),
    EXECUTION_FAILED("ExecutionFailed()", "执行失败"),
    UNAUTHORIZED_CALLER("AccountAccessUnauthorized()", "调用方无权访问"),
    MODULE_ALREADY_INSTALLED("ModuleAlreadyInstalled(uint256,address)", "模块已安装"),
    MODULE_NOT_INSTALLED("ModuleNotInstalled(uint256,address)", "模块未安装"),
    HOOK_ALREADY_INSTALLED("HookAlreadyInstalled(address)", "钩子槽位已被占用"),
    CANNOT_REMOVE_LAST_VALIDATOR("CanNotRemoveLastValidator()", "不能卸载最后一个验证器"),
    FALLBACK_ALREADY_INSTALLED("FallbackAlreadyInstalledForSelector(bytes4)", "该选择器已绑定回退处理器"),
    FALLBACK_SELECTOR_FORBIDDEN("FallbackSelectorForbidden()", "禁止绑定的回退选择器"),
    FALLBACK_CALL_TYPE_INVALID("FallbackCallTypeInvalid()", "回退处理器调用类型无效"),
    MISSING_FALLBACK_HANDLER("MissingFallbackHandler(bytes4)", "缺少回退处理器"),
    MODULE_NOT_ATTESTED("ModuleNotAttested(address,uint256)", "模块未通过注册表证明"),
    ACCOUNT_ALREADY_INITIALIZED("AccountAlreadyInitialized()", "账户已初始化"),
    MALFORMED_SIGNATURE("InvalidSignature()", "签名格式错误"),
    INVALID_EXECUTION_PAYLOAD("InvalidExecutionPayload()", "执行载荷格式错误");

    private final String signature;
    private final String desc;

    ErrorType(String signature, String desc) {
        this.signature = signature;
        this.desc = desc;
    }

    public String getSignature() {
        return signature;
    }

    public String getDesc() {
        return desc;
    }
}
