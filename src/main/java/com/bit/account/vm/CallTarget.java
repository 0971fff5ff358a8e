package com.bit.account.vm;

/**
 * 可被调用的代码单元（合约、回退处理器、账户自身）
 * 抛出 {@link RevertException} 表示回滚，返回值即调用的返回数据
 */
@FunctionalInterface
public interface CallTarget {

    byte[] handle(CallFrame frame);
}
