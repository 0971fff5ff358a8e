package com.bit.account.module.spi;

/**
 * 执行器模块：被允许通过 executeFromExecutor 代表账户发起执行
 */
public interface Executor extends Module {
}
