package com.bit.account.module.spi;

import com.bit.account.common.Address;

/**
 * 可安装模块的公共契约，account 为调用方账户（模块视角下的 msg.sender）
 */
public interface Module {

    /**
     * 安装回调，抛出异常即安装失败
     */
    void onInstall(Address account, byte[] data);

    /**
     * 卸载回调，抛出异常即卸载失败
     */
    void onUninstall(Address account, byte[] data);

    /**
     * 自报是否支持某个模块类别
     */
    boolean isModuleType(long moduleTypeId);

    boolean isInitialized(Address account);
}
