package com.bit.account.account.module;

import com.bit.account.account.AccountState;
import com.bit.account.account.AccountStateView;
import com.bit.account.common.Address;
import com.bit.account.module.spi.Module;

/**
 * 单个模块类别的安装/卸载/查询处理器
 */
public interface ModuleHandler {

    /**
     * 该类别模块必须实现的接口
     */
    Class<? extends Module> moduleInterface();

    void install(AccountState state, Address address, Module module, byte[] initData);

    void uninstall(AccountState state, Address address, Module module, byte[] deInitData);

    /**
     * @param context 类别相关的附加查询数据（回退处理器为选择器）
     */
    boolean isInstalled(AccountStateView state, Address address, byte[] context);
}
