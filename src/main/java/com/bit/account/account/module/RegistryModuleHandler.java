package com.bit.account.account.module;

import com.bit.account.account.AccountState;
import com.bit.account.account.AccountStateView;
import com.bit.account.common.Address;
import com.bit.account.exception.AccountException;
import com.bit.account.exception.ErrorType;
import com.bit.account.module.spi.Module;
import com.bit.account.structure.module.ModuleType;

/**
 * 以有序集合记录的类别：验证器、执行器、两类预校验钩子
 */
public class RegistryModuleHandler implements ModuleHandler {

    private final ModuleType category;

    private final Class<? extends Module> moduleInterface;

    // 为 true 时禁止卸载该类别的最后一个模块
    private final boolean keepLast;

    public RegistryModuleHandler(ModuleType category, Class<? extends Module> moduleInterface, boolean keepLast) {
        this.category = category;
        this.moduleInterface = moduleInterface;
        this.keepLast = keepLast;
    }

    @Override
    public Class<? extends Module> moduleInterface() {
        return moduleInterface;
    }

    @Override
    public void install(AccountState state, Address address, Module module, byte[] initData) {
        state.getRegistry().add(category, address);
        module.onInstall(state.getAccount(), initData);
    }

    @Override
    public void uninstall(AccountState state, Address address, Module module, byte[] deInitData) {
        if (keepLast && state.listModules(category).size() == 1 && state.isModuleInstalled(category, address)) {
            throw new AccountException(ErrorType.CANNOT_REMOVE_LAST_VALIDATOR,
                    "账户 " + state.getAccount() + " 至少保留一个" + category.getDesc());
        }
        state.getRegistry().remove(category, address);
        module.onUninstall(state.getAccount(), deInitData);
    }

    @Override
    public boolean isInstalled(AccountStateView state, Address address, byte[] context) {
        return state.isModuleInstalled(category, address);
    }
}
