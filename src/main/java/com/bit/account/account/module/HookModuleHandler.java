package com.bit.account.account.module;

import com.bit.account.account.AccountState;
import com.bit.account.account.AccountStateView;
import com.bit.account.common.Address;
import com.bit.account.exception.AccountException;
import com.bit.account.exception.ErrorType;
import com.bit.account.module.spi.Hook;
import com.bit.account.module.spi.Module;

/**
 * 钩子类别：单一槽位
 */
public class HookModuleHandler implements ModuleHandler {

    @Override
    public Class<? extends Module> moduleInterface() {
        return Hook.class;
    }

    @Override
    public void install(AccountState state, Address address, Module module, byte[] initData) {
        state.getHook().ifPresent(current -> {
            throw new AccountException(ErrorType.HOOK_ALREADY_INSTALLED, "当前钩子 " + current);
        });
        state.setHook(address);
        module.onInstall(state.getAccount(), initData);
    }

    @Override
    public void uninstall(AccountState state, Address address, Module module, byte[] deInitData) {
        if (!isInstalled(state, address, deInitData)) {
            throw new AccountException(ErrorType.MODULE_NOT_INSTALLED, "钩子 " + address + " 未安装");
        }
        state.setHook(null);
        module.onUninstall(state.getAccount(), deInitData);
    }

    @Override
    public boolean isInstalled(AccountStateView state, Address address, byte[] context) {
        return state.getHook().map(address::equals).orElse(false);
    }
}
