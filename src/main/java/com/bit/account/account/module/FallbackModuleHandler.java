package com.bit.account.account.module;

import com.bit.account.account.AccountState;
import com.bit.account.account.AccountStateView;
import com.bit.account.account.FallbackBinding;
import com.bit.account.common.Address;
import com.bit.account.common.FunctionSelector;
import com.bit.account.exception.AccountException;
import com.bit.account.exception.ErrorType;
import com.bit.account.module.spi.FallbackHandler;
import com.bit.account.module.spi.Module;
import com.bit.account.structure.mode.CallType;
import com.bit.account.util.ByteUtils;
import com.google.common.collect.ImmutableSet;

import java.util.Optional;
import java.util.Set;

/**
 * 回退处理器类别，按选择器绑定
 * 安装数据：选择器(4) | 调用类型(1) | 处理器初始化数据
 * 卸载数据：选择器(4) | 处理器卸载数据
 */
public class FallbackModuleHandler implements ModuleHandler {

    private static final int INSTALL_HEADER = FunctionSelector.LENGTH + 1;

    // 零选择器与模块生命周期回调不可被回退处理器接管
    private static final Set<FunctionSelector> FORBIDDEN = ImmutableSet.of(
            FunctionSelector.ZERO,
            FunctionSelector.of("onInstall(bytes)"),
            FunctionSelector.of("onUninstall(bytes)"));

    @Override
    public Class<? extends Module> moduleInterface() {
        return FallbackHandler.class;
    }

    @Override
    public void install(AccountState state, Address address, Module module, byte[] initData) {
        FunctionSelector selector = FunctionSelector.fromCallData(initData);
        if (FORBIDDEN.contains(selector)) {
            throw new AccountException(ErrorType.FALLBACK_SELECTOR_FORBIDDEN, "选择器 " + selector + " 禁止绑定");
        }
        CallType callType = Optional.ofNullable(initData)
                .filter(data -> data.length >= INSTALL_HEADER)
                .flatMap(data -> CallType.fromCode(data[FunctionSelector.LENGTH]))
                .filter(type -> type == CallType.SINGLE || type == CallType.STATIC)
                .orElseThrow(() -> new AccountException(ErrorType.FALLBACK_CALL_TYPE_INVALID,
                        "回退处理器只支持 SINGLE 或 STATIC 调用"));
        if (state.getFallback(selector).isPresent()) {
            throw new AccountException(ErrorType.FALLBACK_ALREADY_INSTALLED, "选择器 " + selector + " 已绑定");
        }
        state.bindFallback(selector, new FallbackBinding(address, callType));
        module.onInstall(state.getAccount(), ByteUtils.tail(initData, INSTALL_HEADER));
    }

    @Override
    public void uninstall(AccountState state, Address address, Module module, byte[] deInitData) {
        FunctionSelector selector = FunctionSelector.fromCallData(deInitData);
        if (!isInstalled(state, address, deInitData)) {
            throw new AccountException(ErrorType.MODULE_NOT_INSTALLED,
                    "回退处理器 " + address + " 未绑定选择器 " + selector);
        }
        state.unbindFallback(selector);
        module.onUninstall(state.getAccount(), ByteUtils.tail(deInitData, FunctionSelector.LENGTH));
    }

    @Override
    public boolean isInstalled(AccountStateView state, Address address, byte[] context) {
        return state.getFallback(FunctionSelector.fromCallData(context))
                .map(binding -> binding.getHandler().equals(address))
                .orElse(false);
    }
}
