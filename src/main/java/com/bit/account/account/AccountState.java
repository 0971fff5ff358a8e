package com.bit.account.account;

import com.bit.account.common.Address;
import com.bit.account.common.FunctionSelector;
import com.bit.account.module.ModuleRegistry;
import com.bit.account.module.impl.LinkedModuleRegistry;
import com.bit.account.structure.module.ModuleType;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 单个账户的全部可变状态：模块集合、钩子槽、回退绑定、初始化标记、委托记录
 * 仅由生命周期路由与重委托保护修改，其余组件通过 {@link AccountStateView} 读取
 */
@Slf4j
public class AccountState implements AccountStateView {

    private final Address account;

    private ModuleRegistry registry;

    private Address hook;

    private Map<FunctionSelector, FallbackBinding> fallbacks = new LinkedHashMap<>();

    private boolean initialized;

    private Address delegate;

    public AccountState(Address account) {
        this(account, new LinkedModuleRegistry());
    }

    public AccountState(Address account, ModuleRegistry registry) {
        this.account = account;
        this.registry = registry;
    }

    @Override
    public Address getAccount() {
        return account;
    }

    public ModuleRegistry getRegistry() {
        return registry;
    }

    @Override
    public boolean isModuleInstalled(ModuleType category, Address module) {
        return registry.exists(category, module);
    }

    @Override
    public List<Address> listModules(ModuleType category) {
        return registry.list(category);
    }

    @Override
    public Optional<Address> getHook() {
        return Optional.ofNullable(hook);
    }

    public void setHook(Address hook) {
        this.hook = hook;
    }

    @Override
    public Optional<FallbackBinding> getFallback(FunctionSelector selector) {
        return Optional.ofNullable(fallbacks.get(selector));
    }

    public void bindFallback(FunctionSelector selector, FallbackBinding binding) {
        fallbacks.put(selector, binding);
    }

    public void unbindFallback(FunctionSelector selector) {
        fallbacks.remove(selector);
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    public void markInitialized() {
        this.initialized = true;
    }

    @Override
    public boolean hasValidators() {
        return !registry.list(ModuleType.VALIDATOR).isEmpty();
    }

    @Override
    public Optional<Address> getDelegate() {
        return Optional.ofNullable(delegate);
    }

    public void setDelegate(Address delegate) {
        this.delegate = delegate;
    }

    /**
     * 清空验证器、执行器与钩子，保留已初始化标记
     */
    public void resetBookkeeping() {
        registry.clear(ModuleType.VALIDATOR);
        registry.clear(ModuleType.EXECUTOR);
        hook = null;
        initialized = true;
        log.info("账户 {} 模块记录已重置", account);
    }

    public AccountState copy() {
        AccountState copy = new AccountState(account, registry.copy());
        copy.hook = hook;
        copy.fallbacks = new LinkedHashMap<>(fallbacks);
        copy.initialized = initialized;
        copy.delegate = delegate;
        return copy;
    }

    /**
     * 从备份恢复（中止时使用），备份对象此后不应再被使用
     */
    public void restore(AccountState backup) {
        if (!account.equals(backup.account)) {
            throw new IllegalArgumentException("备份不属于账户 " + account);
        }
        this.registry = backup.registry;
        this.hook = backup.hook;
        this.fallbacks = backup.fallbacks;
        this.initialized = backup.initialized;
        this.delegate = backup.delegate;
    }
}
