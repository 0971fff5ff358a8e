package com.bit.account.account;

import com.bit.account.common.Address;
import com.bit.account.common.FunctionSelector;
import com.bit.account.structure.module.ModuleType;

import java.util.List;
import java.util.Optional;

/**
 * 账户状态只读视图，授权引擎、分发引擎与钩子包装只能通过它读取状态
 */
public interface AccountStateView {

    Address getAccount();

    boolean isModuleInstalled(ModuleType category, Address module);

    /**
     * 按安装顺序列出某类别的模块
     */
    List<Address> listModules(ModuleType category);

    Optional<Address> getHook();

    Optional<FallbackBinding> getFallback(FunctionSelector selector);

    boolean isInitialized();

    boolean hasValidators();

    /**
     * 初始化时记录的委托实现，未记录时为空
     */
    Optional<Address> getDelegate();

    /**
     * 引导回退（账户自身签名）仅在未初始化且没有任何验证器时可用
     */
    default boolean isBootstrapAvailable() {
        return !isInitialized() && !hasValidators();
    }
}
