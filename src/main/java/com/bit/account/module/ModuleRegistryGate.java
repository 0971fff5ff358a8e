package com.bit.account.module;

import com.bit.account.common.Address;
import com.bit.account.structure.module.ModuleType;

/**
 * 外部证明注册表闸门：安装模块、执行器发起执行前询问
 */
@FunctionalInterface
public interface ModuleRegistryGate {

    ModuleRegistryGate ALLOW_ALL = (module, category) -> true;

    boolean authorize(Address module, ModuleType category);
}
