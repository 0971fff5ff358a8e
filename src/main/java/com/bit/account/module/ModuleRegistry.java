package com.bit.account.module;

import com.bit.account.common.Address;
import com.bit.account.structure.module.ModuleType;

import java.util.List;

/**
 * 已安装模块集合：按类别维护有序、去重的地址集合
 * 各类别相互独立，同一地址可同时是执行器和钩子
 */
public interface ModuleRegistry {

    boolean exists(ModuleType category, Address module);

    /**
     * 加入集合，已存在时抛出 MODULE_ALREADY_INSTALLED
     */
    void add(ModuleType category, Address module);

    /**
     * 移出集合，不存在时抛出 MODULE_NOT_INSTALLED
     */
    void remove(ModuleType category, Address module);

    /**
     * 按注册顺序返回快照
     */
    List<Address> list(ModuleType category);

    void clear(ModuleType category);

    ModuleRegistry copy();
}
