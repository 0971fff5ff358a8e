package com.bit.account.module.impl;

import com.bit.account.common.Address;
import com.bit.account.exception.AccountException;
import com.bit.account.exception.ErrorType;
import com.bit.account.module.ModuleRegistry;
import com.bit.account.structure.module.ModuleType;
import com.google.common.collect.ImmutableList;

import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * 基于 LinkedHashSet 的模块集合，保持安装顺序
 */
public class LinkedModuleRegistry implements ModuleRegistry {

    private final Map<ModuleType, LinkedHashSet<Address>> sets = new EnumMap<>(ModuleType.class);

    @Override
    public boolean exists(ModuleType category, Address module) {
        LinkedHashSet<Address> set = sets.get(category);
        return set != null && set.contains(module);
    }

    @Override
    public void add(ModuleType category, Address module) {
        if (module == null || module.isZero()) {
            throw new AccountException(ErrorType.INVALID_MODULE, "模块地址不能为空或零地址");
        }
        if (!sets.computeIfAbsent(category, k -> new LinkedHashSet<>()).add(module)) {
            throw new AccountException(ErrorType.MODULE_ALREADY_INSTALLED,
                    category.getDesc() + " " + module + " 已安装");
        }
    }

    @Override
    public void remove(ModuleType category, Address module) {
        LinkedHashSet<Address> set = sets.get(category);
        if (set == null || !set.remove(module)) {
            throw new AccountException(ErrorType.MODULE_NOT_INSTALLED,
                    category.getDesc() + " " + module + " 未安装");
        }
    }

    @Override
    public List<Address> list(ModuleType category) {
        LinkedHashSet<Address> set = sets.get(category);
        return set == null ? ImmutableList.of() : ImmutableList.copyOf(set);
    }

    @Override
    public void clear(ModuleType category) {
        sets.remove(category);
    }

    @Override
    public ModuleRegistry copy() {
        LinkedModuleRegistry copy = new LinkedModuleRegistry();
        sets.forEach((category, set) -> copy.sets.put(category, new LinkedHashSet<>(set)));
        return copy;
    }
}
