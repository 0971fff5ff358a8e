package com.bit.account.module.impl;

import com.bit.account.common.Address;
import com.bit.account.module.ModuleLocator;
import com.bit.account.module.spi.Module;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 模块目录：地址 -> 模块实例
 */
@Slf4j
@Component
public class ModuleDirectory implements ModuleLocator {

    private final Map<Address, Module> modules = new ConcurrentHashMap<>();

    public void register(Address address, Module module) {
        modules.put(address, module);
        log.info("注册模块 {} -> {}", address, module.getClass().getSimpleName());
    }

    public void unregister(Address address) {
        modules.remove(address);
    }

    @Override
    public Optional<Module> find(Address address) {
        return Optional.ofNullable(modules.get(address));
    }
}
