package com.bit.account.module;

import com.bit.account.common.Address;
import com.bit.account.module.spi.Module;

import java.util.Optional;

/**
 * 模块地址到模块实例的解析
 */
public interface ModuleLocator {

    Optional<Module> find(Address address);
}
