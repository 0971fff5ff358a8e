package com.bit.account.structure.event;

import com.bit.account.common.Address;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 模块卸载完成
 */
@Getter
@ToString
@EqualsAndHashCode
public class ModuleUninstalledEvent {

    private final long moduleTypeId;

    private final Address module;

    public ModuleUninstalledEvent(long moduleTypeId, Address module) {
        this.moduleTypeId = moduleTypeId;
        this.module = module;
    }
}
