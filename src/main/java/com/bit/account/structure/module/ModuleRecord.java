package com.bit.account.structure.module;

import com.bit.account.common.Address;
import com.bit.account.util.ByteUtils;
import lombok.Getter;
import lombok.ToString;

/**
 * 待安装模块描述：(类别编号, 地址, 初始化数据)
 */
@Getter
@ToString
public class ModuleRecord {

    private final long moduleTypeId;

    private final Address module;

    private final byte[] initData;

    public ModuleRecord(long moduleTypeId, Address module, byte[] initData) {
        this.moduleTypeId = moduleTypeId;
        this.module = module;
        this.initData = ByteUtils.nullToEmpty(initData);
    }

    public static ModuleRecord of(ModuleType type, Address module, byte[] initData) {
        return new ModuleRecord(type.getId(), module, initData);
    }
}
