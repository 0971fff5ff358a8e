package com.bit.account.mock;

import com.bit.account.common.Address;
import com.bit.account.module.spi.Module;
import com.bit.account.vm.RevertException;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 测试模块基类：记录安装/卸载回调，可配置自报类别与失败行为
 */
@Getter
public abstract class MockModule implements Module {

    private final Set<Long> moduleTypeIds = new HashSet<>();

    private final Set<Address> installedOn = new HashSet<>();

    private final List<byte[]> installData = new ArrayList<>();

    private final List<byte[]> uninstallData = new ArrayList<>();

    @Setter
    private boolean revertOnInstall;

    @Setter
    private boolean revertOnUninstall;

    protected MockModule(long... typeIds) {
        for (long id : typeIds) {
            moduleTypeIds.add(id);
        }
    }

    @Override
    public void onInstall(Address account, byte[] data) {
        if (revertOnInstall) {
            throw new RevertException("install refused");
        }
        installedOn.add(account);
        installData.add(data);
    }

    @Override
    public void onUninstall(Address account, byte[] data) {
        if (revertOnUninstall) {
            throw new RevertException("uninstall refused");
        }
        installedOn.remove(account);
        uninstallData.add(data);
    }

    @Override
    public boolean isModuleType(long moduleTypeId) {
        return moduleTypeIds.contains(moduleTypeId);
    }

    @Override
    public boolean isInitialized(Address account) {
        return installedOn.contains(account);
    }
}
