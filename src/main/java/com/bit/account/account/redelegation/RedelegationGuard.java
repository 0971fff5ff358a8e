package com.bit.account.account.redelegation;

import com.bit.account.account.AccountState;
import com.bit.account.account.module.ModuleLifecycleRouter;
import com.bit.account.common.Address;
import com.bit.account.structure.event.ModuleUninstalledEvent;
import com.bit.account.structure.module.ModuleType;
import com.bit.account.vm.ChainVm;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;

/**
 * 重委托保护：账户的 EIP-7702 委托实现变更后，清除验证器、执行器与钩子
 * 单个模块卸载失败只记录告警，不影响其余模块的清理
 */
@Slf4j
public class RedelegationGuard {

    private static final ModuleType[] PURGED = {ModuleType.VALIDATOR, ModuleType.EXECUTOR};

    private final ChainVm vm;

    private final ModuleLifecycleRouter router;

    public RedelegationGuard(ChainVm vm, ModuleLifecycleRouter router) {
        this.vm = vm;
        this.router = router;
    }

    /**
     * 记录当前委托实现
     */
    public void record(AccountState state) {
        state.setDelegate(vm.delegateOf(state.getAccount()));
    }

    /**
     * @return 委托实现发生变化并完成清理时返回 true
     */
    public boolean checkAndPurge(AccountState state) {
        Address account = state.getAccount();
        Address current = vm.delegateOf(account);
        Address recorded = state.getDelegate().orElse(null);
        if (Objects.equals(current, recorded)) {
            return false;
        }
        log.info("账户 {} 委托实现由 {} 变更为 {}，开始清理已安装模块", account, recorded, current);
        for (ModuleType type : PURGED) {
            for (Address module : state.listModules(type)) {
                tryUninstall(state, type, module);
            }
        }
        state.getHook().ifPresent(hook -> tryUninstall(state, ModuleType.HOOK, hook));
        state.resetBookkeeping();
        state.setDelegate(current);
        return true;
    }

    private void tryUninstall(AccountState state, ModuleType type, Address module) {
        int snapshot = vm.snapshot();
        Optional<RuntimeException> failure = router.forceUninstall(state, type, module);
        if (failure.isPresent()) {
            vm.revertToSnapshot(snapshot);
            log.warn("账户 {} 清理{} {} 失败，已忽略：{}", state.getAccount(), type.getDesc(), module,
                    failure.get().getMessage());
            return;
        }
        vm.discardSnapshot(snapshot);
        vm.emit(state.getAccount(), new ModuleUninstalledEvent(type.getId(), module));
    }
}
