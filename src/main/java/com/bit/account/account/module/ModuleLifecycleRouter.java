package com.bit.account.account.module;

import com.bit.account.account.AccountState;
import com.bit.account.account.AccountStateView;
import com.bit.account.common.Address;
import com.bit.account.exception.AccountException;
import com.bit.account.exception.ErrorType;
import com.bit.account.module.ModuleLocator;
import com.bit.account.module.ModuleRegistryGate;
import com.bit.account.module.spi.Executor;
import com.bit.account.module.spi.Module;
import com.bit.account.module.spi.PreValidationHook;
import com.bit.account.module.spi.Validator;
import com.bit.account.structure.module.ModuleType;
import com.bit.account.util.ByteUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * 模块生命周期路由：按类别编号查表分发到类别处理器
 * 安装检查顺序：类别 -> 模块可解析 -> 自报类别 -> 实现类别接口 -> 证明注册表 -> 类别处理器
 */
@Slf4j
public class ModuleLifecycleRouter {

    private final Map<ModuleType, ModuleHandler> handlers = new EnumMap<>(ModuleType.class);

    private final ModuleLocator locator;

    private final ModuleRegistryGate gate;

    public ModuleLifecycleRouter(ModuleLocator locator, ModuleRegistryGate gate) {
        this.locator = locator;
        this.gate = gate;
        handlers.put(ModuleType.VALIDATOR, new RegistryModuleHandler(ModuleType.VALIDATOR, Validator.class, true));
        handlers.put(ModuleType.EXECUTOR, new RegistryModuleHandler(ModuleType.EXECUTOR, Executor.class, false));
        handlers.put(ModuleType.FALLBACK, new FallbackModuleHandler());
        handlers.put(ModuleType.HOOK, new HookModuleHandler());
        handlers.put(ModuleType.PRE_VALIDATION_HOOK_SIG,
                new RegistryModuleHandler(ModuleType.PRE_VALIDATION_HOOK_SIG, PreValidationHook.class, false));
        handlers.put(ModuleType.PRE_VALIDATION_HOOK_OP,
                new RegistryModuleHandler(ModuleType.PRE_VALIDATION_HOOK_OP, PreValidationHook.class, false));
    }

    public ModuleType install(AccountState state, long moduleTypeId, Address module, byte[] initData) {
        ModuleType type = typeOf(moduleTypeId);
        ModuleHandler handler = handlers.get(type);
        Module instance = resolve(module, Module.class);
        if (!instance.isModuleType(moduleTypeId)) {
            throw new AccountException(ErrorType.MISMATCH_MODULE_TYPE_ID,
                    "模块 " + module + " 不支持类别 " + moduleTypeId);
        }
        if (!handler.moduleInterface().isInstance(instance)) {
            throw new AccountException(ErrorType.INVALID_MODULE,
                    "模块 " + module + " 未实现 " + handler.moduleInterface().getSimpleName());
        }
        if (!gate.authorize(module, type)) {
            throw new AccountException(ErrorType.MODULE_NOT_ATTESTED,
                    "模块 " + module + " 未获得" + type.getDesc() + "证明");
        }
        handler.install(state, module, instance, ByteUtils.nullToEmpty(initData));
        log.info("账户 {} 安装{} {}", state.getAccount(), type.getDesc(), module);
        return type;
    }

    public ModuleType uninstall(AccountState state, long moduleTypeId, Address module, byte[] deInitData) {
        ModuleType type = typeOf(moduleTypeId);
        ModuleHandler handler = handlers.get(type);
        byte[] data = ByteUtils.nullToEmpty(deInitData);
        if (module == null || !handler.isInstalled(state, module, data)) {
            throw new AccountException(ErrorType.MODULE_NOT_INSTALLED, type.getDesc() + " " + module + " 未安装");
        }
        handler.uninstall(state, module, resolve(module, handler.moduleInterface()), data);
        log.info("账户 {} 卸载{} {}", state.getAccount(), type.getDesc(), module);
        return type;
    }

    /**
     * 未知类别返回 false；回退处理器以 context 前4字节为选择器
     */
    public boolean isModuleInstalled(AccountStateView state, long moduleTypeId, Address module, byte[] context) {
        return ModuleType.fromId(moduleTypeId)
                .map(type -> module != null && handlers.get(type).isInstalled(state, module, ByteUtils.nullToEmpty(context)))
                .orElse(false);
    }

    public boolean supportsModule(long moduleTypeId) {
        return ModuleType.fromId(moduleTypeId).isPresent();
    }

    /**
     * 不校验、不修改记录，仅调用模块的卸载回调；失败以返回值交给调用方处理
     */
    public Optional<RuntimeException> forceUninstall(AccountStateView state, ModuleType type, Address module) {
        try {
            resolve(module, handlers.get(type).moduleInterface()).onUninstall(state.getAccount(), ByteUtils.EMPTY);
            return Optional.empty();
        } catch (RuntimeException e) {
            return Optional.of(e);
        }
    }

    private static ModuleType typeOf(long moduleTypeId) {
        return ModuleType.fromId(moduleTypeId)
                .orElseThrow(() -> new AccountException(ErrorType.UNSUPPORTED_MODULE_TYPE, "类别编号 " + moduleTypeId));
    }

    private Module resolve(Address module, Class<? extends Module> moduleInterface) {
        if (module == null) {
            throw new AccountException(ErrorType.INVALID_MODULE, "模块地址为空");
        }
        return locator.find(module)
                .filter(moduleInterface::isInstance)
                .orElseThrow(() -> new AccountException(ErrorType.INVALID_MODULE,
                        "模块 " + module + " 无法解析或未实现 " + moduleInterface.getSimpleName()));
    }
}
