package com.bit.account.service.impl;

import com.bit.account.account.AccountStateView;
import com.bit.account.account.SmartAccount;
import com.bit.account.account.SmartAccountFactory;
import com.bit.account.common.Address;
import com.bit.account.common.Hash32;
import com.bit.account.exception.AccountException;
import com.bit.account.result.Result;
import com.bit.account.service.SmartAccountService;
import com.bit.account.structure.dto.AccountDTO;
import com.bit.account.structure.dto.SignatureCheckDTO;
import com.bit.account.structure.mode.ExecutionMode;
import com.bit.account.structure.module.ModuleType;
import com.bit.account.util.ByteUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 账户查询服务，供接口层使用
 */
@Slf4j
@Component
public class SmartAccountServiceImpl implements SmartAccountService {

    @Autowired
    private SmartAccountFactory factory;

    @Override
    public Result<AccountDTO> createAccount(String address) {
        Address accountAddress;
        try {
            accountAddress = Address.fromHex(address);
        } catch (IllegalArgumentException e) {
            return Result.badRequest("地址格式错误：" + e.getMessage());
        }
        try {
            return Result.OK("账户创建成功", toDTO(factory.create(accountAddress)));
        } catch (IllegalStateException e) {
            log.debug("重复创建账户 {}：{}", address, e.getMessage());
            return Result.badRequest("地址 " + address + " 上已存在账户");
        } catch (IllegalArgumentException e) {
            return Result.badRequest(e.getMessage());
        }
    }

    @Override
    public Result<AccountDTO> getAccountDetail(String address) {
        return withAccount(address, account -> Result.OK(toDTO(account)));
    }

    @Override
    public Result<String> accountId(String address) {
        return withAccount(address, account -> Result.OK(account.accountId()));
    }

    @Override
    public Result<Boolean> supportsModule(String address, long moduleTypeId) {
        return withAccount(address, account -> Result.OK(account.supportsModule(moduleTypeId)));
    }

    @Override
    public Result<Boolean> supportsExecutionMode(String address, String mode) {
        return withAccount(address, account -> Result.OK(account.supportsExecutionMode(ExecutionMode.fromHex(mode))));
    }

    @Override
    public Result<Boolean> isModuleInstalled(String address, long moduleTypeId, String module, String context) {
        return withAccount(address, account -> Result.OK(account.isModuleInstalled(moduleTypeId, Address.fromHex(module),
                context == null || context.isEmpty() ? ByteUtils.EMPTY : ByteUtils.fromHex(context))));
    }

    @Override
    public Result<String> isValidSignature(SignatureCheckDTO request) {
        return withAccount(request.getAccount(), account -> {
            int result = account.isValidSignature(Address.fromHex(request.getSender()),
                    Hash32.fromHex(request.getHash()), ByteUtils.fromHex(request.getSignature()));
            return Result.OK(String.format("0x%08x", result));
        });
    }

    private <T> Result<T> withAccount(String address, Function<SmartAccount, Result<T>> query) {
        try {
            Optional<SmartAccount> account = factory.find(Address.fromHex(address));
            if (account.isEmpty()) {
                return Result.badRequest("账户不存在：" + address);
            }
            return query.apply(account.get());
        } catch (AccountException e) {
            log.debug("账户查询失败 {}：{}", address, e.getMessage());
            return Result.error(e.getMessage());
        } catch (IllegalArgumentException e) {
            return Result.badRequest("参数格式错误：" + e.getMessage());
        }
    }

    private static AccountDTO toDTO(SmartAccount account) {
        AccountStateView state = account.getState();
        AccountDTO dto = new AccountDTO();
        dto.setAddress(account.getAddress().toHex());
        dto.setAccountId(account.accountId());
        dto.setInitialized(state.isInitialized());
        dto.setValidators(state.listModules(ModuleType.VALIDATOR).stream().map(Address::toHex).collect(Collectors.toList()));
        dto.setExecutors(state.listModules(ModuleType.EXECUTOR).stream().map(Address::toHex).collect(Collectors.toList()));
        dto.setHook(state.getHook().map(Address::toHex).orElse(null));
        dto.setDelegate(state.getDelegate().map(Address::toHex).orElse(null));
        return dto;
    }
}
