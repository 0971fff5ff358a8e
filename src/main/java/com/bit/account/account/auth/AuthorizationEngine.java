package com.bit.account.account.auth;

import com.bit.account.account.AccountStateView;
import com.bit.account.common.Address;
import com.bit.account.common.Hash32;
import com.bit.account.exception.AccountException;
import com.bit.account.exception.ErrorType;
import com.bit.account.module.ModuleLocator;
import com.bit.account.module.spi.Validator;
import com.bit.account.structure.auth.AuthorizationRequest;
import com.bit.account.structure.auth.Erc1271;
import com.bit.account.structure.auth.PreValidationContext;
import com.bit.account.structure.auth.ValidationData;
import com.bit.account.structure.module.ModuleType;
import com.bit.account.structure.userop.PackedUserOperation;
import com.bit.account.util.ByteUtils;
import com.bit.account.util.Sha;
import com.bit.account.util.SignatureRecoverer;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * 授权引擎
 * 交易面：nonce 高160位选择验证器，结果为原始 validationData，失败返回哨兵值不抛异常
 * 签名面：签名前20字节选择验证器，结果为 ERC-1271 魔数或 0xffffffff
 * 验证器未安装时，仅在引导回退可用的情况下接受账户自身密钥的签名
 */
@Slf4j
public class AuthorizationEngine {

    private final ModuleLocator locator;

    private final SignatureRecoverer recoverer;

    private final PreValidationPipeline pipeline;

    public AuthorizationEngine(ModuleLocator locator, SignatureRecoverer recoverer) {
        this.locator = locator;
        this.recoverer = recoverer;
        this.pipeline = new PreValidationPipeline(locator);
    }

    public BigInteger validateUserOp(AccountStateView state, PackedUserOperation userOp, Hash32 userOpHash,
                                     BigInteger missingAccountFunds) {
        Address account = state.getAccount();
        Address validatorAddress = Address.fromHighBits(userOp.getNonce());
        if (!state.isModuleInstalled(ModuleType.VALIDATOR, validatorAddress)) {
            if (!state.isBootstrapAvailable()) {
                log.debug("账户 {} 验证器 {} 未安装且引导回退不可用", account, validatorAddress);
                return ValidationData.FAILURE;
            }
            Hash32 signed = Hash32.wrap(Sha.toEthSignedMessageHash(userOpHash.getBytes()));
            return signedByAccount(account, signed, userOp.getSignature()) ? ValidationData.SUCCESS : ValidationData.FAILURE;
        }
        Validator validator = resolve(validatorAddress);
        PreValidationContext context = PreValidationContext.builder()
                .userOp(userOp)
                .missingAccountFunds(missingAccountFunds)
                .build();
        AuthorizationRequest request = pipeline.apply(state, ModuleType.PRE_VALIDATION_HOOK_OP,
                new AuthorizationRequest(userOpHash, userOp.getSignature()), context);
        return validator.validateUserOp(account, userOp.withSignature(request.getSignature()), request.getChallenge());
    }

    /**
     * @throws AccountException INVALID_MODULE 验证器未安装且引导回退不可用
     */
    public int isValidSignature(AccountStateView state, Address sender, Hash32 hash, byte[] signature) {
        Address account = state.getAccount();
        byte[] sig = ByteUtils.nullToEmpty(signature);
        Address validatorAddress = Address.fromPrefix(sig);
        if (!state.isModuleInstalled(ModuleType.VALIDATOR, validatorAddress)) {
            if (!state.isBootstrapAvailable()) {
                throw new AccountException(ErrorType.INVALID_MODULE, "验证器 " + validatorAddress + " 未安装");
            }
            return signedByAccount(account, hash, sig) ? Erc1271.MAGIC_VALUE : Erc1271.FAILED;
        }
        Validator validator = resolve(validatorAddress);
        AuthorizationRequest request = pipeline.apply(state, ModuleType.PRE_VALIDATION_HOOK_SIG,
                new AuthorizationRequest(hash, ByteUtils.tail(sig, Address.LENGTH)),
                PreValidationContext.builder().sender(sender).build());
        return validator.isValidSignatureWithSender(account, sender, request.getChallenge(), request.getSignature());
    }

    private boolean signedByAccount(Address account, Hash32 hash, byte[] signature) {
        try {
            Address signer = recoverer.recover(hash, signature);
            log.debug("引导回退：恢复签名者 {}，账户 {}", signer, account);
            return account.equals(signer);
        } catch (AccountException e) {
            if (e.getErrorType() != ErrorType.MALFORMED_SIGNATURE) {
                throw e;
            }
            log.debug("引导回退：签名格式错误 {}", e.getMessage());
            return false;
        }
    }

    private Validator resolve(Address address) {
        return locator.find(address)
                .filter(Validator.class::isInstance)
                .map(Validator.class::cast)
                .orElseThrow(() -> new AccountException(ErrorType.INVALID_MODULE, "验证器 " + address + " 无法解析"));
    }
}
