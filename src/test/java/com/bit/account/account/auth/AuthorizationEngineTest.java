package com.bit.account.account.auth;

import com.bit.account.account.AccountState;
import com.bit.account.common.Address;
import com.bit.account.common.Hash32;
import com.bit.account.exception.AccountException;
import com.bit.account.exception.ErrorType;
import com.bit.account.mock.MockPreValidationHook;
import com.bit.account.mock.MockValidator;
import com.bit.account.module.impl.ModuleDirectory;
import com.bit.account.structure.auth.Erc1271;
import com.bit.account.structure.auth.ValidationData;
import com.bit.account.structure.module.ModuleType;
import com.bit.account.structure.userop.PackedUserOperation;
import com.bit.account.util.ByteUtils;
import com.bit.account.util.Secp256k1SignatureRecoverer;
import com.bit.account.util.Secp256k1Signer;
import com.bit.account.util.Sha;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.ECKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

import static com.bit.account.mock.AccountTestSupport.address;
import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class AuthorizationEngineTest {

    private final ECKey ownerKey = new ECKey();
    private final Address account = Secp256k1Signer.toAddress(ownerKey);
    private final Address validatorAddress = address(10);
    private final Address hookA = address(20);
    private final Address hookB = address(21);
    private final Address sender = address(30);
    private final Hash32 userOpHash = Hash32.wrap(Sha.keccak256("userOp".getBytes(StandardCharsets.UTF_8)));

    private ModuleDirectory directory;
    private AccountState state;
    private AuthorizationEngine engine;
    private MockValidator validator;

    @BeforeEach
    void setUp() {
        directory = new ModuleDirectory();
        validator = new MockValidator();
        directory.register(validatorAddress, validator);
        directory.register(hookA, new MockPreValidationHook((byte) 0xA1));
        directory.register(hookB, new MockPreValidationHook((byte) 0xB2));
        state = new AccountState(account);
        engine = new AuthorizationEngine(directory, new Secp256k1SignatureRecoverer(100, 1));
    }

    // ------------------------------ 交易授权 ------------------------------

    @Test
    void bootstrapAcceptsAccountKeyOverEthSignedHash() {
        byte[] signature = sign(ownerKey, Sha.toEthSignedMessageHash(userOpHash.getBytes()));

        assertEquals(ValidationData.SUCCESS, engine.validateUserOp(state, userOp(Address.ZERO, signature), userOpHash, BigInteger.ZERO));
    }

    @Test
    void bootstrapRejectsRawHashSignatureAndOtherKeys() {
        byte[] rawSigned = sign(ownerKey, userOpHash.getBytes());
        byte[] otherKey = sign(new ECKey(), Sha.toEthSignedMessageHash(userOpHash.getBytes()));

        assertEquals(ValidationData.FAILURE, engine.validateUserOp(state, userOp(Address.ZERO, rawSigned), userOpHash, BigInteger.ZERO));
        assertEquals(ValidationData.FAILURE, engine.validateUserOp(state, userOp(Address.ZERO, otherKey), userOpHash, BigInteger.ZERO));
    }

    @Test
    void malformedBootstrapSignatureFailsWithoutThrowing() {
        assertEquals(ValidationData.FAILURE,
                engine.validateUserOp(state, userOp(Address.ZERO, new byte[10]), userOpHash, BigInteger.ZERO));
    }

    @Test
    void bootstrapClosesAfterInitialization() {
        byte[] signature = sign(ownerKey, Sha.toEthSignedMessageHash(userOpHash.getBytes()));
        state.markInitialized();

        assertEquals(ValidationData.FAILURE, engine.validateUserOp(state, userOp(Address.ZERO, signature), userOpHash, BigInteger.ZERO));
    }

    @Test
    void bootstrapClosesOnceAValidatorExists() {
        byte[] signature = sign(ownerKey, Sha.toEthSignedMessageHash(userOpHash.getBytes()));
        state.getRegistry().add(ModuleType.VALIDATOR, validatorAddress);

        assertEquals(ValidationData.FAILURE, engine.validateUserOp(state, userOp(Address.ZERO, signature), userOpHash, BigInteger.ZERO));
    }

    @Test
    void installedValidatorResultIsReturnedRaw() {
        state.getRegistry().add(ModuleType.VALIDATOR, validatorAddress);
        BigInteger packed = ValidationData.pack(false, 1_800_000_000L, 1_700_000_000L);
        validator.setValidationResult(packed);

        BigInteger result = engine.validateUserOp(state, userOp(validatorAddress, new byte[]{1, 2}), userOpHash, BigInteger.ZERO);

        assertEquals(packed, result);
        assertEquals(userOpHash, validator.getLastHash());
        assertArrayEquals(new byte[]{1, 2}, validator.getLastSignature());
    }

    @Test
    void operationHooksRunInRegistrationOrder() {
        state.getRegistry().add(ModuleType.VALIDATOR, validatorAddress);
        state.getRegistry().add(ModuleType.PRE_VALIDATION_HOOK_OP, hookA);
        state.getRegistry().add(ModuleType.PRE_VALIDATION_HOOK_OP, hookB);

        engine.validateUserOp(state, userOp(validatorAddress, new byte[]{1}), userOpHash, BigInteger.ZERO);

        Hash32 expected = MockPreValidationHook.apply(MockPreValidationHook.apply(userOpHash, (byte) 0xA1), (byte) 0xB2);
        assertEquals(expected, validator.getLastHash());
        assertArrayEquals(new byte[]{1, (byte) 0xA1, (byte) 0xB2}, validator.getLastSignature());
    }

    @Test
    void reorderingHooksChangesDelegatedPair() {
        state.getRegistry().add(ModuleType.VALIDATOR, validatorAddress);
        state.getRegistry().add(ModuleType.PRE_VALIDATION_HOOK_OP, hookB);
        state.getRegistry().add(ModuleType.PRE_VALIDATION_HOOK_OP, hookA);

        engine.validateUserOp(state, userOp(validatorAddress, new byte[]{1}), userOpHash, BigInteger.ZERO);

        Hash32 forward = MockPreValidationHook.apply(MockPreValidationHook.apply(userOpHash, (byte) 0xA1), (byte) 0xB2);
        assertNotEquals(forward, validator.getLastHash());
        assertArrayEquals(new byte[]{1, (byte) 0xB2, (byte) 0xA1}, validator.getLastSignature());
    }

    @Test
    void signatureHooksDoNotApplyToOperations() {
        state.getRegistry().add(ModuleType.VALIDATOR, validatorAddress);
        state.getRegistry().add(ModuleType.PRE_VALIDATION_HOOK_SIG, hookA);

        engine.validateUserOp(state, userOp(validatorAddress, new byte[]{1}), userOpHash, BigInteger.ZERO);

        assertEquals(userOpHash, validator.getLastHash());
    }

    // ------------------------------ 直接签名 ------------------------------

    @Test
    void bootstrapSignatureCheckUsesRawHash() {
        assertEquals(Erc1271.MAGIC_VALUE, engine.isValidSignature(state, sender, userOpHash, sign(ownerKey, userOpHash.getBytes())));
        assertEquals(Erc1271.FAILED, engine.isValidSignature(state, sender, userOpHash,
                sign(ownerKey, Sha.toEthSignedMessageHash(userOpHash.getBytes()))));
        assertEquals(Erc1271.FAILED, engine.isValidSignature(state, sender, userOpHash, sign(new ECKey(), userOpHash.getBytes())));
        assertEquals(Erc1271.FAILED, engine.isValidSignature(state, sender, userOpHash, new byte[3]));
    }

    @Test
    void signatureCheckRevertsWhenValidatorMissingAfterInitialization() {
        state.markInitialized();

        AccountException e = assertThrows(AccountException.class,
                () -> engine.isValidSignature(state, sender, userOpHash, sign(ownerKey, userOpHash.getBytes())));
        assertEquals(ErrorType.INVALID_MODULE, e.getErrorType());
    }

    @Test
    void installedValidatorReceivesStrippedSignatureAndSender() {
        state.getRegistry().add(ModuleType.VALIDATOR, validatorAddress);
        state.getRegistry().add(ModuleType.PRE_VALIDATION_HOOK_SIG, hookA);
        validator.setSignatureResult(Erc1271.FAILED);

        int result = engine.isValidSignature(state, sender, userOpHash,
                ByteUtils.concat(validatorAddress.toBytes(), new byte[]{9, 9}));

        assertEquals(Erc1271.FAILED, result);
        assertEquals(sender, validator.getLastSender());
        assertEquals(MockPreValidationHook.apply(userOpHash, (byte) 0xA1), validator.getLastHash());
        assertArrayEquals(new byte[]{9, 9, (byte) 0xA1}, validator.getLastSignature());
    }

    private PackedUserOperation userOp(Address validator, byte[] signature) {
        return PackedUserOperation.builder()
                .sender(account)
                .nonce(PackedUserOperation.nonceFor(validator, 0))
                .signature(signature)
                .build();
    }

    private static byte[] sign(ECKey key, byte[] hash) {
        return Secp256k1Signer.sign(key.getPrivKeyBytes(), hash);
    }
}
