package com.bit.account.util;

import com.bit.account.common.Address;
import com.bit.account.common.Hash32;
import com.bit.account.exception.AccountException;
import com.bit.account.exception.ErrorType;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.ECKey;
import org.bouncycastle.util.BigIntegers;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class Secp256k1SignerTest {

    private final byte[] hash = Sha.keccak256("hello smart account".getBytes(StandardCharsets.UTF_8));

    @Test
    void keccakOfEmptyInput() {
        assertEquals("0xc5d2460186f7233c927e7db2dcc703c0e500b653ca82273b7bfad8045d85a470",
                ByteUtils.toHex(Sha.keccak256(new byte[0])));
    }

    @Test
    void derivesKnownAddresses() {
        assertEquals(Address.fromHex("0x7E5F4552091A69125d5DfCb7b8C2659029395Bdf"),
                Secp256k1Signer.toAddress(ECKey.fromPrivate(BigInteger.ONE)));
        assertEquals(Address.fromHex("0x2c7536E3605D9C16a7a3D7b1898e529396a65c23"),
                Secp256k1Signer.toAddress(ECKey.fromPrivate(
                        new BigInteger("4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318", 16))));
    }

    @Test
    void recoversSigner() {
        ECKey key = new ECKey();
        byte[] signature = Secp256k1Signer.sign(key.getPrivKeyBytes(), hash);
        log.info("签名：{}", ByteUtils.toHex(signature));

        assertEquals(65, signature.length);
        int v = signature[64] & 0xFF;
        assertTrue(v == 27 || v == 28);
        assertEquals(Secp256k1Signer.toAddress(key), Secp256k1Signer.recoverAddress(hash, signature));
    }

    @Test
    void acceptsZeroBasedRecoveryId() {
        ECKey key = new ECKey();
        byte[] signature = Secp256k1Signer.sign(key.getPrivKeyBytes(), hash);
        signature[64] = (byte) (signature[64] - 27);
        assertEquals(Secp256k1Signer.toAddress(key), Secp256k1Signer.recoverAddress(hash, signature));
    }

    @Test
    void differentHashRecoversDifferentSigner() {
        ECKey key = new ECKey();
        byte[] signature = Secp256k1Signer.sign(key.getPrivKeyBytes(), hash);
        byte[] other = Sha.keccak256(hash);
        assertNotEquals(Secp256k1Signer.toAddress(key), Secp256k1Signer.recoverAddress(other, signature));
    }

    @Test
    void rejectsMalformedSignatures() {
        ECKey key = new ECKey();
        byte[] good = Secp256k1Signer.sign(key.getPrivKeyBytes(), hash);

        assertMalformed(Arrays.copyOf(good, 64));

        byte[] badV = good.clone();
        badV[64] = 30;
        assertMalformed(badV);

        // s 取 n - s 得到高 S 形式
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(good, 32, 64));
        byte[] highS = good.clone();
        System.arraycopy(BigIntegers.asUnsignedByteArray(32, ECKey.CURVE.getN().subtract(s)), 0, highS, 32, 32);
        assertMalformed(highS);

        byte[] zeroR = good.clone();
        Arrays.fill(zeroR, 0, 32, (byte) 0);
        assertMalformed(zeroR);
    }

    @Test
    void cachedRecovererMatchesDirectRecovery() {
        ECKey key = new ECKey();
        byte[] signature = Secp256k1Signer.sign(key.getPrivKeyBytes(), hash);
        Secp256k1SignatureRecoverer recoverer = new Secp256k1SignatureRecoverer(10, 1);

        Address first = recoverer.recover(Hash32.wrap(hash), signature);
        Address second = recoverer.recover(Hash32.wrap(hash), signature);

        assertEquals(Secp256k1Signer.toAddress(key), first);
        assertEquals(first, second);
        assertThrows(AccountException.class, () -> recoverer.recover(Hash32.wrap(hash), new byte[3]));
    }

    private void assertMalformed(byte[] signature) {
        AccountException e = assertThrows(AccountException.class, () -> Secp256k1Signer.recoverAddress(hash, signature));
        assertEquals(ErrorType.MALFORMED_SIGNATURE, e.getErrorType());
    }
}
