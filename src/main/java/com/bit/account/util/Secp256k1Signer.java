package com.bit.account.util;

import com.bit.account.common.Address;
import com.bit.account.exception.AccountException;
import com.bit.account.exception.ErrorType;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Sha256Hash;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.util.BigIntegers;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * secp256k1 可恢复签名工具（以太坊格式 r(32) | s(32) | v(1)，v 取 27/28）
 */
@Slf4j
public class Secp256k1Signer {

    public static final int SIGNATURE_LENGTH = 65;
    public static final int PRIVATE_KEY_CORE_LENGTH = 32;

    private Secp256k1Signer() {
    }

    // ------------------------------ 地址派生 ------------------------------

    /**
     * 非压缩公钥去掉0x04前缀后做 keccak256，取后20字节
     */
    public static Address toAddress(ECPoint publicKey) {
        byte[] encoded = publicKey.getEncoded(false);
        byte[] hash = Sha.keccak256(Arrays.copyOfRange(encoded, 1, encoded.length));
        return Address.fromBytes(Arrays.copyOfRange(hash, hash.length - Address.LENGTH, hash.length));
    }

    public static Address toAddress(ECKey key) {
        return toAddress(key.getPubKeyPoint());
    }

    public static Address toAddress(byte[] privateKey) {
        return toAddress(ECKey.fromPrivate(privateKey));
    }

    // ------------------------------ 签名 ------------------------------

    /**
     * 对32字节哈希做可恢复签名（bitcoinj 已规范化为 low-S）
     * @param privateKey 32字节核心私钥
     * @param hash32 待签名哈希（调用方负责 EIP-191 包装）
     * @return 65字节签名
     */
    public static byte[] sign(byte[] privateKey, byte[] hash32) {
        if (privateKey.length != PRIVATE_KEY_CORE_LENGTH) {
            throw new IllegalArgumentException("私钥必须为32字节");
        }
        ECKey key = ECKey.fromPrivate(privateKey);
        Sha256Hash message = Sha256Hash.wrap(hash32);
        ECKey.ECDSASignature signature = key.sign(message);
        for (int recId = 0; recId < 4; recId++) {
            ECKey recovered = ECKey.recoverFromSignature(recId, signature, message, false);
            if (recovered != null && recovered.getPubKeyPoint().equals(key.getPubKeyPoint())) {
                return ByteUtils.concat(
                        BigIntegers.asUnsignedByteArray(32, signature.r),
                        BigIntegers.asUnsignedByteArray(32, signature.s),
                        new byte[]{(byte) (27 + recId)});
            }
        }
        throw new IllegalStateException("无法确定恢复标识，签名失败");
    }

    // ------------------------------ 恢复 ------------------------------

    /**
     * 从签名恢复签名者地址
     * @throws AccountException MALFORMED_SIGNATURE 长度、v 值、r/s 范围不合法或无法恢复
     */
    public static Address recoverAddress(byte[] hash32, byte[] signature) {
        if (hash32 == null || hash32.length != 32) {
            throw new IllegalArgumentException("待恢复哈希必须为32字节");
        }
        if (signature == null || signature.length != SIGNATURE_LENGTH) {
            throw new AccountException(ErrorType.MALFORMED_SIGNATURE,
                    "签名长度必须为65字节，实际 " + (signature == null ? 0 : signature.length));
        }
        BigInteger r = new BigInteger(1, Arrays.copyOfRange(signature, 0, 32));
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(signature, 32, 64));
        int v = signature[64] & 0xFF;
        int recId = v >= 27 ? v - 27 : v;
        if (recId != 0 && recId != 1) {
            throw new AccountException(ErrorType.MALFORMED_SIGNATURE, "v 值非法: " + v);
        }
        if (r.signum() == 0 || s.signum() == 0
                || r.compareTo(ECKey.CURVE.getN()) >= 0 || s.compareTo(ECKey.HALF_CURVE_ORDER) > 0) {
            throw new AccountException(ErrorType.MALFORMED_SIGNATURE, "r/s 超出范围或非 low-S 签名");
        }
        ECKey recovered = ECKey.recoverFromSignature(recId, new ECKey.ECDSASignature(r, s), Sha256Hash.wrap(hash32), false);
        if (recovered == null) {
            throw new AccountException(ErrorType.MALFORMED_SIGNATURE, "无法从签名恢复公钥");
        }
        return toAddress(recovered);
    }
}
