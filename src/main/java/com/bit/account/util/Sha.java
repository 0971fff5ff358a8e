package com.bit.account.util;

import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.jcajce.provider.digest.Keccak;

import java.security.MessageDigest;

/**
 * 哈希工具：以太坊体系统一使用 Keccak-256（非 NIST SHA3-256）
 */
@Slf4j
public class Sha {

    // ThreadLocal存储每个线程独立的Keccak-256实例
    private static final ThreadLocal<MessageDigest> KECCAK256_THREAD_LOCAL =
            ThreadLocal.withInitial(Keccak.Digest256::new);

    private static final byte[] ETH_SIGNED_MESSAGE_PREFIX =
            "\u0019Ethereum Signed Message:\n32".getBytes(java.nio.charset.StandardCharsets.US_ASCII);

    private Sha() {
    }

    /**
     * 线程安全的Keccak-256计算
     */
    public static byte[] keccak256(byte[] data) {
        // 允许空输入，按空数组处理
        data = data == null ? new byte[0] : data;
        MessageDigest digest = KECCAK256_THREAD_LOCAL.get();
        digest.reset();
        return digest.digest(data);
    }

    /**
     * 多段数据拼接后计算Keccak-256
     */
    public static byte[] keccak256(byte[]... parts) {
        MessageDigest digest = KECCAK256_THREAD_LOCAL.get();
        digest.reset();
        for (byte[] part : parts) {
            if (part != null) {
                digest.update(part);
            }
        }
        return digest.digest();
    }

    /**
     * EIP-191 个人消息哈希：keccak256("\x19Ethereum Signed Message:\n32" || hash)
     */
    public static byte[] toEthSignedMessageHash(byte[] hash32) {
        if (hash32 == null || hash32.length != 32) {
            throw new IllegalArgumentException("待包装的哈希必须为32字节");
        }
        return keccak256(ETH_SIGNED_MESSAGE_PREFIX, hash32);
    }
}
