package com.bit.account.util;

import com.bit.account.common.Address;
import com.bit.account.common.Hash32;
import com.bit.account.config.SmartAccountProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.bouncycastle.util.encoders.Hex;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 带缓存的 secp256k1 签名者恢复
 * key=哈希Hex:签名Hex，value=签名者地址；格式错误的签名不会进入缓存
 */
@Component
public class Secp256k1SignatureRecoverer implements SignatureRecoverer {

    private final Cache<String, Address> signerCache;

    @Autowired
    public Secp256k1SignatureRecoverer(SmartAccountProperties properties) {
        this(properties.getSignature().getCacheSize(), properties.getSignature().getCacheTtlMinutes());
    }

    public Secp256k1SignatureRecoverer(long cacheSize, long ttlMinutes) {
        this.signerCache = Caffeine.newBuilder()
                .maximumSize(cacheSize)
                .expireAfterWrite(ttlMinutes, TimeUnit.MINUTES)
                .build();
    }

    @Override
    public Address recover(Hash32 hash, byte[] signature) {
        String key = Hex.toHexString(hash.getBytes()) + ":" + Hex.toHexString(signature);
        return signerCache.get(key, k -> Secp256k1Signer.recoverAddress(hash.getBytes(), signature));
    }
}
