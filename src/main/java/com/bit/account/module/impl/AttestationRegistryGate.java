package com.bit.account.module.impl;

import com.bit.account.common.Address;
import com.bit.account.config.SmartAccountProperties;
import com.bit.account.module.ModuleRegistryGate;
import com.bit.account.structure.module.ModuleType;
import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 证明注册表闸门：受信证明方中至少 threshold 个为 (模块, 类别) 出具了证明才放行
 * threshold 为0时不做任何限制
 */
@Slf4j
@Component
public class AttestationRegistryGate implements ModuleRegistryGate {

    private final List<Address> trustedAttesters;

    private final int threshold;

    // 证明方 -> 已证明的 "模块:类别"
    private final Map<Address, Set<String>> attestations = new ConcurrentHashMap<>();

    @Autowired
    public AttestationRegistryGate(SmartAccountProperties properties) {
        this(properties.getRegistry().getAttesters().stream().map(Address::fromHex).collect(Collectors.toList()),
                properties.getRegistry().getThreshold());
    }

    public AttestationRegistryGate(List<Address> trustedAttesters, int threshold) {
        Preconditions.checkArgument(threshold >= 0, "证明阈值不能为负数");
        Preconditions.checkArgument(threshold <= trustedAttesters.size(),
                "证明阈值 %s 超过受信证明方数量 %s", threshold, trustedAttesters.size());
        this.trustedAttesters = Collections.unmodifiableList(new ArrayList<>(trustedAttesters));
        this.threshold = threshold;
        log.info("证明注册表闸门初始化完成，受信证明方 {} 个，阈值 {}", trustedAttesters.size(), threshold);
    }

    public void attest(Address attester, Address module, ModuleType category) {
        attestations.computeIfAbsent(attester, k -> ConcurrentHashMap.newKeySet()).add(key(module, category));
    }

    public void revoke(Address attester, Address module, ModuleType category) {
        Set<String> set = attestations.get(attester);
        if (set != null) {
            set.remove(key(module, category));
        }
    }

    @Override
    public boolean authorize(Address module, ModuleType category) {
        if (threshold == 0) {
            return true;
        }
        String key = key(module, category);
        long count = trustedAttesters.stream()
                .filter(attester -> attestations.getOrDefault(attester, Collections.emptySet()).contains(key))
                .count();
        boolean allowed = count >= threshold;
        if (!allowed) {
            log.warn("模块 {} ({}) 证明数 {} 未达到阈值 {}", module, category, count, threshold);
        }
        return allowed;
    }

    private static String key(Address module, ModuleType category) {
        return module.toHex() + ":" + category.getId();
    }
}
