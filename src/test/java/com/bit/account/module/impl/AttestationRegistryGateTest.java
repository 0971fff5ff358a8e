package com.bit.account.module.impl;

import com.bit.account.common.Address;
import com.bit.account.structure.module.ModuleType;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static com.bit.account.mock.AccountTestSupport.address;
import static org.junit.jupiter.api.Assertions.*;

public class AttestationRegistryGateTest {

    private final Address module = address(100);

    @Test
    void zeroThresholdAllowsEverything() {
        AttestationRegistryGate gate = new AttestationRegistryGate(Collections.emptyList(), 0);
        assertTrue(gate.authorize(module, ModuleType.VALIDATOR));
    }

    @Test
    void requiresThresholdOfTrustedAttesters() {
        List<Address> attesters = List.of(address(1), address(2), address(3));
        AttestationRegistryGate gate = new AttestationRegistryGate(attesters, 2);

        gate.attest(address(1), module, ModuleType.VALIDATOR);
        assertFalse(gate.authorize(module, ModuleType.VALIDATOR));

        // 非受信证明方不计数
        gate.attest(address(50), module, ModuleType.VALIDATOR);
        assertFalse(gate.authorize(module, ModuleType.VALIDATOR));

        gate.attest(address(3), module, ModuleType.VALIDATOR);
        assertTrue(gate.authorize(module, ModuleType.VALIDATOR));
        assertFalse(gate.authorize(module, ModuleType.EXECUTOR));

        gate.revoke(address(3), module, ModuleType.VALIDATOR);
        assertFalse(gate.authorize(module, ModuleType.VALIDATOR));
    }

    @Test
    void thresholdAboveAttesterCountIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new AttestationRegistryGate(List.of(address(1)), 2));
        assertThrows(IllegalArgumentException.class, () -> new AttestationRegistryGate(List.of(address(1)), -1));
    }
}
