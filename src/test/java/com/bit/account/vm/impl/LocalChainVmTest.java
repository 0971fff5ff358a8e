package com.bit.account.vm.impl;

import com.bit.account.common.Address;
import com.bit.account.mock.CounterTarget;
import com.bit.account.vm.CallResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.bit.account.mock.AccountTestSupport.address;
import static org.junit.jupiter.api.Assertions.*;

public class LocalChainVmTest {

    private final Address alice = address(1);
    private final Address counter = address(2);

    private LocalChainVm vm;

    @BeforeEach
    void setUp() {
        vm = new LocalChainVm();
        vm.deploy(counter, new CounterTarget());
        vm.credit(alice, BigInteger.valueOf(100));
    }

    @Test
    void plainTransferToAddressWithoutCode() {
        CallResult result = vm.call(alice, address(3), BigInteger.valueOf(40), new byte[0]);

        assertTrue(result.isSuccess());
        assertEquals(BigInteger.valueOf(60), vm.balanceOf(alice));
        assertEquals(BigInteger.valueOf(40), vm.balanceOf(address(3)));
    }

    @Test
    void insufficientBalanceFailsWithoutEffects() {
        CallResult result = vm.call(alice, counter, BigInteger.valueOf(101), CounterTarget.INCREMENT);

        assertFalse(result.isSuccess());
        assertEquals(BigInteger.valueOf(100), vm.balanceOf(alice));
        assertEquals(0, CounterTarget.read(vm, counter));
    }

    @Test
    void revertedCallUndoesValueAndReturnsRevertData() {
        CallResult result = vm.call(alice, counter, BigInteger.TEN, CounterTarget.FAIL);

        assertFalse(result.isSuccess());
        assertArrayEquals(CounterTarget.BOOM, result.getReturnData());
        assertEquals(BigInteger.valueOf(100), vm.balanceOf(alice));
    }

    @Test
    void outerSnapshotRevertsNestedCommittedCalls() {
        int snapshot = vm.snapshot();
        vm.call(alice, counter, BigInteger.ZERO, CounterTarget.INCREMENT);
        vm.emit(alice, "event");
        assertEquals(1, CounterTarget.read(vm, counter));

        vm.revertToSnapshot(snapshot);

        assertEquals(0, CounterTarget.read(vm, counter));
        assertTrue(vm.getLogs().isEmpty());
    }

    @Test
    void discardKeepsState() {
        int snapshot = vm.snapshot();
        vm.call(alice, counter, BigInteger.ZERO, CounterTarget.INCREMENT);
        vm.discardSnapshot(snapshot);

        assertEquals(1, CounterTarget.read(vm, counter));
        assertThrows(IllegalStateException.class, () -> vm.revertToSnapshot(snapshot));
    }

    @Test
    void staticCallCannotWrite() {
        CallResult result = vm.staticCall(alice, counter, CounterTarget.INCREMENT);

        assertFalse(result.isSuccess());
        assertEquals(0, CounterTarget.read(vm, counter));
    }

    @Test
    void delegateCallWritesIntoCallerContext() {
        CallResult result = vm.delegateCall(alice, address(9), counter, CounterTarget.INCREMENT);

        assertTrue(result.isSuccess());
        assertEquals(1, CounterTarget.read(vm, alice));
        assertEquals(0, CounterTarget.read(vm, counter));
    }

    @Test
    void eventsAreFilteredByType() {
        vm.emit(alice, "text");
        vm.emit(alice, 42);
        assertEquals(1, vm.getEvents(String.class).size());
        assertEquals(1, vm.getEvents(Integer.class).size());
    }

    @Test
    void delegationIsTrackedPerAccount() {
        assertNull(vm.delegateOf(alice));
        vm.setDelegate(alice, address(7));
        assertEquals(address(7), vm.delegateOf(alice));
        vm.setDelegate(alice, null);
        assertNull(vm.delegateOf(alice));
    }

    @Test
    void unexpectedExceptionBecomesEmptyRevert() {
        vm.deploy(address(5), frame -> {
            throw new IllegalStateException("bug");
        });
        CallResult result = vm.call(alice, address(5), BigInteger.ZERO, new byte[0]);

        assertFalse(result.isSuccess());
        assertEquals(0, result.getReturnData().length);
    }
}
