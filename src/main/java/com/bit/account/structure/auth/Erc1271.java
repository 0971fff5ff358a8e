package com.bit.account.structure.auth;

/**
 * 直接签名校验面的结果常量
 */
public final class Erc1271 {

    // bytes4(keccak256("isValidSignature(bytes32,bytes)"))
    public static final int MAGIC_VALUE = 0x1626ba7e;

    public static final int FAILED = 0xffffffff;

    private Erc1271() {
    }

    public static boolean isMagic(int result) {
        return result == MAGIC_VALUE;
    }
}
