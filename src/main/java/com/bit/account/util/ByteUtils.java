package com.bit.account.util;

import org.bouncycastle.util.encoders.Hex;

import java.util.Arrays;

public class ByteUtils {

    public static final byte[] EMPTY = new byte[0];

    private ByteUtils() {
    }

    /**
     * 多段字节数组顺序拼接，null 段视为空
     */
    public static byte[] concat(byte[]... parts) {
        int total = 0;
        for (byte[] part : parts) {
            total += part == null ? 0 : part.length;
        }
        byte[] combined = new byte[total];
        int offset = 0;
        for (byte[] part : parts) {
            if (part == null) {
                continue;
            }
            System.arraycopy(part, 0, combined, offset, part.length);
            offset += part.length;
        }
        return combined;
    }

    /**
     * 截取 [from, 末尾)，越界时返回空数组（与 calldata 切片语义一致）
     */
    public static byte[] tail(byte[] data, int from) {
        if (data == null || from >= data.length) {
            return EMPTY;
        }
        return Arrays.copyOfRange(data, from, data.length);
    }

    /**
     * 截取前 length 字节，不足时右侧补零
     */
    public static byte[] headPadded(byte[] data, int length) {
        byte[] head = new byte[length];
        if (data != null) {
            System.arraycopy(data, 0, head, 0, Math.min(length, data.length));
        }
        return head;
    }

    public static byte[] nullToEmpty(byte[] data) {
        return data == null ? EMPTY : data;
    }

    /**
     * 字节数组转 0x 前缀十六进制字符串
     */
    public static String toHex(byte[] bytes) {
        return "0x" + Hex.toHexString(nullToEmpty(bytes));
    }

    /**
     * 十六进制字符串转字节数组，兼容 0x 前缀
     */
    public static byte[] fromHex(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("十六进制字符串不能为空");
        }
        String clean = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (clean.length() % 2 != 0) {
            throw new IllegalArgumentException("十六进制字符串长度必须为偶数: " + hex);
        }
        return Hex.decode(clean);
    }
}
