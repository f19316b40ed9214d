package com.underscoreresearch.keystore.utils;

import com.google.common.io.BaseEncoding;

public final class EncodingUtils {
    private EncodingUtils() {
    }

    public static String encodeBytes(byte[] bytes) {
        return BaseEncoding.base32().encode(bytes).replace("=", "");
    }

    public static byte[] decodeBytes(String data) {
        return BaseEncoding.base32().decode(data);
    }

    public static String encodeHex(byte[] bytes) {
        return BaseEncoding.base16().lowerCase().encode(bytes);
    }

    /**
     * Decodes hex with or without a leading <code>0x</code>, in either case.
     */
    public static byte[] decodeHex(String data) {
        String hex = data.startsWith("0x") || data.startsWith("0X") ? data.substring(2) : data;
        return BaseEncoding.base16().lowerCase().decode(hex.toLowerCase());
    }

    public static byte[] xor(byte[] first, byte[] second) {
        if (first.length != second.length) {
            throw new IllegalArgumentException("Can not combine values of different length");
        }
        byte[] ret = new byte[first.length];
        for (int i = 0; i < first.length; i++) {
            ret[i] = (byte) (first[i] ^ second[i]);
        }
        return ret;
    }
}
