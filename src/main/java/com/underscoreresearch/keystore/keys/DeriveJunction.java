package com.underscoreresearch.keystore.keys;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import com.underscoreresearch.keystore.errors.InvalidSuriException;

/**
 * One step of a secret URI derivation path. <code>//name</code> is a hard junction and <code>/name</code> a soft
 * one. Numeric names are encoded as little endian 64 bit integers, anything else as a length prefixed string, and
 * the encoding is hashed down if it does not fit the 32 byte chain code.
 */
@EqualsAndHashCode
public final class DeriveJunction {
    public static final int CHAIN_CODE_SIZE = 32;

    @Getter
    private final boolean hard;
    private final byte[] chainCode;

    private DeriveJunction(boolean hard, byte[] chainCode) {
        this.hard = hard;
        this.chainCode = chainCode;
    }

    /**
     * @param junction Junction text without its leading separator, a remaining leading <code>/</code> marks it hard.
     */
    public static DeriveJunction parse(String junction) throws InvalidSuriException {
        boolean hard = junction.startsWith("/");
        String code = hard ? junction.substring(1) : junction;
        if (code.isEmpty()) {
            throw new InvalidSuriException("Empty derivation junction");
        }
        return new DeriveJunction(hard, chainCode(encode(code)));
    }

    private static byte[] encode(String code) throws InvalidSuriException {
        try {
            long index = Long.parseUnsignedLong(code);
            return ByteBuffer.allocate(Long.BYTES).order(ByteOrder.LITTLE_ENDIAN).putLong(index).array();
        } catch (NumberFormatException ignored) {
            return encodeString(code);
        }
    }

    static byte[] encodeString(String value) throws InvalidSuriException {
        byte[] data = value.getBytes(StandardCharsets.UTF_8);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int length = data.length;
        if (length < 1 << 6) {
            out.write(length << 2);
        } else if (length < 1 << 14) {
            int prefix = (length << 2) | 0b01;
            out.write(prefix & 0xff);
            out.write((prefix >> 8) & 0xff);
        } else if (length < 1 << 30) {
            int prefix = (length << 2) | 0b10;
            for (int i = 0; i < 4; i++) {
                out.write((prefix >> (8 * i)) & 0xff);
            }
        } else {
            throw new InvalidSuriException("Derivation junction is too long");
        }
        out.write(data, 0, data.length);
        return out.toByteArray();
    }

    private static byte[] chainCode(byte[] encoded) {
        if (encoded.length > CHAIN_CODE_SIZE) {
            return Blake2.hash256(encoded);
        }
        return Arrays.copyOf(encoded, CHAIN_CODE_SIZE);
    }

    public byte[] getChainCode() {
        return chainCode.clone();
    }
}
