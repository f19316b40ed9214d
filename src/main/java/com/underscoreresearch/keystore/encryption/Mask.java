package com.underscoreresearch.keystore.encryption;

import static com.underscoreresearch.keystore.utils.EncodingUtils.xor;

import java.util.Arrays;

import javax.security.auth.Destroyable;

import com.underscoreresearch.keystore.utils.EncodingUtils;

/**
 * XOR difference between two password keys. A mask on its own reveals neither key, it only moves material keyed
 * with the old key over to the new one. It is only meaningful together with the generation it transitions to.
 */
public final class Mask implements Destroyable {
    public static final int MASK_SIZE = 32;

    private final byte[] mask;
    private volatile boolean destroyed;

    private Mask(byte[] mask) {
        this.mask = mask;
    }

    public static Mask fromBytes(byte[] mask) {
        if (mask.length != MASK_SIZE) {
            throw new IllegalArgumentException("Mask must be " + MASK_SIZE + " bytes");
        }
        return new Mask(mask.clone());
    }

    static Mask wrap(byte[] mask) {
        return new Mask(mask);
    }

    public static Mask decode(String encoded) {
        byte[] data;
        try {
            data = EncodingUtils.decodeBytes(encoded.trim());
        } catch (IllegalArgumentException exc) {
            throw new IllegalArgumentException("Mask is not valid base32", exc);
        }
        try {
            return fromBytes(data);
        } finally {
            Arrays.fill(data, (byte) 0);
        }
    }

    /**
     * Encoded form for handing the mask to sibling copies of the keystore.
     */
    public String encode() {
        return EncodingUtils.encodeBytes(bytes());
    }

    public byte[] toBytes() {
        return bytes().clone();
    }

    byte[] apply(byte[] data) {
        return xor(data, bytes());
    }

    private byte[] bytes() {
        if (destroyed) {
            throw new IllegalStateException("Mask has been destroyed");
        }
        return mask;
    }

    @Override
    public void destroy() {
        destroyed = true;
        Arrays.fill(mask, (byte) 0);
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public String toString() {
        return "Mask[REDACTED]";
    }
}
