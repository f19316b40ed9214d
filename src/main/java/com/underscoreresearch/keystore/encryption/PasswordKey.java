package com.underscoreresearch.keystore.encryption;

import static com.underscoreresearch.keystore.utils.EncodingUtils.xor;

import java.util.Arrays;

import javax.security.auth.Destroyable;

/**
 * 32 byte key derived from a {@link Password} by the {@link SeedCipher}.
 */
public final class PasswordKey implements Destroyable {
    public static final int KEY_SIZE = 32;

    private final byte[] key;
    private volatile boolean destroyed;

    PasswordKey(byte[] key) {
        if (key.length != KEY_SIZE) {
            throw new IllegalArgumentException("Password key must be " + KEY_SIZE + " bytes");
        }
        this.key = key;
    }

    byte[] bytes() {
        if (destroyed) {
            throw new IllegalStateException("Password key has been destroyed");
        }
        return key;
    }

    /**
     * The mask that turns material keyed with this key into material keyed with <code>next</code>.
     */
    public Mask maskTo(PasswordKey next) {
        return Mask.wrap(xor(next.bytes(), bytes()));
    }

    /**
     * The key that results from moving this key through <code>mask</code>.
     */
    public PasswordKey apply(Mask mask) {
        return new PasswordKey(mask.apply(bytes()));
    }

    @Override
    public void destroy() {
        destroyed = true;
        Arrays.fill(key, (byte) 0);
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public String toString() {
        return "PasswordKey[REDACTED]";
    }
}
