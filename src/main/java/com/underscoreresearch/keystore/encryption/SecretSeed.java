package com.underscoreresearch.keystore.encryption;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.function.Function;

import javax.security.auth.Destroyable;

/**
 * The 32 byte device key. The bytes are only reachable through {@link #expose(Function)}, which lends the backing
 * array to the callback for the duration of the call. Callers must not hold on to the array after returning.
 */
public final class SecretSeed implements Destroyable {
    public static final int SEED_SIZE = 32;

    private final byte[] seed;
    private volatile boolean destroyed;

    private SecretSeed(byte[] seed) {
        this.seed = seed;
    }

    /**
     * Copies the supplied bytes, the caller stays responsible for wiping its own array.
     */
    public static SecretSeed fromBytes(byte[] seed) {
        if (seed.length != SEED_SIZE) {
            throw new IllegalArgumentException("Seed must be " + SEED_SIZE + " bytes");
        }
        return new SecretSeed(seed.clone());
    }

    /**
     * Takes ownership of the array without copying. Only used where the array was created for this seed.
     */
    static SecretSeed wrap(byte[] seed) {
        if (seed.length != SEED_SIZE) {
            Arrays.fill(seed, (byte) 0);
            throw new IllegalArgumentException("Seed must be " + SEED_SIZE + " bytes");
        }
        return new SecretSeed(seed);
    }

    public static SecretSeed generate(SecureRandom random) {
        byte[] seed = new byte[SEED_SIZE];
        random.nextBytes(seed);
        return new SecretSeed(seed);
    }

    public <T> T expose(Function<byte[], T> consumer) {
        if (destroyed) {
            throw new IllegalStateException("Secret seed has been destroyed");
        }
        return consumer.apply(seed);
    }

    @Override
    public void destroy() {
        destroyed = true;
        Arrays.fill(seed, (byte) 0);
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public String toString() {
        return "SecretSeed[REDACTED]";
    }
}
