package com.underscoreresearch.keystore.encryption;

import static com.underscoreresearch.keystore.utils.EncodingUtils.xor;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.spec.InvalidKeySpecException;
import java.util.Arrays;

import lombok.Getter;

import org.apache.commons.codec.binary.Base64;

import com.underscoreresearch.keystore.errors.DecryptionException;

import de.mkammerer.argon2.Argon2Advanced;
import de.mkammerer.argon2.Argon2Factory;

/**
 * Argon2 password derivation with the seed stored as <code>seed ^ key</code> next to a SHA3-256 hash of the seed.
 * Since the key enters the stored material through XOR only, re-keying is a single XOR with the mask.
 */
public class Argon2SeedCipher implements SeedCipher {
    public static final String ALGORITHM = "ARGON2";
    public static final int DEFAULT_ITERATIONS = 64;
    public static final int DEFAULT_MEMORY = 8192;
    public static final int DEFAULT_PARALLELISM = 2;
    private static final int SALT_SIZE = 32;
    private static final String SEED_HASH_ALGORITHM = "SHA3-256";

    private final SecureRandom random;
    @Getter
    private final int iterations;
    @Getter
    private final int memory;
    @Getter
    private final int parallelism;

    public Argon2SeedCipher() {
        this(DEFAULT_ITERATIONS, DEFAULT_MEMORY, DEFAULT_PARALLELISM);
    }

    public Argon2SeedCipher(int iterations, int memory, int parallelism) {
        this(new SecureRandom(), iterations, memory, parallelism);
    }

    public Argon2SeedCipher(SecureRandom random, int iterations, int memory, int parallelism) {
        if (iterations < 1 || parallelism < 1 || memory < 8 * parallelism) {
            throw new IllegalArgumentException("Invalid Argon2 parameters");
        }
        this.random = random;
        this.iterations = iterations;
        this.memory = memory;
        this.parallelism = parallelism;
    }

    private static byte[] seedHash(byte[] seed) {
        try {
            return MessageDigest.getInstance(SEED_HASH_ALGORITHM).digest(seed);
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException(e);
        }
    }

    @Override
    public String getAlgorithm() {
        return ALGORITHM;
    }

    @Override
    public byte[] createSalt() {
        byte[] salt = new byte[SALT_SIZE];
        random.nextBytes(salt);
        return salt;
    }

    @Override
    public PasswordKey keyFor(Password password, byte[] salt) throws GeneralSecurityException {
        if (salt == null || salt.length == 0) {
            throw new InvalidKeySpecException("Missing salt");
        }
        Argon2Advanced argon2 = Argon2Factory.createAdvanced();
        String hash = argon2.hash(iterations, memory, parallelism, password.chars(), StandardCharsets.UTF_8, salt);
        int lastPart = hash.lastIndexOf('$');
        byte[] key = Base64.decodeBase64(hash.substring(lastPart + 1));
        if (key.length != PasswordKey.KEY_SIZE) {
            Arrays.fill(key, (byte) 0);
            throw new InvalidKeySpecException("Unexpected password derivative length");
        }
        return new PasswordKey(key);
    }

    @Override
    public SealedSeed encrypt(PasswordKey key, SecretSeed seed) {
        return seed.expose(bytes -> {
            byte[] keyData = xor(bytes, key.bytes());
            return new SealedSeed(keyData, seedHash(bytes));
        });
    }

    @Override
    public SecretSeed decrypt(PasswordKey key, SealedSeed sealed) throws DecryptionException {
        byte[] keyData = sealed.getKeyData();
        if (keyData.length != SecretSeed.SEED_SIZE) {
            throw new DecryptionException("Stored key data has the wrong length");
        }
        byte[] seed = xor(keyData, key.bytes());
        if (!MessageDigest.isEqual(seedHash(seed), sealed.getSeedHash())) {
            Arrays.fill(seed, (byte) 0);
            throw new DecryptionException("Invalid password");
        }
        return SecretSeed.wrap(seed);
    }

    @Override
    public SealedSeed rekey(SealedSeed sealed, Mask mask) {
        return new SealedSeed(mask.apply(sealed.getKeyData()), sealed.getSeedHash());
    }
}
