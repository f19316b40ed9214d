package com.underscoreresearch.keystore.encryption;

import java.security.GeneralSecurityException;

import com.underscoreresearch.keystore.errors.DecryptionException;

/**
 * Turns passwords into keys and protects the device seed with them.
 * <p>
 * Implementations must be homomorphic over XOR of the key: for any mask <code>m = k2 ^ k1</code>,
 * <code>rekey(encrypt(k1, s), m)</code> has to decrypt under <code>k2</code> to <code>s</code>. This is what lets a
 * password change travel between copies of a keystore without ever decrypting the seed on the receiving side.
 */
public interface SeedCipher {
    String getAlgorithm();

    byte[] createSalt();

    /**
     * Slow, deterministic derivation. The same password and salt always produce the same key.
     */
    PasswordKey keyFor(Password password, byte[] salt) throws GeneralSecurityException;

    SealedSeed encrypt(PasswordKey key, SecretSeed seed);

    /**
     * Fails closed, a wrong key or modified material never yields a seed.
     */
    SecretSeed decrypt(PasswordKey key, SealedSeed sealed) throws DecryptionException;

    SealedSeed rekey(SealedSeed sealed, Mask mask);
}
