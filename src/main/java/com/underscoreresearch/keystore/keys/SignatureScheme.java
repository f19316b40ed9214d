package com.underscoreresearch.keystore.keys;

import com.underscoreresearch.keystore.encryption.SecretSeed;

/**
 * Signing algebra a device key is used with. Every operation is deterministic in the seed.
 */
public interface SignatureScheme {
    String getName();

    /**
     * Domain separator for hard key derivation, for instance <code>Ed25519HDKD</code>.
     */
    String getDerivationDomain();

    /**
     * Whether <code>seed</code> can be used as a private key of this scheme.
     */
    boolean isValidSeed(SecretSeed seed);

    byte[] derivePublic(SecretSeed seed);

    byte[] sign(SecretSeed seed, byte[] payload);

    boolean verify(byte[] publicKey, byte[] payload, byte[] signature);

    AccountId toAccountId(byte[] publicKey);
}
