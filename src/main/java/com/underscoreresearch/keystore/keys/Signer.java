package com.underscoreresearch.keystore.keys;

import lombok.Getter;

import com.underscoreresearch.keystore.encryption.SecretSeed;

/**
 * Signs payloads with the seed of the {@link KeyHandle} it came from. The signer borrows that seed, once the handle
 * is destroyed signing fails.
 */
public final class Signer {
    @Getter
    private final SignatureScheme scheme;
    private final SecretSeed seed;
    private final byte[] publicKey;
    @Getter
    private final AccountId accountId;

    Signer(SignatureScheme scheme, SecretSeed seed) {
        this.scheme = scheme;
        this.seed = seed;
        this.publicKey = scheme.derivePublic(seed);
        this.accountId = scheme.toAccountId(publicKey);
    }

    public byte[] getPublicKey() {
        return publicKey.clone();
    }

    public byte[] sign(byte[] payload) {
        return scheme.sign(seed, payload);
    }

    public boolean verify(byte[] payload, byte[] signature) {
        return scheme.verify(publicKey, payload, signature);
    }
}
