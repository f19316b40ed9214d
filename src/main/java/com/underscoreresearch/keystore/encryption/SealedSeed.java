package com.underscoreresearch.keystore.encryption;

import java.security.MessageDigest;

/**
 * A {@link SecretSeed} at rest. <code>keyData</code> is the seed combined with a password key and
 * <code>seedHash</code> lets decryption detect a wrong key or tampered key data.
 */
public final class SealedSeed {
    private final byte[] keyData;
    private final byte[] seedHash;

    public SealedSeed(byte[] keyData, byte[] seedHash) {
        this.keyData = keyData.clone();
        this.seedHash = seedHash.clone();
    }

    public byte[] getKeyData() {
        return keyData.clone();
    }

    public byte[] getSeedHash() {
        return seedHash.clone();
    }

    public boolean sameAs(SealedSeed other) {
        return MessageDigest.isEqual(keyData, other.keyData) && MessageDigest.isEqual(seedHash, other.seedHash);
    }
}
