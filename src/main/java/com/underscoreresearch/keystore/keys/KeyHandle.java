package com.underscoreresearch.keystore.keys;

import java.security.NoSuchAlgorithmException;
import java.security.ProviderException;
import java.security.SecureRandom;
import java.util.Arrays;

import javax.security.auth.Destroyable;

import lombok.Getter;

import com.underscoreresearch.keystore.encryption.SecretSeed;
import com.underscoreresearch.keystore.errors.EntropyException;
import com.underscoreresearch.keystore.errors.InvalidMnemonicException;
import com.underscoreresearch.keystore.errors.InvalidSuriException;
import com.underscoreresearch.keystore.errors.NotEnoughEntropyException;

/**
 * A device key bound to the signature scheme it is used with. Everything public about the key is derived from the
 * seed on demand, destroying the handle wipes the seed and disables every {@link Signer} taken from it.
 */
public final class KeyHandle implements Destroyable {
    @Getter
    private final SignatureScheme scheme;
    private final SecretSeed seed;

    private KeyHandle(SignatureScheme scheme, SecretSeed seed) {
        this.scheme = scheme;
        this.seed = seed;
    }

    public static KeyHandle fromSeed(SignatureScheme scheme, SecretSeed seed) {
        return new KeyHandle(scheme, seed);
    }

    public static KeyHandle generate(SignatureScheme scheme) throws EntropyException {
        SecureRandom random;
        try {
            random = SecureRandom.getInstanceStrong();
        } catch (NoSuchAlgorithmException exc) {
            throw new EntropyException("No strong source of randomness available", exc);
        }
        return generate(scheme, random);
    }

    public static KeyHandle generate(SignatureScheme scheme, SecureRandom random) throws EntropyException {
        try {
            SecretSeed seed = SecretSeed.generate(random);
            while (!scheme.isValidSeed(seed)) {
                seed.destroy();
                seed = SecretSeed.generate(random);
            }
            return new KeyHandle(scheme, seed);
        } catch (ProviderException exc) {
            throw new EntropyException("Failed to collect entropy for device key", exc);
        }
    }

    /**
     * Uses the first 32 bytes of entropy encoded in a BIP-39 phrase, which means only 24 word phrases qualify.
     */
    public static KeyHandle fromMnemonic(SignatureScheme scheme, String phrase)
            throws InvalidMnemonicException, NotEnoughEntropyException {
        byte[] entropy = Mnemonics.toEntropy(phrase);
        try {
            if (entropy.length < SecretSeed.SEED_SIZE) {
                throw new NotEnoughEntropyException(entropy.length, SecretSeed.SEED_SIZE);
            }
            byte[] seed = Arrays.copyOf(entropy, SecretSeed.SEED_SIZE);
            try {
                SecretSeed secretSeed = SecretSeed.fromBytes(seed);
                if (!scheme.isValidSeed(secretSeed)) {
                    secretSeed.destroy();
                    throw new InvalidMnemonicException();
                }
                return new KeyHandle(scheme, secretSeed);
            } finally {
                Arrays.fill(seed, (byte) 0);
            }
        } finally {
            Arrays.fill(entropy, (byte) 0);
        }
    }

    public static KeyHandle fromSuri(SignatureScheme scheme, String suri) throws InvalidSuriException {
        return new KeyHandle(scheme, SecretUri.parse(suri).deriveSeed(scheme));
    }

    /**
     * The seed owned by this handle. It stays valid only as long as the handle is not destroyed.
     */
    public SecretSeed getSecretSeed() {
        return seed;
    }

    public Signer toSigner() {
        return new Signer(scheme, seed);
    }

    public AccountId toAccountId() {
        return scheme.toAccountId(scheme.derivePublic(seed));
    }

    @Override
    public void destroy() {
        seed.destroy();
    }

    @Override
    public boolean isDestroyed() {
        return seed.isDestroyed();
    }

    @Override
    public String toString() {
        return "KeyHandle[" + scheme.getName() + "]";
    }
}
