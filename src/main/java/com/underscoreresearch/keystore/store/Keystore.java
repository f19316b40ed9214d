package com.underscoreresearch.keystore.store;

import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.util.concurrent.locks.ReentrantLock;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.underscoreresearch.keystore.encryption.Mask;
import com.underscoreresearch.keystore.encryption.Password;
import com.underscoreresearch.keystore.encryption.PasswordKey;
import com.underscoreresearch.keystore.encryption.SealedSeed;
import com.underscoreresearch.keystore.encryption.SecretSeed;
import com.underscoreresearch.keystore.encryption.SeedCipher;
import com.underscoreresearch.keystore.errors.DecryptionException;
import com.underscoreresearch.keystore.errors.HasDeviceKeyException;
import com.underscoreresearch.keystore.errors.KeystoreException;
import com.underscoreresearch.keystore.errors.NoDeviceKeyException;
import com.underscoreresearch.keystore.errors.NotUnlockedException;
import com.underscoreresearch.keystore.errors.StaleGenerationException;
import com.underscoreresearch.keystore.errors.StorageException;
import com.underscoreresearch.keystore.keys.AccountId;
import com.underscoreresearch.keystore.keys.KeyHandle;
import com.underscoreresearch.keystore.keys.SignatureScheme;
import com.underscoreresearch.keystore.keys.Signer;
import com.underscoreresearch.keystore.utils.AccessLock;

/**
 * Password protected custody of a single device key.
 * <p>
 * Every operation that touches the store runs with this instance's lock and the directory lock held, and reloads
 * the store from disk first so that changes made by another process are never overwritten. {@link #gen()} only
 * reads the last generation this instance observed and never blocks.
 */
@Slf4j
public class Keystore {
    private final EncryptedStoreFile storeFile;
    private final SeedCipher cipher;
    @Getter
    private final SignatureScheme scheme;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile GenerationCounter generation;
    private UnlockedKey unlocked;

    private Keystore(EncryptedStoreFile storeFile, SeedCipher cipher, SignatureScheme scheme,
                     GenerationCounter generation) {
        this.storeFile = storeFile;
        this.cipher = cipher;
        this.scheme = scheme;
        this.generation = generation;
    }

    /**
     * Opens the keystore in <code>directory</code>. A directory without a store is a valid, empty keystore at
     * generation 0. Nothing is written until a key is provisioned.
     */
    public static Keystore open(Path directory, SeedCipher cipher, SignatureScheme scheme)
            throws StorageException {
        EncryptedStoreFile file = new EncryptedStoreFile(directory);
        EncryptedStore store = file.read();
        log.info("Opened keystore {} at generation {}", directory, store.getGenerationCounter());
        return new Keystore(file, cipher, scheme, store.getGenerationCounter());
    }

    public Path getPath() {
        return storeFile.getDirectory();
    }

    public GenerationCounter gen() {
        return generation;
    }

    public boolean hasDeviceKey() throws KeystoreException {
        return withStore(EncryptedStore::hasDeviceKey);
    }

    public AccountId provisionDevice(Password password, GenerationCounter gen) throws KeystoreException {
        return provisionDevice(password, gen, false);
    }

    /**
     * Generates a fresh device key, stores it under <code>password</code> and leaves the keystore unlocked with it.
     * <code>gen</code> must be the generation the store is currently at, the store moves to the one after it.
     */
    public AccountId provisionDevice(Password password, GenerationCounter gen, boolean force)
            throws KeystoreException {
        return install(() -> KeyHandle.generate(scheme), password, gen, force);
    }

    /**
     * Stores an externally created key, for instance one restored from a paper key. The keystore keeps its own copy
     * of the seed so the caller is free to destroy <code>key</code> afterwards.
     */
    public AccountId setDeviceKey(KeyHandle key, Password password, boolean force) throws KeystoreException {
        if (!key.getScheme().getName().equals(scheme.getName())) {
            throw new IllegalArgumentException("Key uses " + key.getScheme().getName() + " but keystore uses "
                    + scheme.getName());
        }
        if (!scheme.isValidSeed(key.getSecretSeed())) {
            throw new IllegalArgumentException("Key is not a valid " + scheme.getName() + " private key");
        }
        return install(() -> KeyHandle.fromSeed(scheme, key.getSecretSeed().expose(SecretSeed::fromBytes)),
                password, null, force);
    }

    private AccountId install(KeySource source, Password password, GenerationCounter expected, boolean force)
            throws KeystoreException {
        return withStore(store -> {
            GenerationCounter current = store.getGenerationCounter();
            if (store.hasDeviceKey()) {
                if (!force) {
                    throw new HasDeviceKeyException();
                }
                log.warn("Replacing existing device key in {}", getPath());
            }
            if (expected != null && !expected.equals(current)) {
                throw new StaleGenerationException(String.format(
                        "Provisioning expected generation %s but the store is at generation %s", expected, current));
            }
            GenerationCounter next = current.next();

            KeyHandle key = source.create();
            PasswordKey passwordKey = null;
            UnlockedKey installed;
            try {
                byte[] salt = cipher.createSalt();
                passwordKey = deriveKey(password, salt);
                installed = new UnlockedKey(key, passwordKey, next);
                SealedSeed sealed = cipher.encrypt(passwordKey, key.getSecretSeed());
                storeFile.write(EncryptedStore.sealed(cipher.getAlgorithm(), salt, sealed, next));
            } catch (KeystoreException | RuntimeException exc) {
                key.destroy();
                if (passwordKey != null) {
                    passwordKey.destroy();
                }
                throw exc;
            }

            replaceUnlocked(installed);
            generation = next;
            AccountId accountId = unlocked.signer.getAccountId();
            log.info("Provisioned device key {} in {} at generation {}", accountId, getPath(), next);
            return accountId;
        });
    }

    /**
     * Decrypts the device key. A wrong password leaves the keystore exactly as it was, locked or unlocked.
     */
    public void unlock(Password password) throws KeystoreException {
        withStore(store -> {
            if (!store.hasDeviceKey()) {
                throw new NoDeviceKeyException();
            }
            if (!cipher.getAlgorithm().equals(store.getAlgorithm())) {
                throw new StorageException("Keystore uses unsupported algorithm " + store.getAlgorithm());
            }
            PasswordKey passwordKey = deriveKey(password, store.getSaltBytes());
            SecretSeed seed;
            try {
                seed = cipher.decrypt(passwordKey, store.getSealedSeed());
            } catch (DecryptionException exc) {
                passwordKey.destroy();
                log.warn("Failed to unlock keystore {}", getPath());
                throw exc;
            }
            GenerationCounter current = store.getGenerationCounter();
            replaceUnlocked(new UnlockedKey(KeyHandle.fromSeed(scheme, seed), passwordKey, current));
            generation = current;
            log.info("Unlocked keystore {} at generation {}", getPath(), current);
            return null;
        });
    }

    public void lock() {
        lock.lock();
        try {
            if (unlocked != null) {
                replaceUnlocked(null);
                log.info("Locked keystore {}", getPath());
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean isUnlocked() {
        lock.lock();
        try {
            return unlocked != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Computes the mask that moves every copy of this keystore from the current password to
     * <code>newPassword</code>. Nothing is written, the mask has to be applied to each copy, this one included.
     */
    public MaskTransition changePasswordMask(Password newPassword) throws KeystoreException {
        return withStore(store -> {
            UnlockedKey current = requireUnlocked();
            GenerationCounter persisted = store.getGenerationCounter();
            if (!current.generation.equals(persisted)) {
                throw new StaleGenerationException(String.format(
                        "Keystore was unlocked at generation %s but is now at generation %s, unlock it again",
                        current.generation, persisted));
            }
            GenerationCounter next = persisted.next();
            PasswordKey nextKey = deriveKey(newPassword, store.getSaltBytes());
            try {
                MaskTransition transition = new MaskTransition(current.passwordKey.maskTo(nextKey), next);
                log.info("Computed password mask for {} targeting generation {}", getPath(), next);
                return transition;
            } finally {
                nextKey.destroy();
            }
        });
    }

    /**
     * Re-keys the stored seed with <code>mask</code> without decrypting it. Only accepted when the store sits at
     * the generation right before <code>nextGeneration</code>, otherwise the store is left untouched.
     */
    public void applyMask(Mask mask, GenerationCounter nextGeneration) throws KeystoreException {
        withStore(store -> {
            if (!store.hasDeviceKey()) {
                throw new NoDeviceKeyException();
            }
            GenerationCounter current = store.getGenerationCounter();
            if (!nextGeneration.isSuccessorOf(current)) {
                log.warn("Rejected mask for generation {} on keystore {} at generation {}", nextGeneration,
                        getPath(), current);
                throw new StaleGenerationException(current.getValue(), nextGeneration.getValue());
            }

            storeFile.write(store.withSealedSeed(cipher.rekey(store.getSealedSeed(), mask), nextGeneration));
            generation = nextGeneration;

            if (unlocked != null) {
                if (unlocked.generation.equals(current)) {
                    PasswordKey rekeyed = unlocked.passwordKey.apply(mask);
                    unlocked.passwordKey.destroy();
                    unlocked = new UnlockedKey(unlocked.key, rekeyed, nextGeneration);
                } else {
                    replaceUnlocked(null);
                    log.info("Locked keystore {} since it was unlocked at an older generation", getPath());
                }
            }
            log.info("Applied password mask to {}, moved from generation {} to {}", getPath(), current,
                    nextGeneration);
            return null;
        });
    }

    public Signer signer() throws NotUnlockedException {
        lock.lock();
        try {
            return requireUnlocked().signer;
        } finally {
            lock.unlock();
        }
    }

    public AccountId accountId() throws NotUnlockedException {
        return signer().getAccountId();
    }

    public byte[] sign(byte[] payload) throws NotUnlockedException {
        lock.lock();
        try {
            return requireUnlocked().signer.sign(payload);
        } finally {
            lock.unlock();
        }
    }

    private UnlockedKey requireUnlocked() throws NotUnlockedException {
        if (unlocked == null) {
            throw new NotUnlockedException();
        }
        return unlocked;
    }

    private void replaceUnlocked(UnlockedKey next) {
        if (unlocked != null) {
            unlocked.destroy();
        }
        unlocked = next;
    }

    private PasswordKey deriveKey(Password password, byte[] salt) throws KeystoreException {
        try {
            return cipher.keyFor(password, salt);
        } catch (GeneralSecurityException exc) {
            throw new KeystoreException("Failed to derive key from password", exc);
        }
    }

    private <T> T withStore(StoreOperation<T> operation) throws KeystoreException {
        lock.lock();
        try {
            AccessLock fileLock = storeFile.lock();
            try {
                return operation.apply(storeFile.read());
            } finally {
                storeFile.release(fileLock);
            }
        } finally {
            lock.unlock();
        }
    }

    @FunctionalInterface
    private interface StoreOperation<T> {
        T apply(EncryptedStore store) throws KeystoreException;
    }

    @FunctionalInterface
    private interface KeySource {
        KeyHandle create() throws KeystoreException;
    }

    private static final class UnlockedKey {
        private final KeyHandle key;
        private final Signer signer;
        private final PasswordKey passwordKey;
        private final GenerationCounter generation;

        private UnlockedKey(KeyHandle key, PasswordKey passwordKey, GenerationCounter generation) {
            this.key = key;
            this.signer = key.toSigner();
            this.passwordKey = passwordKey;
            this.generation = generation;
        }

        private void destroy() {
            key.destroy();
            passwordKey.destroy();
        }
    }
}
