package com.underscoreresearch.keystore.store;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.hamcrest.core.Is;
import org.hamcrest.core.IsNot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.underscoreresearch.keystore.encryption.Argon2SeedCipher;
import com.underscoreresearch.keystore.encryption.Mask;
import com.underscoreresearch.keystore.encryption.Password;
import com.underscoreresearch.keystore.encryption.SecretSeed;
import com.underscoreresearch.keystore.errors.DecryptionException;
import com.underscoreresearch.keystore.errors.HasDeviceKeyException;
import com.underscoreresearch.keystore.errors.NoDeviceKeyException;
import com.underscoreresearch.keystore.errors.NotUnlockedException;
import com.underscoreresearch.keystore.errors.StaleGenerationException;
import com.underscoreresearch.keystore.keys.AccountId;
import com.underscoreresearch.keystore.keys.EcdsaScheme;
import com.underscoreresearch.keystore.keys.Ed25519Scheme;
import com.underscoreresearch.keystore.keys.KeyHandle;
import com.underscoreresearch.keystore.keys.SignatureScheme;
import com.underscoreresearch.keystore.keys.Signer;
import com.underscoreresearch.keystore.utils.TestDirectories;

class KeystoreTest {
    private static final byte[] PAYLOAD = "payload".getBytes(StandardCharsets.UTF_8);

    private final Argon2SeedCipher cipher = new Argon2SeedCipher(1, 1024, 1);
    private final SignatureScheme scheme = new Ed25519Scheme();
    private Path tempDir;
    private Path keystoreDir;

    @BeforeEach
    public void setup() throws IOException {
        tempDir = Files.createTempDirectory("keystore");
        keystoreDir = tempDir.resolve("primary");
    }

    @AfterEach
    public void teardown() throws IOException {
        TestDirectories.deleteRecursively(tempDir);
    }

    private Keystore open(Path path) throws Exception {
        return Keystore.open(path, cipher, scheme);
    }

    private byte[] snapshot(Path path) throws IOException {
        return Files.readAllBytes(path.resolve(EncryptedStoreFile.STORE_FILE_NAME));
    }

    @Test
    public void testOpenEmpty() throws Exception {
        Keystore keystore = open(keystoreDir);
        assertThat(keystore.gen(), Is.is(GenerationCounter.ZERO));
        assertThat(keystore.hasDeviceKey(), Is.is(false));
        assertThat(keystore.isUnlocked(), Is.is(false));
        assertThrows(NoDeviceKeyException.class, () -> keystore.unlock(new Password("correct-horse")));
    }

    @Test
    public void testProvisionAndReopen() throws Exception {
        Keystore keystore = open(keystoreDir);
        AccountId accountId = keystore.provisionDevice(new Password("correct-horse"), GenerationCounter.ZERO);

        assertThat(keystore.gen(), Is.is(GenerationCounter.of(1)));
        assertThat(keystore.isUnlocked(), Is.is(true));
        assertThat(keystore.accountId(), Is.is(accountId));

        Keystore reopened = open(keystoreDir);
        assertThat(reopened.gen(), Is.is(GenerationCounter.of(1)));
        assertThat(reopened.hasDeviceKey(), Is.is(true));
        reopened.unlock(new Password("correct-horse"));
        assertThat(reopened.accountId(), Is.is(accountId));

        byte[] signature = reopened.sign(PAYLOAD);
        assertThat(keystore.signer().verify(PAYLOAD, signature), Is.is(true));
    }

    @Test
    public void testProvisionTwice() throws Exception {
        Keystore keystore = open(keystoreDir);
        AccountId first = keystore.provisionDevice(new Password("correct-horse"), GenerationCounter.ZERO);
        byte[] before = snapshot(keystoreDir);

        assertThrows(HasDeviceKeyException.class,
                () -> keystore.provisionDevice(new Password("other-password"), keystore.gen()));
        assertThat(snapshot(keystoreDir), Is.is(before));
        assertThat(keystore.accountId(), Is.is(first));

        AccountId second = keystore.provisionDevice(new Password("other-password"), keystore.gen(), true);
        assertThat(second, IsNot.not(first));
        assertThat(keystore.gen(), Is.is(GenerationCounter.of(2)));
        assertThrows(DecryptionException.class, () -> open(keystoreDir).unlock(new Password("correct-horse")));
    }

    @Test
    public void testProvisionAtWrongGeneration() throws Exception {
        Keystore keystore = open(keystoreDir);
        assertThrows(StaleGenerationException.class,
                () -> keystore.provisionDevice(new Password("correct-horse"), GenerationCounter.of(4)));
        assertThat(keystore.hasDeviceKey(), Is.is(false));
        assertThat(keystore.gen(), Is.is(GenerationCounter.ZERO));
    }

    @Test
    public void testWrongPassword() throws Exception {
        Keystore keystore = open(keystoreDir);
        AccountId accountId = keystore.provisionDevice(new Password("correct-horse"), GenerationCounter.ZERO);

        assertThrows(DecryptionException.class, () -> keystore.unlock(new Password("wrong-horse")));
        assertThat(keystore.isUnlocked(), Is.is(true));
        assertThat(keystore.accountId(), Is.is(accountId));

        keystore.lock();
        assertThrows(DecryptionException.class, () -> keystore.unlock(new Password("wrong-horse")));
        assertThat(keystore.isUnlocked(), Is.is(false));
    }

    @Test
    public void testLock() throws Exception {
        Keystore keystore = open(keystoreDir);
        keystore.provisionDevice(new Password("correct-horse"), GenerationCounter.ZERO);
        keystore.lock();

        assertThat(keystore.isUnlocked(), Is.is(false));
        assertThrows(NotUnlockedException.class, keystore::signer);
        assertThrows(NotUnlockedException.class, () -> keystore.sign(PAYLOAD));
        assertThrows(NotUnlockedException.class, () -> keystore.changePasswordMask(new Password("battery-staple")));
        keystore.lock();
    }

    @Test
    public void testSignerDisabledByLock() throws Exception {
        Keystore keystore = open(keystoreDir);
        keystore.provisionDevice(new Password("correct-horse"), GenerationCounter.ZERO);
        Signer signer = keystore.signer();
        keystore.lock();
        assertThrows(IllegalStateException.class, () -> signer.sign(PAYLOAD));
    }

    @Test
    public void testChangePasswordLocally() throws Exception {
        Keystore keystore = open(keystoreDir);
        AccountId accountId = keystore.provisionDevice(new Password("correct-horse"), GenerationCounter.ZERO);

        MaskTransition transition = keystore.changePasswordMask(new Password("battery-staple"));
        assertThat(transition.getNextGeneration(), Is.is(GenerationCounter.of(2)));
        assertThat(keystore.gen(), Is.is(GenerationCounter.of(1)));

        keystore.applyMask(transition.getMask(), transition.getNextGeneration());
        assertThat(keystore.gen(), Is.is(GenerationCounter.of(2)));
        assertThat(keystore.isUnlocked(), Is.is(true));

        MaskTransition again = keystore.changePasswordMask(new Password("third-password"));
        assertThat(again.getNextGeneration(), Is.is(GenerationCounter.of(3)));

        keystore.lock();
        assertThrows(DecryptionException.class, () -> keystore.unlock(new Password("correct-horse")));
        keystore.unlock(new Password("battery-staple"));
        assertThat(keystore.accountId(), Is.is(accountId));
    }

    @Test
    public void testMaskAcrossCopies() throws Exception {
        Keystore primary = open(keystoreDir);
        AccountId accountId = primary.provisionDevice(new Password("correct-horse"), GenerationCounter.ZERO);
        Path copyDir = tempDir.resolve("copy");
        TestDirectories.copyDirectory(keystoreDir, copyDir);
        Keystore copy = open(copyDir);

        MaskTransition transition = primary.changePasswordMask(new Password("battery-staple"));
        String encoded = transition.getMask().encode();
        primary.applyMask(transition.getMask(), transition.getNextGeneration());

        copy.applyMask(Mask.decode(encoded), GenerationCounter.of(2));
        assertThat(copy.gen(), Is.is(GenerationCounter.of(2)));
        assertThat(copy.isUnlocked(), Is.is(false));

        assertThrows(DecryptionException.class, () -> copy.unlock(new Password("correct-horse")));
        copy.unlock(new Password("battery-staple"));
        assertThat(copy.accountId(), Is.is(accountId));
    }

    @Test
    public void testStaleMaskLeavesStoreUntouched() throws Exception {
        Keystore keystore = open(keystoreDir);
        keystore.provisionDevice(new Password("correct-horse"), GenerationCounter.ZERO);
        MaskTransition transition = keystore.changePasswordMask(new Password("battery-staple"));
        keystore.applyMask(transition.getMask(), transition.getNextGeneration());
        byte[] before = snapshot(keystoreDir);

        assertThrows(StaleGenerationException.class,
                () -> keystore.applyMask(transition.getMask(), transition.getNextGeneration()));
        assertThrows(StaleGenerationException.class,
                () -> keystore.applyMask(transition.getMask(), GenerationCounter.of(4)));
        assertThrows(StaleGenerationException.class,
                () -> keystore.applyMask(transition.getMask(), GenerationCounter.of(1)));

        assertThat(snapshot(keystoreDir), Is.is(before));
        assertThat(keystore.gen(), Is.is(GenerationCounter.of(2)));
        keystore.lock();
        keystore.unlock(new Password("battery-staple"));
    }

    @Test
    public void testMaskOnEmptyStore() throws Exception {
        Keystore keystore = open(keystoreDir);
        Mask mask = Mask.fromBytes(new byte[Mask.MASK_SIZE]);
        assertThrows(NoDeviceKeyException.class, () -> keystore.applyMask(mask, GenerationCounter.of(1)));
        assertThat(Files.exists(keystoreDir.resolve(EncryptedStoreFile.STORE_FILE_NAME)), Is.is(false));
    }

    @Test
    public void testChangePasswordAfterExternalChange() throws Exception {
        Keystore first = open(keystoreDir);
        first.provisionDevice(new Password("correct-horse"), GenerationCounter.ZERO);
        Keystore second = open(keystoreDir);
        second.unlock(new Password("correct-horse"));

        MaskTransition transition = first.changePasswordMask(new Password("battery-staple"));
        first.applyMask(transition.getMask(), transition.getNextGeneration());

        assertThrows(StaleGenerationException.class, () -> second.changePasswordMask(new Password("other-pass")));
        assertThrows(StaleGenerationException.class,
                () -> second.applyMask(transition.getMask(), transition.getNextGeneration()));
        assertThat(second.gen(), Is.is(GenerationCounter.of(1)));

        second.unlock(new Password("battery-staple"));
        assertThat(second.gen(), Is.is(GenerationCounter.of(2)));
    }

    @Test
    public void testSetDeviceKey() throws Exception {
        Keystore keystore = open(keystoreDir);
        KeyHandle key = KeyHandle.fromSuri(scheme, "//Alice");
        AccountId expected = key.toAccountId();

        AccountId accountId = keystore.setDeviceKey(key, new Password("correct-horse"), false);
        key.destroy();

        assertThat(accountId, Is.is(expected));
        assertThat(keystore.gen(), Is.is(GenerationCounter.of(1)));
        assertThat(keystore.signer().verify(PAYLOAD, keystore.sign(PAYLOAD)), Is.is(true));

        assertThrows(HasDeviceKeyException.class,
                () -> keystore.setDeviceKey(KeyHandle.fromSuri(scheme, "//Bob"), new Password("correct-horse"), false));

        Keystore reopened = open(keystoreDir);
        reopened.unlock(new Password("correct-horse"));
        assertThat(reopened.accountId(), Is.is(expected));
    }

    @Test
    public void testInvalidKeyLeavesStoreUntouched() throws Exception {
        SignatureScheme ecdsa = new EcdsaScheme();
        Keystore keystore = Keystore.open(keystoreDir, cipher, ecdsa);
        KeyHandle outOfRange = KeyHandle.fromSeed(ecdsa, SecretSeed.fromBytes(filled((byte) 0xff)));

        assertThrows(IllegalArgumentException.class,
                () -> keystore.setDeviceKey(outOfRange, new Password("correct-horse"), false));
        assertThat(keystore.gen(), Is.is(GenerationCounter.ZERO));
        assertThat(keystore.hasDeviceKey(), Is.is(false));
        assertThat(keystore.isUnlocked(), Is.is(false));
        assertThat(Files.exists(keystoreDir.resolve(EncryptedStoreFile.STORE_FILE_NAME)), Is.is(false));

        AccountId accountId = keystore.provisionDevice(new Password("correct-horse"), GenerationCounter.ZERO);
        byte[] before = snapshot(keystoreDir);
        assertThrows(IllegalArgumentException.class,
                () -> keystore.setDeviceKey(outOfRange, new Password("battery-staple"), true));
        assertThat(snapshot(keystoreDir), Is.is(before));
        assertThat(keystore.gen(), Is.is(GenerationCounter.of(1)));
        assertThat(keystore.accountId(), Is.is(accountId));

        Keystore reopened = Keystore.open(keystoreDir, cipher, ecdsa);
        reopened.unlock(new Password("correct-horse"));
        assertThat(reopened.accountId(), Is.is(accountId));
    }

    private static byte[] filled(byte value) {
        byte[] ret = new byte[SecretSeed.SEED_SIZE];
        Arrays.fill(ret, value);
        return ret;
    }

    @Test
    public void testConcurrentMasks() throws Exception {
        Keystore keystore = open(keystoreDir);
        keystore.provisionDevice(new Password("correct-horse"), GenerationCounter.ZERO);
        MaskTransition transition = keystore.changePasswordMask(new Password("battery-staple"));

        ExecutorService executor = Executors.newFixedThreadPool(4);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < 4; i++) {
                Mask mask = Mask.fromBytes(transition.getMask().toBytes());
                results.add(executor.submit(() -> {
                    try {
                        keystore.applyMask(mask, transition.getNextGeneration());
                        return true;
                    } catch (StaleGenerationException exc) {
                        return false;
                    }
                }));
            }
            int applied = 0;
            for (Future<Boolean> result : results) {
                if (result.get()) {
                    applied++;
                }
            }
            assertThat(applied, Is.is(1));
        } finally {
            executor.shutdown();
        }

        assertThat(keystore.gen(), Is.is(GenerationCounter.of(2)));
        keystore.lock();
        keystore.unlock(new Password("battery-staple"));
    }
}
