package com.underscoreresearch.keystore.store;

import static com.underscoreresearch.keystore.utils.SerializationUtils.ENCRYPTED_STORE_READER;
import static com.underscoreresearch.keystore.utils.SerializationUtils.ENCRYPTED_STORE_WRITER;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.underscoreresearch.keystore.errors.StorageException;
import com.underscoreresearch.keystore.utils.AccessLock;

/**
 * The keystore directory on disk. Writes never touch the live file in place, they go to a temporary file in the
 * same directory which is then renamed over it, so a reader sees either the old or the new store.
 */
@Slf4j
public class EncryptedStoreFile {
    public static final String STORE_FILE_NAME = "devicekey.json";
    private static final String LOCK_FILE_NAME = ".lock";

    @Getter
    private final Path directory;

    public EncryptedStoreFile(Path directory) {
        this.directory = directory;
    }

    public Path getStorePath() {
        return directory.resolve(STORE_FILE_NAME);
    }

    public EncryptedStore read() throws StorageException {
        if (Files.exists(directory) && !Files.isDirectory(directory)) {
            throw new StorageException("Keystore location " + directory + " is not a directory");
        }

        byte[] data;
        try {
            data = Files.readAllBytes(getStorePath());
        } catch (NoSuchFileException exc) {
            return EncryptedStore.unprovisioned(GenerationCounter.ZERO);
        } catch (IOException exc) {
            throw new StorageException("Failed to read keystore " + getStorePath(), exc);
        }

        EncryptedStore store;
        try {
            store = ENCRYPTED_STORE_READER.readValue(data);
        } catch (IOException exc) {
            throw new StorageException("Keystore " + getStorePath() + " is corrupt", exc);
        }
        validate(store);
        return store;
    }

    private void validate(EncryptedStore store) throws StorageException {
        if (store == null) {
            throw new StorageException("Keystore " + getStorePath() + " is empty");
        }
        try {
            store.getGenerationCounter();
            if (store.hasDeviceKey()) {
                if (store.getAlgorithm() == null || store.getSalt() == null || store.getSeedHash() == null) {
                    throw new StorageException("Keystore " + getStorePath() + " is missing key parameters");
                }
                store.getSaltBytes();
                store.getSealedSeed();
            }
        } catch (IllegalArgumentException exc) {
            throw new StorageException("Keystore " + getStorePath() + " is corrupt", exc);
        }
    }

    public void write(EncryptedStore store) throws StorageException {
        byte[] data;
        try {
            data = ENCRYPTED_STORE_WRITER.writeValueAsBytes(store);
        } catch (JsonProcessingException exc) {
            throw new StorageException("Failed to serialize keystore", exc);
        }

        Path tempFile = null;
        try {
            Files.createDirectories(directory);
            // Temporary files are created readable by the owner only.
            tempFile = Files.createTempFile(directory, STORE_FILE_NAME, ".tmp");
            try (FileChannel channel = FileChannel.open(tempFile, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(data);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(tempFile, getStorePath(), StandardCopyOption.ATOMIC_MOVE,
                        StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException exc) {
                log.warn("Atomic rename not supported for {}, falling back to replace", directory);
                Files.move(tempFile, getStorePath(), StandardCopyOption.REPLACE_EXISTING);
            }
            tempFile = null;
        } catch (IOException exc) {
            throw new StorageException("Failed to write keystore " + getStorePath(), exc);
        } finally {
            if (tempFile != null) {
                deleteTemporary(tempFile);
            }
        }
    }

    private void deleteTemporary(Path tempFile) {
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException exc) {
            log.warn("Failed to remove temporary keystore file {}", tempFile, exc);
        }
    }

    /**
     * Takes the cross process lock for this keystore directory, creating the directory if needed.
     */
    public AccessLock lock() throws StorageException {
        try {
            Files.createDirectories(directory);
            return AccessLock.acquire(directory.resolve(LOCK_FILE_NAME).toString());
        } catch (IOException exc) {
            throw new StorageException("Failed to lock keystore " + directory, exc);
        }
    }

    public void release(AccessLock lock) {
        try {
            lock.close();
        } catch (IOException exc) {
            log.error("Failed to release keystore lock {}", lock.getFilename(), exc);
        }
    }
}
