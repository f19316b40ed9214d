package com.underscoreresearch.keystore.utils;

import java.io.Closeable;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.RandomAccessFile;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.FileLockInterruptionException;
import java.nio.channels.OverlappingFileLockException;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Exclusive lock on a marker file so that two processes never interleave writes to the same keystore directory.
 * Closing the returned handle releases the lock and the underlying file.
 */
@Slf4j
public class AccessLock implements Closeable {
    private static final long LOCK_RETRY_MILLIS = 10;

    @Getter
    private final String filename;
    private RandomAccessFile file;
    private FileChannel channel;
    private FileLock lock;

    private AccessLock(String filename) {
        this.filename = filename;
    }

    public static AccessLock acquire(String filename) throws IOException {
        AccessLock ret = new AccessLock(filename);
        try {
            ret.lock();
        } catch (IOException exc) {
            ret.close();
            throw exc;
        }
        return ret;
    }

    private void ensureOpenFile() throws IOException {
        if (channel == null || !channel.isOpen()) {
            close();
            file = new RandomAccessFile(filename, "rw");
            channel = file.getChannel();
        }
    }

    private synchronized void lock() throws IOException {
        ensureOpenFile();
        while (lock == null || !lock.isValid()) {
            try {
                Thread.interrupted();
                lock = channel.lock();
            } catch (ClosedChannelException e) {
                ensureOpenFile();
            } catch (FileLockInterruptionException ignored) {
                // Retry, the channel gets reopened on the next pass.
            } catch (OverlappingFileLockException e) {
                // Another keystore instance in this process holds it.
                waitForRelease();
            }
        }
    }

    private void waitForRelease() throws IOException {
        try {
            Thread.sleep(LOCK_RETRY_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted waiting for keystore lock " + filename);
        }
    }

    @Override
    public synchronized void close() throws IOException {
        if (lock != null) {
            if (lock.channel().isOpen()) {
                lock.close();
            }
            lock = null;
        }
        if (channel != null && channel.isOpen()) {
            channel.close();
        }
        if (file != null) {
            file.close();
            file = null;
        }
    }
}
