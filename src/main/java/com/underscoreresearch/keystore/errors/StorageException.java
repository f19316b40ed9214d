package com.underscoreresearch.keystore.errors;

/**
 * The persisted store could not be read or written. Fatal to the operation, in memory state is left untouched.
 */
public class StorageException extends KeystoreException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
