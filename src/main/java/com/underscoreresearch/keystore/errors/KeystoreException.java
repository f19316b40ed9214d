package com.underscoreresearch.keystore.errors;

/**
 * Base class for every failure surfaced by the keystore. None of these are retried internally, recovery such as
 * asking for the password again is up to the caller.
 */
public class KeystoreException extends Exception {
    public KeystoreException(String message) {
        super(message);
    }

    public KeystoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
