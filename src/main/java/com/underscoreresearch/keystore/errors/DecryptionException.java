package com.underscoreresearch.keystore.errors;

/**
 * Wrong password or tampered key material.
 */
public class DecryptionException extends KeystoreException {
    public DecryptionException(String message) {
        super(message);
    }
}
