package com.underscoreresearch.keystore.errors;

public class EntropyException extends KeystoreException {
    public EntropyException(String message, Throwable cause) {
        super(message, cause);
    }
}
