package com.underscoreresearch.keystore.errors;

public class InvalidSuriException extends KeystoreException {
    public InvalidSuriException(String message) {
        super(message);
    }
}
