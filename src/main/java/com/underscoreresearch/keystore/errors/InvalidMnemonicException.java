package com.underscoreresearch.keystore.errors;

public class InvalidMnemonicException extends KeystoreException {
    public InvalidMnemonicException() {
        super("Invalid paperkey.");
    }

    public InvalidMnemonicException(Throwable cause) {
        super("Invalid paperkey.", cause);
    }
}
