package com.underscoreresearch.keystore.errors;

public class NotUnlockedException extends KeystoreException {
    public NotUnlockedException() {
        super("Keystore is locked");
    }
}
