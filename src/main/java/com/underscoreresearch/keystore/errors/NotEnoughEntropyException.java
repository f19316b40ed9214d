package com.underscoreresearch.keystore.errors;

public class NotEnoughEntropyException extends KeystoreException {
    public NotEnoughEntropyException(int available, int required) {
        super(String.format("Mnemonic encodes %d bytes of entropy, at least %d are required", available, required));
    }
}
