package com.underscoreresearch.keystore.errors;

public class HasDeviceKeyException extends KeystoreException {
    public HasDeviceKeyException() {
        super("Device key is already configured. Use `--force` if you want to overwrite it.");
    }
}
