package com.underscoreresearch.keystore.errors;

public class NoDeviceKeyException extends KeystoreException {
    public NoDeviceKeyException() {
        super("No device key has been provisioned");
    }
}
