package com.underscoreresearch.keystore.errors;

public class GenerationExhaustedException extends KeystoreException {
    public GenerationExhaustedException(int generation) {
        super("Generation counter can not be increased beyond " + generation);
    }
}
