package com.underscoreresearch.keystore.errors;

public class StaleGenerationException extends KeystoreException {
    public StaleGenerationException(int currentGeneration, int requestedGeneration) {
        super(String.format("Mask targets generation %d but the store is at generation %d", requestedGeneration,
                currentGeneration));
    }

    public StaleGenerationException(String message) {
        super(message);
    }
}
