package com.underscoreresearch.keystore.configuration;

import static com.underscoreresearch.keystore.configuration.CommandLineModule.KEYSTORE_LOCATION;

import java.nio.file.Paths;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.multibindings.Multibinder;
import com.google.inject.name.Named;
import com.underscoreresearch.keystore.encryption.Argon2SeedCipher;
import com.underscoreresearch.keystore.encryption.SeedCipher;
import com.underscoreresearch.keystore.errors.StorageException;
import com.underscoreresearch.keystore.identity.ProofService;
import com.underscoreresearch.keystore.keys.SignatureScheme;
import com.underscoreresearch.keystore.model.KeystoreConfiguration;
import com.underscoreresearch.keystore.store.Keystore;

public class KeystoreModule extends AbstractModule {
    @Override
    protected void configure() {
        // Proof services are contributed by whoever embeds the keystore, none ship here.
        Multibinder.newSetBinder(binder(), ProofService.class);
    }

    @Provides
    @Singleton
    public SeedCipher seedCipher(KeystoreConfiguration configuration) {
        return new Argon2SeedCipher(configuration.getEffectiveKdfIterations(),
                configuration.getEffectiveKdfMemory(),
                configuration.getEffectiveKdfParallelism());
    }

    @Provides
    @Singleton
    public SignatureScheme signatureScheme(KeystoreConfiguration configuration) {
        return configuration.getEffectiveSignatureScheme().getScheme();
    }

    @Provides
    @Singleton
    public Keystore keystore(@Named(KEYSTORE_LOCATION) String location, SeedCipher cipher, SignatureScheme scheme)
            throws StorageException {
        return Keystore.open(Paths.get(location), cipher, scheme);
    }
}
