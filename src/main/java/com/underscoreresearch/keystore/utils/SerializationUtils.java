package com.underscoreresearch.keystore.utils;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.underscoreresearch.keystore.model.KeystoreConfiguration;
import com.underscoreresearch.keystore.store.EncryptedStore;

public class SerializationUtils {
    public static final ObjectMapper MAPPER = new ObjectMapper()
            .setDefaultPropertyInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static final ObjectReader ENCRYPTED_STORE_READER = MAPPER
            .readerFor(EncryptedStore.class);
    public static final ObjectWriter ENCRYPTED_STORE_WRITER = MAPPER
            .writerFor(EncryptedStore.class)
            .withDefaultPrettyPrinter();

    public static final ObjectReader KEYSTORE_CONFIGURATION_READER = MAPPER
            .readerFor(KeystoreConfiguration.class);
    public static final ObjectWriter KEYSTORE_CONFIGURATION_WRITER = MAPPER
            .writerFor(KeystoreConfiguration.class);
}
