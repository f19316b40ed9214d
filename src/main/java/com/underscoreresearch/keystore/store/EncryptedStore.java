package com.underscoreresearch.keystore.store;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.google.common.base.Strings;
import com.underscoreresearch.keystore.encryption.SealedSeed;
import com.underscoreresearch.keystore.utils.EncodingUtils;

/**
 * Persisted form of the keystore. Byte fields are base32 encoded. A store without key data holds no device key but
 * still remembers its generation.
 */
@Data
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@NoArgsConstructor
@AllArgsConstructor
public class EncryptedStore {
    private String algorithm;
    private String salt;
    private String keyData;
    private String seedHash;
    private int generation;

    public static EncryptedStore unprovisioned(GenerationCounter generation) {
        return EncryptedStore.builder().generation(generation.getValue()).build();
    }

    public static EncryptedStore sealed(String algorithm, byte[] salt, SealedSeed sealedSeed,
                                        GenerationCounter generation) {
        return EncryptedStore.builder()
                .algorithm(algorithm)
                .salt(EncodingUtils.encodeBytes(salt))
                .keyData(EncodingUtils.encodeBytes(sealedSeed.getKeyData()))
                .seedHash(EncodingUtils.encodeBytes(sealedSeed.getSeedHash()))
                .generation(generation.getValue())
                .build();
    }

    public boolean hasDeviceKey() {
        return !Strings.isNullOrEmpty(keyData);
    }

    @JsonIgnore
    public GenerationCounter getGenerationCounter() {
        return GenerationCounter.of(generation);
    }

    @JsonIgnore
    public byte[] getSaltBytes() {
        return EncodingUtils.decodeBytes(salt);
    }

    @JsonIgnore
    public SealedSeed getSealedSeed() {
        return new SealedSeed(EncodingUtils.decodeBytes(keyData), EncodingUtils.decodeBytes(seedHash));
    }

    public EncryptedStore withSealedSeed(SealedSeed sealedSeed, GenerationCounter newGeneration) {
        return toBuilder()
                .keyData(EncodingUtils.encodeBytes(sealedSeed.getKeyData()))
                .seedHash(EncodingUtils.encodeBytes(sealedSeed.getSeedHash()))
                .generation(newGeneration.getValue())
                .build();
    }
}
