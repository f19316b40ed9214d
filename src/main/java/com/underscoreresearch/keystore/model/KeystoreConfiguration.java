package com.underscoreresearch.keystore.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.underscoreresearch.keystore.encryption.Argon2SeedCipher;
import com.underscoreresearch.keystore.keys.SignatureSchemes;

@Data
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@NoArgsConstructor
@AllArgsConstructor
public class KeystoreConfiguration {
    private String keystorePath;
    private SignatureSchemes signatureScheme;
    private Integer kdfIterations;
    private Integer kdfMemory;
    private Integer kdfParallelism;

    @JsonIgnore
    public SignatureSchemes getEffectiveSignatureScheme() {
        return signatureScheme != null ? signatureScheme : SignatureSchemes.ED25519;
    }

    @JsonIgnore
    public int getEffectiveKdfIterations() {
        return kdfIterations != null ? kdfIterations : Argon2SeedCipher.DEFAULT_ITERATIONS;
    }

    @JsonIgnore
    public int getEffectiveKdfMemory() {
        return kdfMemory != null ? kdfMemory : Argon2SeedCipher.DEFAULT_MEMORY;
    }

    @JsonIgnore
    public int getEffectiveKdfParallelism() {
        return kdfParallelism != null ? kdfParallelism : Argon2SeedCipher.DEFAULT_PARALLELISM;
    }
}
