package com.underscoreresearch.keystore.keys;

import java.util.Locale;

import lombok.Getter;

/**
 * Schemes that can be selected through configuration.
 */
public enum SignatureSchemes {
    ED25519(new Ed25519Scheme()),
    ECDSA(new EcdsaScheme());

    @Getter
    private final SignatureScheme scheme;

    SignatureSchemes(SignatureScheme scheme) {
        this.scheme = scheme;
    }

    public static SignatureSchemes fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException exc) {
            throw new IllegalArgumentException("Unknown signature scheme \"" + name + "\"", exc);
        }
    }
}
