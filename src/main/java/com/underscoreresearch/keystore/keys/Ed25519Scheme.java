package com.underscoreresearch.keystore.keys;

import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

import com.underscoreresearch.keystore.encryption.SecretSeed;

/**
 * Ed25519 where the account id is the public key itself.
 */
public class Ed25519Scheme implements SignatureScheme {
    public static final String NAME = "ed25519";
    private static final int PUBLIC_KEY_SIZE = 32;
    private static final int SIGNATURE_SIZE = 64;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDerivationDomain() {
        return "Ed25519HDKD";
    }

    @Override
    public boolean isValidSeed(SecretSeed seed) {
        return true;
    }

    @Override
    public byte[] derivePublic(SecretSeed seed) {
        return seed.expose(bytes -> new Ed25519PrivateKeyParameters(bytes, 0).generatePublicKey().getEncoded());
    }

    @Override
    public byte[] sign(SecretSeed seed, byte[] payload) {
        return seed.expose(bytes -> {
            Ed25519Signer signer = new Ed25519Signer();
            signer.init(true, new Ed25519PrivateKeyParameters(bytes, 0));
            signer.update(payload, 0, payload.length);
            return signer.generateSignature();
        });
    }

    @Override
    public boolean verify(byte[] publicKey, byte[] payload, byte[] signature) {
        if (publicKey.length != PUBLIC_KEY_SIZE || signature.length != SIGNATURE_SIZE) {
            return false;
        }
        try {
            Ed25519Signer verifier = new Ed25519Signer();
            verifier.init(false, new Ed25519PublicKeyParameters(publicKey, 0));
            verifier.update(payload, 0, payload.length);
            return verifier.verifySignature(signature);
        } catch (IllegalArgumentException exc) {
            return false;
        }
    }

    @Override
    public AccountId toAccountId(byte[] publicKey) {
        return new AccountId(publicKey);
    }
}
