package com.underscoreresearch.keystore.keys;

import java.math.BigInteger;
import java.util.Arrays;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;
import org.bouncycastle.util.BigIntegers;

import com.underscoreresearch.keystore.encryption.SecretSeed;

/**
 * ECDSA over secp256k1. Payloads are hashed with blake2b-256 before signing, nonces follow RFC 6979 and
 * signatures are the 64 byte <code>r || s</code> form with a low <code>s</code>. The account id is the blake2b-256
 * hash of the compressed public key.
 */
public class EcdsaScheme implements SignatureScheme {
    public static final String NAME = "ecdsa";
    private static final X9ECParameters CURVE = CustomNamedCurves.getByName("secp256k1");
    private static final ECDomainParameters DOMAIN = new ECDomainParameters(CURVE.getCurve(), CURVE.getG(),
            CURVE.getN(), CURVE.getH());
    private static final BigInteger HALF_ORDER = CURVE.getN().shiftRight(1);
    private static final int SCALAR_SIZE = 32;

    private static boolean inRange(BigInteger d) {
        return d.signum() > 0 && d.compareTo(CURVE.getN()) < 0;
    }

    private static BigInteger privateScalar(byte[] seed) {
        BigInteger d = new BigInteger(1, seed);
        if (!inRange(d)) {
            throw new IllegalArgumentException("Seed is not a valid secp256k1 private key");
        }
        return d;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDerivationDomain() {
        return "Secp256k1HDKD";
    }

    @Override
    public boolean isValidSeed(SecretSeed seed) {
        return seed.expose(bytes -> inRange(new BigInteger(1, bytes)));
    }

    @Override
    public byte[] derivePublic(SecretSeed seed) {
        return seed.expose(bytes -> new FixedPointCombMultiplier()
                .multiply(CURVE.getG(), privateScalar(bytes))
                .normalize()
                .getEncoded(true));
    }

    @Override
    public byte[] sign(SecretSeed seed, byte[] payload) {
        byte[] hash = Blake2.hash256(payload);
        BigInteger[] rs = seed.expose(bytes -> {
            ECDSASigner signer = new ECDSASigner(new HMacDSAKCalculator(new SHA256Digest()));
            signer.init(true, new ECPrivateKeyParameters(privateScalar(bytes), DOMAIN));
            return signer.generateSignature(hash);
        });
        BigInteger s = rs[1];
        if (s.compareTo(HALF_ORDER) > 0) {
            s = CURVE.getN().subtract(s);
        }
        byte[] ret = new byte[SCALAR_SIZE * 2];
        System.arraycopy(BigIntegers.asUnsignedByteArray(SCALAR_SIZE, rs[0]), 0, ret, 0, SCALAR_SIZE);
        System.arraycopy(BigIntegers.asUnsignedByteArray(SCALAR_SIZE, s), 0, ret, SCALAR_SIZE, SCALAR_SIZE);
        return ret;
    }

    @Override
    public boolean verify(byte[] publicKey, byte[] payload, byte[] signature) {
        if (signature.length != SCALAR_SIZE * 2) {
            return false;
        }
        BigInteger r = new BigInteger(1, Arrays.copyOfRange(signature, 0, SCALAR_SIZE));
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(signature, SCALAR_SIZE, SCALAR_SIZE * 2));
        if (s.compareTo(HALF_ORDER) > 0) {
            return false;
        }
        try {
            ECPoint point = CURVE.getCurve().decodePoint(publicKey);
            ECDSASigner verifier = new ECDSASigner();
            verifier.init(false, new ECPublicKeyParameters(point, DOMAIN));
            return verifier.verifySignature(Blake2.hash256(payload), r, s);
        } catch (IllegalArgumentException exc) {
            return false;
        }
    }

    @Override
    public AccountId toAccountId(byte[] publicKey) {
        return new AccountId(Blake2.hash256(publicKey));
    }
}
