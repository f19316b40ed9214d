package com.underscoreresearch.keystore.keys;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.Getter;

import com.underscoreresearch.keystore.encryption.SecretSeed;
import com.underscoreresearch.keystore.errors.InvalidMnemonicException;
import com.underscoreresearch.keystore.errors.InvalidSuriException;
import com.underscoreresearch.keystore.utils.EncodingUtils;

/**
 * Secret URI of the form <code>[phrase | 0x&lt;hex seed&gt;][//hard | /soft]*[///password]</code>.
 * <p>
 * A missing phrase stands for {@link Mnemonics#DEV_PHRASE}. Phrases become seeds through
 * {@link Mnemonics#miniSecret(byte[], String)}, hex seeds are used as is and the password is ignored for them.
 * Only hard junctions are supported, each one replaces the seed with
 * <code>blake2b-256(encode(domain) || seed || chainCode)</code>.
 */
public final class SecretUri {
    private static final Pattern SURI = Pattern.compile(
            "^(?<phrase>[\\w ]+)?(?<path>(//?[^/]+)*)(///(?<password>.*))?$",
            Pattern.UNICODE_CHARACTER_CLASS | Pattern.DOTALL);
    private static final Pattern JUNCTION = Pattern.compile("/(/?[^/]+)");
    private static final String HEX_PREFIX = "0x";

    @Getter
    private final String phrase;
    @Getter
    private final List<DeriveJunction> path;
    private final String password;

    private SecretUri(String phrase, List<DeriveJunction> path, String password) {
        this.phrase = phrase;
        this.path = path;
        this.password = password;
    }

    public static SecretUri parse(String suri) throws InvalidSuriException {
        Matcher matcher = SURI.matcher(suri);
        if (!matcher.matches()) {
            throw new InvalidSuriException("Invalid secret URI format");
        }

        String phrase = matcher.group("phrase");
        if (phrase != null) {
            phrase = phrase.trim();
            if (phrase.isEmpty()) {
                phrase = null;
            }
        }

        List<DeriveJunction> path = new ArrayList<>();
        String pathText = matcher.group("path");
        if (pathText != null) {
            Matcher junctions = JUNCTION.matcher(pathText);
            while (junctions.find()) {
                path.add(DeriveJunction.parse(junctions.group(1)));
            }
        }

        return new SecretUri(phrase, Collections.unmodifiableList(path), matcher.group("password"));
    }

    public SecretSeed deriveSeed(SignatureScheme scheme) throws InvalidSuriException {
        byte[] seed = rootSeed();
        try {
            for (DeriveJunction junction : path) {
                if (!junction.isHard()) {
                    throw new InvalidSuriException("Soft derivation is not supported by " + scheme.getName());
                }
                byte[] next = Blake2.hash256(DeriveJunction.encodeString(scheme.getDerivationDomain()), seed,
                        junction.getChainCode());
                Arrays.fill(seed, (byte) 0);
                seed = next;
            }
            SecretSeed ret = SecretSeed.fromBytes(seed);
            if (!scheme.isValidSeed(ret)) {
                ret.destroy();
                throw new InvalidSuriException("Seed is not a valid " + scheme.getName() + " private key");
            }
            return ret;
        } finally {
            Arrays.fill(seed, (byte) 0);
        }
    }

    private byte[] rootSeed() throws InvalidSuriException {
        String root = phrase != null ? phrase : Mnemonics.DEV_PHRASE;
        if (root.startsWith(HEX_PREFIX)) {
            byte[] seed;
            try {
                seed = EncodingUtils.decodeHex(root);
            } catch (IllegalArgumentException exc) {
                throw new InvalidSuriException("Invalid hex seed");
            }
            if (seed.length != SecretSeed.SEED_SIZE) {
                Arrays.fill(seed, (byte) 0);
                throw new InvalidSuriException("Hex seed must be " + SecretSeed.SEED_SIZE + " bytes");
            }
            return seed;
        }

        byte[] entropy;
        try {
            entropy = Mnemonics.toEntropy(root);
        } catch (InvalidMnemonicException exc) {
            throw new InvalidSuriException("Invalid phrase");
        }
        try {
            return Mnemonics.miniSecret(entropy, password);
        } finally {
            Arrays.fill(entropy, (byte) 0);
        }
    }

    @Override
    public String toString() {
        return "SecretUri[REDACTED]";
    }
}
