package com.underscoreresearch.keystore.keys;

import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import org.bitcoinj.crypto.MnemonicCode;
import org.bitcoinj.crypto.MnemonicException;
import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.KeyParameter;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.underscoreresearch.keystore.errors.InvalidMnemonicException;

/**
 * BIP-39 English phrases.
 */
public final class Mnemonics {
    /**
     * Well known development phrase used when a secret URI has no phrase of its own.
     */
    public static final String DEV_PHRASE = "bottom drive obey lake curtain smoke basket hold race lonely fit walk";
    private static final int MINI_SECRET_ROUNDS = 2048;
    private static final int MINI_SECRET_SIZE = 32;
    private static final Splitter WORD_SPLITTER = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    private Mnemonics() {
    }

    public static List<String> words(String phrase) {
        String normalized = Normalizer.normalize(phrase, Normalizer.Form.NFKD).toLowerCase(Locale.ROOT);
        return WORD_SPLITTER.splitToList(normalized);
    }

    public static byte[] toEntropy(String phrase) throws InvalidMnemonicException {
        MnemonicCode code = MnemonicCode.INSTANCE;
        if (code == null) {
            throw new IllegalStateException("BIP-39 word list is not available");
        }
        try {
            return code.toEntropy(words(phrase));
        } catch (MnemonicException exc) {
            throw new InvalidMnemonicException(exc);
        }
    }

    /**
     * 32 byte secret from phrase entropy: the first half of PBKDF2-HMAC-SHA512 over the entropy with the salt
     * <code>"mnemonic" + password</code>.
     */
    public static byte[] miniSecret(byte[] entropy, String password) {
        PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA512Digest());
        String salt = "mnemonic" + (password != null ? password : "");
        generator.init(entropy, salt.getBytes(StandardCharsets.UTF_8), MINI_SECRET_ROUNDS);
        byte[] derived = ((KeyParameter) generator.generateDerivedParameters(512)).getKey();
        try {
            return Arrays.copyOf(derived, MINI_SECRET_SIZE);
        } finally {
            Arrays.fill(derived, (byte) 0);
        }
    }
}
