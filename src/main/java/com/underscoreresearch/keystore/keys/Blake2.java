package com.underscoreresearch.keystore.keys;

import org.bouncycastle.crypto.digests.Blake2bDigest;

final class Blake2 {
    private Blake2() {
    }

    static byte[] hash256(byte[]... parts) {
        Blake2bDigest digest = new Blake2bDigest(256);
        for (byte[] part : parts) {
            digest.update(part, 0, part.length);
        }
        byte[] ret = new byte[32];
        digest.doFinal(ret, 0);
        return ret;
    }
}
