package com.underscoreresearch.keystore.keys;

import lombok.EqualsAndHashCode;

import com.underscoreresearch.keystore.utils.EncodingUtils;

/**
 * Public identity derived from a device key. Rendered as lower case hex, chain specific address encodings are
 * left to the consumer.
 */
@EqualsAndHashCode
public final class AccountId {
    private final byte[] id;

    public AccountId(byte[] id) {
        this.id = id.clone();
    }

    public static AccountId fromHex(String hex) {
        return new AccountId(EncodingUtils.decodeHex(hex));
    }

    public byte[] toBytes() {
        return id.clone();
    }

    @Override
    public String toString() {
        return EncodingUtils.encodeHex(id);
    }
}
