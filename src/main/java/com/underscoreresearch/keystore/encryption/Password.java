package com.underscoreresearch.keystore.encryption;

import java.util.Arrays;

import javax.security.auth.Destroyable;

/**
 * User supplied password. Held as characters so it can be wiped once the password key has been derived.
 */
public final class Password implements Destroyable {
    private final char[] password;
    private volatile boolean destroyed;

    public Password(char[] password) {
        this.password = password.clone();
    }

    public Password(String password) {
        this.password = password.toCharArray();
    }

    char[] chars() {
        if (destroyed) {
            throw new IllegalStateException("Password has been destroyed");
        }
        return password;
    }

    public int length() {
        return password.length;
    }

    public boolean matches(Password other) {
        return Arrays.equals(chars(), other.chars());
    }

    @Override
    public void destroy() {
        destroyed = true;
        Arrays.fill(password, '\0');
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public String toString() {
        return "Password[REDACTED]";
    }
}
