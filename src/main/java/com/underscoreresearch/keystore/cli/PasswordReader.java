package com.underscoreresearch.keystore.cli;

import java.io.CharArrayWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import com.underscoreresearch.keystore.encryption.Password;

public final class PasswordReader {
    private PasswordReader() {
    }

    public static Password readPassword(String format, Object... args) throws IOException {
        char[] chars = readLine(format, args);
        if (chars == null) {
            return null;
        }
        try {
            return new Password(chars);
        } finally {
            Arrays.fill(chars, '\0');
        }
    }

    public static String readSecretLine(String format, Object... args) throws IOException {
        char[] chars = readLine(format, args);
        return chars != null ? new String(chars) : null;
    }

    private static char[] readLine(String format, Object... args) throws IOException {
        if (System.console() != null) {
            return System.console().readPassword(format, args);
        }
        System.out.printf(format, args);

        Reader reader = new InputStreamReader(System.in, StandardCharsets.UTF_8);
        CharArrayWriter buffer = new CharArrayWriter();
        int c = reader.read();
        if (c == -1) {
            return null;
        }
        while (c != -1 && c != '\n') {
            if (c != '\r') {
                buffer.write(c);
            }
            c = reader.read();
        }
        char[] ret = buffer.toCharArray();
        buffer.reset();
        return ret;
    }
}
