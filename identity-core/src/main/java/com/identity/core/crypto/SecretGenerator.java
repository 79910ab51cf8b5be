package com.identity.core.crypto;

import java.security.SecureRandom;

/**
 * Generates random client secrets.
 */
public class SecretGenerator {

    private static final char[] ALPHABET =
        "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789".toCharArray();

    private final SecureRandom random;
    private final int length;

    public SecretGenerator(int length) {
        this(new SecureRandom(), length);
    }

    SecretGenerator(SecureRandom random, int length) {
        if (length < 16) {
            throw new IllegalArgumentException("secret length must be at least 16");
        }
        this.random = random;
        this.length = length;
    }

    public String generate() {
        char[] secret = new char[length];
        for (int i = 0; i < length; i++) {
            secret[i] = ALPHABET[random.nextInt(ALPHABET.length)];
        }
        return new String(secret);
    }
}
