package com.identity.core.crypto;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

/**
 * {@link PasswordHasher} backed by Spring Security's bcrypt encoder.
 */
public class BCryptPasswordHasher implements PasswordHasher {

    private static final Logger log = LoggerFactory.getLogger(BCryptPasswordHasher.class);

    private final BCryptPasswordEncoder encoder;

    public BCryptPasswordHasher(int strength) {
        this.encoder = new BCryptPasswordEncoder(strength);
    }

    @Override
    public String hash(String raw) {
        if (raw == null || raw.isEmpty()) {
            throw new IllegalArgumentException("secret must not be empty");
        }
        return encoder.encode(raw);
    }

    @Override
    public void verify(String encoded, String raw) throws HashVerificationException {
        if (encoded == null || encoded.isEmpty()) {
            throw new HashVerificationException("no hash to verify against");
        }
        if (raw == null) {
            throw new HashVerificationException("secret is missing");
        }
        boolean matches;
        try {
            matches = encoder.matches(raw, encoded);
        } catch (IllegalArgumentException e) {
            throw new HashVerificationException("hash cannot be evaluated", e);
        }
        if (!matches) {
            log.debug("Secret does not match stored hash");
            throw new HashVerificationException("secret does not match");
        }
    }
}
