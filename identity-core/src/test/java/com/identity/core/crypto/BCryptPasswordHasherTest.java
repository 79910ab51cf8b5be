package com.identity.core.crypto;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BCryptPasswordHasherTest {

    // lowest cost bcrypt accepts, keeps the test fast
    private final BCryptPasswordHasher hasher = new BCryptPasswordHasher(4);

    @Test
    void verify_shouldAcceptMatchingSecret() {
        String hash = hasher.hash("s3cret");

        assertNotEquals("s3cret", hash);
        assertDoesNotThrow(() -> hasher.verify(hash, "s3cret"));
    }

    @Test
    void verify_shouldRejectWrongSecret() {
        String hash = hasher.hash("s3cret");

        assertThrows(HashVerificationException.class, () -> hasher.verify(hash, "wrong"));
    }

    @Test
    void verify_shouldRejectMalformedHash() {
        assertThrows(HashVerificationException.class, () -> hasher.verify("not-a-bcrypt-hash", "s3cret"));
        assertThrows(HashVerificationException.class, () -> hasher.verify(null, "s3cret"));
    }

    @Test
    void secretGenerator_shouldProduceRequestedLength() {
        SecretGenerator generator = new SecretGenerator(32);

        String first = generator.generate();

        assertEquals(32, first.length());
        assertNotEquals(first, generator.generate());
        assertThrows(IllegalArgumentException.class, () -> new SecretGenerator(8));
    }
}
