package com.pocketca.crypto;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.security.KeyPair;

import static org.junit.jupiter.api.Assertions.*;

class KeyPairVerifierTest {

    private final KeyPairService service = new KeyPairService(1024);

    @Test
    @DisplayName("should match a key pair with itself")
    void shouldMatch() {
        KeyPair rsa = service.generate(KeySpec.rsa(1024));
        KeyPair ec = service.generate(KeySpec.ec("prime256v1"));

        assertTrue(KeyPairVerifier.matches(rsa.getPrivate(), rsa.getPublic()));
        assertTrue(KeyPairVerifier.matches(ec.getPrivate(), ec.getPublic()));
    }

    @Test
    @DisplayName("should not match keys from different pairs or families")
    void shouldNotMatch() {
        KeyPair first = service.generate(KeySpec.rsa(1024));
        KeyPair second = service.generate(KeySpec.rsa(1024));
        KeyPair ec = service.generate(KeySpec.ec("prime256v1"));

        assertFalse(KeyPairVerifier.matches(first.getPrivate(), second.getPublic()));
        assertFalse(KeyPairVerifier.matches(first.getPrivate(), ec.getPublic()));
        assertFalse(KeyPairVerifier.matches(ec.getPrivate(), first.getPublic()));
    }
}
