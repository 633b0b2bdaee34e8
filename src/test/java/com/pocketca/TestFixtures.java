package com.pocketca;

import com.pocketca.config.CaConfig;
import com.pocketca.crypto.CertificateIssuer;
import com.pocketca.crypto.KeyPairService;
import com.pocketca.crypto.KeySpec;
import com.pocketca.crypto.SerialNumberAllocator;
import com.pocketca.model.DistinguishedName;
import com.pocketca.model.IssuanceRequest;
import com.pocketca.profile.IdentityProfile;
import com.pocketca.profile.ProfileResolver;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Shared builders for tests. RSA-1024 keeps key generation fast.
 */
public final class TestFixtures {

    public static final int TEST_RSA_BITS = 1024;
    public static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private TestFixtures() {
    }

    public static Clock fixedClock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    public static CaConfig config(Path directory) {
        return CaConfig.builder()
            .storeDirectory(directory.toString())
            .minRsaKeySize(TEST_RSA_BITS)
            .defaultRsaKeySize(TEST_RSA_BITS)
            .defaultDhBits(512)
            .build();
    }

    public static CertificateIssuer issuer(Clock clock) {
        return new CertificateIssuer(new ProfileResolver(), new KeyPairService(TEST_RSA_BITS),
            new SerialNumberAllocator(), clock);
    }

    public static IssuanceRequest.Builder request(IdentityProfile profile, String commonName) {
        return IssuanceRequest.builder()
            .profile(profile)
            .subject(DistinguishedName.builder().commonName(commonName).organization("Home").build())
            .keySpec(KeySpec.rsa(TEST_RSA_BITS));
    }
}
