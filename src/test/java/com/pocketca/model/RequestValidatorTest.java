package com.pocketca.model;

import com.pocketca.config.CaConfig;
import com.pocketca.crypto.KeySpec;
import com.pocketca.exception.ValidationException;
import com.pocketca.profile.IdentityProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RequestValidator
 */
class RequestValidatorTest {

    private final RequestValidator validator = new RequestValidator(CaConfig.defaults());

    private static String repeat(char c, int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            sb.append(c);
        }
        return sb.toString();
    }

    private static IssuanceRequest.Builder www(String commonName) {
        return IssuanceRequest.builder()
            .profile(IdentityProfile.WEB_SERVER)
            .subject(DistinguishedName.builder().commonName(commonName).build());
    }

    private String failingField(IssuanceRequest request) {
        return assertThrows(ValidationException.class, () -> validator.validateOrThrow(request)).getField();
    }

    @Test
    @DisplayName("should accept a request built with defaults")
    void shouldAcceptDefaults() {
        assertDoesNotThrow(() -> validator.validateOrThrow(www("www1").build()));
    }

    @Nested
    @DisplayName("subject")
    class Subject {

        @Test
        @DisplayName("should require a common name")
        void shouldRequireCommonName() {
            assertEquals("CN", failingField(www(null).build()));
            assertEquals("CN", failingField(www("  ").build()));
            assertEquals("CN", failingField(IssuanceRequest.builder().profile(IdentityProfile.ROOT_CA).build()));
        }

        @Test
        @DisplayName("should refuse common names that are not plain file names")
        void shouldRefusePathNames() {
            assertEquals("CN", failingField(www("../etc/passwd").build()));
            assertEquals("CN", failingField(www("a\\b").build()));
            assertEquals("CN", failingField(www("..").build()));
        }

        @Test
        @DisplayName("should refuse over-length fields instead of truncating")
        void shouldRefuseLongFields() {
            assertEquals("CN", failingField(www(repeat('a', 129)).build()));
            assertDoesNotThrow(() -> validator.validateOrThrow(www(repeat('a', 128)).build()));

            IssuanceRequest longLocality = www("www1")
                .subject(DistinguishedName.builder().commonName("www1").locality(repeat('l', 200)).build())
                .build();
            assertEquals("L", failingField(longLocality));
        }

        @Test
        @DisplayName("should require a two-letter country code")
        void shouldCheckCountry() {
            IssuanceRequest bad = www("x")
                .subject(DistinguishedName.builder().commonName("x").country("FRA").build())
                .build();
            IssuanceRequest good = www("x")
                .subject(DistinguishedName.builder().commonName("x").country("FR").build())
                .build();

            assertEquals("C", failingField(bad));
            assertDoesNotThrow(() -> validator.validateOrThrow(good));
        }
    }

    @Test
    @DisplayName("should check artifact names used outside issuance")
    void shouldCheckArtifactNames() {
        assertDoesNotThrow(() -> RequestValidator.validateArtifactName("sub1", "ca"));

        ValidationException e = assertThrows(ValidationException.class,
            () -> RequestValidator.validateArtifactName("../y", "ca"));
        assertEquals("ca", e.getField());
        assertThrows(ValidationException.class, () -> RequestValidator.validateArtifactName("a/b", "NAME"));
        assertThrows(ValidationException.class, () -> RequestValidator.validateArtifactName(null, "NAME"));
    }

    @Nested
    @DisplayName("parameters")
    class Parameters {

        @Test
        @DisplayName("should bound the validity period")
        void shouldBoundDays() {
            assertEquals("days", failingField(www("x").validityDays(0).build()));
            assertEquals("days", failingField(www("x").validityDays(36501).build()));
        }

        @Test
        @DisplayName("should enforce the configured minimum RSA size")
        void shouldEnforceRsaMinimum() {
            assertEquals("rsa", failingField(www("x").keySpec(KeySpec.rsa(1024)).build()));
            assertDoesNotThrow(() -> validator.validateOrThrow(www("x").keySpec(KeySpec.rsa(3072)).build()));
        }

        @Test
        @DisplayName("should require a usable signing authority name for chain-signed profiles")
        void shouldCheckAuthorityName() {
            assertEquals("ca", failingField(www("x").signingAuthority("").build()));
            assertEquals("ca", failingField(www("x").signingAuthority("../root").build()));

            IssuanceRequest root = IssuanceRequest.builder()
                .profile(IdentityProfile.ROOT_CA)
                .subject(DistinguishedName.builder().commonName("root").build())
                .signingAuthority(null)
                .build();
            assertDoesNotThrow(() -> validator.validateOrThrow(root));
        }
    }

    @Nested
    @DisplayName("subject alternative names")
    class SubjectAltNames {

        @Test
        @DisplayName("should accept up to eight entries and refuse the ninth")
        void shouldLimitCount() {
            IssuanceRequest.Builder builder = www("www1");
            for (int i = 0; i < 8; i++) {
                builder.addSubjectAltName(SubjectAltName.dns("host" + i + ".example.com"));
            }
            assertDoesNotThrow(() -> validator.validateOrThrow(builder.build()));

            builder.addSubjectAltName(SubjectAltName.dns("host8.example.com"));
            assertEquals("san", failingField(builder.build()));
        }

        @Test
        @DisplayName("should limit the rendered length of each entry")
        void shouldLimitLength() {
            String fits = repeat('d', 124);
            String tooLong = repeat('d', 125);

            assertDoesNotThrow(() -> validator.validateOrThrow(
                www("x").addSubjectAltName(SubjectAltName.dns(fits)).build()));
            assertEquals("dns", failingField(www("x").addSubjectAltName(SubjectAltName.dns(tooLong)).build()));
        }

        @Test
        @DisplayName("should refuse characters that an IA5String cannot hold")
        void shouldRefuseNonAscii() {
            assertEquals("dns", failingField(
                www("x").addSubjectAltName(SubjectAltName.dns("b\u00fccher.example")).build()));
            assertEquals("email", failingField(
                www("x").addSubjectAltName(SubjectAltName.email("\u4e2d@example.com")).build()));
            assertDoesNotThrow(() -> validator.validateOrThrow(
                www("x").addSubjectAltName(SubjectAltName.dns("xn--bcher-kva.example")).build()));
        }

        @Test
        @DisplayName("should refuse empty values")
        void shouldRefuseEmpty() {
            assertEquals("email", failingField(www("x").addSubjectAltName(SubjectAltName.email(" ")).build()));
        }
    }
}
