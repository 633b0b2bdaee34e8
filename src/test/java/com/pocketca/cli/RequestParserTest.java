package com.pocketca.cli;

import com.pocketca.config.CaConfig;
import com.pocketca.crypto.KeySpec;
import com.pocketca.exception.ValidationException;
import com.pocketca.model.IssuanceRequest;
import com.pocketca.model.SubjectAltName;
import com.pocketca.profile.IdentityProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RequestParser
 */
class RequestParserTest {

    private final RequestParser parser = new RequestParser(CaConfig.defaults());

    @Nested
    @DisplayName("parseIssuance")
    class ParseIssuance {

        @Test
        @DisplayName("should apply defaults when no argument is given")
        void shouldApplyDefaults() {
            IssuanceRequest request = parser.parseIssuance(IdentityProfile.SERVER, Collections.emptyList());

            assertEquals(IdentityProfile.SERVER, request.getProfile());
            assertEquals("server", request.getCommonName());
            assertEquals("Home", request.getSubject().getOrganization());
            assertEquals(3650, request.getValidityDays());
            assertEquals("root", request.getSigningAuthority());
            assertEquals(KeySpec.rsa(2048), request.getKeySpec());
            assertTrue(request.getSubjectAltNames().isEmpty());
        }

        @Test
        @DisplayName("should read every supported key")
        void shouldReadAllKeys() {
            IssuanceRequest request = parser.parseIssuance(IdentityProfile.CLIENT, List.of(
                "CN=alice", "O=Acme", "C=FR", "ST=Bretagne", "L=Rennes",
                "email=alice@example.com", "days=30", "ec=prime256v1", "ca=sub"));

            assertEquals("alice", request.getCommonName());
            assertEquals("Acme", request.getSubject().getOrganization());
            assertEquals("FR", request.getSubject().getCountry());
            assertEquals("Bretagne", request.getSubject().getState());
            assertEquals("Rennes", request.getSubject().getLocality());
            assertEquals(List.of(SubjectAltName.email("alice@example.com")), request.getSubjectAltNames());
            assertEquals(30, request.getValidityDays());
            assertEquals(KeySpec.ec("prime256v1"), request.getKeySpec());
            assertEquals("sub", request.getSigningAuthority());
        }

        @Test
        @DisplayName("should keep SAN entries in command line order")
        void shouldKeepSanOrder() {
            IssuanceRequest request = parser.parseIssuance(IdentityProfile.WEB_SERVER,
                List.of("dns=a.example.com", "email=ops@example.com", "dns=b.example.com"));

            assertEquals(List.of(
                SubjectAltName.dns("a.example.com"),
                SubjectAltName.email("ops@example.com"),
                SubjectAltName.dns("b.example.com")), request.getSubjectAltNames());
        }

        @Test
        @DisplayName("should keep everything after the first equals sign as the value")
        void shouldSplitOnFirstEquals() {
            IssuanceRequest request = parser.parseIssuance(IdentityProfile.ROOT_CA, List.of("O=a=b"));

            assertEquals("a=b", request.getSubject().getOrganization());
        }

        @Test
        @DisplayName("should use configured defaults")
        void shouldUseConfiguredDefaults() {
            CaConfig config = CaConfig.builder()
                .defaultOrganization("Acme")
                .defaultSigningAuthority("sub")
                .defaultValidityDays(90)
                .defaultRsaKeySize(3072)
                .build();

            IssuanceRequest request = new RequestParser(config).parseIssuance(IdentityProfile.SERVER, List.of());

            assertEquals("Acme", request.getSubject().getOrganization());
            assertEquals("sub", request.getSigningAuthority());
            assertEquals(90, request.getValidityDays());
            assertEquals(KeySpec.rsa(3072), request.getKeySpec());
        }
    }

    @Nested
    @DisplayName("rejections")
    class Rejections {

        @Test
        @DisplayName("should reject unsupported keys")
        void shouldRejectUnknownKey() {
            ValidationException e = assertThrows(ValidationException.class,
                () -> parser.parseIssuance(IdentityProfile.SERVER, List.of("OU=Mine")));

            assertEquals("OU", e.getField());
            assertTrue(e.getMessage().contains("Unsupported field: [OU]"));
        }

        @Test
        @DisplayName("should reject arguments that are not key=value")
        void shouldRejectMalformed() {
            assertThrows(ValidationException.class, () -> parser.parseIssuance(IdentityProfile.SERVER, List.of("www1")));
            assertThrows(ValidationException.class, () -> parser.parseIssuance(IdentityProfile.SERVER, List.of("CN=")));
            assertThrows(ValidationException.class, () -> parser.parseIssuance(IdentityProfile.SERVER, List.of("=x")));
        }

        @Test
        @DisplayName("should reject non-numeric days and sizes")
        void shouldRejectNonNumeric() {
            ValidationException days = assertThrows(ValidationException.class,
                () -> parser.parseIssuance(IdentityProfile.SERVER, List.of("days=ten")));
            ValidationException rsa = assertThrows(ValidationException.class,
                () -> parser.parseIssuance(IdentityProfile.SERVER, List.of("rsa=big")));

            assertEquals("days", days.getField());
            assertEquals("rsa", rsa.getField());
        }

        @Test
        @DisplayName("should reject rsa and ec together")
        void shouldRejectBothKeyTypes() {
            assertThrows(ValidationException.class,
                () -> parser.parseIssuance(IdentityProfile.CLIENT, List.of("rsa=2048", "ec=prime256v1")));
        }
    }

    @Nested
    @DisplayName("parseAuthority")
    class ParseAuthority {

        @Test
        @DisplayName("should default to the configured authority")
        void shouldDefault() {
            assertEquals("root", parser.parseAuthority(List.of()));
            assertEquals("sub", parser.parseAuthority(List.of("ca=sub")));
        }

        @Test
        @DisplayName("should accept only ca=")
        void shouldRejectOtherKeys() {
            assertThrows(ValidationException.class, () -> parser.parseAuthority(List.of("CN=x")));
        }

        @Test
        @DisplayName("should refuse an authority that is not a plain file name")
        void shouldRejectPathAuthority() {
            ValidationException e = assertThrows(ValidationException.class,
                () -> parser.parseAuthority(List.of("ca=../y")));

            assertEquals("ca", e.getField());
        }
    }
}
