package com.pocketca.profile;

import com.pocketca.exception.PkiErrorCode;
import com.pocketca.exception.PkiException;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ProfileResolver
 */
class ProfileResolverTest {

    private ProfileResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new ProfileResolver();
    }

    @Nested
    @DisplayName("authorities")
    class Authorities {

        @Test
        @DisplayName("root should be a self-signed critical CA without SAN")
        void rootTemplate() {
            ProfileTemplate root = resolver.resolve(IdentityProfile.ROOT_CA);

            assertEquals("Root", root.getOuLabel());
            assertTrue(root.isCa());
            assertTrue(root.isBasicConstraintsCritical());
            assertTrue(root.isKeyUsageCritical());
            assertEquals(KeyUsage.keyCertSign | KeyUsage.cRLSign, root.getKeyUsageBits());
            assertTrue(root.getExtendedKeyUsages().isEmpty());
            assertEquals(ProfileTemplate.AuthorityKeyIdMode.KEY_ID, root.getAuthorityKeyIdMode());
            assertTrue(root.isSelfSigned());
            assertFalse(root.isSanAllowed());
            assertFalse(root.isEcKeyAllowed());
        }

        @Test
        @DisplayName("sub should be a chain-signed CA")
        void subTemplate() {
            ProfileTemplate sub = resolver.resolve(IdentityProfile.SUB_CA);

            assertEquals("Sub", sub.getOuLabel());
            assertTrue(sub.isCa());
            assertEquals(ProfileTemplate.IssuerMode.CHAIN_SIGNED, sub.getIssuerMode());
            assertFalse(sub.isSelfSigned());
            assertFalse(sub.isSanAllowed());
        }
    }

    @Nested
    @DisplayName("leaves")
    class Leaves {

        @Test
        @DisplayName("server should allow serverAuth only")
        void serverTemplate() {
            ProfileTemplate server = resolver.resolve(IdentityProfile.SERVER);

            assertEquals("Server", server.getOuLabel());
            assertFalse(server.isCa());
            assertFalse(server.isBasicConstraintsCritical());
            assertFalse(server.isKeyUsageCritical());
            assertEquals(KeyUsage.digitalSignature | KeyUsage.keyEncipherment, server.getKeyUsageBits());
            assertEquals(List.of(KeyPurposeId.id_kp_serverAuth), server.getExtendedKeyUsages());
            assertEquals(ProfileTemplate.AuthorityKeyIdMode.ISSUER_AND_KEY_ID, server.getAuthorityKeyIdMode());
            assertTrue(server.isSanAllowed());
            assertFalse(server.isEcKeyAllowed());
        }

        @Test
        @DisplayName("client should be the only profile accepting EC keys")
        void clientTemplate() {
            ProfileTemplate client = resolver.resolve(IdentityProfile.CLIENT);

            assertEquals("Client", client.getOuLabel());
            assertEquals(KeyUsage.digitalSignature, client.getKeyUsageBits());
            assertEquals(List.of(KeyPurposeId.id_kp_clientAuth), client.getExtendedKeyUsages());
            assertTrue(client.isEcKeyAllowed());

            for (IdentityProfile profile : IdentityProfile.values()) {
                if (profile != IdentityProfile.CLIENT) {
                    assertFalse(resolver.resolve(profile).isEcKeyAllowed(), profile.name());
                }
            }
        }

        @Test
        @DisplayName("www should allow serverAuth and clientAuth")
        void webServerTemplate() {
            ProfileTemplate www = resolver.resolve(IdentityProfile.WEB_SERVER);

            assertEquals("Server", www.getOuLabel());
            assertEquals(List.of(KeyPurposeId.id_kp_serverAuth, KeyPurposeId.id_kp_clientAuth),
                www.getExtendedKeyUsages());
            assertTrue(www.isSanAllowed());
        }
    }

    @Test
    @DisplayName("should reject a null profile with UNKNOWN_PROFILE")
    void shouldRejectNullProfile() {
        PkiException e = assertThrows(PkiException.class, () -> resolver.resolve(null));
        assertEquals(PkiErrorCode.UNKNOWN_PROFILE, e.getErrorCode());
    }
}
