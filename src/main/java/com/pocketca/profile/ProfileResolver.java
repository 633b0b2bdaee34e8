package com.pocketca.profile;

import com.pocketca.exception.PkiException;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.asn1.x509.KeyUsage;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Maps an {@link IdentityProfile} to its fixed {@link ProfileTemplate}.
 *
 * <p>The table is declarative: adding a profile means adding one entry here, the
 * extension logic in {@link ProfileTemplate#applyTo} stays shared.
 */
public class ProfileResolver {

    private static final int CA_KEY_USAGE = KeyUsage.keyCertSign | KeyUsage.cRLSign;
    private static final int SERVER_KEY_USAGE = KeyUsage.digitalSignature | KeyUsage.keyEncipherment;

    private final Map<IdentityProfile, ProfileTemplate> templates;

    public ProfileResolver() {
        Map<IdentityProfile, ProfileTemplate> map = new EnumMap<>(IdentityProfile.class);

        map.put(IdentityProfile.ROOT_CA, ProfileTemplate.builder(IdentityProfile.ROOT_CA)
            .ouLabel("Root")
            .basicConstraints(true, true)
            .keyUsage(true, CA_KEY_USAGE)
            .authorityKeyId(ProfileTemplate.AuthorityKeyIdMode.KEY_ID)
            .issuerMode(ProfileTemplate.IssuerMode.SELF_SIGNED)
            .build());

        map.put(IdentityProfile.SUB_CA, ProfileTemplate.builder(IdentityProfile.SUB_CA)
            .ouLabel("Sub")
            .basicConstraints(true, true)
            .keyUsage(true, CA_KEY_USAGE)
            .authorityKeyId(ProfileTemplate.AuthorityKeyIdMode.KEY_ID)
            .build());

        map.put(IdentityProfile.SERVER, ProfileTemplate.builder(IdentityProfile.SERVER)
            .ouLabel("Server")
            .basicConstraints(false, false)
            .keyUsage(false, SERVER_KEY_USAGE)
            .extendedKeyUsage(KeyPurposeId.id_kp_serverAuth)
            .sanAllowed(true)
            .build());

        map.put(IdentityProfile.CLIENT, ProfileTemplate.builder(IdentityProfile.CLIENT)
            .ouLabel("Client")
            .basicConstraints(false, false)
            .keyUsage(false, KeyUsage.digitalSignature)
            .extendedKeyUsage(KeyPurposeId.id_kp_clientAuth)
            .sanAllowed(true)
            .ecKeyAllowed(true)
            .build());

        map.put(IdentityProfile.WEB_SERVER, ProfileTemplate.builder(IdentityProfile.WEB_SERVER)
            .ouLabel("Server")
            .basicConstraints(false, false)
            .keyUsage(false, SERVER_KEY_USAGE)
            .extendedKeyUsage(KeyPurposeId.id_kp_serverAuth, KeyPurposeId.id_kp_clientAuth)
            .sanAllowed(true)
            .build());

        this.templates = Collections.unmodifiableMap(map);
    }

    /**
     * Resolve the policy for a profile.
     *
     * @param profile requested profile
     * @return the profile's template
     * @throws PkiException with {@code UNKNOWN_PROFILE} if the profile has no template
     */
    public ProfileTemplate resolve(IdentityProfile profile) {
        ProfileTemplate template = profile != null ? templates.get(profile) : null;
        if (template == null) {
            throw PkiException.unknownProfile(String.valueOf(profile));
        }
        return template;
    }
}
