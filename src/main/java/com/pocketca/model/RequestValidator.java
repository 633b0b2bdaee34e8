package com.pocketca.model;

import com.pocketca.config.CaConfig;
import com.pocketca.config.CaConfigConstants;
import com.pocketca.crypto.KeySpec;
import com.pocketca.exception.ValidationException;
import com.pocketca.profile.IdentityProfile;
import org.bouncycastle.asn1.ASN1IA5String;

import java.util.regex.Pattern;

/**
 * Rejects malformed issuance requests before any key material is generated.
 * Over-length input is refused, never truncated.
 */
public class RequestValidator {

    private static final Pattern COUNTRY_PATTERN = Pattern.compile("^[A-Za-z]{2}$");
    private static final Pattern FORBIDDEN_NAME_CHARS = Pattern.compile("[/\\\\\\x00]");

    private final CaConfig config;

    public RequestValidator(CaConfig config) {
        this.config = config;
    }

    /**
     * Validate a request against the configured limits.
     *
     * @param request the request to check
     * @throws ValidationException naming the first offending field
     */
    public void validateOrThrow(IssuanceRequest request) {
        if (request.getSubject() == null) {
            throw new ValidationException("Subject is required", "CN");
        }

        DistinguishedName dn = request.getSubject();
        validateArtifactName(dn.getCommonName(), "CN");
        checkLength(dn.getCommonName(), "CN");
        checkLength(dn.getOrganization(), "O");
        checkLength(dn.getOrganizationalUnit(), "OU");
        checkLength(dn.getLocality(), "L");
        checkLength(dn.getState(), "ST");

        String country = dn.getCountry();
        if (country != null && !country.isEmpty() && !COUNTRY_PATTERN.matcher(country).matches()) {
            throw new ValidationException("C must be a 2-letter country code, got: " + country, "C");
        }

        int days = request.getValidityDays();
        if (days < CaConfigConstants.MIN_VALIDITY_DAYS || days > CaConfigConstants.MAX_VALIDITY_DAYS) {
            throw new ValidationException("days must be between " + CaConfigConstants.MIN_VALIDITY_DAYS
                + " and " + CaConfigConstants.MAX_VALIDITY_DAYS + ", got " + days, "days");
        }

        KeySpec keySpec = request.getKeySpec();
        if (keySpec == null) {
            throw new ValidationException("Key specification is required", "rsa");
        }
        if (!keySpec.isEc()) {
            int bits = keySpec.getRsaBits();
            if (bits < config.getMinRsaKeySize() || bits > CaConfigConstants.MAX_RSA_KEY_SIZE) {
                throw new ValidationException("rsa must be between " + config.getMinRsaKeySize()
                    + " and " + CaConfigConstants.MAX_RSA_KEY_SIZE + " bits, got " + bits, "rsa");
            }
        } else {
            checkLength(keySpec.getCurveName(), "ec");
        }

        if (request.getProfile() != IdentityProfile.ROOT_CA) {
            validateArtifactName(request.getSigningAuthority(), "ca");
        }

        if (request.getSubjectAltNames().size() > config.getMaxSanEntries()) {
            throw new ValidationException("At most " + config.getMaxSanEntries()
                + " subject alternative names are allowed, got " + request.getSubjectAltNames().size(), "san");
        }
        for (SubjectAltName san : request.getSubjectAltNames()) {
            String field = san.getType() == SubjectAltName.Type.DNS ? "dns" : "email";
            if (san.getValue().trim().isEmpty()) {
                throw new ValidationException(field + " must not be empty", field);
            }
            if (!ASN1IA5String.isIA5String(san.getValue())) {
                throw new ValidationException(field + " must contain ASCII characters only: "
                    + truncate(san.getValue(), 40), field);
            }
            if (san.render().length() > config.getMaxFieldLength()) {
                throw new ValidationException(field + " entry exceeds " + config.getMaxFieldLength()
                    + " characters: " + truncate(san.render(), 40), field);
            }
        }
    }

    /**
     * Check that a name can be used as a file name inside the store directory.
     *
     * @param name artifact name, e.g. {@code root}
     * @param field field reported on failure
     * @throws ValidationException if the name is blank or contains a path element
     */
    public static void validateArtifactName(String name, String field) {
        if (name == null || name.trim().isEmpty()) {
            throw new ValidationException(field + " is required", field);
        }
        if (FORBIDDEN_NAME_CHARS.matcher(name).find() || ".".equals(name) || "..".equals(name)) {
            throw new ValidationException(field + " cannot be used as a file name: " + name, field);
        }
    }

    private void checkLength(String value, String field) {
        if (value != null && value.length() > config.getMaxFieldLength()) {
            throw new ValidationException(field + " exceeds " + config.getMaxFieldLength()
                + " characters: " + truncate(value, 40), field);
        }
    }

    private static String truncate(String value, int maxLength) {
        if (value.length() <= maxLength) return value;
        return value.substring(0, maxLength) + "...";
    }
}
