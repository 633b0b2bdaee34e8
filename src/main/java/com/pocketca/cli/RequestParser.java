package com.pocketca.cli;

import com.pocketca.config.CaConfig;
import com.pocketca.crypto.KeySpec;
import com.pocketca.exception.ValidationException;
import com.pocketca.model.DistinguishedName;
import com.pocketca.model.IssuanceRequest;
import com.pocketca.model.RequestValidator;
import com.pocketca.model.SubjectAltName;
import com.pocketca.profile.IdentityProfile;

import java.util.List;

/**
 * Turns {@code key=value} command line arguments into requests.
 *
 * <p>Supported keys for issuance: {@code O, CN, C, ST, L, email, dns, days,
 * rsa, ec, ca}. Repeated {@code email} and {@code dns} keys accumulate in
 * the order given; any other repeated key keeps its last value.</p>
 */
public class RequestParser {

    private final CaConfig config;

    public RequestParser(CaConfig config) {
        this.config = config;
    }

    /**
     * Build an issuance request for {@code profile}.
     *
     * @throws ValidationException on an unknown key, a malformed pair or a non-numeric number
     */
    public IssuanceRequest parseIssuance(IdentityProfile profile, List<String> args) {
        DistinguishedName.Builder subject = DistinguishedName.builder()
            .commonName(profile.getCommand())
            .organization(config.getDefaultOrganization());
        IssuanceRequest.Builder request = IssuanceRequest.builder()
            .profile(profile)
            .validityDays(config.getDefaultValidityDays())
            .signingAuthority(config.getDefaultSigningAuthority())
            .keySpec(KeySpec.rsa(config.getDefaultRsaKeySize()));

        boolean rsaGiven = false;
        boolean ecGiven = false;

        for (String arg : args) {
            String[] pair = split(arg);
            String key = pair[0];
            String value = pair[1];
            switch (key) {
                case "O":
                    subject.organization(value);
                    break;
                case "CN":
                    subject.commonName(value);
                    break;
                case "C":
                    subject.country(value);
                    break;
                case "ST":
                    subject.state(value);
                    break;
                case "L":
                    subject.locality(value);
                    break;
                case "email":
                    request.addSubjectAltName(SubjectAltName.email(value));
                    break;
                case "dns":
                    request.addSubjectAltName(SubjectAltName.dns(value));
                    break;
                case "days":
                    request.validityDays(parseInt(key, value));
                    break;
                case "rsa":
                    rsaGiven = true;
                    request.keySpec(KeySpec.rsa(parseInt(key, value)));
                    break;
                case "ec":
                    ecGiven = true;
                    request.keySpec(KeySpec.ec(value));
                    break;
                case "ca":
                    request.signingAuthority(value);
                    break;
                default:
                    throw new ValidationException("Unsupported field: [" + key + "]", key);
            }
        }

        if (rsaGiven && ecGiven) {
            throw new ValidationException("Specify either rsa= or ec=, not both", "ec");
        }

        return request.subject(subject.build()).build();
    }

    /**
     * Read the signing authority from arguments that accept only {@code ca=}.
     */
    public String parseAuthority(List<String> args) {
        String authority = config.getDefaultSigningAuthority();
        for (String arg : args) {
            String[] pair = split(arg);
            if (!"ca".equals(pair[0])) {
                throw new ValidationException("Unsupported field: [" + pair[0] + "]", pair[0]);
            }
            authority = pair[1];
        }
        RequestValidator.validateArtifactName(authority, "ca");
        return authority;
    }

    private String[] split(String arg) {
        int eq = arg.indexOf('=');
        if (eq <= 0 || eq == arg.length() - 1) {
            throw new ValidationException("Expected key=value, got: " + arg, arg);
        }
        return new String[] {arg.substring(0, eq), arg.substring(eq + 1)};
    }

    private int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ValidationException(key + " must be an integer, got: " + value, key);
        }
    }
}
