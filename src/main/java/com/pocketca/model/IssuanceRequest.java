package com.pocketca.model;

import com.pocketca.config.CaConfigConstants;
import com.pocketca.crypto.KeySpec;
import com.pocketca.profile.IdentityProfile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable request to build one identity. Constructed once and passed
 * explicitly to the issuer; no request state lives anywhere else.
 */
public final class IssuanceRequest {
    private final IdentityProfile profile;
    private final DistinguishedName subject;
    private final int validityDays;
    private final String signingAuthority;
    private final KeySpec keySpec;
    private final List<SubjectAltName> subjectAltNames;

    private IssuanceRequest(Builder builder) {
        this.profile = builder.profile;
        this.subject = builder.subject;
        this.validityDays = builder.validityDays;
        this.signingAuthority = builder.signingAuthority;
        this.keySpec = builder.keySpec;
        this.subjectAltNames = Collections.unmodifiableList(new ArrayList<>(builder.subjectAltNames));
    }

    public IdentityProfile getProfile() { return profile; }
    public DistinguishedName getSubject() { return subject; }
    public int getValidityDays() { return validityDays; }
    public String getSigningAuthority() { return signingAuthority; }
    public KeySpec getKeySpec() { return keySpec; }
    public List<SubjectAltName> getSubjectAltNames() { return subjectAltNames; }

    /**
     * Common name of the subject, also the name the artifacts are stored under
     */
    public String getCommonName() {
        return subject != null ? subject.getCommonName() : null;
    }

    public static Builder builder() { return new Builder(); }

    @Override
    public String toString() {
        return "IssuanceRequest{" +
               "profile=" + profile +
               ", subject=" + subject +
               ", validityDays=" + validityDays +
               ", signingAuthority='" + signingAuthority + '\'' +
               ", keySpec=" + keySpec +
               ", subjectAltNames=" + subjectAltNames +
               '}';
    }

    public static class Builder {
        private IdentityProfile profile;
        private DistinguishedName subject;
        private int validityDays = CaConfigConstants.DEFAULT_VALIDITY_DAYS;
        private String signingAuthority = CaConfigConstants.DEFAULT_SIGNING_AUTHORITY;
        private KeySpec keySpec = KeySpec.rsa(CaConfigConstants.DEFAULT_RSA_KEY_SIZE);
        private final List<SubjectAltName> subjectAltNames = new ArrayList<>();

        public Builder profile(IdentityProfile profile) {
            this.profile = profile;
            return this;
        }

        public Builder subject(DistinguishedName subject) {
            this.subject = subject;
            return this;
        }

        public Builder validityDays(int validityDays) {
            this.validityDays = validityDays;
            return this;
        }

        public Builder signingAuthority(String signingAuthority) {
            this.signingAuthority = signingAuthority;
            return this;
        }

        public Builder keySpec(KeySpec keySpec) {
            this.keySpec = keySpec;
            return this;
        }

        public Builder addSubjectAltName(SubjectAltName subjectAltName) {
            this.subjectAltNames.add(subjectAltName);
            return this;
        }

        public Builder subjectAltNames(List<SubjectAltName> subjectAltNames) {
            this.subjectAltNames.clear();
            this.subjectAltNames.addAll(subjectAltNames);
            return this;
        }

        public IssuanceRequest build() {
            return new IssuanceRequest(this);
        }
    }
}
