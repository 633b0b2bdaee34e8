package com.pocketca.profile;

import com.pocketca.model.SubjectAltName;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.CertIOException;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509ExtensionUtils;

import java.security.NoSuchAlgorithmException;
import java.security.PublicKey;
import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;
import java.util.Collections;
import java.util.List;

/**
 * Fixed certificate policy for one {@link IdentityProfile}: the OU label, the
 * extension set and the issuance rules.
 *
 * <p>Every template carries basicConstraints, keyUsage, subjectKeyIdentifier and
 * authorityKeyIdentifier; extendedKeyUsage and subjectAltName only where listed.
 * {@link #applyTo} is the single routine that turns a template into extensions.
 */
public final class ProfileTemplate {

    /**
     * How the certificate is signed
     */
    public enum IssuerMode {
        SELF_SIGNED,
        CHAIN_SIGNED
    }

    /**
     * Content of the authorityKeyIdentifier extension
     */
    public enum AuthorityKeyIdMode {
        /** keyIdentifier only */
        KEY_ID,
        /** keyIdentifier plus the issuer's issuer name and serial */
        ISSUER_AND_KEY_ID
    }

    private final IdentityProfile profile;
    private final String ouLabel;
    private final boolean ca;
    private final boolean basicConstraintsCritical;
    private final int keyUsageBits;
    private final boolean keyUsageCritical;
    private final List<KeyPurposeId> extendedKeyUsages;
    private final AuthorityKeyIdMode authorityKeyIdMode;
    private final boolean sanAllowed;
    private final boolean ecKeyAllowed;
    private final IssuerMode issuerMode;

    private ProfileTemplate(Builder builder) {
        this.profile = builder.profile;
        this.ouLabel = builder.ouLabel;
        this.ca = builder.ca;
        this.basicConstraintsCritical = builder.basicConstraintsCritical;
        this.keyUsageBits = builder.keyUsageBits;
        this.keyUsageCritical = builder.keyUsageCritical;
        this.extendedKeyUsages = Collections.unmodifiableList(builder.extendedKeyUsages);
        this.authorityKeyIdMode = builder.authorityKeyIdMode;
        this.sanAllowed = builder.sanAllowed;
        this.ecKeyAllowed = builder.ecKeyAllowed;
        this.issuerMode = builder.issuerMode;
    }

    public IdentityProfile getProfile() { return profile; }
    public String getOuLabel() { return ouLabel; }
    public boolean isCa() { return ca; }
    public boolean isBasicConstraintsCritical() { return basicConstraintsCritical; }
    public int getKeyUsageBits() { return keyUsageBits; }
    public boolean isKeyUsageCritical() { return keyUsageCritical; }
    public List<KeyPurposeId> getExtendedKeyUsages() { return extendedKeyUsages; }
    public AuthorityKeyIdMode getAuthorityKeyIdMode() { return authorityKeyIdMode; }
    public boolean isSanAllowed() { return sanAllowed; }
    public boolean isEcKeyAllowed() { return ecKeyAllowed; }
    public IssuerMode getIssuerMode() { return issuerMode; }

    public boolean isSelfSigned() {
        return issuerMode == IssuerMode.SELF_SIGNED;
    }

    /**
     * Add this template's extensions to a certificate under construction.
     *
     * @param builder certificate builder
     * @param subjectKey public key being certified
     * @param issuerCertificate certificate of the signing authority, null when self-signed
     * @param subjectAltNames SAN entries, may be empty
     */
    public void applyTo(X509v3CertificateBuilder builder,
                        PublicKey subjectKey,
                        X509Certificate issuerCertificate,
                        List<SubjectAltName> subjectAltNames)
            throws CertIOException, NoSuchAlgorithmException, CertificateEncodingException {
        JcaX509ExtensionUtils extUtils = new JcaX509ExtensionUtils();

        if (sanAllowed && subjectAltNames != null && !subjectAltNames.isEmpty()) {
            GeneralName[] names = new GeneralName[subjectAltNames.size()];
            for (int i = 0; i < names.length; i++) {
                names[i] = subjectAltNames.get(i).toGeneralName();
            }
            builder.addExtension(Extension.subjectAlternativeName, false, new GeneralNames(names));
        }

        builder.addExtension(Extension.basicConstraints, basicConstraintsCritical, new BasicConstraints(ca));
        builder.addExtension(Extension.keyUsage, keyUsageCritical, new KeyUsage(keyUsageBits));

        if (!extendedKeyUsages.isEmpty()) {
            builder.addExtension(Extension.extendedKeyUsage, false,
                new ExtendedKeyUsage(extendedKeyUsages.toArray(new KeyPurposeId[0])));
        }

        builder.addExtension(Extension.subjectKeyIdentifier, false,
            extUtils.createSubjectKeyIdentifier(subjectKey));

        if (issuerCertificate == null) {
            builder.addExtension(Extension.authorityKeyIdentifier, false,
                extUtils.createAuthorityKeyIdentifier(subjectKey));
        } else if (authorityKeyIdMode == AuthorityKeyIdMode.ISSUER_AND_KEY_ID) {
            builder.addExtension(Extension.authorityKeyIdentifier, false,
                extUtils.createAuthorityKeyIdentifier(issuerCertificate));
        } else {
            builder.addExtension(Extension.authorityKeyIdentifier, false,
                extUtils.createAuthorityKeyIdentifier(issuerCertificate.getPublicKey()));
        }
    }

    static Builder builder(IdentityProfile profile) {
        return new Builder(profile);
    }

    static class Builder {
        private final IdentityProfile profile;
        private String ouLabel;
        private boolean ca;
        private boolean basicConstraintsCritical;
        private int keyUsageBits;
        private boolean keyUsageCritical;
        private List<KeyPurposeId> extendedKeyUsages = Collections.emptyList();
        private AuthorityKeyIdMode authorityKeyIdMode = AuthorityKeyIdMode.ISSUER_AND_KEY_ID;
        private boolean sanAllowed;
        private boolean ecKeyAllowed;
        private IssuerMode issuerMode = IssuerMode.CHAIN_SIGNED;

        private Builder(IdentityProfile profile) {
            this.profile = profile;
        }

        Builder ouLabel(String ouLabel) {
            this.ouLabel = ouLabel;
            return this;
        }

        Builder basicConstraints(boolean critical, boolean ca) {
            this.basicConstraintsCritical = critical;
            this.ca = ca;
            return this;
        }

        Builder keyUsage(boolean critical, int keyUsageBits) {
            this.keyUsageCritical = critical;
            this.keyUsageBits = keyUsageBits;
            return this;
        }

        Builder extendedKeyUsage(KeyPurposeId... purposes) {
            this.extendedKeyUsages = List.of(purposes);
            return this;
        }

        Builder authorityKeyId(AuthorityKeyIdMode mode) {
            this.authorityKeyIdMode = mode;
            return this;
        }

        Builder sanAllowed(boolean sanAllowed) {
            this.sanAllowed = sanAllowed;
            return this;
        }

        Builder ecKeyAllowed(boolean ecKeyAllowed) {
            this.ecKeyAllowed = ecKeyAllowed;
            return this;
        }

        Builder issuerMode(IssuerMode issuerMode) {
            this.issuerMode = issuerMode;
            return this;
        }

        ProfileTemplate build() {
            return new ProfileTemplate(this);
        }
    }
}
