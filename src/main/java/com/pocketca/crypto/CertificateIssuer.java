package com.pocketca.crypto;

import com.pocketca.exception.PkiErrorCode;
import com.pocketca.exception.PkiException;
import com.pocketca.model.DistinguishedName;
import com.pocketca.model.Identity;
import com.pocketca.model.IssuanceRequest;
import com.pocketca.profile.ProfileResolver;
import com.pocketca.profile.ProfileTemplate;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;

/**
 * Builds and signs X.509 v3 certificates from an {@link IssuanceRequest}.
 *
 * <p>The issuer does not touch the file system: the caller supplies the
 * signing authority and persists the returned {@link Identity}.</p>
 */
public class CertificateIssuer {

    private static final Logger logger = LoggerFactory.getLogger(CertificateIssuer.class);

    private final ProfileResolver profileResolver;
    private final KeyPairService keyPairService;
    private final SerialNumberAllocator serialAllocator;
    private final Clock clock;

    public CertificateIssuer(ProfileResolver profileResolver,
                             KeyPairService keyPairService,
                             SerialNumberAllocator serialAllocator,
                             Clock clock) {
        this.profileResolver = profileResolver;
        this.keyPairService = keyPairService;
        this.serialAllocator = serialAllocator;
        this.clock = clock;
    }

    /**
     * Check the parts of a request that depend only on its profile.
     *
     * @return the resolved template
     * @throws PkiException UNKNOWN_PROFILE, UNSUPPORTED_KEY_FOR_PROFILE or SAN_NOT_PERMITTED
     */
    public ProfileTemplate checkRequest(IssuanceRequest request) {
        ProfileTemplate template = profileResolver.resolve(request.getProfile());
        String command = template.getProfile().getCommand();

        if (request.getKeySpec() != null && request.getKeySpec().isEc() && !template.isEcKeyAllowed()) {
            throw PkiException.unsupportedKeyForProfile(command);
        }
        if (!request.getSubjectAltNames().isEmpty() && !template.isSanAllowed()) {
            throw PkiException.sanNotPermitted(command);
        }
        return template;
    }

    public Identity issue(IssuanceRequest request, Identity signer) {
        return issue(request, signer, KeyGenerationListener.NONE);
    }

    /**
     * Generate a key pair and a certificate for it.
     *
     * @param request what to issue
     * @param signer signing authority; ignored for self-signed profiles
     * @param listener key generation progress callback
     * @return the new identity, named after the request's common name
     */
    public Identity issue(IssuanceRequest request, Identity signer, KeyGenerationListener listener) {
        ProfileTemplate template = checkRequest(request);

        if (!template.isSelfSigned()) {
            checkSigner(request.getSigningAuthority(), signer);
        }

        KeyPair keyPair = keyPairService.generate(request.getKeySpec(), listener);
        BigInteger serial = serialAllocator.allocate();

        DistinguishedName subjectDn = request.getSubject().withOrganizationalUnit(template.getOuLabel());
        if (!template.isSelfSigned()) {
            String signerOrganization = DistinguishedName.firstValue(signer.getSubject(), BCStyle.O);
            if (signerOrganization != null) {
                subjectDn = subjectDn.withOrganization(signerOrganization);
            }
        }
        X500Name subject = subjectDn.toX500Name();

        X500Name issuer;
        PrivateKey signingKey;
        if (template.isSelfSigned()) {
            issuer = subject;
            signingKey = keyPair.getPrivate();
        } else {
            issuer = signer.getSubject();
            signingKey = signer.getPrivateKey();
        }

        Instant notBefore = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant notAfter = notBefore.plus(Duration.ofDays(request.getValidityDays()));

        try {
            X509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
                issuer,
                serial,
                Date.from(notBefore),
                Date.from(notAfter),
                subject,
                keyPair.getPublic()
            );

            template.applyTo(builder, keyPair.getPublic(),
                template.isSelfSigned() ? null : signer.getCertificate(),
                request.getSubjectAltNames());

            ContentSigner contentSigner = new JcaContentSignerBuilder(CryptoConstants.signatureAlgorithmFor(signingKey))
                .setProvider(CryptoConstants.PROVIDER)
                .build(signingKey);

            X509CertificateHolder holder = builder.build(contentSigner);
            X509Certificate certificate = new JcaX509CertificateConverter()
                .setProvider(CryptoConstants.PROVIDER)
                .getCertificate(holder);

            logger.info("Issued {} certificate for '{}' (serial {})",
                template.getProfile().getCommand(), request.getCommonName(), serial.toString(16));

            return new Identity(request.getCommonName(), keyPair.getPrivate(), certificate);

        } catch (IOException | GeneralSecurityException | OperatorCreationException e) {
            throw PkiException.cryptoFailure("Failed to build certificate for " + request.getCommonName(), e);
        }
    }

    private void checkSigner(String authorityName, Identity signer) {
        if (signer == null) {
            throw PkiException.signingAuthorityNotFound(authorityName);
        }
        if (signer.getCertificate().getBasicConstraints() < 0) {
            throw new PkiException(PkiErrorCode.INVALID_SIGNING_AUTHORITY,
                signer.getName() + " is not a certificate authority");
        }
        if (!KeyPairVerifier.matches(signer.getPrivateKey(), signer.getPublicKey())) {
            throw PkiException.invalidSigningAuthority(signer.getName());
        }
    }
}
