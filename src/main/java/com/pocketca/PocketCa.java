package com.pocketca;

import com.pocketca.config.CaConfig;
import com.pocketca.crl.RevocationLedger;
import com.pocketca.crl.RevokedEntry;
import com.pocketca.crypto.CertificateIssuer;
import com.pocketca.crypto.DhParameterGenerator;
import com.pocketca.crypto.KeyGenerationListener;
import com.pocketca.crypto.KeyPairService;
import com.pocketca.crypto.SerialNumberAllocator;
import com.pocketca.exception.PkiException;
import com.pocketca.model.Identity;
import com.pocketca.model.IssuanceRequest;
import com.pocketca.model.RequestValidator;
import com.pocketca.profile.ProfileResolver;
import com.pocketca.profile.ProfileTemplate;
import com.pocketca.store.IdentityStore;
import com.pocketca.store.NamedLocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.cert.X509CRL;
import java.time.Clock;
import java.util.List;

/**
 * Entry point for issuing identities and maintaining CRLs in one directory.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * PocketCa ca = new PocketCa(CaConfig.builder().storeDirectory("/srv/pki").build());
 * ca.buildIdentity(IssuanceRequest.builder()
 *     .profile(IdentityProfile.ROOT_CA)
 *     .subject(DistinguishedName.builder().commonName("root").organization("Home").build())
 *     .build());
 * }</pre>
 */
public class PocketCa {

    private static final Logger logger = LoggerFactory.getLogger(PocketCa.class);

    private static final String DH_FILE_PREFIX = "dh";
    private static final String DH_FILE_SUFFIX = ".pem";

    private final CaConfig config;
    private final IdentityStore store;
    private final RequestValidator requestValidator;
    private final CertificateIssuer issuer;
    private final RevocationLedger ledger;
    private final DhParameterGenerator dhParameterGenerator;
    private final NamedLocks identityLocks = new NamedLocks();
    private final NamedLocks authorityLocks = new NamedLocks();

    public PocketCa(CaConfig config) {
        this(config, Clock.systemUTC());
    }

    public PocketCa(CaConfig config, Clock clock) {
        this.config = config;
        this.store = new IdentityStore(config.getStorePath());
        this.requestValidator = new RequestValidator(config);
        this.issuer = new CertificateIssuer(
            new ProfileResolver(),
            new KeyPairService(config.getMinRsaKeySize()),
            new SerialNumberAllocator(),
            clock
        );
        this.ledger = new RevocationLedger(store, config.getCrlValidityDays(), clock);
        this.dhParameterGenerator = new DhParameterGenerator();
    }

    public CaConfig getConfig() {
        return config;
    }

    public IdentityStore getStore() {
        return store;
    }

    public RevocationLedger getLedger() {
        return ledger;
    }

    public Identity buildIdentity(IssuanceRequest request) {
        return buildIdentity(request, KeyGenerationListener.NONE);
    }

    /**
     * Issue and persist a new identity.
     *
     * <p>All checks that can fail without touching key material run first;
     * an existing name is refused before any key is generated.</p>
     *
     * @param request what to issue
     * @param listener key generation progress callback
     * @return the saved identity
     */
    public Identity buildIdentity(IssuanceRequest request, KeyGenerationListener listener) {
        requestValidator.validateOrThrow(request);
        String name = request.getCommonName();

        return identityLocks.withLock(name, () -> {
            store.checkAvailable(name);
            ProfileTemplate template = issuer.checkRequest(request);

            Identity signer = null;
            if (!template.isSelfSigned()) {
                signer = store.loadAuthority(request.getSigningAuthority());
            }

            Identity identity = issuer.issue(request, signer, listener);
            store.save(identity);
            logger.info("Built {} identity '{}'", request.getProfile().getCommand(), name);
            return identity;
        });
    }

    /**
     * Revoke the certificate stored under {@code targetName} in the CRL of {@code authority}.
     */
    public X509CRL revoke(String authority, String targetName) {
        RequestValidator.validateArtifactName(authority, "ca");
        RequestValidator.validateArtifactName(targetName, "NAME");
        return authorityLocks.withLock(authority, () -> ledger.revokeIdentity(authority, targetName));
    }

    public X509CRL revokeSerial(String authority, BigInteger serial) {
        RequestValidator.validateArtifactName(authority, "ca");
        return authorityLocks.withLock(authority, () -> ledger.revoke(authority, serial));
    }

    public List<RevokedEntry> listRevoked(String authority) {
        RequestValidator.validateArtifactName(authority, "ca");
        return ledger.list(authority);
    }

    /**
     * Generate DH parameters and write them to {@code dh<bits>.pem}.
     *
     * @return path of the written file
     */
    public Path generateDhParameters(int bits) {
        String fileName = DH_FILE_PREFIX + bits + DH_FILE_SUFFIX;
        if (Files.exists(store.getDirectory().resolve(fileName))) {
            throw PkiException.identityAlreadyExists(fileName);
        }
        byte[] pem = dhParameterGenerator.generate(bits);
        Path path = store.writeNew(fileName, pem);
        logger.info("Wrote {}-bit DH parameters to {}", bits, path);
        return path;
    }
}
