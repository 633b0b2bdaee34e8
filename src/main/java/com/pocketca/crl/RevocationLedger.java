package com.pocketca.crl;

import com.pocketca.crypto.CryptoConstants;
import com.pocketca.crypto.PemCodec;
import com.pocketca.exception.PkiException;
import com.pocketca.model.Identity;
import com.pocketca.store.IdentityStore;
import org.bouncycastle.asn1.x509.CRLNumber;
import org.bouncycastle.asn1.x509.CRLReason;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.cert.CertException;
import org.bouncycastle.cert.X509CRLEntryHolder;
import org.bouncycastle.cert.X509CRLHolder;
import org.bouncycastle.cert.X509v2CRLBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CRLHolder;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.ContentVerifierProvider;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.bouncycastle.operator.jcajce.JcaContentVerifierProviderBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigInteger;
import java.security.cert.CRLException;
import java.security.cert.X509CRL;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Optional;

/**
 * Maintains one X.509 v2 CRL per signing authority.
 *
 * <p>Every revocation re-reads the current CRL, appends the new entry,
 * increments the cRLNumber by one and re-signs the whole list. The new CRL
 * is fully built and signed before the file on disk is replaced.</p>
 */
public class RevocationLedger {

    private static final Logger logger = LoggerFactory.getLogger(RevocationLedger.class);

    private final IdentityStore store;
    private final PemCodec pemCodec;
    private final int crlValidityDays;
    private final Clock clock;

    public RevocationLedger(IdentityStore store, int crlValidityDays, Clock clock) {
        this(store, new PemCodec(), crlValidityDays, clock);
    }

    public RevocationLedger(IdentityStore store, PemCodec pemCodec, int crlValidityDays, Clock clock) {
        this.store = store;
        this.pemCodec = pemCodec;
        this.crlValidityDays = crlValidityDays;
        this.clock = clock;
    }

    /**
     * Revoke the certificate stored under {@code targetName}.
     */
    public X509CRL revokeIdentity(String authority, String targetName) {
        X509Certificate target = store.loadCertificate(targetName);
        return revoke(authority, target.getSerialNumber(), RevocationReason.UNSPECIFIED);
    }

    public X509CRL revoke(String authority, BigInteger serial) {
        return revoke(authority, serial, RevocationReason.UNSPECIFIED);
    }

    /**
     * Add {@code serial} to the CRL of {@code authority} and publish the result.
     *
     * @return the newly signed CRL
     * @throws PkiException SIGNING_AUTHORITY_NOT_FOUND, CA_KEY_NOT_FOUND or MALFORMED_CRL
     */
    public X509CRL revoke(String authority, BigInteger serial, RevocationReason reason) {
        Identity ca = store.loadAuthority(authority);
        Optional<X509CRLHolder> existing = store.loadCrl(authority);

        BigInteger number = BigInteger.ONE;
        List<RevokedEntry> entries = new ArrayList<>();
        if (existing.isPresent()) {
            X509CRLHolder current = existing.get();
            verifySignature(authority, ca, current);
            number = crlNumber(authority, current).add(BigInteger.ONE);
            entries.addAll(readEntries(current));
        }

        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        entries.add(new RevokedEntry(serial, now, reason));
        Collections.sort(entries);

        X509CRL crl = sign(ca, number, now, entries);
        store.saveCrl(authority, crl);

        logger.info("Revoked serial {} under '{}' (CRL number {}, {} entries)",
            serial.toString(16), authority, number, entries.size());
        return crl;
    }

    /**
     * Entries of the CRL published by {@code authority}, in serial order.
     * Empty when no CRL has been published yet.
     */
    public List<RevokedEntry> list(String authority) {
        Optional<X509CRLHolder> existing = store.loadCrl(authority);
        if (!existing.isPresent()) {
            return Collections.emptyList();
        }
        List<RevokedEntry> entries = readEntries(existing.get());
        Collections.sort(entries);
        return entries;
    }

    /**
     * Read the cRLNumber extension of a CRL, or null if it has none.
     */
    public static BigInteger crlNumber(X509CRL crl) {
        try {
            Extension extension = new JcaX509CRLHolder(crl).getExtension(Extension.cRLNumber);
            return extension != null ? CRLNumber.getInstance(extension.getParsedValue()).getCRLNumber() : null;
        } catch (CRLException e) {
            throw PkiException.cryptoFailure("Cannot read cRLNumber", e);
        }
    }

    private BigInteger crlNumber(String authority, X509CRLHolder holder) {
        Extension extension = holder.getExtension(Extension.cRLNumber);
        if (extension == null) {
            throw PkiException.malformedCrl(authority, null);
        }
        try {
            return CRLNumber.getInstance(extension.getParsedValue()).getCRLNumber();
        } catch (IllegalArgumentException e) {
            throw PkiException.malformedCrl(authority, e);
        }
    }

    private void verifySignature(String authority, Identity ca, X509CRLHolder holder) {
        try {
            ContentVerifierProvider verifier = new JcaContentVerifierProviderBuilder()
                .setProvider(CryptoConstants.PROVIDER)
                .build(ca.getPublicKey());
            if (!holder.isSignatureValid(verifier)) {
                throw PkiException.malformedCrl(authority, null);
            }
        } catch (OperatorCreationException | CertException e) {
            throw PkiException.malformedCrl(authority, e);
        }
    }

    private List<RevokedEntry> readEntries(X509CRLHolder holder) {
        List<RevokedEntry> entries = new ArrayList<>();
        @SuppressWarnings("unchecked")
        Collection<X509CRLEntryHolder> revoked = holder.getRevokedCertificates();
        for (X509CRLEntryHolder entry : revoked) {
            RevocationReason reason = RevocationReason.UNSPECIFIED;
            Extension reasonExt = entry.getExtension(Extension.reasonCode);
            if (reasonExt != null) {
                reason = RevocationReason.fromCode(
                    CRLReason.getInstance(reasonExt.getParsedValue()).getValue().intValue());
            }
            entries.add(new RevokedEntry(entry.getSerialNumber(), entry.getRevocationDate().toInstant(), reason));
        }
        return entries;
    }

    private X509CRL sign(Identity ca, BigInteger number, Instant now, List<RevokedEntry> entries) {
        try {
            X509v2CRLBuilder builder = new X509v2CRLBuilder(ca.getSubject(), Date.from(now));
            builder.setNextUpdate(Date.from(now.plus(Duration.ofDays(crlValidityDays))));
            for (RevokedEntry entry : entries) {
                // reason code 0 omits the reasonCode entry extension
                builder.addCRLEntry(entry.getSerialNumber(), Date.from(entry.getRevocationDate()),
                    entry.getReason().getCode());
            }
            builder.addExtension(Extension.cRLNumber, false, new CRLNumber(number));

            ContentSigner signer = new JcaContentSignerBuilder(CryptoConstants.signatureAlgorithmFor(ca.getPrivateKey()))
                .setProvider(CryptoConstants.PROVIDER)
                .build(ca.getPrivateKey());
            return pemCodec.toCrl(builder.build(signer));
        } catch (IOException | OperatorCreationException e) {
            throw PkiException.cryptoFailure("Failed to sign CRL for " + ca.getName(), e);
        }
    }
}
