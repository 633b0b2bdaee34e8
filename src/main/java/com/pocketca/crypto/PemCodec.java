package com.pocketca.crypto;

import com.pocketca.exception.PkiException;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.cert.X509CRLHolder;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CRLConverter;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.security.PrivateKey;
import java.security.cert.CRLException;
import java.security.cert.CertificateException;
import java.security.cert.X509CRL;
import java.security.cert.X509Certificate;

/**
 * PEM encoding and decoding of certificates, private keys and CRLs.
 *
 * <p>Private keys are written in the traditional OpenSSL layouts: PKCS#1
 * ({@code RSA PRIVATE KEY}) for RSA and SEC1 ({@code EC PRIVATE KEY}) for EC.
 * Both those layouts and PKCS#8 ({@code PRIVATE KEY}) are accepted on read.
 */
public class PemCodec {

    private final JcaX509CertificateConverter certificateConverter =
        new JcaX509CertificateConverter().setProvider(CryptoConstants.PROVIDER);
    private final JcaX509CRLConverter crlConverter =
        new JcaX509CRLConverter().setProvider(CryptoConstants.PROVIDER);
    private final JcaPEMKeyConverter keyConverter =
        new JcaPEMKeyConverter().setProvider(CryptoConstants.PROVIDER);

    /**
     * Encode a certificate, private key or CRL as PEM.
     *
     * @param object a {@link X509Certificate}, {@link PrivateKey} or {@link X509CRL}
     * @return PEM bytes (ASCII)
     */
    public byte[] encode(Object object) {
        StringWriter out = new StringWriter();
        try (JcaPEMWriter writer = new JcaPEMWriter(out)) {
            writer.writeObject(object);
        } catch (IOException e) {
            throw PkiException.cryptoFailure("Failed to PEM-encode " + object.getClass().getSimpleName(), e);
        }
        return out.toString().getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * Decode the first certificate in PEM content.
     *
     * @throws IOException if the content is not a PEM certificate
     */
    public X509Certificate decodeCertificate(byte[] pem) throws IOException {
        Object obj = readFirst(pem);
        if (!(obj instanceof X509CertificateHolder)) {
            throw new IOException("Content is not a PEM certificate");
        }
        try {
            return certificateConverter.getCertificate((X509CertificateHolder) obj);
        } catch (CertificateException e) {
            throw new IOException("Invalid certificate: " + e.getMessage(), e);
        }
    }

    /**
     * Decode the first private key in PEM content.
     *
     * @throws IOException if the content is not an unencrypted PEM private key
     */
    public PrivateKey decodePrivateKey(byte[] pem) throws IOException {
        Object obj = readFirst(pem);
        if (obj instanceof PEMKeyPair) {
            return keyConverter.getKeyPair((PEMKeyPair) obj).getPrivate();
        }
        if (obj instanceof PrivateKeyInfo) {
            return keyConverter.getPrivateKey((PrivateKeyInfo) obj);
        }
        throw new IOException("Content is not an unencrypted PEM private key");
    }

    /**
     * Decode the first CRL in PEM content, keeping the Bouncy Castle holder so
     * extensions can be read directly.
     *
     * @throws IOException if the content is not a PEM CRL
     */
    public X509CRLHolder decodeCrlHolder(byte[] pem) throws IOException {
        Object obj = readFirst(pem);
        if (!(obj instanceof X509CRLHolder)) {
            throw new IOException("Content is not a PEM CRL");
        }
        return (X509CRLHolder) obj;
    }

    public X509CRL decodeCrl(byte[] pem) throws IOException {
        return toCrl(decodeCrlHolder(pem));
    }

    public X509CRL toCrl(X509CRLHolder holder) throws IOException {
        try {
            return crlConverter.getCRL(holder);
        } catch (CRLException e) {
            throw new IOException("Invalid CRL: " + e.getMessage(), e);
        }
    }

    private Object readFirst(byte[] pem) throws IOException {
        try (PEMParser parser = new PEMParser(new StringReader(new String(pem, StandardCharsets.US_ASCII)))) {
            Object obj = parser.readObject();
            if (obj == null) {
                throw new IOException("No PEM object found");
            }
            return obj;
        } catch (RuntimeException e) {
            // PEMParser reports malformed base64 and ASN.1 as unchecked exceptions
            throw new IOException("Malformed PEM content: " + e.getMessage(), e);
        }
    }
}
