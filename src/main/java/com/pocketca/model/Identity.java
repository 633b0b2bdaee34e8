package com.pocketca.model;

import org.bouncycastle.asn1.x500.X500Name;

import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.cert.X509Certificate;

/**
 * A named private key and the certificate issued for it.
 */
public final class Identity {
    private final String name;
    private final PrivateKey privateKey;
    private final X509Certificate certificate;

    public Identity(String name, PrivateKey privateKey, X509Certificate certificate) {
        this.name = name;
        this.privateKey = privateKey;
        this.certificate = certificate;
    }

    public String getName() {
        return name;
    }

    public PrivateKey getPrivateKey() {
        return privateKey;
    }

    public X509Certificate getCertificate() {
        return certificate;
    }

    public PublicKey getPublicKey() {
        return certificate.getPublicKey();
    }

    /**
     * Subject name with its original encoding preserved, for name chaining.
     */
    public X500Name getSubject() {
        return X500Name.getInstance(certificate.getSubjectX500Principal().getEncoded());
    }

    @Override
    public String toString() {
        return "Identity{name='" + name + "', subject=" + certificate.getSubjectX500Principal().getName() + '}';
    }
}
