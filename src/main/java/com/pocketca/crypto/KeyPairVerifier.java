package com.pocketca.crypto;

import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.Signature;

/**
 * Checks that a private key belongs to a public key.
 */
public final class KeyPairVerifier {

    private static final SecureRandom RANDOM = new SecureRandom();

    private KeyPairVerifier() {
        // Utility class
    }

    /**
     * Sign a random challenge with the private key and verify it with the public key.
     *
     * @return true if the keys form a pair
     */
    public static boolean matches(PrivateKey privateKey, PublicKey publicKey) {
        if (privateKey == null || publicKey == null
                || !sameFamily(privateKey.getAlgorithm(), publicKey.getAlgorithm())) {
            return false;
        }

        try {
            byte[] testData = new byte[32];
            RANDOM.nextBytes(testData);

            String algorithm = CryptoConstants.signatureAlgorithmFor(privateKey);
            Signature signature = Signature.getInstance(algorithm, CryptoConstants.PROVIDER);
            signature.initSign(privateKey);
            signature.update(testData);
            byte[] sig = signature.sign();

            signature.initVerify(publicKey);
            signature.update(testData);
            return signature.verify(sig);
        } catch (GeneralSecurityException e) {
            return false;
        }
    }

    private static boolean sameFamily(String a, String b) {
        return CryptoConstants.signatureAlgorithmFor(a).equals(CryptoConstants.signatureAlgorithmFor(b));
    }
}
