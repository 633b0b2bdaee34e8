package com.pocketca.crypto;

import org.bouncycastle.jce.provider.BouncyCastleProvider;

import java.security.Key;
import java.security.Provider;

/**
 * Algorithm names and the provider shared by the crypto classes.
 */
public final class CryptoConstants {

    private CryptoConstants() {
        // Utility class
    }

    /** Bouncy Castle instance, used without registering it globally */
    public static final Provider PROVIDER = new BouncyCastleProvider();

    public static final String RSA_ALGORITHM = "RSA";
    public static final String EC_ALGORITHM = "EC";
    public static final String RSA_SIGNATURE_ALGORITHM = "SHA256withRSA";
    public static final String EC_SIGNATURE_ALGORITHM = "SHA256withECDSA";

    /** Serial numbers are 16 bytes, the first two being {@link #SERIAL_TAG} */
    public static final int SERIAL_LENGTH = 16;
    public static final byte[] SERIAL_TAG = {(byte) 0x2c, (byte) 0xca};
    public static final int SERIAL_TAG_VALUE = 0x2cca;

    /**
     * SHA-256 signature algorithm matching the key type.
     *
     * @param key signing or verification key
     * @return JCA signature algorithm name
     */
    public static String signatureAlgorithmFor(Key key) {
        return signatureAlgorithmFor(key.getAlgorithm());
    }

    /**
     * SHA-256 signature algorithm for a key algorithm name such as {@code RSA} or {@code EC}.
     */
    public static String signatureAlgorithmFor(String keyAlgorithm) {
        if (EC_ALGORITHM.equals(keyAlgorithm) || "ECDSA".equals(keyAlgorithm)) {
            return EC_SIGNATURE_ALGORITHM;
        }
        return RSA_SIGNATURE_ALGORITHM;
    }
}
