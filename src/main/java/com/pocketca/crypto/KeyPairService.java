package com.pocketca.crypto;

import com.pocketca.config.CaConfigConstants;
import com.pocketca.exception.PkiException;
import com.pocketca.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.InvalidAlgorithmParameterException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.RSAKeyGenParameterSpec;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Generates RSA and named-curve EC key pairs.
 *
 * <p>RSA keys come from the platform provider, EC keys from Bouncy Castle, which
 * knows the OpenSSL curve names such as {@code prime256v1}. Generation holds no
 * shared state, so one instance may be used from several threads.
 */
public class KeyPairService {

    private static final Logger logger = LoggerFactory.getLogger(KeyPairService.class);

    private final int minRsaKeySize;
    private final SecureRandom random;

    public KeyPairService() {
        this(CaConfigConstants.DEFAULT_MIN_RSA_KEY_SIZE);
    }

    public KeyPairService(int minRsaKeySize) {
        this(minRsaKeySize, new SecureRandom());
    }

    public KeyPairService(int minRsaKeySize, SecureRandom random) {
        this.minRsaKeySize = minRsaKeySize;
        this.random = random;
    }

    public int getMinRsaKeySize() {
        return minRsaKeySize;
    }

    /**
     * Generate a key pair.
     *
     * @param spec requested key type
     * @return generated KeyPair
     * @throws ValidationException if the RSA size is below the configured minimum
     * @throws PkiException with {@code UNKNOWN_CURVE} if the curve is not recognized
     */
    public KeyPair generate(KeySpec spec) {
        return generate(spec, KeyGenerationListener.NONE);
    }

    /**
     * Generate a key pair, reporting progress to a listener.
     *
     * @param spec requested key type
     * @param listener progress observer, advisory only
     * @return generated KeyPair
     */
    public KeyPair generate(KeySpec spec, KeyGenerationListener listener) {
        KeyGenerationListener observer = listener != null ? listener : KeyGenerationListener.NONE;
        notifyStarted(observer, spec);
        long start = System.nanoTime();

        KeyPair keyPair = spec.isEc() ? generateEc(spec.getCurveName()) : generateRsa(spec.getRsaBits());

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        logger.debug("Generated {} in {}ms", spec, elapsed.toMillis());
        notifyCompleted(observer, spec, elapsed);
        return keyPair;
    }

    /**
     * Generate a key pair on a worker pool. Large RSA sizes take seconds, so
     * callers serving many requests should not block on them.
     *
     * @param spec requested key type
     * @param executor pool running the generation
     * @param listener progress observer, advisory only
     * @return future completed with the key pair, or exceptionally with the generation error
     */
    public CompletableFuture<KeyPair> generateAsync(KeySpec spec, Executor executor, KeyGenerationListener listener) {
        return CompletableFuture.supplyAsync(() -> generate(spec, listener), executor);
    }

    private KeyPair generateRsa(int keySize) {
        if (keySize < minRsaKeySize) {
            throw new ValidationException(
                "RSA key size must be at least " + minRsaKeySize + " bits, got " + keySize, "rsa");
        }

        try {
            KeyPairGenerator keyGen = KeyPairGenerator.getInstance(CryptoConstants.RSA_ALGORITHM);
            keyGen.initialize(new RSAKeyGenParameterSpec(keySize, RSAKeyGenParameterSpec.F4), random);
            return keyGen.generateKeyPair();
        } catch (NoSuchAlgorithmException | InvalidAlgorithmParameterException e) {
            throw PkiException.cryptoFailure("Failed to generate RSA-" + keySize + " key: " + e.getMessage(), e);
        }
    }

    private KeyPair generateEc(String curveName) {
        KeyPairGenerator keyGen;
        try {
            keyGen = KeyPairGenerator.getInstance(CryptoConstants.EC_ALGORITHM, CryptoConstants.PROVIDER);
        } catch (NoSuchAlgorithmException e) {
            throw PkiException.cryptoFailure("EC key generation unavailable: " + e.getMessage(), e);
        }

        try {
            keyGen.initialize(new ECGenParameterSpec(curveName), random);
        } catch (InvalidAlgorithmParameterException | IllegalArgumentException e) {
            throw PkiException.unknownCurve(curveName, e);
        }
        return keyGen.generateKeyPair();
    }

    private void notifyStarted(KeyGenerationListener listener, KeySpec spec) {
        try {
            listener.onStarted(spec);
        } catch (RuntimeException e) {
            logger.warn("Key generation listener failed on start: {}", e.getMessage());
        }
    }

    private void notifyCompleted(KeyGenerationListener listener, KeySpec spec, Duration elapsed) {
        try {
            listener.onCompleted(spec, elapsed);
        } catch (RuntimeException e) {
            logger.warn("Key generation listener failed on completion: {}", e.getMessage());
        }
    }
}
