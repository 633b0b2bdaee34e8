package com.pocketca.crypto;

import com.pocketca.exception.PkiException;
import com.pocketca.exception.ValidationException;
import org.bouncycastle.asn1.pkcs.DHParameter;
import org.bouncycastle.crypto.generators.DHParametersGenerator;
import org.bouncycastle.crypto.params.DHParameters;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;

/**
 * Generates Diffie-Hellman group parameters for TLS servers.
 *
 * <p>The prime is a safe prime ({@code p = 2q + 1} with {@code q} prime) of
 * exactly the requested size. Large sizes take minutes.
 */
public class DhParameterGenerator {

    private static final Logger logger = LoggerFactory.getLogger(DhParameterGenerator.class);

    static final String PEM_TYPE = "DH PARAMETERS";
    public static final int MIN_BITS = 512;
    public static final int MAX_BITS = 8192;
    static final int PRIME_CERTAINTY = 80;

    private final SecureRandom random;

    public DhParameterGenerator() {
        this(new SecureRandom());
    }

    public DhParameterGenerator(SecureRandom random) {
        this.random = random;
    }

    /**
     * Generate a DH group and encode it as a PKCS#3 "DH PARAMETERS" PEM block.
     *
     * @param bits prime size
     * @return ASCII PEM bytes
     * @throws ValidationException if the size is outside {@link #MIN_BITS}..{@link #MAX_BITS}
     */
    public byte[] generate(int bits) {
        if (bits < MIN_BITS || bits > MAX_BITS) {
            throw new ValidationException("DH parameter size must be between " + MIN_BITS
                + " and " + MAX_BITS + " bits, got " + bits, "bits");
        }

        long start = System.nanoTime();
        DHParametersGenerator generator = new DHParametersGenerator();
        generator.init(bits, PRIME_CERTAINTY, random);
        DHParameters parameters;
        try {
            parameters = generator.generateParameters();
        } catch (RuntimeException e) {
            throw PkiException.cryptoFailure("DH parameter generation failed", e);
        }
        logger.debug("Generated {}-bit DH parameters in {} ms", bits, (System.nanoTime() - start) / 1_000_000);

        DHParameter asn1 = new DHParameter(parameters.getP(), parameters.getG(), parameters.getL());
        try {
            StringWriter out = new StringWriter();
            try (PemWriter writer = new PemWriter(out)) {
                writer.writeObject(new PemObject(PEM_TYPE, asn1.getEncoded()));
            }
            return out.toString().getBytes(StandardCharsets.US_ASCII);
        } catch (IOException e) {
            throw PkiException.cryptoFailure("Failed to encode DH parameters", e);
        }
    }
}
