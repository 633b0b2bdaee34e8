package com.pocketca.crypto;

import java.util.Objects;

/**
 * Requested key type: RSA with a modulus size, or EC on a named curve.
 */
public final class KeySpec {

    public enum Algorithm {
        RSA,
        EC
    }

    private final Algorithm algorithm;
    private final int rsaBits;
    private final String curveName;

    private KeySpec(Algorithm algorithm, int rsaBits, String curveName) {
        this.algorithm = algorithm;
        this.rsaBits = rsaBits;
        this.curveName = curveName;
    }

    public static KeySpec rsa(int bits) {
        return new KeySpec(Algorithm.RSA, bits, null);
    }

    public static KeySpec ec(String curveName) {
        return new KeySpec(Algorithm.EC, 0, Objects.requireNonNull(curveName, "curveName"));
    }

    public Algorithm getAlgorithm() {
        return algorithm;
    }

    public int getRsaBits() {
        return rsaBits;
    }

    public String getCurveName() {
        return curveName;
    }

    public boolean isEc() {
        return algorithm == Algorithm.EC;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        KeySpec that = (KeySpec) o;
        return rsaBits == that.rsaBits && algorithm == that.algorithm && Objects.equals(curveName, that.curveName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(algorithm, rsaBits, curveName);
    }

    @Override
    public String toString() {
        return isEc() ? "EC key [" + curveName + "]" : "RSA-" + rsaBits + " key";
    }
}
