package com.pocketca.crl;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Objects;

/**
 * One revoked certificate as listed in a CRL.
 */
public final class RevokedEntry implements Comparable<RevokedEntry> {
    private final BigInteger serialNumber;
    private final Instant revocationDate;
    private final RevocationReason reason;

    public RevokedEntry(BigInteger serialNumber, Instant revocationDate, RevocationReason reason) {
        this.serialNumber = Objects.requireNonNull(serialNumber, "serialNumber");
        this.revocationDate = Objects.requireNonNull(revocationDate, "revocationDate");
        this.reason = reason != null ? reason : RevocationReason.UNSPECIFIED;
    }

    public BigInteger getSerialNumber() {
        return serialNumber;
    }

    public Instant getRevocationDate() {
        return revocationDate;
    }

    public RevocationReason getReason() {
        return reason;
    }

    @Override
    public int compareTo(RevokedEntry other) {
        return serialNumber.compareTo(other.serialNumber);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RevokedEntry that = (RevokedEntry) o;
        return serialNumber.equals(that.serialNumber) &&
               revocationDate.equals(that.revocationDate) &&
               reason == that.reason;
    }

    @Override
    public int hashCode() {
        return Objects.hash(serialNumber, revocationDate, reason);
    }

    @Override
    public String toString() {
        return "RevokedEntry{serial=" + serialNumber.toString(16) +
               ", revocationDate=" + revocationDate +
               ", reason=" + reason + '}';
    }
}
