package com.pocketca.model;

import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.ASN1String;
import org.bouncycastle.asn1.x500.RDN;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.X500NameBuilder;
import org.bouncycastle.asn1.x500.style.BCStyle;

import java.util.Objects;

/**
 * Subject or issuer name of a certificate.
 *
 * <p>Only the common name is mandatory. Instances are immutable; the
 * {@code with*} methods return modified copies.
 */
public class DistinguishedName {
    private final String organization;
    private final String organizationalUnit;
    private final String commonName;
    private final String country;
    private final String locality;
    private final String state;

    private DistinguishedName(Builder builder) {
        this.organization = builder.organization;
        this.organizationalUnit = builder.organizationalUnit;
        this.commonName = builder.commonName;
        this.country = builder.country;
        this.locality = builder.locality;
        this.state = builder.state;
    }

    public String getOrganization() { return organization; }
    public String getOrganizationalUnit() { return organizationalUnit; }
    public String getCommonName() { return commonName; }
    public String getCountry() { return country; }
    public String getLocality() { return locality; }
    public String getState() { return state; }

    public DistinguishedName withOrganization(String organization) {
        return toBuilder().organization(organization).build();
    }

    public DistinguishedName withOrganizationalUnit(String organizationalUnit) {
        return toBuilder().organizationalUnit(organizationalUnit).build();
    }

    /**
     * Encode as an X.500 name. RDNs are emitted in the order C, O, CN, OU, L, ST;
     * absent fields are skipped.
     */
    public X500Name toX500Name() {
        X500NameBuilder builder = new X500NameBuilder(BCStyle.INSTANCE);
        addIfPresent(builder, BCStyle.C, country);
        addIfPresent(builder, BCStyle.O, organization);
        addIfPresent(builder, BCStyle.CN, commonName);
        addIfPresent(builder, BCStyle.OU, organizationalUnit);
        addIfPresent(builder, BCStyle.L, locality);
        addIfPresent(builder, BCStyle.ST, state);
        return builder.build();
    }

    /**
     * Get the first value of an attribute in an X.500 name, or null when absent.
     */
    public static String firstValue(X500Name name, ASN1ObjectIdentifier attribute) {
        RDN[] rdns = name.getRDNs(attribute);
        if (rdns != null && rdns.length > 0) {
            ASN1Encodable value = rdns[0].getFirst().getValue();
            if (value instanceof ASN1String) {
                return ((ASN1String) value).getString();
            }
            return value.toString();
        }
        return null;
    }

    private static void addIfPresent(X500NameBuilder builder, ASN1ObjectIdentifier attribute, String value) {
        if (value != null && !value.isEmpty()) {
            builder.addRDN(attribute, value);
        }
    }

    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() {
        return new Builder()
            .organization(organization)
            .organizationalUnit(organizationalUnit)
            .commonName(commonName)
            .country(country)
            .locality(locality)
            .state(state);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DistinguishedName that = (DistinguishedName) o;
        return Objects.equals(organization, that.organization) &&
               Objects.equals(organizationalUnit, that.organizationalUnit) &&
               Objects.equals(commonName, that.commonName) &&
               Objects.equals(country, that.country) &&
               Objects.equals(locality, that.locality) &&
               Objects.equals(state, that.state);
    }

    @Override
    public int hashCode() {
        return Objects.hash(organization, organizationalUnit, commonName, country, locality, state);
    }

    @Override
    public String toString() {
        return toX500Name().toString();
    }

    public static class Builder {
        private String organization;
        private String organizationalUnit;
        private String commonName;
        private String country;
        private String locality;
        private String state;

        public Builder organization(String organization) {
            this.organization = organization;
            return this;
        }

        public Builder organizationalUnit(String organizationalUnit) {
            this.organizationalUnit = organizationalUnit;
            return this;
        }

        public Builder commonName(String commonName) {
            this.commonName = commonName;
            return this;
        }

        public Builder country(String country) {
            this.country = country;
            return this;
        }

        public Builder locality(String locality) {
            this.locality = locality;
            return this;
        }

        public Builder state(String state) {
            this.state = state;
            return this;
        }

        public DistinguishedName build() {
            return new DistinguishedName(this);
        }
    }
}
