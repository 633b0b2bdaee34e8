package com.pocketca.model;

import org.bouncycastle.asn1.x509.GeneralName;

import java.util.Objects;

/**
 * One subject alternative name entry: a DNS name or an email address.
 */
public final class SubjectAltName {

    public enum Type {
        DNS("DNS", GeneralName.dNSName),
        EMAIL("email", GeneralName.rfc822Name);

        private final String prefix;
        private final int tag;

        Type(String prefix, int tag) {
            this.prefix = prefix;
            this.tag = tag;
        }

        public String getPrefix() {
            return prefix;
        }

        public int getTag() {
            return tag;
        }
    }

    private final Type type;
    private final String value;

    private SubjectAltName(Type type, String value) {
        this.type = Objects.requireNonNull(type, "type");
        this.value = Objects.requireNonNull(value, "value");
    }

    public static SubjectAltName dns(String name) {
        return new SubjectAltName(Type.DNS, name);
    }

    public static SubjectAltName email(String address) {
        return new SubjectAltName(Type.EMAIL, address);
    }

    public Type getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    /**
     * Rendered form, e.g. {@code DNS:example.com} or {@code email:me@example.com}.
     */
    public String render() {
        return type.getPrefix() + ":" + value;
    }

    public GeneralName toGeneralName() {
        return new GeneralName(type.getTag(), value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SubjectAltName that = (SubjectAltName) o;
        return type == that.type && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return render();
    }
}
