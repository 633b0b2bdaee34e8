package com.pocketca.exception;

/**
 * Error codes for certificate and CRL operations.
 */
public enum PkiErrorCode {
    IDENTITY_ALREADY_EXISTS("PKI01", "Identity already exists"),
    IDENTITY_NOT_FOUND("PKI02", "Identity not found"),
    SIGNING_AUTHORITY_NOT_FOUND("PKI03", "Signing authority not found"),
    INVALID_SIGNING_AUTHORITY("PKI04", "Signing authority certificate and private key do not match"),
    UNKNOWN_PROFILE("PKI05", "Unknown profile"),
    UNSUPPORTED_KEY_FOR_PROFILE("PKI06", "Key type not supported for this profile"),
    SAN_NOT_PERMITTED("PKI07", "Subject alternative names are not permitted for this profile"),
    UNKNOWN_CURVE("PKI08", "Unknown elliptic curve"),
    CA_KEY_NOT_FOUND("PKI09", "CA private key not found"),
    MALFORMED_CRL("PKI10", "Existing CRL cannot be parsed"),
    FILESYSTEM_UNAVAILABLE("PKI11", "Filesystem unavailable"),
    CRYPTO_FAILURE("PKI12", "Cryptographic operation failed");

    private final String code;
    private final String defaultMessage;

    PkiErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
