package com.pocketca.exception;

/**
 * Base exception for all certificate authority operations.
 *
 * <p>Unchecked, like every error in this library. Each instance carries a
 * {@link PkiErrorCode} so callers can branch on the failure kind, and every
 * failure is terminal for the requested operation: nothing is retried.
 */
public class PkiException extends RuntimeException {
    private final PkiErrorCode errorCode;
    private final String code;

    public PkiException(String message) {
        this(message, (String) null, null);
    }

    public PkiException(String message, String code) {
        this(message, code, null);
    }

    public PkiException(String message, String code, Throwable cause) {
        super(message, cause);
        this.errorCode = null;
        this.code = code;
    }

    public PkiException(PkiErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public PkiException(PkiErrorCode errorCode, String message, Throwable cause) {
        super(message != null ? message : errorCode.getDefaultMessage(), cause);
        this.errorCode = errorCode;
        this.code = errorCode.getCode();
    }

    /**
     * Get the error kind, or null for codes outside {@link PkiErrorCode}
     */
    public PkiErrorCode getErrorCode() {
        return errorCode;
    }

    public String getCode() {
        return code;
    }

    public static PkiException identityAlreadyExists(String name) {
        return new PkiException(PkiErrorCode.IDENTITY_ALREADY_EXISTS,
            "Identity named " + name + " already exists in this directory");
    }

    public static PkiException identityNotFound(String name) {
        return new PkiException(PkiErrorCode.IDENTITY_NOT_FOUND, "Cannot find: " + name + ".crt");
    }

    public static PkiException signingAuthorityNotFound(String name) {
        return new PkiException(PkiErrorCode.SIGNING_AUTHORITY_NOT_FOUND,
            "Cannot find signing authority certificate: " + name + ".crt");
    }

    public static PkiException invalidSigningAuthority(String name) {
        return new PkiException(PkiErrorCode.INVALID_SIGNING_AUTHORITY,
            "Certificate and private key of " + name + " do not match");
    }

    public static PkiException unknownProfile(String profile) {
        return new PkiException(PkiErrorCode.UNKNOWN_PROFILE, "Unknown profile: " + profile);
    }

    public static PkiException unsupportedKeyForProfile(String profile) {
        return new PkiException(PkiErrorCode.UNSUPPORTED_KEY_FOR_PROFILE,
            "EC keys are only supported for clients, not for profile " + profile);
    }

    public static PkiException sanNotPermitted(String profile) {
        return new PkiException(PkiErrorCode.SAN_NOT_PERMITTED,
            "Subject alternative names are not permitted for profile " + profile);
    }

    public static PkiException unknownCurve(String curve, Throwable cause) {
        return new PkiException(PkiErrorCode.UNKNOWN_CURVE, "Unknown curve: [" + curve + "]", cause);
    }

    public static PkiException caKeyNotFound(String name, Throwable cause) {
        return new PkiException(PkiErrorCode.CA_KEY_NOT_FOUND, "Cannot load CA private key: " + name + ".key", cause);
    }

    public static PkiException malformedCrl(String name, Throwable cause) {
        String detail = cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : "";
        return new PkiException(PkiErrorCode.MALFORMED_CRL, "Cannot parse CRL " + name + ".crl" + detail, cause);
    }

    public static PkiException filesystemUnavailable(String target, Throwable cause) {
        String detail = cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : "";
        return new PkiException(PkiErrorCode.FILESYSTEM_UNAVAILABLE, "Cannot write " + target + detail, cause);
    }

    public static PkiException cryptoFailure(String message, Throwable cause) {
        return new PkiException(PkiErrorCode.CRYPTO_FAILURE, message, cause);
    }
}
