package com.pocketca.exception;

/**
 * Validation exception for rejected request input
 */
public class ValidationException extends PkiException {
    private final String field;

    public ValidationException(String message) {
        this(message, "VALIDATION_ERROR", null);
    }

    public ValidationException(String message, String field) {
        this(message, "VALIDATION_ERROR", field);
    }

    public ValidationException(String message, String code, String field) {
        super(message, code);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
