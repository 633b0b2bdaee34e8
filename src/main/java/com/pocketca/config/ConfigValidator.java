package com.pocketca.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Certificate authority configuration validator.
 * Collects every problem before reporting, so a bad file is fixed in one pass.
 */
public class ConfigValidator {
    
    /**
     * Validation error detail
     */
    public static class ValidationError {
        private final String field;
        private final String message;
        private final Object value;
        
        public ValidationError(String field, String message) {
            this(field, message, null);
        }
        
        public ValidationError(String field, String message, Object value) {
            this.field = field;
            this.message = message;
            this.value = value;
        }
        
        public String getField() { return field; }
        public String getMessage() { return message; }
        public Object getValue() { return value; }
        
        @Override
        public String toString() {
            return field + ": " + message;
        }
    }
    
    /**
     * Validation result
     */
    public static class ValidationResult {
        private final boolean valid;
        private final List<ValidationError> errors;
        
        public ValidationResult(boolean valid, List<ValidationError> errors) {
            this.valid = valid;
            this.errors = Collections.unmodifiableList(errors);
        }
        
        public boolean isValid() { return valid; }
        public List<ValidationError> getErrors() { return errors; }
    }
    
    /**
     * Validate the configuration
     * 
     * @param config the configuration to validate
     * @return the validation result
     */
    public ValidationResult validate(CaConfig config) {
        List<ValidationError> errors = new ArrayList<>();
        
        validateRequired(config, errors);
        validateKeySizes(config, errors);
        validateRanges(config, errors);
        
        return new ValidationResult(errors.isEmpty(), errors);
    }
    
    /**
     * Validate and throw exception if invalid
     * 
     * @param config the configuration to validate
     * @throws ConfigValidationException if validation fails
     */
    public void validateOrThrow(CaConfig config) {
        ValidationResult result = validate(config);
        if (!result.isValid()) {
            StringBuilder sb = new StringBuilder("Configuration validation failed: ");
            List<ValidationError> errors = result.getErrors();
            for (int i = 0; i < errors.size(); i++) {
                if (i > 0) sb.append("; ");
                sb.append(errors.get(i));
            }
            throw new ConfigValidationException(sb.toString(), errors.get(0).getField());
        }
    }
    
    private void validateRequired(CaConfig config, List<ValidationError> errors) {
        if (isNullOrEmpty(config.getStoreDirectory())) {
            errors.add(new ValidationError("storeDirectory", "storeDirectory is required"));
        }
        if (isNullOrEmpty(config.getDefaultOrganization())) {
            errors.add(new ValidationError("defaultOrganization", "defaultOrganization is required"));
        }
        if (isNullOrEmpty(config.getDefaultSigningAuthority())) {
            errors.add(new ValidationError("defaultSigningAuthority", "defaultSigningAuthority is required"));
        }
    }
    
    private void validateKeySizes(CaConfig config, List<ValidationError> errors) {
        int minRsa = config.getMinRsaKeySize();
        if (minRsa < CaConfigConstants.ABSOLUTE_MIN_RSA_KEY_SIZE) {
            errors.add(new ValidationError("minRsaKeySize",
                "minRsaKeySize must be at least " + CaConfigConstants.ABSOLUTE_MIN_RSA_KEY_SIZE + " bits", minRsa));
        }
        
        int rsa = config.getDefaultRsaKeySize();
        if (rsa < minRsa) {
            errors.add(new ValidationError("defaultRsaKeySize",
                "defaultRsaKeySize must not be below minRsaKeySize (" + minRsa + ")", rsa));
        } else if (rsa > CaConfigConstants.MAX_RSA_KEY_SIZE) {
            errors.add(new ValidationError("defaultRsaKeySize",
                "defaultRsaKeySize should not exceed " + CaConfigConstants.MAX_RSA_KEY_SIZE + " bits", rsa));
        }
        
        int dh = config.getDefaultDhBits();
        if (dh < CaConfigConstants.ABSOLUTE_MIN_RSA_KEY_SIZE) {
            errors.add(new ValidationError("defaultDhBits",
                "defaultDhBits must be at least " + CaConfigConstants.ABSOLUTE_MIN_RSA_KEY_SIZE + " bits", dh));
        }
    }
    
    private void validateRanges(CaConfig config, List<ValidationError> errors) {
        int days = config.getDefaultValidityDays();
        if (days < CaConfigConstants.MIN_VALIDITY_DAYS) {
            errors.add(new ValidationError("defaultValidityDays", "defaultValidityDays must be a positive number", days));
        } else if (days > CaConfigConstants.MAX_VALIDITY_DAYS) {
            errors.add(new ValidationError("defaultValidityDays",
                "defaultValidityDays should not exceed " + CaConfigConstants.MAX_VALIDITY_DAYS, days));
        }
        
        int crlDays = config.getCrlValidityDays();
        if (crlDays < CaConfigConstants.MIN_VALIDITY_DAYS) {
            errors.add(new ValidationError("crlValidityDays", "crlValidityDays must be a positive number", crlDays));
        }
        
        int san = config.getMaxSanEntries();
        if (san < 0) {
            errors.add(new ValidationError("maxSanEntries", "maxSanEntries must be a non-negative integer", san));
        } else if (san > CaConfigConstants.MAX_SAN_ENTRIES_LIMIT) {
            errors.add(new ValidationError("maxSanEntries",
                "maxSanEntries should not exceed " + CaConfigConstants.MAX_SAN_ENTRIES_LIMIT, san));
        }
        
        int fieldLength = config.getMaxFieldLength();
        if (fieldLength <= 0) {
            errors.add(new ValidationError("maxFieldLength", "maxFieldLength must be a positive number", fieldLength));
        }
    }
    
    private boolean isNullOrEmpty(String value) {
        return value == null || value.trim().isEmpty();
    }
}
