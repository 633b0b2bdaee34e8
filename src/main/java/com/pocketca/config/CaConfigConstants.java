package com.pocketca.config;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Certificate authority configuration constants and defaults
 */
public final class CaConfigConstants {
    
    private CaConfigConstants() {
        // Utility class
    }
    
    // Default values
    public static final String DEFAULT_STORE_DIRECTORY = ".";
    public static final int DEFAULT_VALIDITY_DAYS = 3650;
    public static final int DEFAULT_RSA_KEY_SIZE = 2048;
    public static final int DEFAULT_MIN_RSA_KEY_SIZE = 2048;
    public static final String DEFAULT_ORGANIZATION = "Home";
    public static final String DEFAULT_SIGNING_AUTHORITY = "root";
    public static final int DEFAULT_CRL_VALIDITY_DAYS = 365;
    public static final int DEFAULT_MAX_SAN_ENTRIES = 8;
    public static final int DEFAULT_MAX_FIELD_LENGTH = 128;
    public static final int DEFAULT_DH_BITS = 2048;
    
    // Validation limits
    public static final int MIN_VALIDITY_DAYS = 1;
    public static final int MAX_VALIDITY_DAYS = 36500;
    public static final int ABSOLUTE_MIN_RSA_KEY_SIZE = 512;
    public static final int MAX_RSA_KEY_SIZE = 16384;
    public static final int MAX_SAN_ENTRIES_LIMIT = 64;
    
    // Environment variable names
    public static final String ENV_STORE_DIRECTORY = "POCKETCA_STORE_DIR";
    public static final String ENV_VALIDITY_DAYS = "POCKETCA_VALIDITY_DAYS";
    public static final String ENV_RSA_KEY_SIZE = "POCKETCA_RSA_KEY_SIZE";
    public static final String ENV_MIN_RSA_KEY_SIZE = "POCKETCA_MIN_RSA_KEY_SIZE";
    public static final String ENV_ORGANIZATION = "POCKETCA_ORGANIZATION";
    public static final String ENV_SIGNING_AUTHORITY = "POCKETCA_SIGNING_AUTHORITY";
    public static final String ENV_CRL_VALIDITY_DAYS = "POCKETCA_CRL_VALIDITY_DAYS";
    public static final String ENV_MAX_SAN_ENTRIES = "POCKETCA_MAX_SAN_ENTRIES";
    public static final String ENV_MAX_FIELD_LENGTH = "POCKETCA_MAX_FIELD_LENGTH";
    public static final String ENV_DH_BITS = "POCKETCA_DH_BITS";
    
    /**
     * Environment variable to config field mapping
     */
    public static final Map<String, String> ENV_VAR_MAPPING;
    
    static {
        Map<String, String> map = new HashMap<>();
        map.put(ENV_STORE_DIRECTORY, "storeDirectory");
        map.put(ENV_VALIDITY_DAYS, "defaultValidityDays");
        map.put(ENV_RSA_KEY_SIZE, "defaultRsaKeySize");
        map.put(ENV_MIN_RSA_KEY_SIZE, "minRsaKeySize");
        map.put(ENV_ORGANIZATION, "defaultOrganization");
        map.put(ENV_SIGNING_AUTHORITY, "defaultSigningAuthority");
        map.put(ENV_CRL_VALIDITY_DAYS, "crlValidityDays");
        map.put(ENV_MAX_SAN_ENTRIES, "maxSanEntries");
        map.put(ENV_MAX_FIELD_LENGTH, "maxFieldLength");
        map.put(ENV_DH_BITS, "defaultDhBits");
        ENV_VAR_MAPPING = Collections.unmodifiableMap(map);
    }
}
