package com.pocketca.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Certificate authority configuration.
 * Holds the defaults applied to requests and the policy limits enforced on them.
 * Use the Builder pattern to construct instances.
 */
public class CaConfig {
    
    // Artifact location
    private final String storeDirectory;
    
    // Issuance defaults
    private final int defaultValidityDays;
    private final int defaultRsaKeySize;
    private final String defaultOrganization;
    private final String defaultSigningAuthority;
    private final int defaultDhBits;
    
    // Policy limits
    private final int minRsaKeySize;
    private final int maxSanEntries;
    private final int maxFieldLength;
    
    // Revocation
    private final int crlValidityDays;
    
    private CaConfig(Builder builder) {
        this.storeDirectory = builder.storeDirectory;
        this.defaultValidityDays = builder.defaultValidityDays;
        this.defaultRsaKeySize = builder.defaultRsaKeySize;
        this.defaultOrganization = builder.defaultOrganization;
        this.defaultSigningAuthority = builder.defaultSigningAuthority;
        this.defaultDhBits = builder.defaultDhBits;
        this.minRsaKeySize = builder.minRsaKeySize;
        this.maxSanEntries = builder.maxSanEntries;
        this.maxFieldLength = builder.maxFieldLength;
        this.crlValidityDays = builder.crlValidityDays;
    }
    
    /**
     * Default configuration: current directory, RSA-2048, ten-year certificates.
     */
    public static CaConfig defaults() {
        return builder().build();
    }
    
    // Getters
    
    public String getStoreDirectory() {
        return storeDirectory;
    }
    
    public Path getStorePath() {
        return Paths.get(storeDirectory);
    }
    
    public int getDefaultValidityDays() {
        return defaultValidityDays;
    }
    
    public int getDefaultRsaKeySize() {
        return defaultRsaKeySize;
    }
    
    public String getDefaultOrganization() {
        return defaultOrganization;
    }
    
    public String getDefaultSigningAuthority() {
        return defaultSigningAuthority;
    }
    
    public int getDefaultDhBits() {
        return defaultDhBits;
    }
    
    public int getMinRsaKeySize() {
        return minRsaKeySize;
    }
    
    public int getMaxSanEntries() {
        return maxSanEntries;
    }
    
    public int getMaxFieldLength() {
        return maxFieldLength;
    }
    
    public int getCrlValidityDays() {
        return crlValidityDays;
    }
    
    /**
     * Create a new Builder instance
     * 
     * @return a new Builder
     */
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * Create a Builder initialized with this config's values
     * 
     * @return a new Builder with current values
     */
    public Builder toBuilder() {
        return new Builder()
            .storeDirectory(this.storeDirectory)
            .defaultValidityDays(this.defaultValidityDays)
            .defaultRsaKeySize(this.defaultRsaKeySize)
            .defaultOrganization(this.defaultOrganization)
            .defaultSigningAuthority(this.defaultSigningAuthority)
            .defaultDhBits(this.defaultDhBits)
            .minRsaKeySize(this.minRsaKeySize)
            .maxSanEntries(this.maxSanEntries)
            .maxFieldLength(this.maxFieldLength)
            .crlValidityDays(this.crlValidityDays);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CaConfig that = (CaConfig) o;
        return defaultValidityDays == that.defaultValidityDays &&
               defaultRsaKeySize == that.defaultRsaKeySize &&
               defaultDhBits == that.defaultDhBits &&
               minRsaKeySize == that.minRsaKeySize &&
               maxSanEntries == that.maxSanEntries &&
               maxFieldLength == that.maxFieldLength &&
               crlValidityDays == that.crlValidityDays &&
               Objects.equals(storeDirectory, that.storeDirectory) &&
               Objects.equals(defaultOrganization, that.defaultOrganization) &&
               Objects.equals(defaultSigningAuthority, that.defaultSigningAuthority);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(storeDirectory, defaultValidityDays, defaultRsaKeySize,
            defaultOrganization, defaultSigningAuthority, defaultDhBits,
            minRsaKeySize, maxSanEntries, maxFieldLength, crlValidityDays);
    }
    
    @Override
    public String toString() {
        return "CaConfig{" +
               "storeDirectory='" + storeDirectory + '\'' +
               ", defaultValidityDays=" + defaultValidityDays +
               ", defaultRsaKeySize=" + defaultRsaKeySize +
               ", minRsaKeySize=" + minRsaKeySize +
               ", defaultOrganization='" + defaultOrganization + '\'' +
               ", defaultSigningAuthority='" + defaultSigningAuthority + '\'' +
               ", crlValidityDays=" + crlValidityDays +
               '}';
    }
    
    /**
     * Builder for CaConfig
     */
    public static class Builder {
        private String storeDirectory = CaConfigConstants.DEFAULT_STORE_DIRECTORY;
        private int defaultValidityDays = CaConfigConstants.DEFAULT_VALIDITY_DAYS;
        private int defaultRsaKeySize = CaConfigConstants.DEFAULT_RSA_KEY_SIZE;
        private String defaultOrganization = CaConfigConstants.DEFAULT_ORGANIZATION;
        private String defaultSigningAuthority = CaConfigConstants.DEFAULT_SIGNING_AUTHORITY;
        private int defaultDhBits = CaConfigConstants.DEFAULT_DH_BITS;
        private int minRsaKeySize = CaConfigConstants.DEFAULT_MIN_RSA_KEY_SIZE;
        private int maxSanEntries = CaConfigConstants.DEFAULT_MAX_SAN_ENTRIES;
        private int maxFieldLength = CaConfigConstants.DEFAULT_MAX_FIELD_LENGTH;
        private int crlValidityDays = CaConfigConstants.DEFAULT_CRL_VALIDITY_DAYS;
        
        public Builder storeDirectory(String storeDirectory) {
            this.storeDirectory = storeDirectory;
            return this;
        }
        
        public Builder defaultValidityDays(int defaultValidityDays) {
            this.defaultValidityDays = defaultValidityDays;
            return this;
        }
        
        public Builder defaultRsaKeySize(int defaultRsaKeySize) {
            this.defaultRsaKeySize = defaultRsaKeySize;
            return this;
        }
        
        public Builder defaultOrganization(String defaultOrganization) {
            this.defaultOrganization = defaultOrganization;
            return this;
        }
        
        public Builder defaultSigningAuthority(String defaultSigningAuthority) {
            this.defaultSigningAuthority = defaultSigningAuthority;
            return this;
        }
        
        public Builder defaultDhBits(int defaultDhBits) {
            this.defaultDhBits = defaultDhBits;
            return this;
        }
        
        public Builder minRsaKeySize(int minRsaKeySize) {
            this.minRsaKeySize = minRsaKeySize;
            return this;
        }
        
        public Builder maxSanEntries(int maxSanEntries) {
            this.maxSanEntries = maxSanEntries;
            return this;
        }
        
        public Builder maxFieldLength(int maxFieldLength) {
            this.maxFieldLength = maxFieldLength;
            return this;
        }
        
        public Builder crlValidityDays(int crlValidityDays) {
            this.crlValidityDays = crlValidityDays;
            return this;
        }
        
        /**
         * Build and validate the CaConfig
         * 
         * @return the validated CaConfig
         * @throws ConfigValidationException if validation fails
         */
        public CaConfig build() {
            CaConfig config = new CaConfig(this);
            ConfigValidator validator = new ConfigValidator();
            validator.validateOrThrow(config);
            return config;
        }
        
        /**
         * Build without validation
         * 
         * @return the CaConfig (unvalidated)
         */
        public CaConfig buildUnchecked() {
            return new CaConfig(this);
        }
    }
}
