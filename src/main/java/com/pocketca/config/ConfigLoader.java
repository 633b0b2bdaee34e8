package com.pocketca.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.pocketca.exception.PkiException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Certificate authority configuration loader.
 * Reads a JSON file, {@code POCKETCA_*} environment variables and programmatic
 * overrides, and merges them into a {@link CaConfig}.
 */
public class ConfigLoader {
    
    private static final Set<String> INT_KEYS = Set.of(
        "defaultValidityDays", "defaultRsaKeySize", "minRsaKeySize", "crlValidityDays",
        "maxSanEntries", "maxFieldLength", "defaultDhBits");
    
    private final ObjectMapper objectMapper;
    private final Map<String, String> environment;
    
    public ConfigLoader() {
        this(System.getenv());
    }
    
    /**
     * Create a loader reading variables from the given map instead of the process environment
     * 
     * @param environment environment variables
     */
    public ConfigLoader(Map<String, String> environment) {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.environment = environment;
    }
    
    /**
     * Load configuration from a JSON file
     * 
     * @param path path to JSON configuration file
     * @return configuration map
     * @throws PkiException if file not found or invalid JSON
     */
    public Map<String, Object> fromFile(String path) throws PkiException {
        Path filePath = Paths.get(path).toAbsolutePath();
        
        if (!Files.exists(filePath)) {
            throw new PkiException("Configuration file not found: " + filePath, "CONFIG_FILE_NOT_FOUND");
        }
        
        try {
            JsonNode rootNode = objectMapper.readTree(filePath.toFile());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = objectMapper.convertValue(rootNode, Map.class);
            return resolveStoreDirectory(config, filePath.getParent());
        } catch (IOException | IllegalArgumentException e) {
            throw new PkiException("Invalid JSON in configuration file: " + filePath, "CONFIG_PARSE_ERROR", e);
        }
    }
    
    /**
     * Load configuration from environment variables
     * 
     * @return configuration map
     */
    public Map<String, Object> fromEnvironment() {
        Map<String, Object> config = new HashMap<>();
        
        for (Map.Entry<String, String> entry : CaConfigConstants.ENV_VAR_MAPPING.entrySet()) {
            String value = environment.get(entry.getKey());
            if (value != null && !value.isEmpty()) {
                config.put(entry.getValue(), parseEnvValue(entry.getValue(), value));
            }
        }
        
        return config;
    }
    
    /**
     * Merge multiple configuration sources
     * Priority: later sources override earlier sources
     * 
     * @param sources configuration maps in order of increasing priority
     * @return merged configuration
     */
    @SafeVarargs
    public final Map<String, Object> merge(Map<String, Object>... sources) {
        Map<String, Object> merged = new HashMap<>();
        
        for (Map<String, Object> source : sources) {
            for (Map.Entry<String, Object> entry : source.entrySet()) {
                if (entry.getValue() != null) {
                    merged.put(entry.getKey(), entry.getValue());
                }
            }
        }
        
        return merged;
    }
    
    /**
     * Resolve configuration map to CaConfig object
     * 
     * @param configMap configuration map
     * @return resolved and validated CaConfig
     * @throws ConfigValidationException if the resolved values are invalid
     */
    public CaConfig resolve(Map<String, Object> configMap) {
        CaConfig.Builder builder = CaConfig.builder();
        
        if (configMap.containsKey("storeDirectory")) {
            builder.storeDirectory(String.valueOf(configMap.get("storeDirectory")));
        }
        if (configMap.containsKey("defaultOrganization")) {
            builder.defaultOrganization(String.valueOf(configMap.get("defaultOrganization")));
        }
        if (configMap.containsKey("defaultSigningAuthority")) {
            builder.defaultSigningAuthority(String.valueOf(configMap.get("defaultSigningAuthority")));
        }
        if (configMap.containsKey("defaultValidityDays")) {
            builder.defaultValidityDays(toInt(configMap, "defaultValidityDays"));
        }
        if (configMap.containsKey("defaultRsaKeySize")) {
            builder.defaultRsaKeySize(toInt(configMap, "defaultRsaKeySize"));
        }
        if (configMap.containsKey("minRsaKeySize")) {
            builder.minRsaKeySize(toInt(configMap, "minRsaKeySize"));
        }
        if (configMap.containsKey("crlValidityDays")) {
            builder.crlValidityDays(toInt(configMap, "crlValidityDays"));
        }
        if (configMap.containsKey("maxSanEntries")) {
            builder.maxSanEntries(toInt(configMap, "maxSanEntries"));
        }
        if (configMap.containsKey("maxFieldLength")) {
            builder.maxFieldLength(toInt(configMap, "maxFieldLength"));
        }
        if (configMap.containsKey("defaultDhBits")) {
            builder.defaultDhBits(toInt(configMap, "defaultDhBits"));
        }
        
        return builder.build();
    }
    
    /**
     * Load, merge, and resolve configuration from multiple sources
     * 
     * @param filePath path to JSON configuration file (optional, null to skip)
     * @param loadEnv whether to load from environment variables
     * @param programmaticConfig programmatic configuration (optional, null to skip)
     * @return resolved CaConfig
     */
    public CaConfig load(String filePath, boolean loadEnv, Map<String, Object> programmaticConfig) {
        Map<String, Object> fileConfig = filePath != null ? fromFile(filePath) : new HashMap<>();
        Map<String, Object> envConfig = loadEnv ? fromEnvironment() : new HashMap<>();
        Map<String, Object> progConfig = programmaticConfig != null ? programmaticConfig : new HashMap<>();
        
        return resolve(merge(fileConfig, envConfig, progConfig));
    }
    
    /**
     * Create a configuration template file holding every default
     * 
     * @param path path to write template
     * @throws PkiException if writing fails
     */
    public void createTemplate(String path) throws PkiException {
        Map<String, Object> template = new LinkedHashMap<>();
        template.put("storeDirectory", CaConfigConstants.DEFAULT_STORE_DIRECTORY);
        template.put("defaultOrganization", CaConfigConstants.DEFAULT_ORGANIZATION);
        template.put("defaultSigningAuthority", CaConfigConstants.DEFAULT_SIGNING_AUTHORITY);
        template.put("defaultValidityDays", CaConfigConstants.DEFAULT_VALIDITY_DAYS);
        template.put("defaultRsaKeySize", CaConfigConstants.DEFAULT_RSA_KEY_SIZE);
        template.put("minRsaKeySize", CaConfigConstants.DEFAULT_MIN_RSA_KEY_SIZE);
        template.put("crlValidityDays", CaConfigConstants.DEFAULT_CRL_VALIDITY_DAYS);
        template.put("maxSanEntries", CaConfigConstants.DEFAULT_MAX_SAN_ENTRIES);
        template.put("maxFieldLength", CaConfigConstants.DEFAULT_MAX_FIELD_LENGTH);
        template.put("defaultDhBits", CaConfigConstants.DEFAULT_DH_BITS);
        
        Path filePath = Paths.get(path).toAbsolutePath();
        try {
            Files.createDirectories(filePath.getParent());
            objectMapper.writeValue(filePath.toFile(), template);
        } catch (IOException e) {
            throw new PkiException("Failed to create configuration template: " + e.getMessage(), "CONFIG_WRITE_ERROR", e);
        }
    }
    
    private Object parseEnvValue(String key, String value) {
        if (INT_KEYS.contains(key)) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                return value;
            }
        }
        return value;
    }
    
    private Map<String, Object> resolveStoreDirectory(Map<String, Object> config, Path basePath) {
        Map<String, Object> processed = new HashMap<>(config);
        
        // Relative store directories are relative to the config file, not the working directory
        Object dir = processed.get("storeDirectory");
        if (dir instanceof String && !Paths.get((String) dir).isAbsolute()) {
            processed.put("storeDirectory", basePath.resolve((String) dir).normalize().toString());
        }
        
        return processed;
    }
    
    private int toInt(Map<String, Object> configMap, String key) {
        Object value = configMap.get(key);
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new ConfigValidationException(key + " must be an integer, got: " + value, key);
        }
    }
}
