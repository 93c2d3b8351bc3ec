package de.mirkosertic.lawnotes.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Central configuration for the law notes crawler.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Command line options (applied through the setters)
 * 2. Environment variables
 * 3. System properties
 * 4. User config file (~/.lawnotes/config.yaml)
 * 5. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_API_BASE_URL = "LAWNOTES_API_BASE_URL";
    private static final String ENV_OUTPUT_DIR = "LAWNOTES_OUTPUT_DIR";
    private static final String ENV_DICTIONARY_PATH = "LAWNOTES_DICTIONARY_PATH";
    private static final String ENV_UNRESOLVED_PATH = "LAWNOTES_UNRESOLVED_PATH";
    private static final String PROP_API_BASE_URL = "lawnotes.api.base-url";
    private static final String PROP_OUTPUT_DIR = "lawnotes.output-dir";
    private static final String CONFIG_DIR = ".lawnotes";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // API settings
    private String apiBaseUrl = "https://laws.e-gov.go.jp";
    private long timeoutMs = 30000;
    private int retryAttempts = 3;
    private long retryBackoffMs = 400;
    private int listingPageSize = 100;

    // Crawl settings
    private String outputDir = "laws";
    private int maxDepth = 2;
    private boolean noOverwrite = false;
    private boolean nonInteractive = false;

    // Storage settings
    private String dictionaryPath = "data/law_name_dict.json";
    private String unresolvedPath = "data/unresolved_refs.json";

    ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromUserConfig();

        // Step 3: Apply environment variables and system properties
        config.applyEnvironmentOverrides();

        logger.debug("Configuration loaded: apiBaseUrl={}, outputDir={}, maxDepth={}, dictionaryPath={}",
                config.apiBaseUrl, config.outputDir, config.maxDepth, config.dictionaryPath);

        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> lawnotesConfig = (Map<String, Object>) config.get("lawnotes");
        if (lawnotesConfig == null) {
            return;
        }

        final Map<String, Object> apiConfig = (Map<String, Object>) lawnotesConfig.get("api");
        if (apiConfig != null) {
            applyApiConfig(apiConfig);
        }

        final Map<String, Object> crawlConfig = (Map<String, Object>) lawnotesConfig.get("crawl");
        if (crawlConfig != null) {
            applyCrawlConfig(crawlConfig);
        }

        final Map<String, Object> storageConfig = (Map<String, Object>) lawnotesConfig.get("storage");
        if (storageConfig != null) {
            if (storageConfig.containsKey("dictionary-path")) {
                this.dictionaryPath = resolveVariables(storageConfig.get("dictionary-path").toString());
            }
            if (storageConfig.containsKey("unresolved-path")) {
                this.unresolvedPath = resolveVariables(storageConfig.get("unresolved-path").toString());
            }
        }
    }

    private void applyApiConfig(final Map<String, Object> apiConfig) {
        if (apiConfig.containsKey("base-url")) {
            setApiBaseUrl(resolveVariables(apiConfig.get("base-url").toString()));
        }
        if (apiConfig.containsKey("timeout-ms")) {
            setTimeoutMs(((Number) apiConfig.get("timeout-ms")).longValue());
        }
        if (apiConfig.containsKey("retry-attempts")) {
            setRetryAttempts(((Number) apiConfig.get("retry-attempts")).intValue());
        }
        if (apiConfig.containsKey("retry-backoff-ms")) {
            final long backoff = ((Number) apiConfig.get("retry-backoff-ms")).longValue();
            if (backoff < 0) {
                throw new IllegalArgumentException("retry-backoff-ms must not be negative: " + backoff);
            }
            this.retryBackoffMs = backoff;
        }
        if (apiConfig.containsKey("listing-page-size")) {
            final int pageSize = ((Number) apiConfig.get("listing-page-size")).intValue();
            if (pageSize <= 0) {
                throw new IllegalArgumentException("listing-page-size must be positive: " + pageSize);
            }
            this.listingPageSize = pageSize;
        }
    }

    private void applyCrawlConfig(final Map<String, Object> crawlConfig) {
        if (crawlConfig.containsKey("output-dir")) {
            this.outputDir = resolveVariables(crawlConfig.get("output-dir").toString());
        }
        if (crawlConfig.containsKey("max-depth")) {
            setMaxDepth(((Number) crawlConfig.get("max-depth")).intValue());
        }
        if (crawlConfig.containsKey("no-overwrite")) {
            this.noOverwrite = (Boolean) crawlConfig.get("no-overwrite");
        }
        if (crawlConfig.containsKey("non-interactive")) {
            this.nonInteractive = (Boolean) crawlConfig.get("non-interactive");
        }
    }

    private void applyEnvironmentOverrides() {
        final String envBaseUrl = System.getenv(ENV_API_BASE_URL);
        if (envBaseUrl != null && !envBaseUrl.trim().isEmpty()) {
            this.apiBaseUrl = envBaseUrl.trim();
            logger.info("API base URL from environment: {}", this.apiBaseUrl);
        }

        final String envOutputDir = System.getenv(ENV_OUTPUT_DIR);
        if (envOutputDir != null && !envOutputDir.trim().isEmpty()) {
            this.outputDir = envOutputDir.trim();
        }

        final String envDictionaryPath = System.getenv(ENV_DICTIONARY_PATH);
        if (envDictionaryPath != null && !envDictionaryPath.trim().isEmpty()) {
            this.dictionaryPath = envDictionaryPath.trim();
        }

        final String envUnresolvedPath = System.getenv(ENV_UNRESOLVED_PATH);
        if (envUnresolvedPath != null && !envUnresolvedPath.trim().isEmpty()) {
            this.unresolvedPath = envUnresolvedPath.trim();
        }

        // System properties, for running from an IDE
        final String propBaseUrl = System.getProperty(PROP_API_BASE_URL);
        if (propBaseUrl != null && !propBaseUrl.isEmpty()) {
            this.apiBaseUrl = propBaseUrl;
        }
        final String propOutputDir = System.getProperty(PROP_OUTPUT_DIR);
        if (propOutputDir != null && !propOutputDir.isEmpty()) {
            this.outputDir = propOutputDir;
        }
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    private String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    // Getters and command line overrides

    public String getApiBaseUrl() {
        return apiBaseUrl;
    }

    public void setApiBaseUrl(final String apiBaseUrl) {
        if (apiBaseUrl == null || apiBaseUrl.isBlank()) {
            throw new IllegalArgumentException("API base URL must not be empty");
        }
        this.apiBaseUrl = apiBaseUrl.trim();
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(final long timeoutMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeout must be positive: " + timeoutMs);
        }
        this.timeoutMs = timeoutMs;
    }

    public int getRetryAttempts() {
        return retryAttempts;
    }

    public void setRetryAttempts(final int retryAttempts) {
        if (retryAttempts <= 0) {
            throw new IllegalArgumentException("retry attempts must be at least 1: " + retryAttempts);
        }
        this.retryAttempts = retryAttempts;
    }

    public long getRetryBackoffMs() {
        return retryBackoffMs;
    }

    public int getListingPageSize() {
        return listingPageSize;
    }

    public Path getOutputDir() {
        return Paths.get(outputDir);
    }

    public void setOutputDir(final String outputDir) {
        this.outputDir = outputDir;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(final int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("max depth must not be negative: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public boolean isNoOverwrite() {
        return noOverwrite;
    }

    public void setNoOverwrite(final boolean noOverwrite) {
        this.noOverwrite = noOverwrite;
    }

    public boolean isNonInteractive() {
        return nonInteractive;
    }

    public void setNonInteractive(final boolean nonInteractive) {
        this.nonInteractive = nonInteractive;
    }

    public Path getDictionaryPath() {
        return Paths.get(dictionaryPath);
    }

    public void setDictionaryPath(final String dictionaryPath) {
        this.dictionaryPath = dictionaryPath;
    }

    public Path getUnresolvedPath() {
        return Paths.get(unresolvedPath);
    }

    public void setUnresolvedPath(final String unresolvedPath) {
        this.unresolvedPath = unresolvedPath;
    }
}
