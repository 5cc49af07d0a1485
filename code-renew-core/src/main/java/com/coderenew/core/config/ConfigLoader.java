package com.coderenew.core.config;

import com.coderenew.core.config.CodeRenewConfig.AnalysisConfig;
import com.coderenew.core.config.CodeRenewConfig.BatchingConfig;
import com.coderenew.core.config.CodeRenewConfig.KnowledgeConfig;
import com.coderenew.core.config.CodeRenewConfig.RetryConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Utility for loading CodeRenew configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code coderenew.yaml} into {@link CodeRenewConfig} records.
 * If the config file is missing or invalid, returns {@link CodeRenewConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CodeRenewConfig config = ConfigLoader.loadWithEnvironment(Paths.get("coderenew.yaml"));
 * int ceiling = config.batching().maxTokensPerBatch();
 * }</pre>
 */
public class ConfigLoader {

    public static final String DEFAULT_FILE_NAME = "coderenew.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link CodeRenewConfig#defaults()}.
     *
     * @param configPath path to {@code coderenew.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static CodeRenewConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return CodeRenewConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return CodeRenewConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            CodeRenewConfig config = YAML_MAPPER.readValue(configPath.toFile(), CodeRenewConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return CodeRenewConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return CodeRenewConfig.defaults();
        }
    }

    /**
     * Loads configuration and applies process environment overrides.
     *
     * @param configPath path to {@code coderenew.yaml}
     * @return configuration with environment overrides applied
     */
    public static CodeRenewConfig loadWithEnvironment(Path configPath) {
        return applyEnvironment(load(configPath), System.getenv());
    }

    /**
     * Applies environment overrides.
     *
     * <p>API keys from the environment fill blank configured keys; every other
     * recognized variable replaces the configured value. Unparseable numbers are
     * logged and ignored.
     *
     * @param config base configuration
     * @param env environment variables
     * @return configuration with overrides applied
     */
    public static CodeRenewConfig applyEnvironment(CodeRenewConfig config, Map<String, String> env) {
        AnalysisConfig analysis = config.analysis();
        analysis = new AnalysisConfig(
            env.getOrDefault("CLAUDE_MODEL", analysis.model()),
            analysis.baseUrl(),
            analysis.hasApiKey() ? analysis.apiKey() : env.getOrDefault("ANTHROPIC_API_KEY", ""),
            analysis.maxOutputTokens(),
            analysis.requestTimeoutSeconds()
        );

        KnowledgeConfig knowledge = config.knowledge();
        knowledge = new KnowledgeConfig(
            env.containsKey("WORDPRESS_MCP_ENABLED")
                ? Boolean.valueOf(Boolean.parseBoolean(env.get("WORDPRESS_MCP_ENABLED").trim()))
                : knowledge.remoteEnabled(),
            env.getOrDefault("WORDPRESS_MCP_URL", knowledge.remoteUrl()),
            knowledge.apiKey().isBlank() ? env.getOrDefault("WORDPRESS_MCP_API_KEY", "") : knowledge.apiKey(),
            knowledge.timeoutSeconds(),
            knowledge.cacheTtlSeconds(),
            knowledge.cacheMaxEntries()
        );

        BatchingConfig batching = config.batching();
        batching = new BatchingConfig(
            intOverride(env, "SCANNER_MAX_TOKENS_PER_BATCH", batching.maxTokensPerBatch()),
            batching.maxFilesPerBatch()
        );

        RetryConfig retry = config.retry();
        retry = new RetryConfig(
            intOverride(env, "SCANNER_MAX_RETRIES", retry.maxRetries()),
            retry.baseDelayMillis(),
            retry.maxDelayMillis()
        );

        return new CodeRenewConfig(analysis, retry, config.circuitBreaker(), knowledge, batching, config.pricing());
    }

    private static Integer intOverride(Map<String, String> env, String name, Integer current) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            return current;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring {}={}: not an integer", name, value);
            return current;
        }
    }
}
