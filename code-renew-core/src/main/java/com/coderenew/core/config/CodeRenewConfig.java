package com.coderenew.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration for CodeRenew.
 *
 * <p>Loaded from {@code coderenew.yaml}. Every section and every value is optional;
 * missing parts fall back to {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * analysis:
 *   model: "claude-3-5-sonnet-20241022"
 *   maxOutputTokens: 4096
 *
 * retry:
 *   maxRetries: 3
 *
 * knowledge:
 *   remoteEnabled: false
 *
 * batching:
 *   maxTokensPerBatch: 150000
 *   maxFilesPerBatch: 20
 * }</pre>
 *
 * @param analysis analysis service settings
 * @param retry retry policy settings
 * @param circuitBreaker circuit breaker settings
 * @param knowledge knowledge base settings
 * @param batching batch planning limits
 * @param pricing token pricing for estimates
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CodeRenewConfig(
    @JsonProperty("analysis") AnalysisConfig analysis,
    @JsonProperty("retry") RetryConfig retry,
    @JsonProperty("circuitBreaker") CircuitBreakerConfig circuitBreaker,
    @JsonProperty("knowledge") KnowledgeConfig knowledge,
    @JsonProperty("batching") BatchingConfig batching,
    @JsonProperty("pricing") PricingConfig pricing
) {
    public CodeRenewConfig {
        if (analysis == null) {
            analysis = new AnalysisConfig(null, null, null, null, null);
        }
        if (retry == null) {
            retry = new RetryConfig(null, null, null);
        }
        if (circuitBreaker == null) {
            circuitBreaker = new CircuitBreakerConfig(null, null);
        }
        if (knowledge == null) {
            knowledge = new KnowledgeConfig(null, null, null, null, null, null);
        }
        if (batching == null) {
            batching = new BatchingConfig(null, null);
        }
        if (pricing == null) {
            pricing = new PricingConfig(null, null, null);
        }
    }

    /**
     * Creates a configuration with every default applied.
     *
     * @return default configuration
     */
    public static CodeRenewConfig defaults() {
        return new CodeRenewConfig(null, null, null, null, null, null);
    }

    /**
     * Analysis service settings.
     *
     * @param model model identifier
     * @param baseUrl service base URL
     * @param apiKey API key; blank means "read ANTHROPIC_API_KEY"
     * @param maxOutputTokens completion token limit per call
     * @param requestTimeoutSeconds per-request timeout
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AnalysisConfig(
        @JsonProperty("model") String model,
        @JsonProperty("baseUrl") String baseUrl,
        @JsonProperty("apiKey") String apiKey,
        @JsonProperty("maxOutputTokens") Integer maxOutputTokens,
        @JsonProperty("requestTimeoutSeconds") Integer requestTimeoutSeconds
    ) {
        public AnalysisConfig {
            model = model == null || model.isBlank() ? "claude-3-5-sonnet-20241022" : model;
            baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.anthropic.com" : baseUrl;
            apiKey = apiKey == null ? "" : apiKey;
            maxOutputTokens = maxOutputTokens == null ? 4096 : maxOutputTokens;
            requestTimeoutSeconds = requestTimeoutSeconds == null ? 120 : requestTimeoutSeconds;
        }

        public boolean hasApiKey() {
            return !apiKey.isBlank();
        }
    }

    /**
     * Retry policy settings.
     *
     * @param maxRetries retries after the first attempt
     * @param baseDelayMillis delay before the first retry
     * @param maxDelayMillis upper bound for any delay
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RetryConfig(
        @JsonProperty("maxRetries") Integer maxRetries,
        @JsonProperty("baseDelayMillis") Long baseDelayMillis,
        @JsonProperty("maxDelayMillis") Long maxDelayMillis
    ) {
        public RetryConfig {
            maxRetries = maxRetries == null ? 3 : maxRetries;
            baseDelayMillis = baseDelayMillis == null ? 2000L : baseDelayMillis;
            maxDelayMillis = maxDelayMillis == null ? 30000L : maxDelayMillis;
        }
    }

    /**
     * Circuit breaker settings.
     *
     * @param failureThreshold consecutive failures before opening
     * @param resetTimeoutSeconds time to stay open before a trial call
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CircuitBreakerConfig(
        @JsonProperty("failureThreshold") Integer failureThreshold,
        @JsonProperty("resetTimeoutSeconds") Integer resetTimeoutSeconds
    ) {
        public CircuitBreakerConfig {
            failureThreshold = failureThreshold == null ? 5 : failureThreshold;
            resetTimeoutSeconds = resetTimeoutSeconds == null ? 30 : resetTimeoutSeconds;
        }
    }

    /**
     * Knowledge base settings.
     *
     * @param remoteEnabled whether to consult the remote knowledge service
     * @param remoteUrl remote knowledge service base URL
     * @param apiKey bearer credential; blank means "read WORDPRESS_MCP_API_KEY"
     * @param timeoutSeconds range query timeout
     * @param cacheTtlSeconds lifetime of cached range results
     * @param cacheMaxEntries maximum cached range results
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record KnowledgeConfig(
        @JsonProperty("remoteEnabled") Boolean remoteEnabled,
        @JsonProperty("remoteUrl") String remoteUrl,
        @JsonProperty("apiKey") String apiKey,
        @JsonProperty("timeoutSeconds") Integer timeoutSeconds,
        @JsonProperty("cacheTtlSeconds") Integer cacheTtlSeconds,
        @JsonProperty("cacheMaxEntries") Integer cacheMaxEntries
    ) {
        public KnowledgeConfig {
            remoteEnabled = remoteEnabled == null ? Boolean.TRUE : remoteEnabled;
            remoteUrl = remoteUrl == null || remoteUrl.isBlank() ? "https://wordpress.com/mcp" : remoteUrl;
            apiKey = apiKey == null ? "" : apiKey;
            timeoutSeconds = timeoutSeconds == null ? 5 : timeoutSeconds;
            cacheTtlSeconds = cacheTtlSeconds == null ? 3600 : cacheTtlSeconds;
            cacheMaxEntries = cacheMaxEntries == null ? 1000 : cacheMaxEntries;
        }
    }

    /**
     * Batch planning limits.
     *
     * @param maxTokensPerBatch token ceiling per batch; the byte ceiling is four times this
     * @param maxFilesPerBatch file-count ceiling per batch
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BatchingConfig(
        @JsonProperty("maxTokensPerBatch") Integer maxTokensPerBatch,
        @JsonProperty("maxFilesPerBatch") Integer maxFilesPerBatch
    ) {
        public BatchingConfig {
            maxTokensPerBatch = maxTokensPerBatch == null ? 150_000 : maxTokensPerBatch;
            maxFilesPerBatch = maxFilesPerBatch == null ? 20 : maxFilesPerBatch;
        }
    }

    /**
     * Token pricing used by estimates.
     *
     * @param inputCostPerMillionTokens USD per million prompt tokens
     * @param outputCostPerMillionTokens USD per million completion tokens
     * @param expectedOutputRatio expected completion tokens per prompt token
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PricingConfig(
        @JsonProperty("inputCostPerMillionTokens") Double inputCostPerMillionTokens,
        @JsonProperty("outputCostPerMillionTokens") Double outputCostPerMillionTokens,
        @JsonProperty("expectedOutputRatio") Double expectedOutputRatio
    ) {
        public PricingConfig {
            inputCostPerMillionTokens = inputCostPerMillionTokens == null ? 3.0 : inputCostPerMillionTokens;
            outputCostPerMillionTokens = outputCostPerMillionTokens == null ? 15.0 : outputCostPerMillionTokens;
            expectedOutputRatio = expectedOutputRatio == null ? 0.1 : expectedOutputRatio;
        }
    }
}
