package com.coderenew.core.ai;

import com.coderenew.core.exception.AnalysisServiceException;
import com.coderenew.core.exception.AnalysisServiceException.Failure;
import com.coderenew.core.exception.CircuitBreakerOpenException;
import com.coderenew.core.knowledge.DeprecationKnowledgeBase;
import com.coderenew.core.model.DeprecatedItem;
import com.coderenew.core.resilience.CircuitBreaker;
import com.coderenew.core.resilience.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Resilient client for batch compatibility analysis by the external service.
 *
 * <p>Each batch becomes one prompt embedding every file and the known changes in
 * the version range. The call goes through the circuit breaker, which wraps the
 * retry policy, so one exhausted retry sequence counts as a single breaker failure.
 *
 * <p>Failure handling:
 * <ul>
 *   <li>Transient failures are retried by {@link RetryPolicy}</li>
 *   <li>Non-retryable failures and exhausted retries raise {@link AnalysisServiceException}</li>
 *   <li>An open breaker raises {@link CircuitBreakerOpenException} without any network I/O</li>
 *   <li>A response without a usable structured payload yields a missing {@link StructuredOutput}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class AnalysisClient {

    static final int MAX_CONTEXT_ITEMS = 50;

    private static final Logger log = LoggerFactory.getLogger(AnalysisClient.class);

    private final AnalysisTransport transport;
    private final RetryPolicy retryPolicy;
    private final CircuitBreaker circuitBreaker;
    private final DeprecationKnowledgeBase knowledgeBase;
    private final StructuredOutputExtractor extractor;
    private final String model;
    private final int maxOutputTokens;

    public AnalysisClient(
        AnalysisTransport transport,
        RetryPolicy retryPolicy,
        CircuitBreaker circuitBreaker,
        DeprecationKnowledgeBase knowledgeBase,
        String model,
        int maxOutputTokens
    ) {
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "circuitBreaker must not be null");
        this.knowledgeBase = Objects.requireNonNull(knowledgeBase, "knowledgeBase must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.maxOutputTokens = maxOutputTokens;
        this.extractor = new StructuredOutputExtractor();
    }

    /**
     * Analyzes one batch of files.
     *
     * @param files files with their (optimized) content
     * @param versionFrom version upgrading from
     * @param versionTo version upgrading to
     * @param context optional extra context for the prompt, may be null
     * @return structured output, possibly missing
     * @throws AnalysisServiceException on non-retryable failure or exhausted retries
     * @throws CircuitBreakerOpenException if the breaker is open
     * @throws InterruptedException if interrupted during the call or a backoff
     */
    public StructuredOutput analyzeBatch(List<AnalysisFile> files, String versionFrom, String versionTo, String context)
        throws InterruptedException {
        String prompt = buildPrompt(files, versionFrom, versionTo, context);
        AnalysisRequest request = new AnalysisRequest(model, maxOutputTokens, prompt, CompatibilityReportTool.definition());

        AnalysisResponse response;
        try {
            response = circuitBreaker.execute(() -> retryPolicy.execute(() -> transport.send(request)));
        } catch (AnalysisServiceException e) {
            if (e.getFailure() == Failure.MALFORMED_RESPONSE) {
                log.warn("Degrading batch of {} files: {}", files.size(), e.getMessage());
                return StructuredOutput.missing(e.getMessage(), TokenUsage.NONE);
            }
            throw e;
        }

        StructuredOutput output = extractor.extract(response, CompatibilityReportTool.NAME);
        if (!output.isPresent()) {
            log.warn("Degrading batch of {} files: {}", files.size(), output.missingReason());
        }
        return output;
    }

    String buildPrompt(List<AnalysisFile> files, String versionFrom, String versionTo, String context) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are a WordPress compatibility expert. Analyze the following ")
            .append(files.size()).append(files.size() == 1 ? " file" : " files")
            .append(" for compatibility issues when upgrading from WordPress ")
            .append(versionFrom).append(" to ").append(versionTo).append(".\n\n");

        List<DeprecatedItem> changes = knowledgeBase.deprecatedInRange(versionFrom, versionTo).join();
        if (!changes.isEmpty()) {
            prompt.append("Known changes between these versions:\n");
            changes.stream().limit(MAX_CONTEXT_ITEMS).forEach(item -> prompt.append(describe(item)).append('\n'));
            if (changes.size() > MAX_CONTEXT_ITEMS) {
                prompt.append("- ... and ").append(changes.size() - MAX_CONTEXT_ITEMS).append(" more\n");
            }
            prompt.append('\n');
        }

        prompt.append("""
            Please identify:
            1. Deprecated functions and hooks
            2. Removed functions
            3. Breaking changes
            4. Security concerns
            5. Compatibility warnings

            """);
        prompt.append("Report your findings with the ").append(CompatibilityReportTool.NAME)
            .append(" tool. Set each issue's file to the exact path shown in its FILE header.\n\n");

        for (AnalysisFile file : files) {
            prompt.append("=== FILE: ").append(file.path()).append(" ===\n")
                .append(file.content()).append("\n\n");
        }

        if (context != null && !context.isBlank()) {
            prompt.append("Additional context: ").append(context).append('\n');
        }
        return prompt.toString();
    }

    private static String describe(DeprecatedItem item) {
        StringBuilder line = new StringBuilder("- ").append(item.name())
            .append(" (").append(item.changeType().wireName())
            .append(", ").append(item.severity().wireName())
            .append(", deprecated in ").append(item.deprecatedIn());
        if (item.removedIn() != null) {
            line.append(", removed in ").append(item.removedIn());
        }
        line.append(")");
        if (!item.description().isBlank()) {
            line.append(": ").append(item.description());
        }
        if (item.replacement() != null) {
            line.append(" Replacement: ").append(item.replacement());
        }
        return line.toString();
    }
}
