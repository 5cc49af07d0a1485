package com.coderenew.core.scan;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Statistics collected during a scan.
 *
 * <p>Gives callers visibility into coverage (how many files and batches were
 * actually analyzed), cost (token totals) and degraded paths (failed or degraded
 * batches, error messages).
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * ScanStatistics.Builder stats = new ScanStatistics.Builder().filesDiscovered(40);
 * stats.incrementFilesProcessed();
 * stats.addError("batch", "Batch 2: rate limited");
 * ScanStatistics snapshot = stats.build();
 * }</pre>
 *
 * @param filesDiscovered source files found in the input
 * @param filesProcessed files that went through the static pass
 * @param filesSkipped files skipped as vendor, minified, third-party or empty
 * @param filesFailed files that could not be read
 * @param batchesPlanned batches produced by the planner
 * @param batchesProcessed batches that returned a structured verdict
 * @param batchesDegraded batches that returned no structured payload
 * @param batchesFailed batches that raised an error
 * @param staticIssues issues from the static pass
 * @param aiIssues issues from the analysis service
 * @param originalTokens tokens before optimization of dispatched files
 * @param optimizedTokens tokens after optimization of dispatched files
 * @param inputTokens prompt tokens billed by the analysis service
 * @param outputTokens completion tokens billed by the analysis service
 * @param cancelled whether batch dispatch was stopped early
 * @param errorCounts map of error types to their occurrence counts
 * @param topErrors first error messages (max 10)
 */
public record ScanStatistics(
    @JsonProperty("files_discovered") int filesDiscovered,
    @JsonProperty("files_processed") int filesProcessed,
    @JsonProperty("files_skipped") int filesSkipped,
    @JsonProperty("files_failed") int filesFailed,
    @JsonProperty("batches_planned") int batchesPlanned,
    @JsonProperty("batches_processed") int batchesProcessed,
    @JsonProperty("batches_degraded") int batchesDegraded,
    @JsonProperty("batches_failed") int batchesFailed,
    @JsonProperty("static_issues") int staticIssues,
    @JsonProperty("ai_issues") int aiIssues,
    @JsonProperty("original_tokens") long originalTokens,
    @JsonProperty("optimized_tokens") long optimizedTokens,
    @JsonProperty("input_tokens") long inputTokens,
    @JsonProperty("output_tokens") long outputTokens,
    @JsonProperty("cancelled") boolean cancelled,
    @JsonProperty("error_counts") Map<String, Integer> errorCounts,
    @JsonProperty("top_errors") List<String> topErrors
) {
    static final int MAX_TOP_ERRORS = 10;

    public ScanStatistics {
        if (errorCounts == null) {
            errorCounts = Map.of();
        }
        if (topErrors == null) {
            topErrors = List.of();
        }
    }

    /**
     * Creates an empty statistics instance (nothing processed).
     *
     * @return empty statistics
     */
    public static ScanStatistics empty() {
        return new Builder().build();
    }

    /**
     * Tokens removed by optimization.
     *
     * @return original minus optimized tokens, never negative
     */
    @JsonProperty("tokens_saved")
    public long tokensSaved() {
        return Math.max(0, originalTokens - optimizedTokens);
    }

    @JsonIgnore
    public boolean hasFailures() {
        return filesFailed > 0 || batchesFailed > 0;
    }

    /**
     * Returns a human-readable summary of the statistics.
     *
     * @return summary string
     */
    @JsonIgnore
    public String getSummary() {
        return String.format(
            "Files: %d discovered, %d processed, %d skipped, %d failed; "
                + "Batches: %d planned, %d processed, %d degraded, %d failed; "
                + "Issues: %d static, %d ai; Tokens: %d saved, %d in, %d out%s",
            filesDiscovered, filesProcessed, filesSkipped, filesFailed,
            batchesPlanned, batchesProcessed, batchesDegraded, batchesFailed,
            staticIssues, aiIssues,
            tokensSaved(), inputTokens, outputTokens,
            cancelled ? " (cancelled)" : ""
        );
    }

    /**
     * Builder for constructing ScanStatistics incrementally.
     */
    public static class Builder {
        private int filesDiscovered = 0;
        private int filesProcessed = 0;
        private int filesSkipped = 0;
        private int filesFailed = 0;
        private int batchesPlanned = 0;
        private int batchesProcessed = 0;
        private int batchesDegraded = 0;
        private int batchesFailed = 0;
        private int staticIssues = 0;
        private int aiIssues = 0;
        private long originalTokens = 0;
        private long optimizedTokens = 0;
        private long inputTokens = 0;
        private long outputTokens = 0;
        private boolean cancelled = false;
        private final Map<String, Integer> errorCounts = new HashMap<>();
        private final List<String> topErrors = new ArrayList<>();

        public Builder filesDiscovered(int count) {
            this.filesDiscovered = count;
            return this;
        }

        public Builder incrementFilesProcessed() {
            this.filesProcessed++;
            return this;
        }

        public Builder incrementFilesSkipped() {
            this.filesSkipped++;
            return this;
        }

        public Builder incrementFilesFailed() {
            this.filesFailed++;
            return this;
        }

        public Builder batchesPlanned(int count) {
            this.batchesPlanned = count;
            return this;
        }

        public Builder incrementBatchesProcessed() {
            this.batchesProcessed++;
            return this;
        }

        public Builder incrementBatchesDegraded() {
            this.batchesDegraded++;
            return this;
        }

        public Builder incrementBatchesFailed() {
            this.batchesFailed++;
            return this;
        }

        public Builder staticIssues(int count) {
            this.staticIssues = count;
            return this;
        }

        public Builder aiIssues(int count) {
            this.aiIssues = count;
            return this;
        }

        public Builder addOptimization(long original, long optimized) {
            this.originalTokens += original;
            this.optimizedTokens += optimized;
            return this;
        }

        public Builder addUsage(long input, long output) {
            this.inputTokens += input;
            this.outputTokens += output;
            return this;
        }

        public Builder cancelled(boolean cancelled) {
            this.cancelled = cancelled;
            return this;
        }

        public Builder addError(String errorType, String errorDetail) {
            errorCounts.merge(errorType, 1, Integer::sum);
            if (topErrors.size() < MAX_TOP_ERRORS) {
                topErrors.add(errorDetail);
            }
            return this;
        }

        public ScanStatistics build() {
            return new ScanStatistics(
                filesDiscovered,
                filesProcessed,
                filesSkipped,
                filesFailed,
                batchesPlanned,
                batchesProcessed,
                batchesDegraded,
                batchesFailed,
                staticIssues,
                aiIssues,
                originalTokens,
                optimizedTokens,
                inputTokens,
                outputTokens,
                cancelled,
                Map.copyOf(errorCounts),
                List.copyOf(topErrors)
            );
        }
    }
}
