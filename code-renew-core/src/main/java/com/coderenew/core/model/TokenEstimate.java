package com.coderenew.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Side-effect-free projection of what a full scan would cost.
 *
 * @param totalFiles files that would be analyzed
 * @param totalTokens estimated tokens across those files
 * @param estimatedBatches number of analysis-service calls
 * @param estimatedCost projected cost in USD
 * @param contextOverflowRisk how far the project exceeds a single batch
 * @param topFiles largest files by estimated tokens, descending
 */
public record TokenEstimate(
    @JsonProperty("total_files") int totalFiles,
    @JsonProperty("total_tokens") long totalTokens,
    @JsonProperty("estimated_batches") int estimatedBatches,
    @JsonProperty("estimated_cost") double estimatedCost,
    @JsonProperty("context_overflow_risk") OverflowRisk contextOverflowRisk,
    @JsonProperty("top_files") List<FileTokenCount> topFiles
) {
    public TokenEstimate {
        topFiles = topFiles == null ? List.of() : List.copyOf(topFiles);
    }
}
