package com.coderenew.core.model;

import java.util.Map;

/**
 * Aggregate of several {@link OptimizationResult}s.
 *
 * @param filesProcessed number of optimized files
 * @param totalOriginalTokens sum of original token counts
 * @param totalOptimizedTokens sum of optimized token counts
 * @param totalTokensSaved difference of the two sums
 * @param averageReductionPercent saved tokens as a percentage of the original total
 * @param filesByComplexity file count per complexity bucket
 */
public record OptimizationStats(
    int filesProcessed,
    long totalOriginalTokens,
    long totalOptimizedTokens,
    long totalTokensSaved,
    double averageReductionPercent,
    Map<Complexity, Integer> filesByComplexity
) {
    public OptimizationStats {
        filesByComplexity = filesByComplexity == null ? Map.of() : Map.copyOf(filesByComplexity);
    }
}
