package com.coderenew.core.model;

import java.util.Objects;

/**
 * Outcome of shrinking one file's source text for AI analysis.
 *
 * @param optimizedCode reduced source text
 * @param originalTokens token count before optimization
 * @param optimizedTokens token count after optimization
 * @param tokensSaved {@code originalTokens - optimizedTokens}
 * @param reductionPercent saved tokens as a percentage of the original, 0 for empty input
 * @param patterns structural fingerprint of the original text
 */
public record OptimizationResult(
    String optimizedCode,
    int originalTokens,
    int optimizedTokens,
    int tokensSaved,
    double reductionPercent,
    FilePatterns patterns
) {
    public OptimizationResult {
        Objects.requireNonNull(optimizedCode, "optimizedCode must not be null");
        Objects.requireNonNull(patterns, "patterns must not be null");
    }
}
