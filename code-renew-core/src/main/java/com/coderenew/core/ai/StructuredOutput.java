package com.coderenew.core.ai;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of extracting the structured payload from a service response.
 *
 * <p>Either a parsed {@link BatchAnalysis} is present, or {@code missingReason}
 * says why it is not. Callers decide explicitly how to treat the missing case;
 * {@link #analysisOrDegraded()} gives the conventional fallback.
 *
 * @param payload parsed analysis, empty if missing
 * @param missingReason why the payload is missing, null if present
 * @param usage tokens billed for the call that produced this output
 */
public record StructuredOutput(Optional<BatchAnalysis> payload, String missingReason, TokenUsage usage) {

    public StructuredOutput {
        Objects.requireNonNull(payload, "payload must not be null");
        if (usage == null) {
            usage = TokenUsage.NONE;
        }
    }

    public static StructuredOutput found(BatchAnalysis analysis, TokenUsage usage) {
        return new StructuredOutput(Optional.of(analysis), null, usage);
    }

    public static StructuredOutput missing(String reason, TokenUsage usage) {
        return new StructuredOutput(Optional.empty(), reason, usage);
    }

    public boolean isPresent() {
        return payload.isPresent();
    }

    /**
     * Returns the payload, or an unknown-risk analysis without issues.
     *
     * @return analysis
     */
    public BatchAnalysis analysisOrDegraded() {
        return payload.orElseGet(() -> BatchAnalysis.degraded(missingReason));
    }
}
