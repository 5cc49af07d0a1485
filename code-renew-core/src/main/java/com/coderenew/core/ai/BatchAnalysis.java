package com.coderenew.core.ai;

import com.coderenew.core.model.RiskLevel;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Structured verdict for one batch of files.
 *
 * @param riskLevel service's overall verdict for the batch
 * @param summary short summary of the findings
 * @param issues individual issues
 * @param recommendations general recommendations
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BatchAnalysis(
    @JsonProperty("risk_level") RiskLevel riskLevel,
    @JsonProperty("summary") String summary,
    @JsonProperty("issues") List<AiIssue> issues,
    @JsonProperty("recommendations") List<String> recommendations
) {
    public BatchAnalysis {
        if (riskLevel == null) {
            riskLevel = RiskLevel.UNKNOWN;
        }
        if (summary == null) {
            summary = "";
        }
        issues = issues == null ? List.of() : List.copyOf(issues);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    /**
     * Result used when the service produced no usable structured payload.
     *
     * @param reason why the payload is missing
     * @return unknown-risk analysis without issues
     */
    public static BatchAnalysis degraded(String reason) {
        return new BatchAnalysis(RiskLevel.UNKNOWN, "Analysis unavailable: " + reason, List.of(), List.of());
    }
}
