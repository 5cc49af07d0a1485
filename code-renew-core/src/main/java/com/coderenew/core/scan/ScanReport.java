package com.coderenew.core.scan;

import com.coderenew.core.model.RiskLevel;
import com.coderenew.core.model.ScanIssue;
import com.coderenew.core.model.Severity;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one scan: the merged issues, the overall risk and the statistics.
 *
 * @param scanId session identifier
 * @param status terminal status of the scan
 * @param versionFrom version upgrading from
 * @param versionTo version upgrading to
 * @param riskLevel overall risk over all issues
 * @param issues merged, deduplicated issues (static first)
 * @param statistics statistics snapshot
 * @param failureReason why the scan failed, null unless failed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScanReport(
    @JsonProperty("scan_id") String scanId,
    @JsonProperty("status") ScanStatus status,
    @JsonProperty("version_from") String versionFrom,
    @JsonProperty("version_to") String versionTo,
    @JsonProperty("risk_level") RiskLevel riskLevel,
    @JsonProperty("issues") List<ScanIssue> issues,
    @JsonProperty("statistics") ScanStatistics statistics,
    @JsonProperty("failure_reason") String failureReason
) {
    public ScanReport {
        Objects.requireNonNull(scanId, "scanId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        issues = issues == null ? List.of() : List.copyOf(issues);
        if (statistics == null) {
            statistics = ScanStatistics.empty();
        }
        if (riskLevel == null) {
            riskLevel = riskOf(issues);
        }
    }

    /**
     * Rolls a set of issues up into one risk level.
     *
     * @param issues issues to aggregate
     * @return CRITICAL if any issue is critical, SAFE if there are none, otherwise WARNING
     */
    public static RiskLevel riskOf(Collection<ScanIssue> issues) {
        if (issues.isEmpty()) {
            return RiskLevel.SAFE;
        }
        boolean critical = issues.stream().anyMatch(issue -> issue.severity() == Severity.CRITICAL);
        return critical ? RiskLevel.CRITICAL : RiskLevel.WARNING;
    }

    public boolean isCompleted() {
        return status == ScanStatus.COMPLETED;
    }

    public long countBySeverity(Severity severity) {
        return issues.stream().filter(issue -> issue.severity() == severity).count();
    }
}
