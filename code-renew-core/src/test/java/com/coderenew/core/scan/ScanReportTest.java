package com.coderenew.core.scan;

import com.coderenew.core.model.IssueSource;
import com.coderenew.core.model.RiskLevel;
import com.coderenew.core.model.ScanIssue;
import com.coderenew.core.model.Severity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ScanReport}.
 */
class ScanReportTest {

    private static ScanIssue issue(Severity severity) {
        return new ScanIssue(severity, "deprecated_function", "a.php", 1, "d", "r", null, IssueSource.STATIC);
    }

    @Test
    void riskOf_rollsUpSeverities() {
        assertThat(ScanReport.riskOf(List.of())).isEqualTo(RiskLevel.SAFE);
        assertThat(ScanReport.riskOf(List.of(issue(Severity.INFO)))).isEqualTo(RiskLevel.WARNING);
        assertThat(ScanReport.riskOf(List.of(issue(Severity.HIGH), issue(Severity.LOW)))).isEqualTo(RiskLevel.WARNING);
        assertThat(ScanReport.riskOf(List.of(issue(Severity.LOW), issue(Severity.CRITICAL)))).isEqualTo(RiskLevel.CRITICAL);
    }

    @Test
    void constructor_missingRisk_computedFromIssues() {
        ScanReport report = new ScanReport("id", ScanStatus.COMPLETED, "5.9", "6.4", null,
            List.of(issue(Severity.CRITICAL), issue(Severity.CRITICAL), issue(Severity.MEDIUM)), null, null);

        assertThat(report.riskLevel()).isEqualTo(RiskLevel.CRITICAL);
        assertThat(report.countBySeverity(Severity.CRITICAL)).isEqualTo(2);
        assertThat(report.statistics()).isEqualTo(ScanStatistics.empty());
        assertThat(report.isCompleted()).isTrue();
    }

    @Test
    void json_omitsNullFailureReason() {
        ScanReport report = new ScanReport("id", ScanStatus.COMPLETED, "5.9", "6.4", RiskLevel.SAFE, List.of(), null, null);

        JsonNode json = new ObjectMapper().valueToTree(report);

        assertThat(json.path("scan_id").asText()).isEqualTo("id");
        assertThat(json.path("status").asText()).isEqualTo("completed");
        assertThat(json.path("risk_level").asText()).isEqualTo("safe");
        assertThat(json.has("failure_reason")).isFalse();
    }
}
