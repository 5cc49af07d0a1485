package com.coderenew.core.ai;

import com.coderenew.core.model.RiskLevel;
import com.coderenew.core.model.Severity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link StructuredOutputExtractor}.
 */
class StructuredOutputExtractorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TokenUsage USAGE = new TokenUsage(1200, 300);

    private final StructuredOutputExtractor extractor = new StructuredOutputExtractor();

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }

    private static AnalysisResponse response(ContentBlock... blocks) {
        return new AnalysisResponse(List.of(blocks), "tool_use", USAGE);
    }

    @Test
    void extract_matchingToolCall_returnsAnalysis() throws Exception {
        // Given
        JsonNode input = json("""
            {
              "risk_level": "critical",
              "summary": "One removed function",
              "issues": [{
                "file": "plugin.php", "severity": "critical", "issue_type": "removed_function",
                "line": 12, "description": "get_page() was removed", "recommendation": "Use get_post()"
              }],
              "recommendations": ["Upgrade carefully"],
              "confidence": 0.9
            }
            """);

        // When
        StructuredOutput output = extractor.extract(
            response(new ContentBlock("text", "Let me report.", null, null),
                new ContentBlock("tool_use", null, CompatibilityReportTool.NAME, input)),
            CompatibilityReportTool.NAME);

        // Then
        assertThat(output.isPresent()).isTrue();
        BatchAnalysis analysis = output.payload().orElseThrow();
        assertThat(analysis.riskLevel()).isEqualTo(RiskLevel.CRITICAL);
        assertThat(analysis.issues()).hasSize(1);
        AiIssue issue = analysis.issues().get(0);
        assertThat(issue.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(issue.line()).isEqualTo(12);
        assertThat(analysis.recommendations()).containsExactly("Upgrade carefully");
        assertThat(output.usage()).isEqualTo(USAGE);
    }

    @Test
    void extract_textOnlyResponse_returnsMissingWithUsage() {
        StructuredOutput output = extractor.extract(
            response(new ContentBlock("text", "{\"risk_level\": \"safe\"}", null, null)),
            CompatibilityReportTool.NAME);

        assertThat(output.isPresent()).isFalse();
        assertThat(output.missingReason()).contains("no " + CompatibilityReportTool.NAME);
        assertThat(output.usage()).isEqualTo(USAGE);
        assertThat(output.analysisOrDegraded().riskLevel()).isEqualTo(RiskLevel.UNKNOWN);
    }

    @Test
    void extract_otherToolName_ignored() throws Exception {
        StructuredOutput output = extractor.extract(
            response(new ContentBlock("tool_use", null, "some_other_tool", json("{\"risk_level\": \"safe\"}"))),
            CompatibilityReportTool.NAME);

        assertThat(output.isPresent()).isFalse();
    }

    @Test
    void extract_nonObjectInput_returnsMissing() throws Exception {
        StructuredOutput output = extractor.extract(
            response(new ContentBlock("tool_use", null, CompatibilityReportTool.NAME, json("[1, 2]"))),
            CompatibilityReportTool.NAME);

        assertThat(output.isPresent()).isFalse();
        assertThat(output.missingReason()).contains("without an input object");
    }

    @Test
    void extract_schemaMismatch_returnsMissing() throws Exception {
        StructuredOutput output = extractor.extract(
            response(new ContentBlock("tool_use", null, CompatibilityReportTool.NAME,
                json("{\"issues\": [{\"line\": \"not a number\"}]}"))),
            CompatibilityReportTool.NAME);

        assertThat(output.isPresent()).isFalse();
        assertThat(output.missingReason()).contains("does not match the report schema");
    }

    @Test
    void extract_unknownEnumValues_fallBackToDefaults() throws Exception {
        StructuredOutput output = extractor.extract(
            response(new ContentBlock("tool_use", null, CompatibilityReportTool.NAME,
                json("{\"risk_level\": \"catastrophic\", \"summary\": \"x\", \"issues\": [{\"severity\": \"urgent\"}]}"))),
            CompatibilityReportTool.NAME);

        BatchAnalysis analysis = output.payload().orElseThrow();
        assertThat(analysis.riskLevel()).isEqualTo(RiskLevel.UNKNOWN);
        assertThat(analysis.issues().get(0).severity()).isEqualTo(Severity.MEDIUM);
    }
}
