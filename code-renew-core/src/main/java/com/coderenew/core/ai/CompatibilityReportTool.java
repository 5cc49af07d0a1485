package com.coderenew.core.ai;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Definition of the {@value #NAME} tool whose input is a {@link BatchAnalysis}.
 */
public final class CompatibilityReportTool {

    public static final String NAME = "report_compatibility_issues";

    private CompatibilityReportTool() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    public static ToolDefinition definition() {
        Map<String, Object> issueProperties = new LinkedHashMap<>();
        issueProperties.put("file", property("string", "Filename where the issue was found"));
        issueProperties.put("severity", enumProperty("Severity of the issue",
            List.of("critical", "high", "medium", "low", "info")));
        issueProperties.put("issue_type", enumProperty("Type of compatibility issue",
            List.of("deprecated_function", "removed_function", "breaking_change", "security", "best_practice")));
        issueProperties.put("line", property("integer", "Line number where the issue occurs (if known)"));
        issueProperties.put("description", property("string", "Clear explanation of what is wrong"));
        issueProperties.put("recommendation", property("string", "Specific actionable steps to fix the issue"));
        issueProperties.put("code_snippet", property("string", "The problematic code snippet (optional)"));

        Map<String, Object> issue = new LinkedHashMap<>();
        issue.put("type", "object");
        issue.put("properties", issueProperties);
        issue.put("required", List.of("file", "severity", "issue_type", "description", "recommendation"));

        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("risk_level", enumProperty("Overall risk assessment for the analyzed code",
            List.of("safe", "warning", "critical")));
        properties.put("summary", property("string", "Brief summary of the compatibility findings"));
        properties.put("issues", Map.of(
            "type", "array",
            "items", issue,
            "description", "List of specific compatibility issues found"));
        properties.put("recommendations", Map.of(
            "type", "array",
            "items", Map.of("type", "string"),
            "description", "General recommendations for the entire codebase"));

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", List.of("risk_level", "summary", "issues"));

        return new ToolDefinition(NAME, "Report WordPress compatibility issues found in the analyzed code", schema);
    }

    private static Map<String, Object> property(String type, String description) {
        return Map.of("type", type, "description", description);
    }

    private static Map<String, Object> enumProperty(String description, List<String> values) {
        return Map.of("type", "string", "enum", values, "description", description);
    }
}
