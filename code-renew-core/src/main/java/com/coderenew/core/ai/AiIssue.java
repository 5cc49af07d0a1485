package com.coderenew.core.ai;

import com.coderenew.core.model.Severity;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One issue as reported by the analysis service.
 *
 * @param file file name or path the service attributed the issue to, may be blank
 * @param severity reported severity
 * @param issueType reported category
 * @param line reported line, or null
 * @param description what is wrong
 * @param recommendation how to fix it
 * @param codeSnippet offending code, or null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AiIssue(
    @JsonProperty("file") String file,
    @JsonProperty("severity") Severity severity,
    @JsonProperty("issue_type") String issueType,
    @JsonProperty("line") Integer line,
    @JsonProperty("description") String description,
    @JsonProperty("recommendation") String recommendation,
    @JsonProperty("code_snippet") String codeSnippet
) {
    public AiIssue {
        if (severity == null) {
            severity = Severity.MEDIUM;
        }
    }
}
