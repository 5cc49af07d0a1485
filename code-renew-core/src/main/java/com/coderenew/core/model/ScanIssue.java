package com.coderenew.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single compatibility finding produced during a scan.
 *
 * <p>Issues are ephemeral: the scan creates them and hands them to the caller,
 * which decides how to persist them.
 *
 * @param severity issue severity
 * @param issueType issue category (e.g. "removed_function", "security")
 * @param filePath path of the file the issue was found in, relative to the scan root when known
 * @param line 1-based line number, or null if unknown
 * @param description what is wrong
 * @param recommendation how to fix it
 * @param codeSnippet offending code with a little context, or null
 * @param source whether the issue came from the static pass or the analysis service
 * @param deprecatedIn version the offending identifier was deprecated in, for catalogue hits
 * @param removedIn version the offending identifier was removed in, for catalogue hits
 * @param replacement suggested replacement, for catalogue hits
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScanIssue(
    @JsonProperty("severity") Severity severity,
    @JsonProperty("issue_type") String issueType,
    @JsonProperty("file") String filePath,
    @JsonProperty("line") Integer line,
    @JsonProperty("description") String description,
    @JsonProperty("recommendation") String recommendation,
    @JsonProperty("code_snippet") String codeSnippet,
    @JsonProperty("source") IssueSource source,
    @JsonProperty("deprecated_in") String deprecatedIn,
    @JsonProperty("removed_in") String removedIn,
    @JsonProperty("replacement") String replacement
) {
    public ScanIssue {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(source, "source must not be null");
        if (issueType == null || issueType.isBlank()) {
            issueType = "compatibility";
        }
        if (filePath == null) {
            filePath = "";
        }
        if (description == null) {
            description = "";
        }
        if (recommendation == null) {
            recommendation = "";
        }
        if (line != null && line <= 0) {
            line = null;
        }
    }

    public ScanIssue(
        Severity severity,
        String issueType,
        String filePath,
        Integer line,
        String description,
        String recommendation,
        String codeSnippet,
        IssueSource source
    ) {
        this(severity, issueType, filePath, line, description, recommendation, codeSnippet, source, null, null, null);
    }

    /**
     * Returns a copy attributed to another file.
     *
     * @param newFilePath file path to attribute the issue to
     * @return new issue with the file path replaced
     */
    public ScanIssue withFilePath(String newFilePath) {
        return new ScanIssue(severity, issueType, newFilePath, line, description, recommendation, codeSnippet, source,
            deprecatedIn, removedIn, replacement);
    }

    /**
     * Key used to collapse duplicate findings.
     *
     * @return file, line, type and description joined
     */
    public String deduplicationKey() {
        return filePath + "#" + line + "#" + issueType + "#" + description;
    }
}
