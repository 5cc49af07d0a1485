package com.coderenew.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Match of a fixed security signature.
 *
 * @param type signature category ("sql_injection", "xss", "file_inclusion")
 * @param line 1-based line of the match
 * @param severity hard-coded severity of the signature
 * @param description what the signature indicates
 * @param codeSnippet matched line with surrounding context
 */
public record SecurityFinding(
    @JsonProperty("type") String type,
    @JsonProperty("line") int line,
    @JsonProperty("severity") Severity severity,
    @JsonProperty("description") String description,
    @JsonProperty("code_snippet") String codeSnippet
) {
}
