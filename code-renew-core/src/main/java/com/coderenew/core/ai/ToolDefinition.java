package com.coderenew.core.ai;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Structured-output tool the service is asked to call.
 *
 * @param name tool name
 * @param description what the tool reports
 * @param inputSchema JSON schema of the tool input
 */
public record ToolDefinition(
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("input_schema") Map<String, Object> inputSchema
) {
}
