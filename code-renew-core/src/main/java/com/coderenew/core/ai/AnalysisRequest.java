package com.coderenew.core.ai;

import java.util.Objects;

/**
 * One call to the analysis service.
 *
 * @param model model identifier
 * @param maxTokens maximum completion tokens
 * @param prompt user prompt
 * @param tool structured-output tool the service must call
 */
public record AnalysisRequest(String model, int maxTokens, String prompt, ToolDefinition tool) {

    public AnalysisRequest {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(prompt, "prompt must not be null");
        Objects.requireNonNull(tool, "tool must not be null");
    }
}
