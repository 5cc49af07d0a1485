package com.coderenew.core.ai;

import java.util.List;

/**
 * Raw response of the analysis service.
 *
 * @param content response content blocks
 * @param stopReason why generation stopped, may be null
 * @param usage billed tokens
 */
public record AnalysisResponse(List<ContentBlock> content, String stopReason, TokenUsage usage) {

    public AnalysisResponse {
        content = content == null ? List.of() : List.copyOf(content);
        if (usage == null) {
            usage = TokenUsage.NONE;
        }
    }
}
