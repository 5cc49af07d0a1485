package com.coderenew.core.ai;

/**
 * A file included in an analysis prompt.
 *
 * @param path display path, also used by the service for attribution
 * @param content (optimized) file content
 */
public record AnalysisFile(String path, String content) {
}
