package com.coderenew.core.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Finds the tool call carrying the structured verdict in a service response.
 */
public class StructuredOutputExtractor {

    private final ObjectMapper mapper = JsonMapper.builder()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
        .build();

    /**
     * Extracts the input of the first tool-use block with the given tool name.
     *
     * @param response service response
     * @param toolName expected tool name
     * @return found output, or a missing output naming the reason
     */
    public StructuredOutput extract(AnalysisResponse response, String toolName) {
        for (ContentBlock block : response.content()) {
            if (!block.isToolUse() || !toolName.equals(block.name())) {
                continue;
            }
            if (block.input() == null || !block.input().isObject()) {
                return StructuredOutput.missing("tool " + toolName + " called without an input object", response.usage());
            }
            try {
                BatchAnalysis analysis = mapper.treeToValue(block.input(), BatchAnalysis.class);
                return StructuredOutput.found(analysis, response.usage());
            } catch (JsonProcessingException | IllegalArgumentException e) {
                return StructuredOutput.missing("tool input does not match the report schema: "
                    + e.getMessage(), response.usage());
            }
        }
        return StructuredOutput.missing("no " + toolName + " tool call in response (stop reason "
            + response.stopReason() + ")", response.usage());
    }
}
