package com.coderenew.core.ai;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One entry of a service response's heterogeneous content list.
 *
 * @param type block type ("text", "tool_use", ...)
 * @param text text for text blocks, else null
 * @param name tool name for tool-use blocks, else null
 * @param input tool input for tool-use blocks, else null
 */
public record ContentBlock(String type, String text, String name, JsonNode input) {

    public boolean isToolUse() {
        return "tool_use".equals(type);
    }
}
