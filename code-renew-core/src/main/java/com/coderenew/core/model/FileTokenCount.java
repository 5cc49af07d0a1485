package com.coderenew.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Estimated token count of one file.
 *
 * @param file file path
 * @param tokens estimated tokens
 */
public record FileTokenCount(@JsonProperty("file") String file, @JsonProperty("tokens") int tokens) {
}
