package com.coderenew.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Cheap structural fingerprint of a source file.
 *
 * @param hasHooks file registers actions or filters
 * @param hasDbQueries file touches the database wrapper or a low-level driver
 * @param hasUserInput file reads request superglobals
 * @param hasDeprecatedTags file carries {@code @deprecated} markers
 * @param functionCount number of function declarations
 * @param classCount number of class declarations
 * @param complexity complexity bucket derived from the two counts
 */
public record FilePatterns(
    @JsonProperty("has_hooks") boolean hasHooks,
    @JsonProperty("has_db_queries") boolean hasDbQueries,
    @JsonProperty("has_user_input") boolean hasUserInput,
    @JsonProperty("has_deprecated_tags") boolean hasDeprecatedTags,
    @JsonProperty("function_count") int functionCount,
    @JsonProperty("class_count") int classCount,
    @JsonProperty("complexity") Complexity complexity
) {
    public FilePatterns {
        if (complexity == null) {
            complexity = Complexity.of(functionCount + classCount);
        }
    }
}
