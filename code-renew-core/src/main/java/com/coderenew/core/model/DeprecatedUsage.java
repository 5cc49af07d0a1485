package com.coderenew.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One call site of a catalogued deprecated identifier.
 *
 * @param function identifier called
 * @param line 1-based line of the call
 * @param deprecatedIn version the identifier was deprecated in
 * @param removedIn version it was removed in, or null
 * @param replacement suggested replacement, or null
 * @param severity catalogue severity
 * @param description catalogue description
 * @param changeType catalogue change kind
 */
public record DeprecatedUsage(
    @JsonProperty("function") String function,
    @JsonProperty("line") int line,
    @JsonProperty("deprecated_in") String deprecatedIn,
    @JsonProperty("removed_in") String removedIn,
    @JsonProperty("replacement") String replacement,
    @JsonProperty("severity") Severity severity,
    @JsonProperty("description") String description,
    @JsonProperty("change_type") ChangeType changeType
) {
    /**
     * Creates a usage record from a catalogue entry.
     *
     * @param item catalogue entry
     * @param function identifier as written at the call site
     * @param line 1-based call-site line
     * @return usage record
     */
    public static DeprecatedUsage of(DeprecatedItem item, String function, int line) {
        return new DeprecatedUsage(
            function,
            line,
            item.deprecatedIn(),
            item.removedIn(),
            item.replacement(),
            item.severity(),
            item.description(),
            item.changeType()
        );
    }
}
