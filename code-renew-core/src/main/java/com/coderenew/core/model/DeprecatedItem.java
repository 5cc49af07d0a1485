package com.coderenew.core.model;

import com.coderenew.core.version.WordPressVersion;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A platform identifier whose availability or behavior changed in a release.
 *
 * <p>Identity is the {@code name}: two items with the same name describe the same
 * identifier, and merges replace by name.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * DeprecatedItem item = new DeprecatedItem(
 *     "get_page", "3.9", "6.1", "get_post",
 *     ChangeType.REMOVED_FUNCTION, Severity.CRITICAL,
 *     "Function get_page() was deprecated in 3.9 and removed in 6.1",
 *     "https://developer.wordpress.org/reference/functions/get_page/"
 * );
 * }</pre>
 *
 * @param name identifier (function, hook or API name)
 * @param deprecatedIn version the identifier was first deprecated in
 * @param removedIn version it was removed in, or null if still present
 * @param replacement suggested replacement, or null
 * @param changeType kind of change
 * @param severity impact of the change
 * @param description human-readable description
 * @param documentationUrl reference documentation, or null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DeprecatedItem(
    @JsonProperty("name") String name,
    @JsonProperty("deprecated_in") String deprecatedIn,
    @JsonProperty("removed_in") String removedIn,
    @JsonProperty("replacement") String replacement,
    @JsonProperty("change_type") ChangeType changeType,
    @JsonProperty("severity") Severity severity,
    @JsonProperty("description") String description,
    @JsonProperty("documentation_url") String documentationUrl
) {
    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if the removed version precedes the deprecated version
     */
    public DeprecatedItem {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(deprecatedIn, "deprecatedIn must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (removedIn != null && removedIn.isBlank()) {
            removedIn = null;
        }
        if (changeType == null) {
            changeType = ChangeType.DEPRECATED_FUNCTION;
        }
        if (severity == null) {
            severity = Severity.MEDIUM;
        }
        if (description == null) {
            description = "";
        }
        if (removedIn != null && WordPressVersion.compare(removedIn, deprecatedIn) < 0) {
            throw new IllegalArgumentException(
                "removedIn (" + removedIn + ") precedes deprecatedIn (" + deprecatedIn + ") for " + name);
        }
    }

    /**
     * Returns true if the identifier has been removed from the platform.
     *
     * @return true if {@code removedIn} is set
     */
    public boolean isRemoved() {
        return removedIn != null;
    }

    /**
     * Returns true if the identifier is removed at or before the given target version.
     *
     * @param targetVersion version being upgraded to
     * @return true if calls to this identifier fail on the target version
     */
    public boolean isRemovedBy(String targetVersion) {
        return removedIn != null && WordPressVersion.compare(removedIn, targetVersion) <= 0;
    }

    /**
     * Returns true if either the deprecated or removed version lies in {@code [from, to]}.
     *
     * @param from lower bound (inclusive)
     * @param to upper bound (inclusive)
     * @return true if the item changed within the range
     */
    public boolean changedWithin(WordPressVersion from, WordPressVersion to) {
        if (WordPressVersion.parse(deprecatedIn).isWithin(from, to)) {
            return true;
        }
        return removedIn != null && WordPressVersion.parse(removedIn).isWithin(from, to);
    }
}
