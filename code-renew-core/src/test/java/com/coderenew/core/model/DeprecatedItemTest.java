package com.coderenew.core.model;

import com.coderenew.core.version.WordPressVersion;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link DeprecatedItem}.
 */
class DeprecatedItemTest {

    @Test
    void constructor_removedBeforeDeprecated_throwsException() {
        assertThatThrownBy(() -> new DeprecatedItem("f", "6.1", "5.0", null, null, null, null, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("precedes");
    }

    @Test
    void constructor_nullOptionalFields_appliesDefaults() {
        DeprecatedItem item = new DeprecatedItem("f", "5.0", " ", null, null, null, null, null);

        assertThat(item.removedIn()).isNull();
        assertThat(item.changeType()).isEqualTo(ChangeType.DEPRECATED_FUNCTION);
        assertThat(item.severity()).isEqualTo(Severity.MEDIUM);
        assertThat(item.description()).isEmpty();
    }

    @Test
    void isRemovedBy_targetAtOrAfterRemoval_returnsTrue() {
        DeprecatedItem item = new DeprecatedItem("get_page", "3.9", "6.1", "get_post",
            ChangeType.REMOVED_FUNCTION, Severity.CRITICAL, "", null);

        assertThat(item.isRemovedBy("6.1")).isTrue();
        assertThat(item.isRemovedBy("6.4")).isTrue();
        assertThat(item.isRemovedBy("6.0")).isFalse();
    }

    @Test
    void changedWithin_matchesEitherDeprecatedOrRemovedVersion() {
        DeprecatedItem item = new DeprecatedItem("get_page", "3.9", "6.1", null, null, null, null, null);

        assertThat(item.changedWithin(WordPressVersion.parse("5.9"), WordPressVersion.parse("6.4"))).isTrue();
        assertThat(item.changedWithin(WordPressVersion.parse("3.0"), WordPressVersion.parse("4.0"))).isTrue();
        assertThat(item.changedWithin(WordPressVersion.parse("4.0"), WordPressVersion.parse("6.0"))).isFalse();
    }

    @Test
    void deserialize_unknownEnumValues_fallBackToDefaults() throws Exception {
        String json = """
            {"name": "f", "deprecated_in": "5.0", "change_type": "mystery", "severity": "severe"}
            """;

        DeprecatedItem item = new ObjectMapper().readValue(json, DeprecatedItem.class);

        assertThat(item.changeType()).isEqualTo(ChangeType.DEPRECATED_FUNCTION);
        assertThat(item.severity()).isEqualTo(Severity.MEDIUM);
    }
}
