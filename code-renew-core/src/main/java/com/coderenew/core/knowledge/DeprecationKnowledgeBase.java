package com.coderenew.core.knowledge;

import com.coderenew.core.model.ChangeType;
import com.coderenew.core.model.DeprecatedItem;
import com.coderenew.core.model.Severity;
import com.coderenew.core.model.VersionSummary;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Versioned catalogue of deprecated, removed and changed platform identifiers.
 *
 * <p>Range queries are asynchronous because implementations may consult a remote
 * knowledge source; the purely local implementation returns already-completed
 * futures. Exact-name lookups are synchronous in-memory index lookups.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * DeprecationKnowledgeBase kb = LocalDeprecationKnowledgeBase.fromBundledCatalog();
 * List<DeprecatedItem> changes = kb.deprecatedInRange("5.9", "6.4").join();
 * kb.checkFunction("get_page").ifPresent(item -> log.info("use {}", item.replacement()));
 * }</pre>
 *
 * @see LocalDeprecationKnowledgeBase
 * @see HybridKnowledgeBase
 * @since 1.0.0
 */
public interface DeprecationKnowledgeBase {

    /**
     * Looks up a catalogue entry by exact identifier name.
     *
     * @param name identifier name (e.g. "get_page")
     * @return entry if the identifier is catalogued
     */
    Optional<DeprecatedItem> checkFunction(String name);

    /**
     * Returns every entry whose deprecated or removed version lies within
     * {@code [from, to]} inclusive under numeric version ordering.
     *
     * @param from lower version bound
     * @param to upper version bound
     * @return future completing with the matching entries; never completes exceptionally
     */
    CompletableFuture<List<DeprecatedItem>> deprecatedInRange(String from, String to);

    /**
     * Returns all catalogued identifier names.
     *
     * @return identifier names
     */
    Set<String> allFunctionNames();

    /**
     * Entries in range that are critical or removed outright.
     *
     * @param from lower version bound
     * @param to upper version bound
     * @return future completing with critical entries
     */
    default CompletableFuture<List<DeprecatedItem>> criticalChanges(String from, String to) {
        return deprecatedInRange(from, to).thenApply(items -> items.stream()
            .filter(item -> item.severity() == Severity.CRITICAL
                || item.changeType() == ChangeType.REMOVED_FUNCTION)
            .toList());
    }

    /**
     * Entries in range describing breaking changes.
     *
     * @param from lower version bound
     * @param to upper version bound
     * @return future completing with breaking changes
     */
    default CompletableFuture<List<DeprecatedItem>> breakingChanges(String from, String to) {
        return deprecatedInRange(from, to).thenApply(items -> items.stream()
            .filter(item -> item.changeType() == ChangeType.BREAKING_CHANGE)
            .toList());
    }

    /**
     * Counts of entries in range by severity and change kind.
     *
     * @param from lower version bound
     * @param to upper version bound
     * @return future completing with the summary
     */
    default CompletableFuture<VersionSummary> versionSummary(String from, String to) {
        return deprecatedInRange(from, to).thenApply(VersionSummary::of);
    }

    default Optional<String> replacementSuggestion(String name) {
        return checkFunction(name).map(DeprecatedItem::replacement);
    }

    default Optional<String> documentationUrl(String name) {
        return checkFunction(name).map(DeprecatedItem::documentationUrl);
    }
}
