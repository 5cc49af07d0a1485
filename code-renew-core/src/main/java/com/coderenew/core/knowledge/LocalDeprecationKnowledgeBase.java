package com.coderenew.core.knowledge;

import com.coderenew.core.model.DeprecatedItem;
import com.coderenew.core.version.WordPressVersion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * In-memory deprecation catalogue indexed by name and by deprecated version.
 *
 * <p>Immutable after construction and safe to share between threads.
 * When two entries share a name, the later one wins.
 */
public class LocalDeprecationKnowledgeBase implements DeprecationKnowledgeBase {

    private final List<DeprecatedItem> items;
    private final Map<String, DeprecatedItem> byName;
    private final Map<String, List<DeprecatedItem>> byVersion;

    public LocalDeprecationKnowledgeBase(List<DeprecatedItem> items) {
        Map<String, DeprecatedItem> names = new LinkedHashMap<>();
        for (DeprecatedItem item : items) {
            names.put(item.name(), item);
        }
        Map<String, List<DeprecatedItem>> versions = new LinkedHashMap<>();
        for (DeprecatedItem item : names.values()) {
            versions.computeIfAbsent(item.deprecatedIn(), v -> new ArrayList<>()).add(item);
        }
        versions.replaceAll((version, list) -> List.copyOf(list));

        this.byName = Collections.unmodifiableMap(names);
        this.byVersion = Collections.unmodifiableMap(versions);
        this.items = List.copyOf(names.values());
    }

    /**
     * Creates a knowledge base over the catalogue bundled with the library.
     *
     * @return local knowledge base
     */
    public static LocalDeprecationKnowledgeBase fromBundledCatalog() {
        return new LocalDeprecationKnowledgeBase(DeprecationCatalogLoader.loadBundled());
    }

    @Override
    public Optional<DeprecatedItem> checkFunction(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byName.get(name));
    }

    @Override
    public CompletableFuture<List<DeprecatedItem>> deprecatedInRange(String from, String to) {
        return CompletableFuture.completedFuture(findInRange(from, to));
    }

    @Override
    public Set<String> allFunctionNames() {
        return byName.keySet();
    }

    /**
     * Returns the entries first deprecated in exactly the given version.
     *
     * @param version version string as written in the catalogue
     * @return entries, empty if none
     */
    public List<DeprecatedItem> deprecatedInVersion(String version) {
        return byVersion.getOrDefault(version, List.of());
    }

    /**
     * Returns every catalogue entry in load order.
     *
     * @return all entries
     */
    public List<DeprecatedItem> items() {
        return items;
    }

    List<DeprecatedItem> findInRange(String from, String to) {
        WordPressVersion lower = WordPressVersion.parse(from);
        WordPressVersion upper = WordPressVersion.parse(to);
        return items.stream()
            .filter(item -> item.changedWithin(lower, upper))
            .toList();
    }
}
