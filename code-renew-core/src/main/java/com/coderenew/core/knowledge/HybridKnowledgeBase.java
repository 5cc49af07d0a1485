package com.coderenew.core.knowledge;

import com.coderenew.core.model.DeprecatedItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Knowledge base that augments the local catalogue with a remote knowledge source.
 *
 * <p>Range queries merge local and remote records by name, with remote records
 * replacing local ones. Merged results are cached per {@code (from, to)} for the
 * cache TTL; the cache holds the pending future, so concurrent lookups of the
 * same range share one remote call. Remote failures are logged and the lookup
 * completes with local data only; futures returned by this class never complete
 * exceptionally.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * HybridKnowledgeBase kb = new HybridKnowledgeBase(
 *     LocalDeprecationKnowledgeBase.fromBundledCatalog(),
 *     new HttpRemoteKnowledgeSource("https://wordpress.com/mcp", apiKey),
 *     new KnowledgeCache<>(Clock.systemUTC(), Duration.ofHours(1), 1000),
 *     ForkJoinPool.commonPool());
 * List<DeprecatedItem> items = kb.deprecatedInRange("5.9", "6.4").join();
 * }</pre>
 */
public class HybridKnowledgeBase implements DeprecationKnowledgeBase {

    private static final Logger log = LoggerFactory.getLogger(HybridKnowledgeBase.class);

    private final LocalDeprecationKnowledgeBase local;
    private final RemoteKnowledgeSource remote;
    private final KnowledgeCache<String, CompletableFuture<List<DeprecatedItem>>> cache;
    private final Executor executor;

    public HybridKnowledgeBase(
        LocalDeprecationKnowledgeBase local,
        RemoteKnowledgeSource remote,
        KnowledgeCache<String, CompletableFuture<List<DeprecatedItem>>> cache,
        Executor executor
    ) {
        this.local = Objects.requireNonNull(local, "local must not be null");
        this.remote = Objects.requireNonNull(remote, "remote must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    /**
     * Looks up a name in the local catalogue, then in remote range results
     * that are already cached and complete. Never triggers a remote call.
     */
    @Override
    public Optional<DeprecatedItem> checkFunction(String name) {
        Optional<DeprecatedItem> found = local.checkFunction(name);
        if (found.isPresent()) {
            return found;
        }
        for (CompletableFuture<List<DeprecatedItem>> result : completedResults()) {
            for (DeprecatedItem item : result.join()) {
                if (item.name().equals(name)) {
                    return Optional.of(item);
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public CompletableFuture<List<DeprecatedItem>> deprecatedInRange(String from, String to) {
        String key = "range:" + from + ":" + to;
        return cache.computeIfAbsent(key, k -> fetchMerged(from, to));
    }

    @Override
    public Set<String> allFunctionNames() {
        Set<String> names = new LinkedHashSet<>(local.allFunctionNames());
        for (CompletableFuture<List<DeprecatedItem>> result : completedResults()) {
            result.join().forEach(item -> names.add(item.name()));
        }
        return names;
    }

    /**
     * Fetches free-form detail about one identifier from the remote source.
     *
     * @param name identifier name
     * @return future completing with the detail, or empty on any failure
     */
    public CompletableFuture<Optional<Map<String, Object>>> functionInfo(String name) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return remote.fetchFunctionInfo(name);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, executor).exceptionally(e -> {
            log.warn("Function info lookup for {} failed: {}", name, rootMessage(e));
            return Optional.empty();
        });
    }

    private CompletableFuture<List<DeprecatedItem>> fetchMerged(String from, String to) {
        List<DeprecatedItem> localItems = local.findInRange(from, to);
        return CompletableFuture.supplyAsync(() -> {
            try {
                return remote.fetchDeprecations(from, to);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, executor).handle((remoteItems, error) -> {
            if (error != null) {
                log.warn("Remote knowledge lookup for {}..{} failed, using local catalogue: {}",
                    from, to, rootMessage(error));
                return localItems;
            }
            return merge(localItems, remoteItems);
        });
    }

    static List<DeprecatedItem> merge(List<DeprecatedItem> localItems, List<DeprecatedItem> remoteItems) {
        Map<String, DeprecatedItem> merged = new LinkedHashMap<>();
        localItems.forEach(item -> merged.put(item.name(), item));
        remoteItems.forEach(item -> merged.put(item.name(), item));
        return List.copyOf(merged.values());
    }

    private Collection<CompletableFuture<List<DeprecatedItem>>> completedResults() {
        return cache.liveValues().stream()
            .filter(future -> future.isDone() && !future.isCompletedExceptionally())
            .toList();
    }

    private static String rootMessage(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof UncheckedIOException)
            && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }
}
