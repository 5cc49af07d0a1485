package com.coderenew.core.knowledge;

import com.coderenew.core.model.ChangeType;
import com.coderenew.core.model.DeprecatedItem;
import com.coderenew.core.model.Severity;
import com.coderenew.core.testing.MutableClock;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link HybridKnowledgeBase}.
 */
class HybridKnowledgeBaseTest {

    private static final DeprecatedItem LOCAL_LOW =
        new DeprecatedItem("old_fn", "6.0", null, "new_fn", ChangeType.DEPRECATED_FUNCTION, Severity.LOW, "local", null);
    private static final DeprecatedItem REMOTE_CRITICAL =
        new DeprecatedItem("old_fn", "6.0", "6.2", "new_fn", ChangeType.REMOVED_FUNCTION, Severity.CRITICAL, "remote", null);
    private static final DeprecatedItem REMOTE_ONLY =
        new DeprecatedItem("remote_fn", "6.1", null, null, ChangeType.DEPRECATED_FUNCTION, Severity.MEDIUM, "remote", null);

    private final MutableClock clock = new MutableClock();
    private final LocalDeprecationKnowledgeBase local = new LocalDeprecationKnowledgeBase(List.of(LOCAL_LOW));

    /**
     * Remote source that counts calls and returns a fixed answer.
     */
    static class CountingRemote implements RemoteKnowledgeSource {
        final AtomicInteger calls = new AtomicInteger();
        final List<DeprecatedItem> answer;
        final IOException failure;

        CountingRemote(List<DeprecatedItem> answer, IOException failure) {
            this.answer = answer;
            this.failure = failure;
        }

        @Override
        public List<DeprecatedItem> fetchDeprecations(String from, String to) throws IOException {
            calls.incrementAndGet();
            if (failure != null) {
                throw failure;
            }
            return answer;
        }

        @Override
        public Optional<Map<String, Object>> fetchFunctionInfo(String name) throws IOException {
            if (failure != null) {
                throw failure;
            }
            return Optional.of(Map.of("name", name));
        }
    }

    private HybridKnowledgeBase hybrid(RemoteKnowledgeSource remote) {
        return new HybridKnowledgeBase(local, remote, new KnowledgeCache<>(clock, Duration.ofHours(1), 100), Runnable::run);
    }

    @Test
    void deprecatedInRange_remoteRecord_replacesLocalRecord() {
        // Given
        HybridKnowledgeBase kb = hybrid(new CountingRemote(List.of(REMOTE_CRITICAL, REMOTE_ONLY), null));

        // When
        List<DeprecatedItem> items = kb.deprecatedInRange("5.9", "6.4").join();

        // Then
        assertThat(items).containsExactlyInAnyOrder(REMOTE_CRITICAL, REMOTE_ONLY);
        assertThat(kb.criticalChanges("5.9", "6.4").join()).containsExactly(REMOTE_CRITICAL);
    }

    @Test
    void deprecatedInRange_remoteFails_fallsBackToLocal() {
        HybridKnowledgeBase kb = hybrid(new CountingRemote(List.of(), new IOException("connection refused")));

        List<DeprecatedItem> items = kb.deprecatedInRange("5.9", "6.4").join();

        assertThat(items).containsExactly(LOCAL_LOW);
    }

    @Test
    void deprecatedInRange_repeatedWithinTtl_callsRemoteOnce() {
        CountingRemote remote = new CountingRemote(List.of(REMOTE_ONLY), null);
        HybridKnowledgeBase kb = hybrid(remote);

        kb.deprecatedInRange("5.9", "6.4").join();
        kb.deprecatedInRange("5.9", "6.4").join();
        kb.versionSummary("5.9", "6.4").join();

        assertThat(remote.calls).hasValue(1);
    }

    @Test
    void deprecatedInRange_failedLookup_cachedUntilTtlExpires() {
        CountingRemote remote = new CountingRemote(List.of(), new IOException("timeout"));
        HybridKnowledgeBase kb = hybrid(remote);

        kb.deprecatedInRange("5.9", "6.4").join();
        kb.deprecatedInRange("5.9", "6.4").join();
        assertThat(remote.calls).hasValue(1);

        clock.advance(Duration.ofHours(1));
        kb.deprecatedInRange("5.9", "6.4").join();

        assertThat(remote.calls).hasValue(2);
    }

    @Test
    void deprecatedInRange_differentRanges_cachedSeparately() {
        CountingRemote remote = new CountingRemote(List.of(REMOTE_ONLY), null);
        HybridKnowledgeBase kb = hybrid(remote);

        kb.deprecatedInRange("5.9", "6.4").join();
        kb.deprecatedInRange("6.0", "6.4").join();

        assertThat(remote.calls).hasValue(2);
    }

    @Test
    void deprecatedInRange_concurrentCallers_shareOneRemoteCall() throws Exception {
        // Given: a remote that blocks until released
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        RemoteKnowledgeSource blocking = new CountingRemote(List.of(REMOTE_ONLY), null) {
            @Override
            public List<DeprecatedItem> fetchDeprecations(String from, String to) throws IOException {
                calls.incrementAndGet();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return answer;
            }
        };
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            HybridKnowledgeBase kb = new HybridKnowledgeBase(local, blocking,
                new KnowledgeCache<>(clock, Duration.ofHours(1), 100), executor);

            // When
            List<CompletableFuture<List<DeprecatedItem>>> futures = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                futures.add(kb.deprecatedInRange("5.9", "6.4"));
            }
            release.countDown();

            // Then
            for (CompletableFuture<List<DeprecatedItem>> future : futures) {
                assertThat(future.get(5, TimeUnit.SECONDS)).contains(REMOTE_ONLY);
            }
            assertThat(calls).hasValue(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void checkFunction_remoteOnlyName_foundAfterRangeLookup() {
        HybridKnowledgeBase kb = hybrid(new CountingRemote(List.of(REMOTE_ONLY), null));
        assertThat(kb.checkFunction("remote_fn")).isEmpty();

        kb.deprecatedInRange("5.9", "6.4").join();

        assertThat(kb.checkFunction("remote_fn")).contains(REMOTE_ONLY);
        assertThat(kb.allFunctionNames()).contains("old_fn", "remote_fn");
    }

    @Test
    void functionInfo_remoteFailure_returnsEmpty() {
        HybridKnowledgeBase failing = hybrid(new CountingRemote(List.of(), new IOException("down")));
        HybridKnowledgeBase working = hybrid(new CountingRemote(List.of(), null));

        assertThat(failing.functionInfo("get_page").join()).isEmpty();
        assertThat(working.functionInfo("get_page").join()).contains(Map.of("name", "get_page"));
    }

    @Test
    void merge_sameName_remoteWinsAndOrderKept() {
        List<DeprecatedItem> merged = HybridKnowledgeBase.merge(List.of(LOCAL_LOW), List.of(REMOTE_ONLY, REMOTE_CRITICAL));

        assertThat(merged).containsExactly(REMOTE_CRITICAL, REMOTE_ONLY);
    }
}
