package com.coderenew.core;

import com.coderenew.core.ai.AnalysisClient;
import com.coderenew.core.ai.AnthropicMessagesTransport;
import com.coderenew.core.analyzer.StaticAnalyzer;
import com.coderenew.core.config.CodeRenewConfig;
import com.coderenew.core.config.CodeRenewConfig.AnalysisConfig;
import com.coderenew.core.config.CodeRenewConfig.KnowledgeConfig;
import com.coderenew.core.knowledge.DeprecationKnowledgeBase;
import com.coderenew.core.knowledge.HttpRemoteKnowledgeSource;
import com.coderenew.core.knowledge.HybridKnowledgeBase;
import com.coderenew.core.knowledge.KnowledgeCache;
import com.coderenew.core.knowledge.LocalDeprecationKnowledgeBase;
import com.coderenew.core.optimizer.TokenBudgetOptimizer;
import com.coderenew.core.optimizer.TokenCounters;
import com.coderenew.core.resilience.CircuitBreaker;
import com.coderenew.core.resilience.RetryPolicy;
import com.coderenew.core.scan.BatchPlanner;
import com.coderenew.core.scan.ScanOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the scanning pipeline from a {@link CodeRenewConfig}.
 *
 * <p>Owns the stateful collaborators (knowledge cache, circuit breaker, HTTP clients
 * and the executor for remote knowledge lookups). One engine can serve many scans;
 * they share the breaker and the cache. Close it to release the executor.
 *
 * <p>Modes:
 * <ul>
 *   <li><b>offline</b> - local catalogue only, no analysis service</li>
 *   <li><b>static-only</b> - remote knowledge as configured, no analysis service</li>
 *   <li>otherwise the analysis service is used when an API key is configured</li>
 * </ul>
 */
public final class CodeRenewEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CodeRenewEngine.class);

    private final CodeRenewConfig config;
    private final ExecutorService executor;
    private final DeprecationKnowledgeBase knowledgeBase;
    private final TokenBudgetOptimizer optimizer;
    private final StaticAnalyzer analyzer;
    private final CircuitBreaker circuitBreaker;
    private final ScanOrchestrator orchestrator;

    private CodeRenewEngine(CodeRenewConfig config, boolean staticOnly, boolean offline) {
        this.config = config;
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "coderenew-knowledge");
            thread.setDaemon(true);
            return thread;
        });

        LocalDeprecationKnowledgeBase local = LocalDeprecationKnowledgeBase.fromBundledCatalog();
        this.knowledgeBase = offline ? local : knowledgeBase(local, config.knowledge(), executor);
        this.optimizer = new TokenBudgetOptimizer(TokenCounters.createDefault());
        this.analyzer = new StaticAnalyzer(knowledgeBase);
        this.circuitBreaker = CircuitBreaker.forAnalysisService(
            "analysis-service",
            config.circuitBreaker().failureThreshold(),
            Duration.ofSeconds(config.circuitBreaker().resetTimeoutSeconds()),
            Clock.systemUTC()
        );

        AnalysisClient client = null;
        AnalysisConfig analysis = config.analysis();
        if (staticOnly || offline) {
            log.info("Analysis service disabled ({})", offline ? "offline" : "static-only");
        } else if (!analysis.hasApiKey()) {
            log.warn("No analysis service API key configured, running static analysis only");
        } else {
            client = analysisClient(analysis);
        }

        this.orchestrator = new ScanOrchestrator(
            optimizer,
            analyzer,
            client,
            new BatchPlanner(config.batching().maxTokensPerBatch(), config.batching().maxFilesPerBatch()),
            config.pricing()
        );
    }

    /**
     * Creates an engine that uses every configured collaborator.
     *
     * @param config configuration
     * @return engine
     */
    public static CodeRenewEngine create(CodeRenewConfig config) {
        return new CodeRenewEngine(config, false, false);
    }

    /**
     * Creates an engine.
     *
     * @param config configuration
     * @param staticOnly true to skip the analysis service
     * @param offline true to skip every network collaborator
     * @return engine
     */
    public static CodeRenewEngine create(CodeRenewConfig config, boolean staticOnly, boolean offline) {
        return new CodeRenewEngine(config, staticOnly, offline);
    }

    private static DeprecationKnowledgeBase knowledgeBase(
        LocalDeprecationKnowledgeBase local,
        KnowledgeConfig knowledge,
        ExecutorService executor
    ) {
        if (!knowledge.remoteEnabled()) {
            log.info("Remote knowledge disabled, using the bundled catalogue");
            return local;
        }
        Duration timeout = Duration.ofSeconds(knowledge.timeoutSeconds());
        HttpRemoteKnowledgeSource remote = new HttpRemoteKnowledgeSource(
            HttpClient.newBuilder().connectTimeout(timeout).build(),
            knowledge.remoteUrl(),
            knowledge.apiKey().isBlank() ? null : knowledge.apiKey(),
            timeout
        );
        log.info("Remote knowledge enabled: {}", knowledge.remoteUrl());
        return new HybridKnowledgeBase(
            local,
            remote,
            new KnowledgeCache<>(Clock.systemUTC(), Duration.ofSeconds(knowledge.cacheTtlSeconds()),
                knowledge.cacheMaxEntries()),
            executor
        );
    }

    private AnalysisClient analysisClient(AnalysisConfig analysis) {
        Duration timeout = Duration.ofSeconds(analysis.requestTimeoutSeconds());
        AnthropicMessagesTransport transport = new AnthropicMessagesTransport(
            HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(30)).build(),
            analysis.baseUrl(),
            analysis.apiKey(),
            timeout
        );
        RetryPolicy retry = new RetryPolicy(
            config.retry().maxRetries(),
            Duration.ofMillis(config.retry().baseDelayMillis()),
            Duration.ofMillis(config.retry().maxDelayMillis())
        );
        log.info("Analysis service enabled: model {}", analysis.model());
        return new AnalysisClient(transport, retry, circuitBreaker, knowledgeBase, analysis.model(),
            analysis.maxOutputTokens());
    }

    public CodeRenewConfig getConfig() {
        return config;
    }

    public DeprecationKnowledgeBase getKnowledgeBase() {
        return knowledgeBase;
    }

    public TokenBudgetOptimizer getOptimizer() {
        return optimizer;
    }

    public StaticAnalyzer getAnalyzer() {
        return analyzer;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public ScanOrchestrator getOrchestrator() {
        return orchestrator;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
