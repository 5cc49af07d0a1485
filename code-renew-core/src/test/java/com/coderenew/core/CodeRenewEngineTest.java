package com.coderenew.core;

import com.coderenew.core.config.CodeRenewConfig;
import com.coderenew.core.config.CodeRenewConfig.AnalysisConfig;
import com.coderenew.core.config.CodeRenewConfig.KnowledgeConfig;
import com.coderenew.core.knowledge.HybridKnowledgeBase;
import com.coderenew.core.knowledge.LocalDeprecationKnowledgeBase;
import com.coderenew.core.resilience.CircuitBreakerState;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CodeRenewEngineTest {

    private static CodeRenewConfig withApiKey(String apiKey) {
        return new CodeRenewConfig(new AnalysisConfig(null, null, apiKey, null, null), null, null, null, null, null);
    }

    @Test
    void create_offline_usesLocalCatalogueAndStaticAnalysis() {
        try (CodeRenewEngine engine = CodeRenewEngine.create(withApiKey("sk-test"), false, true)) {
            assertThat(engine.getKnowledgeBase()).isInstanceOf(LocalDeprecationKnowledgeBase.class);
            assertThat(engine.getOrchestrator().isStaticOnly()).isTrue();
        }
    }

    @Test
    void create_remoteEnabled_usesHybridKnowledgeBase() {
        try (CodeRenewEngine engine = CodeRenewEngine.create(CodeRenewConfig.defaults(), true, false)) {
            assertThat(engine.getKnowledgeBase()).isInstanceOf(HybridKnowledgeBase.class);
            assertThat(engine.getOrchestrator().isStaticOnly()).isTrue();
        }
    }

    @Test
    void create_remoteDisabled_usesLocalCatalogue() {
        CodeRenewConfig config = new CodeRenewConfig(null, null, null,
            new KnowledgeConfig(false, null, null, null, null, null), null, null);

        try (CodeRenewEngine engine = CodeRenewEngine.create(config)) {
            assertThat(engine.getKnowledgeBase()).isInstanceOf(LocalDeprecationKnowledgeBase.class);
        }
    }

    @Test
    void create_withoutApiKey_fallsBackToStaticAnalysis() {
        try (CodeRenewEngine engine = CodeRenewEngine.create(CodeRenewConfig.defaults())) {
            assertThat(engine.getOrchestrator().isStaticOnly()).isTrue();
        }
    }

    @Test
    void create_withApiKey_enablesAnalysisService() {
        try (CodeRenewEngine engine = CodeRenewEngine.create(withApiKey("sk-test"))) {
            assertThat(engine.getOrchestrator().isStaticOnly()).isFalse();
            assertThat(engine.getCircuitBreaker().getState()).isEqualTo(CircuitBreakerState.CLOSED);
        }
    }
}
