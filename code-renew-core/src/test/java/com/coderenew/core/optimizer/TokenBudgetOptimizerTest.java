package com.coderenew.core.optimizer;

import com.coderenew.core.model.Complexity;
import com.coderenew.core.model.FilePatterns;
import com.coderenew.core.model.OptimizationResult;
import com.coderenew.core.model.OptimizationStats;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TokenBudgetOptimizer}.
 */
class TokenBudgetOptimizerTest {

    private final TokenBudgetOptimizer optimizer = new TokenBudgetOptimizer(TokenCounters.heuristic());

    private static final String PLUGIN = """
        <?php
        /**
         * Plugin Name: Sample
         */

        // Register hooks
        add_action('init', 'sample_init');

        function sample_init() {
            $page    =    get_page( 42 );   // legacy call
            $id = $_GET['id'];
            $wpdb->query("SELECT * FROM t WHERE id = $id");
        }

        /**
         * @deprecated 2.0 Use sample_init()
         */
        function sample_old() {}
        """;

    @ParameterizedTest
    @ValueSource(strings = {
        "vendor/autoload.php",
        "plugin/node_modules/x/index.js",
        "assets/app.min.js",
        "wp-includes/post.php",
        "WP-ADMIN/index.php",
        "dist/main.js",
        "plugin\\vendor\\lib.php"
    })
    void shouldSkipFile_dependencyBuildOrCorePath_returnsTrue(String path) {
        assertThat(optimizer.shouldSkipFile(Path.of(path))).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"my-plugin/my-plugin.php", "theme/functions.php", "assets/app.js"})
    void shouldSkipFile_projectSource_returnsFalse(String path) {
        assertThat(optimizer.shouldSkipFile(Path.of(path))).isFalse();
    }

    @Test
    void isThirdPartyCode_libraryBanner_returnsTrue() {
        String jquery = "/*!\n * jQuery JavaScript Library\n * Copyright (c) jQuery Foundation\n */\n(function(){})();";

        assertThat(optimizer.isThirdPartyCode(jquery)).isTrue();
        assertThat(optimizer.isThirdPartyCode(PLUGIN)).isFalse();
    }

    @Test
    void optimizeCode_smallFile_stripsCommentsAndKeepsDeprecationMarkers() {
        OptimizationResult result = optimizer.optimizeCode(PLUGIN);

        assertThat(result.optimizedCode())
            .doesNotContain("Register hooks", "legacy call", "Plugin Name")
            .contains("@deprecated 2.0", "get_page( 42 )", "add_action('init', 'sample_init');");
        assertThat(result.optimizedTokens()).isLessThan(result.originalTokens());
        assertThat(result.tokensSaved()).isEqualTo(result.originalTokens() - result.optimizedTokens());
    }

    @Test
    void optimizeCode_smallFile_collapsesWhitespaceButKeepsIndentation() {
        String optimized = optimizer.optimizeCode(PLUGIN).optimizedCode();

        assertThat(optimized).contains("    $page = get_page( 42 );");
        assertThat(optimized).doesNotContain("\n\n");
    }

    @Test
    void optimizeCode_appliedTwice_isIdempotent() {
        String once = optimizer.optimizeCode(PLUGIN).optimizedCode();
        String twice = optimizer.optimizeCode(once).optimizedCode();

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void optimizeCode_largeFile_reducedToCriticalSections() {
        // Given: a file well above the critical section threshold
        StringBuilder code = new StringBuilder("<?php\n");
        for (int i = 0; i < 300; i++) {
            code.append("function helper_").append(i).append("($a) {\n")
                .append("    $x = compute_value($a, ").append(i).append(");\n")
                .append("    $y = another_call($x, 'padding text for the body');\n")
                .append("    return $x + ").append(i).append(";\n}\n");
        }
        code.append("add_action('init', 'helper_1');\n");
        code.append("$rows = $wpdb->get_results(\"SELECT * FROM t\");\n");
        code.append("/** @deprecated 1.0 */\n");

        // When
        OptimizationResult result = optimizer.optimizeCode(code.toString());

        // Then
        assertThat(result.optimizedCode())
            .startsWith(TokenBudgetOptimizer.CONDENSED_MARKER)
            .contains("function helper_299($a) {", "add_action('init', 'helper_1');", "$wpdb->get_results", "@deprecated 1.0")
            .doesNotContain("return $x + 299;");
        assertThat(result.optimizedTokens()).isLessThan(result.originalTokens() / 2);
        assertThat(optimizer.optimizeCode(result.optimizedCode()).optimizedCode()).isEqualTo(result.optimizedCode());
    }

    @Test
    void optimizeCode_preserveStructure_neverReduces() {
        String large = "<?php\n" + "function f() { return 1; }\n".repeat(600);

        OptimizationResult result = optimizer.optimizeCode(large, true);

        assertThat(result.optimizedCode()).doesNotStartWith(TokenBudgetOptimizer.CONDENSED_MARKER);
    }

    @Test
    void extractFilePatterns_pluginSource_detectsHooksDbAndInput() {
        FilePatterns patterns = optimizer.extractFilePatterns(PLUGIN);

        assertThat(patterns.hasHooks()).isTrue();
        assertThat(patterns.hasDbQueries()).isTrue();
        assertThat(patterns.hasUserInput()).isTrue();
        assertThat(patterns.hasDeprecatedTags()).isTrue();
        assertThat(patterns.functionCount()).isEqualTo(2);
        assertThat(patterns.complexity()).isEqualTo(Complexity.LOW);
    }

    @Test
    void getOptimizationStats_aggregatesResults() {
        List<OptimizationResult> results = List.of(optimizer.optimizeCode(PLUGIN), optimizer.optimizeCode("<?php echo 1;"));

        OptimizationStats stats = optimizer.getOptimizationStats(results);

        assertThat(stats.filesProcessed()).isEqualTo(2);
        assertThat(stats.totalTokensSaved()).isEqualTo(stats.totalOriginalTokens() - stats.totalOptimizedTokens());
        assertThat(stats.filesByComplexity()).containsEntry(Complexity.LOW, 2).containsEntry(Complexity.HIGH, 0);
    }
}
