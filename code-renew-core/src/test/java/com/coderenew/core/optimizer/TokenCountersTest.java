package com.coderenew.core.optimizer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the {@link TokenCounter} implementations.
 */
class TokenCountersTest {

    @Test
    void heuristic_countsFourBytesPerToken() {
        TokenCounter counter = TokenCounters.heuristic();

        assertThat(counter.count("")).isZero();
        assertThat(counter.count(null)).isZero();
        assertThat(counter.count("abcdefgh")).isEqualTo(2);
        assertThat(counter.count("abcdefghijk")).isEqualTo(2);
        assertThat(counter.name()).isEqualTo("heuristic");
    }

    @Test
    void heuristic_isMonotonicInLength() {
        TokenCounter counter = TokenCounters.heuristic();
        String text = "function get_page() {}";

        assertThat(counter.count(text + text)).isGreaterThanOrEqualTo(counter.count(text));
    }

    @Test
    void createDefault_countsRealisticSource() {
        TokenCounter counter = TokenCounters.createDefault();

        int tokens = counter.count("<?php $page = get_page(42); echo $page->post_title;");

        assertThat(tokens).isPositive().isLessThan(60);
        assertThat(counter.count("")).isZero();
    }
}
