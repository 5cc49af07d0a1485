package com.coderenew.core.optimizer;

import java.nio.charset.StandardCharsets;

/**
 * Approximates one token per four bytes of UTF-8.
 *
 * <p>Monotonic in text length; never consults an encoder.
 */
public class HeuristicTokenCounter implements TokenCounter {

    static final int BYTES_PER_TOKEN = 4;

    @Override
    public int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return text.getBytes(StandardCharsets.UTF_8).length / BYTES_PER_TOKEN;
    }

    @Override
    public String name() {
        return "heuristic";
    }
}
