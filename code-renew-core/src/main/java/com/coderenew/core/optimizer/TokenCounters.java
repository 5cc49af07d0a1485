package com.coderenew.core.optimizer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for {@link TokenCounter} instances.
 */
public final class TokenCounters {

    private static final Logger log = LoggerFactory.getLogger(TokenCounters.class);

    private TokenCounters() {
        // Utility class - prevent instantiation
    }

    /**
     * Creates the BPE counter, falling back to the byte heuristic when the
     * encoder cannot be loaded.
     *
     * @return token counter
     */
    public static TokenCounter createDefault() {
        try {
            return new BpeTokenCounter();
        } catch (RuntimeException | LinkageError e) {
            log.warn("BPE tokenizer unavailable, falling back to byte heuristic: {}", e.getMessage());
            return heuristic();
        }
    }

    public static TokenCounter heuristic() {
        return new HeuristicTokenCounter();
    }
}
