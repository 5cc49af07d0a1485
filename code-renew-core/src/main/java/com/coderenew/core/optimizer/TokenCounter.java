package com.coderenew.core.optimizer;

/**
 * Estimates how many sub-word tokens a text costs when sent to the analysis service.
 *
 * <p>Implementations must be deterministic: the same text always yields the same count.
 *
 * @see TokenCounters
 */
public interface TokenCounter {

    /**
     * Counts tokens in the text.
     *
     * @param text text to measure, may be empty
     * @return non-negative token count
     */
    int count(String text);

    /**
     * Short name of the counting strategy, for logs.
     *
     * @return strategy name
     */
    String name();
}
