package com.coderenew.core.analyzer;

import com.coderenew.core.util.PhpPatterns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base class for analyzers that inspect source text with regular expressions.
 *
 * <p>Provides:
 * <ul>
 *   <li>Logger initialization (one logger per analyzer class)</li>
 *   <li>Match collection as immutable {@link MatchResult}s</li>
 *   <li>Offset to line-number conversion</li>
 *   <li>Code snippets with surrounding context lines</li>
 * </ul>
 *
 * <p>Analysis is lexical: nothing here understands PHP syntax beyond what a
 * pattern expresses, so findings are heuristics.
 *
 * @since 1.0.0
 */
public abstract class AbstractPatternAnalyzer {

    /** Lines of context on each side of a snippet's focus line. */
    protected static final int CONTEXT_LINES = 2;

    protected final Logger log;

    protected AbstractPatternAnalyzer() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    // ==================== Pattern Matching Utilities ====================

    /**
     * Finds all matches of a compiled pattern in the given text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return match results in order of appearance
     */
    protected List<MatchResult> findMatches(Pattern pattern, String text) {
        List<MatchResult> matches = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            matches.add(matcher.toMatchResult());
        }
        return matches;
    }

    /**
     * Checks if a pattern matches anywhere in the text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return true if pattern matches
     */
    protected boolean matches(Pattern pattern, String text) {
        return pattern.matcher(text).find();
    }

    // ==================== Line Utilities ====================

    /**
     * Converts a character offset into a 1-based line number.
     *
     * @param text source text
     * @param offset character offset into {@code text}
     * @return line number containing the offset
     */
    protected int lineNumberAt(String text, int offset) {
        int line = 1;
        int limit = Math.min(offset, text.length());
        for (int i = 0; i < limit; i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    /**
     * Returns the given line with {@link #CONTEXT_LINES} lines on either side.
     *
     * @param text source text
     * @param lineNumber 1-based focus line
     * @return snippet joined with newlines
     */
    protected String lineContext(String text, int lineNumber) {
        String[] lines = PhpPatterns.lines(text);
        int start = Math.max(0, lineNumber - CONTEXT_LINES - 1);
        int end = Math.min(lines.length, lineNumber + CONTEXT_LINES);
        if (start >= end) {
            return "";
        }
        return String.join("\n", Arrays.asList(lines).subList(start, end));
    }
}
