package com.coderenew.core.optimizer;

import com.coderenew.core.model.Complexity;
import com.coderenew.core.model.FilePatterns;
import com.coderenew.core.model.OptimizationResult;
import com.coderenew.core.model.OptimizationStats;
import com.coderenew.core.util.PhpPatterns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keeps source text sent to the analysis service within a token budget.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Token counting through a pluggable {@link TokenCounter}</li>
 *   <li>Skip decisions for dependency, build and platform-core files</li>
 *   <li>Third-party detection from license and author banners</li>
 *   <li>Code reduction: comment stripping, whitespace collapsing and, for large
 *       files, reduction to signatures plus hook, database and request-input statements</li>
 * </ul>
 *
 * <p>Deprecation markers always survive optimization, and
 * {@link #optimizeCode(String, boolean)} is idempotent: optimizing its own output
 * returns that output unchanged.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * TokenBudgetOptimizer optimizer = new TokenBudgetOptimizer(TokenCounters.createDefault());
 * if (!optimizer.shouldSkipFile(path)) {
 *     OptimizationResult result = optimizer.optimizeCode(Files.readString(path));
 *     log.info("Saved {} tokens", result.tokensSaved());
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public class TokenBudgetOptimizer {

    /** Files still longer than this after stripping are reduced to critical sections. */
    public static final int CRITICAL_SECTION_THRESHOLD_CHARS = 10_000;

    /** First line of a reduced file; reduced input is returned unchanged. */
    public static final String CONDENSED_MARKER = "// [code-renew] condensed: function bodies elided";

    static final int HEADER_LINES = 10;
    static final int THIRD_PARTY_HEADER_LINES = 50;

    private static final Logger log = LoggerFactory.getLogger(TokenBudgetOptimizer.class);

    private static final List<Pattern> THIRD_PARTY_INDICATORS = List.of(
        Pattern.compile("@package\\s+(jQuery|Bootstrap|Modernizr|Underscore)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("Copyright.*\\(c\\).*(?:jQuery|Bootstrap|Facebook|Google)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("MIT License.*(?:jQuery|Bootstrap)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("@link\\s+https?://(?:jquery|getbootstrap|npmjs)", Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern INNER_WHITESPACE = Pattern.compile("[ \\t]{2,}");

    private final TokenCounter tokenCounter;
    private final FileSkipRule skipRule;

    public TokenBudgetOptimizer(TokenCounter tokenCounter, FileSkipRule skipRule) {
        this.tokenCounter = Objects.requireNonNull(tokenCounter, "tokenCounter must not be null");
        this.skipRule = Objects.requireNonNull(skipRule, "skipRule must not be null");
    }

    public TokenBudgetOptimizer(TokenCounter tokenCounter) {
        this(tokenCounter, FileSkipRules.defaults());
    }

    /**
     * Counts tokens with the configured counter.
     *
     * @param text text to measure
     * @return token count
     */
    public int countTokens(String text) {
        return tokenCounter.count(text);
    }

    /**
     * Returns true if the file is dependency, build, minified or platform-core code.
     *
     * @param file path, ideally relative to the scanned project root
     * @return true if the file should not be analyzed
     */
    public boolean shouldSkipFile(Path file) {
        String normalized = file.toString().replace('\\', '/').toLowerCase(Locale.ROOT);
        return skipRule.test(normalized);
    }

    /**
     * Inspects the first lines of a file for third-party license or author banners.
     *
     * @param content file content
     * @return true if the file looks like a bundled library
     */
    public boolean isThirdPartyCode(String content) {
        String[] lines = PhpPatterns.lines(content);
        String header = String.join("\n", Arrays.copyOf(lines, Math.min(lines.length, THIRD_PARTY_HEADER_LINES)));
        return THIRD_PARTY_INDICATORS.stream().anyMatch(p -> p.matcher(header).find());
    }

    /**
     * Computes a cheap structural fingerprint of the source.
     *
     * @param content file content
     * @return detected patterns
     */
    public FilePatterns extractFilePatterns(String content) {
        int functions = count(PhpPatterns.FUNCTION_DECLARATION, content);
        int classes = count(PhpPatterns.CLASS_DECLARATION, content);
        return new FilePatterns(
            PhpPatterns.HOOK_REGISTRATION.matcher(content).find(),
            PhpPatterns.DB_ACCESS.matcher(content).find(),
            PhpPatterns.USER_INPUT.matcher(content).find(),
            PhpPatterns.DEPRECATED_TAG.matcher(content).find(),
            functions,
            classes,
            Complexity.of(functions + classes)
        );
    }

    public OptimizationResult optimizeCode(String code) {
        return optimizeCode(code, false);
    }

    /**
     * Shrinks source text while keeping what compatibility analysis needs.
     *
     * @param code original source text
     * @param preserveStructure if true, never reduce to critical sections
     * @return optimized text with token accounting
     */
    public OptimizationResult optimizeCode(String code, boolean preserveStructure) {
        int originalTokens = countTokens(code);
        FilePatterns patterns = extractFilePatterns(code);

        String optimized;
        if (code.startsWith(CONDENSED_MARKER)) {
            optimized = code;
        } else {
            optimized = collapseWhitespace(CommentStripper.strip(code));
            if (!preserveStructure && optimized.length() > CRITICAL_SECTION_THRESHOLD_CHARS) {
                optimized = extractCriticalSections(optimized, patterns);
            }
        }

        int optimizedTokens = countTokens(optimized);
        int saved = originalTokens - optimizedTokens;
        double reduction = originalTokens > 0 ? saved * 100.0 / originalTokens : 0.0;
        log.debug("Optimized {} -> {} tokens ({}% reduction)", originalTokens, optimizedTokens,
            String.format(Locale.ROOT, "%.1f", reduction));
        return new OptimizationResult(optimized, originalTokens, optimizedTokens, saved, reduction, patterns);
    }

    /**
     * Aggregates per-file optimization results.
     *
     * @param results optimization results
     * @return aggregate statistics
     */
    public OptimizationStats getOptimizationStats(List<OptimizationResult> results) {
        long original = results.stream().mapToLong(OptimizationResult::originalTokens).sum();
        long optimized = results.stream().mapToLong(OptimizationResult::optimizedTokens).sum();
        long saved = original - optimized;

        Map<Complexity, Integer> byComplexity = new EnumMap<>(Complexity.class);
        for (Complexity complexity : Complexity.values()) {
            byComplexity.put(complexity, 0);
        }
        results.forEach(r -> byComplexity.merge(r.patterns().complexity(), 1, Integer::sum));

        return new OptimizationStats(
            results.size(),
            original,
            optimized,
            saved,
            original > 0 ? saved * 100.0 / original : 0.0,
            byComplexity
        );
    }

    static String collapseWhitespace(String code) {
        List<String> lines = new ArrayList<>();
        for (String line : PhpPatterns.lines(code)) {
            if (line.isBlank()) {
                continue;
            }
            String content = line.stripLeading();
            String indentation = line.substring(0, line.length() - content.length());
            lines.add(indentation + INNER_WHITESPACE.matcher(content).replaceAll(" ").stripTrailing());
        }
        return String.join("\n", lines);
    }

    private String extractCriticalSections(String code, FilePatterns patterns) {
        List<String> sections = new ArrayList<>();
        sections.add(CONDENSED_MARKER);

        String[] lines = PhpPatterns.lines(code);
        sections.add(String.join("\n", Arrays.copyOf(lines, Math.min(lines.length, HEADER_LINES))));

        Matcher signatures = PhpPatterns.FUNCTION_SIGNATURE.matcher(code);
        while (signatures.find()) {
            sections.add(signatures.group().strip() + "\n    ...\n}");
        }

        addMatches(sections, PhpPatterns.HOOK_STATEMENT, code);
        if (patterns.hasDbQueries()) {
            addMatches(sections, PhpPatterns.DB_STATEMENT, code);
        }
        if (patterns.hasUserInput()) {
            addMatches(sections, PhpPatterns.USER_INPUT_STATEMENT, code);
        }
        for (String line : lines) {
            if (PhpPatterns.DEPRECATED_TAG.matcher(line).find()) {
                sections.add(line.strip());
            }
        }

        log.debug("Reduced {} chars to {} critical sections", code.length(), sections.size() - 1);
        return String.join("\n", sections);
    }

    private static void addMatches(List<String> sections, Pattern pattern, String code) {
        Matcher matcher = pattern.matcher(code);
        while (matcher.find()) {
            sections.add(matcher.group().strip());
        }
    }

    private static int count(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
