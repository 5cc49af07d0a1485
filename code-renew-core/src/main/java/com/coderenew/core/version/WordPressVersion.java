package com.coderenew.core.version;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Dot-separated platform version compared as a numeric tuple.
 *
 * <p>Comparison is element-wise; when one version is a prefix of the other the
 * shorter one sorts first, so {@code 6.1 < 6.1.0 < 6.1.1}. A version string with
 * any non-numeric segment parses to {@code (0)}, which sorts before every real
 * release.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * WordPressVersion.parse("6.4.1").compareTo(WordPressVersion.parse("6.10")) < 0
 * WordPressVersion.parse("6.1").isWithin("5.9", "6.4")   // true
 * }</pre>
 *
 * @param parts numeric version segments, never empty
 * @since 1.0.0
 */
public record WordPressVersion(List<Integer> parts) implements Comparable<WordPressVersion> {

    /** Parse result for unparseable input. */
    public static final WordPressVersion ZERO = new WordPressVersion(List.of(0));

    public WordPressVersion {
        if (parts == null || parts.isEmpty()) {
            parts = List.of(0);
        } else {
            parts = List.copyOf(parts);
        }
    }

    /**
     * Parses a dot-separated version string.
     *
     * @param version version string (e.g. "5.9", "6.4.1"); may be null
     * @return parsed version, or {@link #ZERO} if any segment is not an integer
     */
    public static WordPressVersion parse(String version) {
        if (version == null || version.isBlank()) {
            return ZERO;
        }
        List<Integer> parsed = new ArrayList<>();
        for (String segment : version.trim().split("\\.", -1)) {
            try {
                parsed.add(Integer.parseInt(segment));
            } catch (NumberFormatException e) {
                return ZERO;
            }
        }
        return new WordPressVersion(Collections.unmodifiableList(parsed));
    }

    /**
     * Compares two version strings.
     *
     * @param left first version
     * @param right second version
     * @return negative, zero or positive as {@code left} is lower, equal or higher
     */
    public static int compare(String left, String right) {
        return parse(left).compareTo(parse(right));
    }

    /**
     * Checks whether this version lies in {@code [from, to]} inclusive.
     *
     * @param from lower bound
     * @param to upper bound
     * @return true if {@code from <= this <= to}
     */
    public boolean isWithin(WordPressVersion from, WordPressVersion to) {
        return from.compareTo(this) <= 0 && compareTo(to) <= 0;
    }

    /**
     * String overload of {@link #isWithin(WordPressVersion, WordPressVersion)}.
     *
     * @param from lower bound
     * @param to upper bound
     * @return true if {@code from <= this <= to}
     */
    public boolean isWithin(String from, String to) {
        return isWithin(parse(from), parse(to));
    }

    @Override
    public int compareTo(WordPressVersion other) {
        int shared = Math.min(parts.size(), other.parts.size());
        for (int i = 0; i < shared; i++) {
            int cmp = Integer.compare(parts.get(i), other.parts.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(parts.size(), other.parts.size());
    }

    @Override
    public String toString() {
        return parts.stream().map(String::valueOf).collect(Collectors.joining("."));
    }
}
