package com.coderenew.core.util;

import java.util.regex.Pattern;

/**
 * Shared precompiled patterns for lexical inspection of WordPress PHP and JavaScript sources.
 *
 * <p>Patterns are compiled once at class loading time and shared by the
 * optimizer and the static analyzer so both agree on what counts as a hook,
 * a database call or a request superglobal.
 *
 * @since 1.0.0
 */
public final class PhpPatterns {

    /** {@code add_action(} / {@code add_filter(}. */
    public static final Pattern HOOK_REGISTRATION =
        Pattern.compile("add_(action|filter)\\s*\\(");

    /** Hook registration with a literal hook name; group 1 is the kind, group 2 the name. */
    public static final Pattern HOOK_WITH_NAME =
        Pattern.compile("\\badd_(action|filter)\\s*\\(\\s*['\"]([^'\"]+)['\"]");

    /** Hook registration statement up to the terminating semicolon. */
    public static final Pattern HOOK_STATEMENT =
        Pattern.compile("add_(action|filter)\\s*\\([^;]+;");

    public static final Pattern DB_ACCESS =
        Pattern.compile("\\$wpdb->|mysql_|mysqli_");

    /** Database statement from the start of its line to the terminating semicolon. */
    public static final Pattern DB_STATEMENT =
        Pattern.compile("[^;\\n]*(?:\\$wpdb->|mysql_|mysqli_)[^;]*;");

    public static final Pattern USER_INPUT =
        Pattern.compile("\\$_(GET|POST|REQUEST|COOKIE|SERVER)\\[");

    /** Superglobal read from the start of its line to the terminating semicolon. */
    public static final Pattern USER_INPUT_STATEMENT =
        Pattern.compile("[^;\\n]*\\$_(GET|POST|REQUEST|COOKIE)[^;]*;");

    public static final Pattern DEPRECATED_TAG =
        Pattern.compile("@deprecated", Pattern.CASE_INSENSITIVE);

    public static final Pattern FUNCTION_DECLARATION =
        Pattern.compile("\\bfunction\\s+\\w+\\s*\\(");

    /** Function signature up to and including the opening brace. */
    public static final Pattern FUNCTION_SIGNATURE =
        Pattern.compile("function\\s+\\w+\\s*\\([^)]*\\)[^{;]*\\{");

    public static final Pattern CLASS_DECLARATION =
        Pattern.compile("\\bclass\\s+\\w+");

    /** Identifier followed by an opening parenthesis; group 1 is the identifier. */
    public static final Pattern FUNCTION_CALL =
        Pattern.compile("\\b([a-zA-Z_][a-zA-Z0-9_]*)\\s*\\(");

    private PhpPatterns() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Splits text into lines, accepting both {@code \n} and {@code \r\n}.
     *
     * @param text source text
     * @return lines without terminators
     */
    public static String[] lines(String text) {
        return text.split("\\r?\\n", -1);
    }
}
