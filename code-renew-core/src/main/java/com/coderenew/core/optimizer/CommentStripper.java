package com.coderenew.core.optimizer;

import com.coderenew.core.util.PhpPatterns;

/**
 * Removes comments from PHP and JavaScript source text.
 *
 * <p>A small lexer rather than a regex so that comment markers inside string
 * literals are left alone. Recognized forms are {@code //} and {@code /* *}{@code /}
 * comments, plus {@code #} line comments when they start a line or follow
 * whitespace ({@code #!} and {@code #[} are code). Any comment that mentions
 * {@code @deprecated} is kept verbatim.
 *
 * <p>A removed block comment becomes a single space, or a newline if it spanned
 * lines, so neighbouring tokens never merge.
 */
final class CommentStripper {

    private CommentStripper() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    static String strip(String code) {
        StringBuilder out = new StringBuilder(code.length());
        int length = code.length();
        int i = 0;
        while (i < length) {
            char c = code.charAt(i);
            char next = i + 1 < length ? code.charAt(i + 1) : '\0';

            if (c == '\'' || c == '"' || c == '`') {
                i = copyString(code, i, c, out);
            } else if (c == '/' && next == '/') {
                i = handleLineComment(code, i, out);
            } else if (c == '#' && isHashComment(out, next)) {
                i = handleLineComment(code, i, out);
            } else if (c == '/' && next == '*') {
                int close = code.indexOf("*/", i + 2);
                int end = close < 0 ? length : close + 2;
                String comment = code.substring(i, end);
                if (isDeprecationComment(comment)) {
                    out.append(comment);
                } else {
                    out.append(comment.indexOf('\n') >= 0 ? '\n' : ' ');
                }
                i = end;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private static int copyString(String code, int start, char quote, StringBuilder out) {
        int length = code.length();
        out.append(quote);
        int i = start + 1;
        while (i < length) {
            char c = code.charAt(i);
            out.append(c);
            if (c == '\\' && i + 1 < length) {
                out.append(code.charAt(i + 1));
                i += 2;
                continue;
            }
            i++;
            if (c == quote) {
                break;
            }
        }
        return i;
    }

    private static int handleLineComment(String code, int start, StringBuilder out) {
        int newline = code.indexOf('\n', start);
        int end = newline < 0 ? code.length() : newline;
        String comment = code.substring(start, end);
        if (isDeprecationComment(comment)) {
            out.append(comment);
        }
        return end;
    }

    private static boolean isHashComment(StringBuilder out, char next) {
        if (next == '!' || next == '[') {
            return false;
        }
        return out.length() == 0 || Character.isWhitespace(out.charAt(out.length() - 1));
    }

    private static boolean isDeprecationComment(String comment) {
        return PhpPatterns.DEPRECATED_TAG.matcher(comment).find();
    }
}
