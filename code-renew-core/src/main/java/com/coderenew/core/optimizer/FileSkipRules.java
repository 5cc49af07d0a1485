package com.coderenew.core.optimizer;

import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * Factory for common {@link FileSkipRule}s.
 *
 * <p>Covers third-party dependency folders, minified or bundled assets, build
 * output and files shipped with the platform itself.
 */
public final class FileSkipRules {

    private FileSkipRules() {
        // Utility class - prevent instantiation
    }

    // ===== Dependencies =====

    /**
     * Package manager folders ({@code vendor/}, {@code node_modules/}, {@code bower_components/}).
     *
     * @return rule matching dependency folders
     */
    public static FileSkipRule dependencyDirectories() {
        return anyPattern("(^|/)vendor/", "(^|/)node_modules/", "(^|/)bower_components/");
    }

    /**
     * Bundled library folders ({@code lib/}, {@code libs/}, {@code packages/}).
     *
     * @return rule matching library folders
     */
    public static FileSkipRule libraryDirectories() {
        return anyPattern("(^|/)libs?/", "(^|/)packages/");
    }

    // ===== Build output =====

    public static FileSkipRule minifiedAssets() {
        return anyPattern("\\.min\\.(js|css)$", "\\.bundle\\.(js|css)$");
    }

    public static FileSkipRule buildOutput() {
        return anyPattern("(^|/)dist/", "(^|/)build/");
    }

    // ===== Platform core =====

    /**
     * Files shipped with WordPress itself.
     *
     * @return rule matching platform core files
     */
    public static FileSkipRule platformCore() {
        return anyPattern(
            "(^|/)wp-includes/",
            "(^|/)wp-admin/",
            "wp-content/plugins/akismet/",
            "wp-content/plugins/hello\\.php$"
        );
    }

    // ===== Composite =====

    /**
     * Every built-in rule combined.
     *
     * @return default skip rule
     */
    public static FileSkipRule defaults() {
        return dependencyDirectories()
            .or(libraryDirectories())
            .or(minifiedAssets())
            .or(buildOutput())
            .or(platformCore());
    }

    /**
     * Matches if any of the regexes is found in the normalized path.
     *
     * @param regexes regular expressions, matched with {@code find()}
     * @return rule
     */
    public static FileSkipRule anyPattern(String... regexes) {
        Pattern[] patterns = Arrays.stream(regexes)
            .map(Pattern::compile)
            .toArray(Pattern[]::new);
        return path -> Arrays.stream(patterns).anyMatch(p -> p.matcher(path).find());
    }
}
