package com.coderenew.core.optimizer;

/**
 * Rule deciding whether a source path is excluded from analysis.
 *
 * <p>Rules receive the path normalized to forward slashes and lower case,
 * and compose via {@link #or(FileSkipRule)}, {@link #and(FileSkipRule)}
 * and {@link #negate()}.
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * FileSkipRule rule = FileSkipRules.dependencyDirectories()
 *     .or(FileSkipRules.minifiedAssets());
 *
 * if (rule.test("plugin/vendor/autoload.php")) {
 *     // skip the file
 * }
 * }</pre>
 *
 * @see FileSkipRules
 */
@FunctionalInterface
public interface FileSkipRule {

    /**
     * Checks whether the file should be skipped.
     *
     * @param normalizedPath path with forward slashes, lower case
     * @return {@code true} if the file should not be analyzed
     */
    boolean test(String normalizedPath);

    default FileSkipRule or(FileSkipRule other) {
        return path -> this.test(path) || other.test(path);
    }

    default FileSkipRule and(FileSkipRule other) {
        return path -> this.test(path) && other.test(path);
    }

    default FileSkipRule negate() {
        return path -> !this.test(path);
    }
}
