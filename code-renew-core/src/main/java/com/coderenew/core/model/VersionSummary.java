package com.coderenew.core.model;

import java.util.Collection;

/**
 * Counts of catalogue changes within a version range.
 *
 * @param total number of changes
 * @param critical changes with critical severity
 * @param high changes with high severity
 * @param medium changes with medium severity
 * @param low changes with low severity
 * @param removedFunctions removed-function changes
 * @param deprecatedFunctions deprecated-function changes
 * @param breakingChanges breaking changes
 * @param securityIssues security changes
 */
public record VersionSummary(
    int total,
    int critical,
    int high,
    int medium,
    int low,
    int removedFunctions,
    int deprecatedFunctions,
    int breakingChanges,
    int securityIssues
) {
    /**
     * Summarizes a collection of catalogue entries.
     *
     * @param items entries to count
     * @return summary
     */
    public static VersionSummary of(Collection<DeprecatedItem> items) {
        return new VersionSummary(
            items.size(),
            countSeverity(items, Severity.CRITICAL),
            countSeverity(items, Severity.HIGH),
            countSeverity(items, Severity.MEDIUM),
            countSeverity(items, Severity.LOW),
            countType(items, ChangeType.REMOVED_FUNCTION),
            countType(items, ChangeType.DEPRECATED_FUNCTION),
            countType(items, ChangeType.BREAKING_CHANGE),
            countType(items, ChangeType.SECURITY_ISSUE)
        );
    }

    private static int countSeverity(Collection<DeprecatedItem> items, Severity severity) {
        return (int) items.stream().filter(item -> item.severity() == severity).count();
    }

    private static int countType(Collection<DeprecatedItem> items, ChangeType type) {
        return (int) items.stream().filter(item -> item.changeType() == type).count();
    }
}
