package com.coderenew.core.model;

import java.util.List;
import java.util.Set;

/**
 * Complete static analysis report for one file.
 *
 * @param file file path
 * @param functions distinct called identifiers
 * @param hooks hook registrations
 * @param deprecatedUsage deprecated call sites
 * @param securityIssues security signature matches
 * @param patterns anti-pattern findings
 */
public record FileAnalysis(
    String file,
    Set<String> functions,
    List<HookUsage> hooks,
    List<DeprecatedUsage> deprecatedUsage,
    List<SecurityFinding> securityIssues,
    List<PatternFinding> patterns
) {
    public FileAnalysis {
        functions = functions == null ? Set.of() : Set.copyOf(functions);
        hooks = hooks == null ? List.of() : List.copyOf(hooks);
        deprecatedUsage = deprecatedUsage == null ? List.of() : List.copyOf(deprecatedUsage);
        securityIssues = securityIssues == null ? List.of() : List.copyOf(securityIssues);
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
    }
}
