package com.coderenew.core.model;

import java.util.List;

/**
 * Result of the fast static pre-scan of one file.
 *
 * @param riskLevel CRITICAL if any critical finding exists, WARNING if any finding exists, else SAFE
 * @param deprecatedFunctionsFound number of deprecated call sites
 * @param securityIssuesFound number of security signature matches
 * @param criticalIssues number of critical findings of either kind
 * @param deprecatedUsage deprecated call sites
 * @param securityIssues security signature matches
 * @param versionSummary catalogue changes in the requested range
 */
public record QuickScanResult(
    RiskLevel riskLevel,
    int deprecatedFunctionsFound,
    int securityIssuesFound,
    int criticalIssues,
    List<DeprecatedUsage> deprecatedUsage,
    List<SecurityFinding> securityIssues,
    VersionSummary versionSummary
) {
    public QuickScanResult {
        deprecatedUsage = deprecatedUsage == null ? List.of() : List.copyOf(deprecatedUsage);
        securityIssues = securityIssues == null ? List.of() : List.copyOf(securityIssues);
    }
}
