package com.coderenew.core.model;

/**
 * File-level anti-pattern detected by a heuristic.
 *
 * @param type category ("anti_pattern", "security", "deprecated")
 * @param severity severity of the heuristic
 * @param description what was detected
 * @param recommendation how to fix it
 */
public record PatternFinding(String type, Severity severity, String description, String recommendation) {
}
