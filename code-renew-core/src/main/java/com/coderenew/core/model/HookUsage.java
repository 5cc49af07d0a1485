package com.coderenew.core.model;

/**
 * A hook registration found in source text.
 *
 * @param type action or filter
 * @param name hook name
 * @param line 1-based line of the registration call
 */
public record HookUsage(HookType type, String name, int line) {
}
