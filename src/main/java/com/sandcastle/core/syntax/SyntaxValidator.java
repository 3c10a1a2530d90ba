package com.sandcastle.core.syntax;

/**
 * Pre-flight check that source parses, run before any worker is spawned.
 */
public interface SyntaxValidator {

    /**
     * Parses {@code code} without executing it. Empty source is valid.
     *
     * @throws com.sandcastle.core.model.CodeExecutionException of kind SYNTAX with
     *         {@code "Line <n>: <message>"} when the source does not parse
     */
    void validate(String code);
}
