package io.sqlsugar.variable;

/**
 * Which extraction tier produced a descriptor.
 */
public enum ExtractionMethod {
    /**
     * Walked from the template engine's node tree.
     */
    STRUCTURAL,
    /**
     * Pattern scan after syntax validation, each variable test-rendered with its demo value.
     */
    VALIDATED_PATTERN,
    /**
     * Pattern scan only.
     */
    PATTERN
}
