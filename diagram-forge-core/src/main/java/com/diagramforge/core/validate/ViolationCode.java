package com.diagramforge.core.validate;

/**
 * Structural violations, declared in the order they are checked.
 */
public enum ViolationCode {
    PARSE_ERROR,
    NESTED_CELL,
    DUPLICATE_ID,
    MISSING_PARENT,
    INVALID_PARENT,
    INVALID_EDGE_REF,
    ORPHANED_MXPOINT
}
