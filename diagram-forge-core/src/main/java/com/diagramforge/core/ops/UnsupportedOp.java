package com.diagramforge.core.ops;

/**
 * Placeholder for an operation whose {@code type} is not recognized.
 *
 * @param type the unrecognized type, may be {@code null}
 */
public record UnsupportedOp(String type) implements DiagramEditOp {
}
