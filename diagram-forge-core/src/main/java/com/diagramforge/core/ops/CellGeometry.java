package com.diagramforge.core.ops;

/**
 * Partial vertex geometry for raw cell operations. Absent fields are left untouched.
 *
 * @param x left edge
 * @param y top edge
 * @param width width
 * @param height height
 */
public record CellGeometry(Double x, Double y, Double width, Double height) {
}
