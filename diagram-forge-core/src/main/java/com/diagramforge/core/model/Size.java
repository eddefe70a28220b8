package com.diagramforge.core.model;

/**
 * Width and height of a vertex.
 *
 * @param width horizontal extent, never negative
 * @param height vertical extent, never negative
 */
public record Size(double width, double height) {
    /**
     * Compact constructor with validation.
     */
    public Size {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("size must not be negative: " + width + "x" + height);
        }
    }
}
