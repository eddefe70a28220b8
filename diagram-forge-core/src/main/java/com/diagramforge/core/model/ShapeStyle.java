package com.diagramforge.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Visual style bag shared by all vertex kinds. Every field is optional; absent fields
 * contribute no style token.
 *
 * @param fill fill colour (e.g. {@code #DAE8FC})
 * @param stroke stroke colour
 * @param strokeWidth stroke width in pixels
 * @param opacity opacity 0-100
 * @param shadow whether to draw a drop shadow
 * @param dashed whether the outline is dashed
 */
public record ShapeStyle(
    String fill,
    String stroke,
    Double strokeWidth,
    Double opacity,
    Boolean shadow,
    Boolean dashed
) {
    private static final ShapeStyle EMPTY = new ShapeStyle(null, null, null, null, null, null);

    public static ShapeStyle empty() {
        return EMPTY;
    }

    public static ShapeStyle fill(String fill) {
        return new ShapeStyle(fill, null, null, null, null, null);
    }

    public ShapeStyle withFill(String newFill) {
        return new ShapeStyle(newFill, stroke, strokeWidth, opacity, shadow, dashed);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return EMPTY.equals(this);
    }
}
