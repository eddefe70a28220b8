package com.diagramforge.core.model;

import java.util.Objects;

/**
 * Bitmap or SVG image referenced by URL or data URI.
 *
 * @param id unique cell id
 * @param parent containing cell id
 * @param position top-left corner
 * @param size explicit size
 * @param style shape style bag
 * @param textStyle text style bag
 * @param src image URL or data URI
 * @param preserveAspect keep the aspect ratio fixed
 * @param label caption
 */
public record ImageComponent(
    String id,
    String parent,
    Position position,
    Size size,
    ShapeStyle style,
    TextStyle textStyle,
    String src,
    Boolean preserveAspect,
    String label
) implements VertexComponent {

    public ImageComponent {
        Objects.requireNonNull(id, "id must not be null");
        if (src == null) {
            src = "";
        }
        if (style == null) {
            style = ShapeStyle.empty();
        }
        if (textStyle == null) {
            textStyle = TextStyle.empty();
        }
    }

    @Override
    public ComponentKind kind() {
        return ComponentKind.IMAGE;
    }
}
