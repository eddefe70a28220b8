package com.diagramforge.core.model;

import java.util.Objects;

/**
 * Rectangle with rounded corners.
 *
 * @param id unique cell id
 * @param parent containing cell id
 * @param position top-left corner
 * @param size explicit size
 * @param style shape style bag
 * @param textStyle text style bag
 * @param label label text
 * @param cornerRadius arc size token, {@code null} for the renderer default
 */
public record RoundedRectComponent(
    String id,
    String parent,
    Position position,
    Size size,
    ShapeStyle style,
    TextStyle textStyle,
    String label,
    Double cornerRadius
) implements VertexComponent {

    public RoundedRectComponent {
        Objects.requireNonNull(id, "id must not be null");
        if (style == null) {
            style = ShapeStyle.empty();
        }
        if (textStyle == null) {
            textStyle = TextStyle.empty();
        }
    }

    @Override
    public ComponentKind kind() {
        return ComponentKind.ROUNDED_RECT;
    }
}
