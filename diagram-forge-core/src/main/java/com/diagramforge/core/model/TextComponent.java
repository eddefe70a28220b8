package com.diagramforge.core.model;

import java.util.Objects;

/**
 * Free-standing text without outline or fill.
 *
 * @param id unique cell id
 * @param parent containing cell id
 * @param position top-left corner
 * @param size explicit size
 * @param style shape style bag
 * @param textStyle text style bag
 * @param text the text (may contain markup)
 */
public record TextComponent(
    String id,
    String parent,
    Position position,
    Size size,
    ShapeStyle style,
    TextStyle textStyle,
    String text
) implements VertexComponent {

    public TextComponent {
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
        return ComponentKind.TEXT;
    }
}
