package com.diagramforge.core.model;

import java.util.Objects;

/**
 * Card with a coloured header, title and smaller subtitle line.
 *
 * @param id unique cell id
 * @param parent containing cell id
 * @param position top-left corner
 * @param size explicit size
 * @param style shape style bag
 * @param textStyle text style bag
 * @param title card title
 * @param subtitle second, smaller line
 * @param content body text
 * @param headerColor header fill colour
 */
public record CardComponent(
    String id,
    String parent,
    Position position,
    Size size,
    ShapeStyle style,
    TextStyle textStyle,
    String title,
    String subtitle,
    String content,
    String headerColor
) implements VertexComponent {

    public CardComponent {
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
        return ComponentKind.CARD;
    }
}
