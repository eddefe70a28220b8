package com.diagramforge.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Triangle pointing in one of four directions.
 *
 * @param id unique cell id
 * @param parent containing cell id
 * @param position top-left corner
 * @param size explicit size
 * @param style shape style bag
 * @param textStyle text style bag
 * @param label label text
 * @param direction direction the apex points to, {@code null} for east
 */
public record TriangleComponent(
    String id,
    String parent,
    Position position,
    Size size,
    ShapeStyle style,
    TextStyle textStyle,
    String label,
    Direction direction
) implements VertexComponent {

    public TriangleComponent {
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
        return ComponentKind.TRIANGLE;
    }

    public enum Direction {
        NORTH, SOUTH, EAST, WEST;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }
    }
}
