package com.diagramforge.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Speech-bubble callout.
 *
 * @param id unique cell id
 * @param parent containing cell id
 * @param position top-left corner
 * @param size explicit size
 * @param style shape style bag
 * @param textStyle text style bag
 * @param text callout text
 * @param calloutStyle semantic colouring, used when no explicit fill is set
 * @param pointerDirection side the pointer sits on
 */
public record CalloutComponent(
    String id,
    String parent,
    Position position,
    Size size,
    ShapeStyle style,
    TextStyle textStyle,
    String text,
    Tone calloutStyle,
    PointerDirection pointerDirection
) implements VertexComponent {

    public CalloutComponent {
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
        return ComponentKind.CALLOUT;
    }

    /**
     * Semantic colouring of a callout with its fill colour.
     */
    public enum Tone {
        NOTE("#ffffc0"),
        WARNING("#ffcccc"),
        INFO("#cce5ff"),
        TIP("#ccffcc");

        private final String fillColor;

        Tone(String fillColor) {
            this.fillColor = fillColor;
        }

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }

        public String fillColor() {
            return fillColor;
        }
    }

    /**
     * Side of the bubble the pointer is drawn on, with its dialect rotation.
     */
    public enum PointerDirection {
        LEFT(0),
        RIGHT(180),
        TOP(90),
        BOTTOM(270);

        private final int rotation;

        PointerDirection(int rotation) {
            this.rotation = rotation;
        }

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }

        public int rotation() {
            return rotation;
        }
    }
}
