package com.diagramforge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Linear process flow rendered as a single banner.
 *
 * @param id unique cell id
 * @param parent containing cell id
 * @param position top-left corner
 * @param size explicit size
 * @param style shape style bag
 * @param textStyle text style bag
 * @param steps steps in order
 * @param horizontal horizontal layout
 */
public record ProcessComponent(
    String id,
    String parent,
    Position position,
    Size size,
    ShapeStyle style,
    TextStyle textStyle,
    List<ProcessStep> steps,
    Boolean horizontal
) implements VertexComponent {

    public ProcessComponent {
        Objects.requireNonNull(id, "id must not be null");
        if (style == null) {
            style = ShapeStyle.empty();
        }
        if (textStyle == null) {
            textStyle = TextStyle.empty();
        }
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    @Override
    public ComponentKind kind() {
        return ComponentKind.PROCESS;
    }
}
