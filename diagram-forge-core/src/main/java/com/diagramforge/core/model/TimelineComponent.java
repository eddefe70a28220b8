package com.diagramforge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Timeline banner.
 *
 * @param id unique cell id
 * @param parent containing cell id
 * @param position top-left corner
 * @param size explicit size
 * @param style shape style bag
 * @param textStyle text style bag
 * @param title timeline title
 * @param events events in chronological order
 * @param horizontal horizontal layout
 */
public record TimelineComponent(
    String id,
    String parent,
    Position position,
    Size size,
    ShapeStyle style,
    TextStyle textStyle,
    String title,
    List<TimelineEvent> events,
    Boolean horizontal
) implements VertexComponent {

    public TimelineComponent {
        Objects.requireNonNull(id, "id must not be null");
        if (style == null) {
            style = ShapeStyle.empty();
        }
        if (textStyle == null) {
            textStyle = TextStyle.empty();
        }
        events = events == null ? List.of() : List.copyOf(events);
    }

    @Override
    public ComponentKind kind() {
        return ComponentKind.TIMELINE;
    }
}
