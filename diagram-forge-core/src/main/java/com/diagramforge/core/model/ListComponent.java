package com.diagramforge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Titled list of bulleted or numbered items.
 *
 * @param id unique cell id
 * @param parent containing cell id
 * @param position top-left corner
 * @param size explicit size
 * @param style shape style bag
 * @param textStyle text style bag
 * @param title list title
 * @param items item lines
 * @param numbered number the items instead of bulleting them
 */
public record ListComponent(
    String id,
    String parent,
    Position position,
    Size size,
    ShapeStyle style,
    TextStyle textStyle,
    String title,
    List<String> items,
    Boolean numbered
) implements VertexComponent {

    public ListComponent {
        Objects.requireNonNull(id, "id must not be null");
        if (style == null) {
            style = ShapeStyle.empty();
        }
        if (textStyle == null) {
            textStyle = TextStyle.empty();
        }
        items = items == null ? List.of() : List.copyOf(items);
    }

    @Override
    public ComponentKind kind() {
        return ComponentKind.LIST;
    }
}
