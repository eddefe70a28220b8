package com.diagramforge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * UML class box with attribute and method compartments.
 *
 * @param id unique cell id
 * @param parent containing cell id
 * @param position top-left corner
 * @param size explicit size
 * @param style shape style bag
 * @param textStyle text style bag
 * @param name class name
 * @param attributes attribute lines, e.g. {@code +id: String}
 * @param methods method lines, e.g. {@code +getId(): String}
 */
public record UmlClassComponent(
    String id,
    String parent,
    Position position,
    Size size,
    ShapeStyle style,
    TextStyle textStyle,
    String name,
    List<String> attributes,
    List<String> methods
) implements VertexComponent {

    public UmlClassComponent {
        Objects.requireNonNull(id, "id must not be null");
        if (style == null) {
            style = ShapeStyle.empty();
        }
        if (textStyle == null) {
            textStyle = TextStyle.empty();
        }
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
        methods = methods == null ? List.of() : List.copyOf(methods);
    }

    @Override
    public ComponentKind kind() {
        return ComponentKind.UML_CLASS;
    }
}
