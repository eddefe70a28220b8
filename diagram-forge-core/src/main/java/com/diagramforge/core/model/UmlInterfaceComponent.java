package com.diagramforge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * UML interface box: stereotype, name and method compartment.
 *
 * @param id unique cell id
 * @param parent containing cell id
 * @param position top-left corner
 * @param size explicit size
 * @param style shape style bag
 * @param textStyle text style bag
 * @param name interface name
 * @param methods method lines
 */
public record UmlInterfaceComponent(
    String id,
    String parent,
    Position position,
    Size size,
    ShapeStyle style,
    TextStyle textStyle,
    String name,
    List<String> methods
) implements VertexComponent {

    public UmlInterfaceComponent {
        Objects.requireNonNull(id, "id must not be null");
        if (style == null) {
            style = ShapeStyle.empty();
        }
        if (textStyle == null) {
            textStyle = TextStyle.empty();
        }
        methods = methods == null ? List.of() : List.copyOf(methods);
    }

    @Override
    public ComponentKind kind() {
        return ComponentKind.UML_INTERFACE;
    }
}
