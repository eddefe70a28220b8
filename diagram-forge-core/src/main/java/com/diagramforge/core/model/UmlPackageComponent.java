package com.diagramforge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * UML package frame.
 *
 * @param id unique cell id
 * @param parent containing cell id
 * @param position top-left corner
 * @param size explicit size
 * @param style shape style bag
 * @param textStyle text style bag
 * @param name package name
 * @param children ids of contained cells
 */
public record UmlPackageComponent(
    String id,
    String parent,
    Position position,
    Size size,
    ShapeStyle style,
    TextStyle textStyle,
    String name,
    List<String> children
) implements ContainerComponent {

    public UmlPackageComponent {
        Objects.requireNonNull(id, "id must not be null");
        if (style == null) {
            style = ShapeStyle.empty();
        }
        if (textStyle == null) {
            textStyle = TextStyle.empty();
        }
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public ComponentKind kind() {
        return ComponentKind.UML_PACKAGE;
    }

    @Override
    public UmlPackageComponent withChildren(List<String> newChildren) {
        return new UmlPackageComponent(id, parent, position, size, style, textStyle, name, newChildren);
    }
}
