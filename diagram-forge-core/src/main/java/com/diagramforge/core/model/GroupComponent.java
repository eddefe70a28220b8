package com.diagramforge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Invisible grouping container.
 *
 * @param id unique cell id
 * @param parent containing cell id
 * @param position top-left corner
 * @param size explicit size
 * @param style shape style bag
 * @param textStyle text style bag
 * @param children derived ids of contained cells
 * @param collapsible whether the group can be collapsed
 * @param collapsed whether the group is collapsed
 */
public record GroupComponent(
    String id,
    String parent,
    Position position,
    Size size,
    ShapeStyle style,
    TextStyle textStyle,
    List<String> children,
    Boolean collapsible,
    Boolean collapsed
) implements ContainerComponent {

    public GroupComponent {
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
        return ComponentKind.GROUP;
    }

    @Override
    public GroupComponent withChildren(List<String> newChildren) {
        return new GroupComponent(id, parent, position, size, style, textStyle, newChildren, collapsible, collapsed);
    }
}
