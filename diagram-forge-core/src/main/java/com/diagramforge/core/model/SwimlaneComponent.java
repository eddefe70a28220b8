package com.diagramforge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Titled container lane.
 *
 * @param id unique cell id
 * @param parent containing cell id
 * @param position top-left corner
 * @param size explicit size
 * @param style shape style bag
 * @param textStyle text style bag
 * @param title header text
 * @param titleHeight header height, {@code null} for 30
 * @param horizontal lay the header out horizontally
 * @param children derived ids of contained cells
 * @param headerFill header fill colour
 * @param collapsible whether the lane can be collapsed
 * @param collapsed whether the lane is collapsed
 */
public record SwimlaneComponent(
    String id,
    String parent,
    Position position,
    Size size,
    ShapeStyle style,
    TextStyle textStyle,
    String title,
    Double titleHeight,
    Boolean horizontal,
    List<String> children,
    String headerFill,
    Boolean collapsible,
    Boolean collapsed
) implements ContainerComponent {

    public SwimlaneComponent {
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
        return ComponentKind.SWIMLANE;
    }

    @Override
    public SwimlaneComponent withChildren(List<String> newChildren) {
        return new SwimlaneComponent(id, parent, position, size, style, textStyle, title, titleHeight,
            horizontal, newChildren, headerFill, collapsible, collapsed);
    }
}
