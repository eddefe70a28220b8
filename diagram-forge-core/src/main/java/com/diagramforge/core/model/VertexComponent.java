package com.diagramforge.core.model;

/**
 * A component rendered as a shape with its own geometry.
 *
 * <p>{@link #position()} and {@link #size()} may be {@code null}; the converter then falls back
 * to the configured default position and the catalog default size for the kind.
 */
public sealed interface VertexComponent extends DiagramComponent
    permits ShapeComponent, RoundedRectComponent, TriangleComponent, TextComponent, ImageComponent,
        CloudIconComponent, UmlClassComponent, UmlInterfaceComponent, CardComponent, ListComponent,
        TimelineComponent, TableComponent, ProcessComponent, CalloutComponent, ContainerComponent {

    Position position();

    Size size();

    ShapeStyle style();

    TextStyle textStyle();
}
