package com.diagramforge.core.model;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A vertex whose only content is a label: the plain geometric shapes, the network icons,
 * and the actor/document/cloud shapes. The {@code kind} field selects which.
 *
 * @param kind one of {@link #SUPPORTED_KINDS}
 * @param id unique cell id
 * @param parent containing cell id, {@code null} for the default layer
 * @param position top-left corner, or {@code null} for the default position
 * @param size explicit size, or {@code null} for the catalog default
 * @param style shape style bag
 * @param textStyle text style bag
 * @param label label text (may contain markup)
 */
public record ShapeComponent(
    ComponentKind kind,
    String id,
    String parent,
    Position position,
    Size size,
    ShapeStyle style,
    TextStyle textStyle,
    String label
) implements VertexComponent {

    /** Kinds represented by this record. */
    public static final Set<ComponentKind> SUPPORTED_KINDS = EnumSet.of(
        ComponentKind.RECTANGLE, ComponentKind.ELLIPSE, ComponentKind.DIAMOND, ComponentKind.HEXAGON,
        ComponentKind.CYLINDER, ComponentKind.PARALLELOGRAM, ComponentKind.STEP, ComponentKind.NOTE,
        ComponentKind.SERVER, ComponentKind.DESKTOP, ComponentKind.LAPTOP, ComponentKind.ROUTER,
        ComponentKind.SWITCH, ComponentKind.FIREWALL, ComponentKind.INTERNET, ComponentKind.DATABASE,
        ComponentKind.ACTOR, ComponentKind.DOCUMENT, ComponentKind.CLOUD
    );

    /**
     * Compact constructor with validation.
     */
    public ShapeComponent {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(id, "id must not be null");
        if (!SUPPORTED_KINDS.contains(kind)) {
            throw new IllegalArgumentException("Kind " + kind + " is not a plain labeled shape");
        }
        if (style == null) {
            style = ShapeStyle.empty();
        }
        if (textStyle == null) {
            textStyle = TextStyle.empty();
        }
    }

    /**
     * Creates a shape with default geometry and styles.
     *
     * @param kind shape kind
     * @param id cell id
     * @param label label text
     * @return new shape
     */
    public static ShapeComponent of(ComponentKind kind, String id, String label) {
        return new ShapeComponent(kind, id, null, null, null, null, null, label);
    }

    /**
     * Creates a shape at an explicit position with the default size.
     *
     * @param kind shape kind
     * @param id cell id
     * @param label label text
     * @param x left edge
     * @param y top edge
     * @return new shape
     */
    public static ShapeComponent at(ComponentKind kind, String id, String label, double x, double y) {
        return new ShapeComponent(kind, id, null, new Position(x, y), null, null, null, label);
    }
}
