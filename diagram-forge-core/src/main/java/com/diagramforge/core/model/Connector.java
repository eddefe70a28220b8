package com.diagramforge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A directed link between two cells.
 *
 * @param id unique cell id
 * @param parent containing cell id, {@code null} for the default layer
 * @param source id of the source cell
 * @param target id of the target cell
 * @param label optional label
 * @param style routing and stroke style
 * @param waypoints intermediate routing points, in order
 */
public record Connector(
    String id,
    String parent,
    String source,
    String target,
    String label,
    ConnectorStyle style,
    List<Position> waypoints
) implements DiagramComponent {

    public Connector {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        if (style == null) {
            style = ConnectorStyle.empty();
        }
        waypoints = waypoints == null ? List.of() : List.copyOf(waypoints);
    }

    /**
     * Creates an unlabeled connector with default style.
     *
     * @param id connector id
     * @param source source cell id
     * @param target target cell id
     * @return new connector
     */
    public static Connector between(String id, String source, String target) {
        return new Connector(id, null, source, target, null, null, null);
    }

    @Override
    public ComponentKind kind() {
        return ComponentKind.CONNECTOR;
    }
}
