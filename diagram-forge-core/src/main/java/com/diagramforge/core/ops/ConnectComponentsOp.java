package com.diagramforge.core.ops;

import com.diagramforge.core.model.ConnectorStyle;
import com.diagramforge.core.model.Position;

import java.util.List;
import java.util.Objects;

/**
 * Creates a connector between two existing components.
 *
 * @param id new connector id, must not exist yet; a missing or blank id is derived from the endpoints
 * @param source existing source id
 * @param target existing target id
 * @param label optional label
 * @param style optional connector style
 * @param waypoints optional waypoints
 */
public record ConnectComponentsOp(
    String id,
    String source,
    String target,
    String label,
    ConnectorStyle style,
    List<Position> waypoints
) implements DiagramEditOp {

    public static final String TYPE = "connectComponents";

    public ConnectComponentsOp {
        id = id == null ? "" : id;
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        waypoints = waypoints == null ? List.of() : List.copyOf(waypoints);
    }

    public static ConnectComponentsOp of(String id, String source, String target) {
        return new ConnectComponentsOp(id, source, target, null, null, null);
    }

    @Override
    public String type() {
        return TYPE;
    }
}
