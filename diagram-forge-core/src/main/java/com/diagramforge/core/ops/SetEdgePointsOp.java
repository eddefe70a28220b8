package com.diagramforge.core.ops;

import com.diagramforge.core.model.Position;

import java.util.Objects;

/**
 * Sets the free source and/or target point of an edge.
 *
 * @param id edge cell id
 * @param sourcePoint new source point, or {@code null} to keep it
 * @param targetPoint new target point, or {@code null} to keep it
 */
public record SetEdgePointsOp(String id, Position sourcePoint, Position targetPoint) implements DiagramEditOp {

    public static final String TYPE = "setEdgePoints";

    public SetEdgePointsOp {
        Objects.requireNonNull(id, "id must not be null");
    }

    @Override
    public String type() {
        return TYPE;
    }
}
