package com.diagramforge.core.ops;

import java.util.Objects;

/**
 * Adds a raw cell.
 *
 * @param id new cell id, must not exist yet
 * @param parent parent id, {@code null} for the default layer; must exist
 * @param value cell value
 * @param style style string
 * @param vertex mark as vertex
 * @param edge mark as edge
 * @param source edge source id
 * @param target edge target id
 * @param geometry vertex geometry
 */
public record AddCellOp(
    String id,
    String parent,
    String value,
    String style,
    Boolean vertex,
    Boolean edge,
    String source,
    String target,
    CellGeometry geometry
) implements DiagramEditOp {

    public static final String TYPE = "addCell";

    public AddCellOp {
        Objects.requireNonNull(id, "id must not be null");
    }

    /**
     * Creates a vertex cell under the given parent.
     *
     * @param id cell id
     * @param parent parent id
     * @param value value
     * @param style style string
     * @param geometry geometry
     * @return new operation
     */
    public static AddCellOp vertex(String id, String parent, String value, String style, CellGeometry geometry) {
        return new AddCellOp(id, parent, value, style, Boolean.TRUE, null, null, null, geometry);
    }

    @Override
    public String type() {
        return TYPE;
    }
}
