package com.diagramforge.core.ops;

import java.util.Objects;

/**
 * Updates value, style and/or geometry of a raw cell. {@code null} fields are left unchanged.
 *
 * @param id cell id
 * @param value new value
 * @param style new style string, replacing the old one
 * @param geometry geometry fields to overwrite
 */
public record UpdateCellOp(String id, String value, String style, CellGeometry geometry) implements DiagramEditOp {

    public static final String TYPE = "updateCell";

    public UpdateCellOp {
        Objects.requireNonNull(id, "id must not be null");
    }

    @Override
    public String type() {
        return TYPE;
    }
}
