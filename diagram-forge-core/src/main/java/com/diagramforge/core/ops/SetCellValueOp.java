package com.diagramforge.core.ops;

import java.util.Objects;

/**
 * Replaces a cell's text value.
 *
 * @param id cell id
 * @param value new value
 * @param escape {@code false} when the value is already entity-escaped; {@code null} or
 *               {@code true} for raw text
 */
public record SetCellValueOp(String id, String value, Boolean escape) implements DiagramEditOp {

    public static final String TYPE = "setCellValue";

    public SetCellValueOp {
        Objects.requireNonNull(id, "id must not be null");
        if (value == null) {
            value = "";
        }
    }

    public SetCellValueOp(String id, String value) {
        this(id, value, null);
    }

    @Override
    public String type() {
        return TYPE;
    }
}
