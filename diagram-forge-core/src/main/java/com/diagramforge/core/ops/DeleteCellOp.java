package com.diagramforge.core.ops;

import java.util.Objects;

/**
 * Deletes a cell. Deleting an absent id is a no-op.
 *
 * @param id cell id
 */
public record DeleteCellOp(String id) implements DiagramEditOp {

    public static final String TYPE = "deleteCell";

    public DeleteCellOp {
        Objects.requireNonNull(id, "id must not be null");
    }

    @Override
    public String type() {
        return TYPE;
    }
}
