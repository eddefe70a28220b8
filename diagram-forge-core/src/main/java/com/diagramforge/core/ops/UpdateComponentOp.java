package com.diagramforge.core.ops;

import java.util.Objects;

/**
 * Updates geometry, text and recognized style keys of an existing component. Style keys
 * the update does not name are preserved.
 *
 * @param id component id
 * @param updates fields to overwrite
 */
public record UpdateComponentOp(String id, ComponentUpdates updates) implements DiagramEditOp {

    public static final String TYPE = "updateComponent";

    public UpdateComponentOp {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(updates, "updates must not be null");
    }

    @Override
    public String type() {
        return TYPE;
    }
}
