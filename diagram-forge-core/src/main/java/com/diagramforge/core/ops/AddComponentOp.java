package com.diagramforge.core.ops;

import com.diagramforge.core.model.DiagramComponent;

import java.util.Objects;

/**
 * Adds a typed component, converted to a cell the same way full documents are generated.
 *
 * @param component component to add; its id must not exist yet
 */
public record AddComponentOp(DiagramComponent component) implements DiagramEditOp {

    public static final String TYPE = "addComponent";

    public AddComponentOp {
        Objects.requireNonNull(component, "component must not be null");
    }

    @Override
    public String type() {
        return TYPE;
    }
}
