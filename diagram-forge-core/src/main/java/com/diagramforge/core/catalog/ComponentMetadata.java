package com.diagramforge.core.catalog;

import com.diagramforge.core.model.ComponentKind;
import com.diagramforge.core.model.Size;

import java.util.Objects;

/**
 * Static metadata for one component kind.
 *
 * @param kind the kind described
 * @param defaultSize size used when a component omits one
 * @param baseStyle fixed style fragment the kind always contributes (without trailing separator)
 * @param edge whether the kind is serialized as an edge cell
 * @param container whether the kind can hold child cells
 */
public record ComponentMetadata(
    ComponentKind kind,
    Size defaultSize,
    String baseStyle,
    boolean edge,
    boolean container
) {
    public ComponentMetadata {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(defaultSize, "defaultSize must not be null");
        if (baseStyle == null) {
            baseStyle = "";
        }
    }
}
