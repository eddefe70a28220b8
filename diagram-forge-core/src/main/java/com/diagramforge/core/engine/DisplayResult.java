package com.diagramforge.core.engine;

import java.util.List;
import java.util.Objects;

/**
 * Document ready for rendering.
 *
 * @param xml complete {@code mxfile} document
 * @param fixes auto-fixes applied to reach a valid document, empty when none were needed
 */
public record DisplayResult(String xml, List<String> fixes) {

    public DisplayResult {
        Objects.requireNonNull(xml, "xml must not be null");
        fixes = fixes == null ? List.of() : List.copyOf(fixes);
    }
}
