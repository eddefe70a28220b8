package com.diagramforge.core.analysis;

import java.util.List;

/**
 * Modification of one cell between two revisions.
 *
 * @param current the cell as it is now
 * @param changes human-readable change descriptions
 */
public record CellChange(CellSnapshot current, List<String> changes) {

    public CellChange {
        changes = changes == null ? List.of() : List.copyOf(changes);
    }

    public String id() {
        return current.id();
    }
}
