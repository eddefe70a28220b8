package com.diagramforge.core.analysis;

import java.util.List;

/**
 * Cell-level difference between two revisions of a document. Reserved cells are ignored.
 *
 * @param added cells only in the newer revision
 * @param removed cells only in the older revision
 * @param modified cells present in both with different attributes
 */
public record XmlDiff(List<CellSnapshot> added, List<CellSnapshot> removed, List<CellChange> modified) {

    public XmlDiff {
        added = added == null ? List.of() : List.copyOf(added);
        removed = removed == null ? List.of() : List.copyOf(removed);
        modified = modified == null ? List.of() : List.copyOf(modified);
    }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty() && modified.isEmpty();
    }
}
