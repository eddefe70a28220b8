package com.diagramforge.core.analysis;

import com.diagramforge.core.xml.MxCells;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Flat, attribute-level view of one cell. Absent attributes are {@code null}.
 *
 * @param id cell id
 * @param value value attribute
 * @param parent parent attribute
 * @param style style attribute
 * @param vertex whether {@code vertex="1"}
 * @param edge whether {@code edge="1"}
 * @param source edge source
 * @param target edge target
 * @param x geometry x
 * @param y geometry y
 * @param width geometry width
 * @param height geometry height
 */
public record CellSnapshot(
    String id,
    String value,
    String parent,
    String style,
    boolean vertex,
    boolean edge,
    String source,
    String target,
    String x,
    String y,
    String width,
    String height
) {
    public CellSnapshot {
        Objects.requireNonNull(id, "id must not be null");
    }

    /**
     * Reads the cells of a document, skipping cells without an id.
     *
     * @param document parsed document
     * @param limit maximum number of cell elements to read
     * @return snapshots in document order
     */
    public static List<CellSnapshot> extract(Document document, int limit) {
        List<Element> cells = MxCells.cells(document);
        List<CellSnapshot> snapshots = new ArrayList<>();
        for (int i = 0; i < cells.size() && i < limit; i++) {
            Element cell = cells.get(i);
            String id = MxCells.attribute(cell, MxCells.ATTR_ID);
            if (id == null || id.isEmpty()) {
                continue;
            }
            Element geometry = MxCells.childElements(cell, MxCells.GEOMETRY).stream().findFirst().orElse(null);
            snapshots.add(new CellSnapshot(
                id,
                MxCells.attribute(cell, MxCells.ATTR_VALUE),
                MxCells.attribute(cell, MxCells.ATTR_PARENT),
                MxCells.attribute(cell, MxCells.ATTR_STYLE),
                MxCells.isVertex(cell),
                MxCells.isEdge(cell),
                MxCells.attribute(cell, MxCells.ATTR_SOURCE),
                MxCells.attribute(cell, MxCells.ATTR_TARGET),
                geometry == null ? null : MxCells.attribute(geometry, "x"),
                geometry == null ? null : MxCells.attribute(geometry, "y"),
                geometry == null ? null : MxCells.attribute(geometry, "width"),
                geometry == null ? null : MxCells.attribute(geometry, "height")));
        }
        return snapshots;
    }

    public boolean isReserved() {
        return MxCells.isReserved(id);
    }

    /**
     * Returns whether the cell is a swimlane or declares itself a container.
     *
     * @return {@code true} for container vertices
     */
    public boolean isContainer() {
        return vertex && style != null && (style.contains("swimlane") || style.contains("container=1"));
    }

    /**
     * Returns the value with whitespace collapsed and cut to {@code max} characters.
     *
     * @param max maximum length
     * @return short label, empty when the cell has no value
     */
    public String shortLabel(int max) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        String collapsed = value.replaceAll("\\s+", " ");
        return collapsed.length() > max ? collapsed.substring(0, max) : collapsed;
    }
}
