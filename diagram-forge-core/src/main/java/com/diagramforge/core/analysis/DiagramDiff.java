package com.diagramforge.core.analysis;

import com.diagramforge.core.config.EngineConfig;
import com.diagramforge.core.xml.XmlDocumentCodec;
import com.diagramforge.core.xml.XmlParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Compares two revisions of a diagram and summarizes what changed.
 */
public class DiagramDiff {

    private static final Logger log = LoggerFactory.getLogger(DiagramDiff.class);

    static final String NO_CHANGES = "No changes detected";
    static final String PARSE_FAILED = "Unable to compare XML (parsing failed)";

    private final XmlDocumentCodec codec;
    private final EngineConfig.AnalysisSettings limits;

    public DiagramDiff(XmlDocumentCodec codec) {
        this(codec, EngineConfig.defaults());
    }

    public DiagramDiff(XmlDocumentCodec codec, EngineConfig config) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.limits = config.analysis();
    }

    /**
     * Computes the cell-level difference.
     *
     * @param previousXml older revision
     * @param currentXml newer revision
     * @return the difference, or empty when either side does not parse
     */
    public Optional<XmlDiff> compare(String previousXml, String currentXml) {
        Map<String, CellSnapshot> previous;
        Map<String, CellSnapshot> current;
        try {
            previous = index(previousXml);
            current = index(currentXml);
        } catch (XmlParseException e) {
            log.debug("Cannot diff documents: {}", e.getMessage());
            return Optional.empty();
        }

        List<CellSnapshot> added = new ArrayList<>();
        List<CellChange> modified = new ArrayList<>();
        for (CellSnapshot cell : current.values()) {
            if (cell.isReserved()) {
                continue;
            }
            CellSnapshot before = previous.get(cell.id());
            if (before == null) {
                added.add(cell);
            } else if (!before.equals(cell)) {
                List<String> changes = describeChanges(before, cell);
                if (!changes.isEmpty()) {
                    modified.add(new CellChange(cell, changes));
                }
            }
        }
        List<CellSnapshot> removed = previous.values().stream()
            .filter(cell -> !cell.isReserved() && !current.containsKey(cell.id()))
            .toList();
        return Optional.of(new XmlDiff(added, removed, modified));
    }

    /**
     * Renders the difference as text.
     *
     * @param previousXml older revision
     * @param currentXml newer revision
     * @return change summary
     */
    public String generateXmlDiff(String previousXml, String currentXml) {
        Optional<XmlDiff> compared = compare(previousXml, currentXml);
        if (compared.isEmpty()) {
            return PARSE_FAILED;
        }
        XmlDiff diff = compared.get();
        if (diff.isEmpty()) {
            return NO_CHANGES;
        }

        List<String> lines = new ArrayList<>();
        lines.add("Changes:");
        lines.add("");
        appendSection(lines, "Added", diff.added(), DiagramDiff::formatCell);
        appendSection(lines, "Removed", diff.removed(), DiagramDiff::formatCell);
        appendSection(lines, "Modified", diff.modified(),
            change -> formatCell(change.current()) + ": " + String.join(", ", change.changes()));
        return String.join("\n", lines).trim();
    }

    static List<String> describeChanges(CellSnapshot before, CellSnapshot after) {
        List<String> changes = new ArrayList<>();
        if (!Objects.equals(before.value(), after.value())) {
            changes.add("label: \"" + before.value() + "\" → \"" + after.value() + "\"");
        }
        if (!Objects.equals(before.style(), after.style())) {
            changes.add("style changed");
        }
        if (!Objects.equals(before.parent(), after.parent())) {
            changes.add("parent: " + before.parent() + " → " + after.parent());
        }
        if (!Objects.equals(before.source(), after.source()) || !Objects.equals(before.target(), after.target())) {
            changes.add("connection: " + before.source() + "→" + before.target()
                + " to " + after.source() + "→" + after.target());
        }
        if (!Objects.equals(before.x(), after.x()) || !Objects.equals(before.y(), after.y())) {
            changes.add("position changed");
        }
        if (!Objects.equals(before.width(), after.width()) || !Objects.equals(before.height(), after.height())) {
            changes.add("size changed");
        }
        return changes;
    }

    private Map<String, CellSnapshot> index(String xml) throws XmlParseException {
        Map<String, CellSnapshot> cells = new LinkedHashMap<>();
        for (CellSnapshot cell : CellSnapshot.extract(codec.parse(xml), limits.maxCells())) {
            cells.put(cell.id(), cell);
        }
        return cells;
    }

    private <T> void appendSection(List<String> lines, String title, List<T> items, Function<T, String> format) {
        if (items.isEmpty()) {
            return;
        }
        int max = limits.maxDiffEntries();
        lines.add(title + " " + items.size() + " elements:");
        items.stream().limit(max).map(item -> "- " + format.apply(item)).forEach(lines::add);
        if (items.size() > max) {
            lines.add("- ...and " + (items.size() - max) + " more");
        }
        lines.add("");
    }

    private static String formatCell(CellSnapshot cell) {
        String type = cell.vertex() ? "node" : cell.edge() ? "edge" : "cell";
        String label = cell.value() == null || cell.value().isEmpty() ? "" : " \"" + cell.value() + "\"";
        return type + " " + cell.id() + label;
    }
}
