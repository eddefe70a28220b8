package com.diagramforge.core.analysis;

import com.diagramforge.core.config.EngineConfig;
import com.diagramforge.core.xml.XmlDocumentCodec;
import com.diagramforge.core.xml.XmlParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Produces a compact textual outline of a diagram: nodes, edges, containers and
 * reference warnings.
 *
 * <pre>
 * Nodes: 2
 * - api "API" parent=1 (x=40, y=40, w=120, h=60)
 * - db "Orders DB" parent=1 (x=240, y=40, w=120, h=80)
 *
 * Edges: 1
 * - e1 "reads" api -&gt; db
 * </pre>
 */
public class DiagramAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(DiagramAnalyzer.class);

    static final int LABEL_LENGTH = 60;
    static final int MAX_WARNING_IDS = 20;

    private final XmlDocumentCodec codec;
    private final EngineConfig.AnalysisSettings limits;

    public DiagramAnalyzer(XmlDocumentCodec codec) {
        this(codec, EngineConfig.defaults());
    }

    public DiagramAnalyzer(XmlDocumentCodec codec, EngineConfig config) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.limits = config.analysis();
    }

    /**
     * Builds the outline of a document.
     *
     * @param xml document text
     * @return outline, or a warning when the document does not parse
     */
    public String analyzeDiagramXml(String xml) {
        Document document;
        try {
            document = codec.parse(xml);
        } catch (XmlParseException e) {
            log.debug("Cannot analyze document: {}", e.getMessage());
            return String.join("\n",
                "Warnings:",
                "- Unable to parse XML (possibly an incomplete fragment).",
                "Analyze the current XML again or regenerate the diagram.");
        }

        List<CellSnapshot> cells = CellSnapshot.extract(document, limits.maxCells());
        Set<String> ids = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (CellSnapshot cell : cells) {
            if (!ids.add(cell.id())) {
                duplicates.add(cell.id());
            }
        }

        List<CellSnapshot> vertices = cells.stream()
            .filter(c -> c.vertex() && !c.edge() && !c.isReserved())
            .toList();
        List<CellSnapshot> edges = cells.stream().filter(CellSnapshot::edge).toList();
        List<CellSnapshot> containers = vertices.stream().filter(CellSnapshot::isContainer).toList();

        List<String> lines = new ArrayList<>();
        lines.add("Nodes: " + vertices.size());
        appendListed(lines, vertices, limits.maxListedNodes(), "nodes",
            n -> "- " + n.id() + quoted(n) + (n.parent() != null ? " parent=" + n.parent() : "") + bounds(n));

        lines.add("");
        lines.add("Edges: " + edges.size());
        appendListed(lines, edges, limits.maxListedEdges(), "edges",
            e -> "- " + e.id() + quoted(e) + " " + orUnknown(e.source()) + " -> " + orUnknown(e.target()));

        if (!containers.isEmpty()) {
            lines.add("");
            lines.add("Containers/Swimlanes: " + containers.size());
            appendListed(lines, containers, limits.maxListedNodes(), "containers",
                c -> "- " + c.id() + quoted(c) + bounds(c));
        }

        List<String> warnings = warnings(cells, vertices, edges, ids, duplicates);
        if (!warnings.isEmpty()) {
            lines.add("");
            lines.add("Warnings:");
            lines.addAll(warnings);
        }
        return String.join("\n", lines);
    }

    private List<String> warnings(List<CellSnapshot> cells, List<CellSnapshot> vertices, List<CellSnapshot> edges,
                                  Set<String> ids, Set<String> duplicates) {
        List<String> warnings = new ArrayList<>();
        if (!duplicates.isEmpty()) {
            warnings.add("- Duplicate ids: " + joinLimited(new ArrayList<>(duplicates), Function.identity()));
        }

        List<CellSnapshot> missingParent = vertices.stream().filter(c -> c.parent() == null || c.parent().isEmpty()).toList();
        if (!missingParent.isEmpty()) {
            warnings.add("- Nodes without parent: " + joinLimited(missingParent, CellSnapshot::id));
        }
        List<CellSnapshot> invalidParent = vertices.stream()
            .filter(c -> c.parent() != null && !c.parent().isEmpty() && !ids.contains(c.parent()))
            .toList();
        if (!invalidParent.isEmpty()) {
            warnings.add("- Parents referencing missing cells: " + joinLimited(invalidParent, c -> c.id() + "->" + c.parent()));
        }

        List<CellSnapshot> missingEnds = edges.stream()
            .filter(e -> isBlank(e.source()) || isBlank(e.target()))
            .toList();
        if (!missingEnds.isEmpty()) {
            warnings.add("- Edges without source/target: " + joinLimited(missingEnds, CellSnapshot::id));
        }
        List<CellSnapshot> danglingEnds = edges.stream()
            .filter(e -> (!isBlank(e.source()) && !ids.contains(e.source()))
                || (!isBlank(e.target()) && !ids.contains(e.target())))
            .toList();
        if (!danglingEnds.isEmpty()) {
            warnings.add("- Edges referencing missing cells: " + joinLimited(danglingEnds,
                e -> e.id() + "(" + orUnknown(e.source()) + "->" + orUnknown(e.target()) + ")"));
        }

        if (cells.size() >= limits.maxCells()) {
            warnings.add("- Only the first " + limits.maxCells() + " mxCell elements were analyzed.");
        }
        return warnings;
    }

    private static void appendListed(List<String> lines, List<CellSnapshot> cells, int max, String noun,
                                     Function<CellSnapshot, String> format) {
        cells.stream().limit(max).map(format).forEach(lines::add);
        if (cells.size() > max) {
            lines.add("- ...(" + (cells.size() - max) + " more " + noun + " omitted)");
        }
    }

    private static <T> String joinLimited(List<T> items, Function<T, String> format) {
        String joined = items.stream().limit(MAX_WARNING_IDS).map(format).collect(Collectors.joining(", "));
        return items.size() > MAX_WARNING_IDS ? joined + " ..." : joined;
    }

    private static String quoted(CellSnapshot cell) {
        String label = cell.shortLabel(LABEL_LENGTH);
        return label.isEmpty() ? "" : " \"" + label + "\"";
    }

    private static String bounds(CellSnapshot cell) {
        List<String> parts = new ArrayList<>();
        addPart(parts, "x", cell.x());
        addPart(parts, "y", cell.y());
        addPart(parts, "w", cell.width());
        addPart(parts, "h", cell.height());
        return parts.isEmpty() ? "" : " (" + String.join(", ", parts) + ")";
    }

    private static void addPart(List<String> parts, String name, String value) {
        if (!isBlank(value)) {
            parts.add(name + "=" + value);
        }
    }

    private static String orUnknown(String value) {
        return isBlank(value) ? "?" : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isEmpty();
    }
}
