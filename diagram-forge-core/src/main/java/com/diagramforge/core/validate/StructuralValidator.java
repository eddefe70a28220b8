package com.diagramforge.core.validate;

import com.diagramforge.core.xml.MxCells;
import com.diagramforge.core.xml.XmlDocumentCodec;
import com.diagramforge.core.xml.XmlParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Checks the structural invariants of a diagram document and reports the first one that
 * is violated, in {@link ViolationCode} order.
 */
public class StructuralValidator {

    private static final Logger log = LoggerFactory.getLogger(StructuralValidator.class);

    private final XmlDocumentCodec codec;

    public StructuralValidator(XmlDocumentCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    /**
     * Validates the document.
     *
     * @param xml document text
     * @return the first violation, or empty when the document is structurally sound
     */
    public Optional<StructuralViolation> validate(String xml) {
        Document document;
        try {
            document = codec.parse(xml == null ? "" : xml);
        } catch (XmlParseException e) {
            log.debug("Validation failed to parse document: {}", e.getMessage());
            return Optional.of(new StructuralViolation(ViolationCode.PARSE_ERROR,
                "XML syntax error (" + e.getMessage() + "). Common cause: unescaped <, >, & or \" in an attribute value.",
                List.of(),
                "Escape special characters (< as &lt;, > as &gt;, & as &amp;, \" as &quot;) and regenerate the diagram."));
        }
        return validate(document);
    }

    /**
     * Validates an already parsed document.
     *
     * @param document parsed document
     * @return the first violation, or empty
     */
    public Optional<StructuralViolation> validate(Document document) {
        List<Element> cells = MxCells.cells(document);

        Set<String> ids = new HashSet<>();
        List<String> duplicates = new ArrayList<>();
        List<String> nested = new ArrayList<>();
        List<String> missingParent = new ArrayList<>();
        List<Element> withParent = new ArrayList<>();
        List<Element> edges = new ArrayList<>();

        for (Element cell : cells) {
            String id = cell.getAttribute(MxCells.ATTR_ID);
            if (!id.isEmpty() && !ids.add(id)) {
                duplicates.add(id);
            }
            Node parentNode = cell.getParentNode();
            if (parentNode instanceof Element parentElement && MxCells.CELL.equals(parentElement.getTagName())) {
                nested.add(orUnknown(id));
            }
            if (!"0".equals(id)) {
                if (cell.getAttribute(MxCells.ATTR_PARENT).isEmpty()) {
                    if (!id.isEmpty()) {
                        missingParent.add(id);
                    }
                } else {
                    withParent.add(cell);
                }
            }
            if (MxCells.isEdge(cell)) {
                edges.add(cell);
            }
        }

        if (!nested.isEmpty()) {
            return violation(ViolationCode.NESTED_CELL,
                "Found an mxCell nested inside another mxCell.",
                nested,
                "Move every mxCell so it is a direct child of <root>.");
        }
        if (!duplicates.isEmpty()) {
            return violation(ViolationCode.DUPLICATE_ID,
                "Found duplicate mxCell ids; every id must be unique.",
                duplicates,
                "Give every new vertex and edge an id that is not used anywhere else in the document.");
        }
        if (!missingParent.isEmpty()) {
            return violation(ViolationCode.MISSING_PARENT,
                "Found an mxCell without a parent; every cell except id=\"0\" needs one.",
                missingParent,
                "Add parent=\"1\" or the id of an existing container to the cell.");
        }

        List<String> invalidParents = withParent.stream()
            .filter(cell -> !ids.contains(cell.getAttribute(MxCells.ATTR_PARENT)))
            .map(cell -> orUnknown(cell.getAttribute(MxCells.ATTR_ID)))
            .toList();
        if (!invalidParents.isEmpty()) {
            return violation(ViolationCode.INVALID_PARENT,
                "Found a parent attribute referencing a cell that does not exist.",
                invalidParents,
                "Point parent at an existing cell id, usually parent=\"1\" or a container or swimlane id.");
        }

        List<String> invalidRefs = new ArrayList<>();
        for (Element edge : edges) {
            String id = orUnknown(edge.getAttribute(MxCells.ATTR_ID));
            String source = edge.getAttribute(MxCells.ATTR_SOURCE);
            String target = edge.getAttribute(MxCells.ATTR_TARGET);
            if (!source.isEmpty() && !ids.contains(source)) {
                invalidRefs.add(id + " (source:" + source + ")");
            }
            if (!target.isEmpty() && !ids.contains(target)) {
                invalidRefs.add(id + " (target:" + target + ")");
            }
        }
        if (!invalidRefs.isEmpty()) {
            return violation(ViolationCode.INVALID_EDGE_REF,
                "Found an edge whose source or target references a cell that does not exist.",
                invalidRefs,
                "Make edge source and target reference vertex ids present in the document.");
        }

        List<String> orphanedPoints = orphanedPointOwners(document);
        if (!orphanedPoints.isEmpty()) {
            return violation(ViolationCode.ORPHANED_MXPOINT,
                "Found an mxPoint outside <Array as=\"points\"> and without an as attribute.",
                orphanedPoints,
                "Add as=\"sourcePoint\" or as=\"targetPoint\" to the mxPoint, or move it into <Array as=\"points\">.");
        }
        return Optional.empty();
    }

    /**
     * Returns whether the document has no structural violation.
     *
     * @param xml document text
     * @return {@code true} if valid
     */
    public boolean isValid(String xml) {
        return validate(xml).isEmpty();
    }

    private static List<String> orphanedPointOwners(Document document) {
        Set<String> owners = new LinkedHashSet<>();
        NodeList points = document.getElementsByTagName(MxCells.POINT);
        for (int i = 0; i < points.getLength(); i++) {
            Element point = (Element) points.item(i);
            if (point.hasAttribute(MxCells.ATTR_AS) || isInPointsArray(point)) {
                continue;
            }
            Node ancestor = point.getParentNode();
            while (ancestor instanceof Element element && !MxCells.CELL.equals(element.getTagName())) {
                ancestor = element.getParentNode();
            }
            String owner = ancestor instanceof Element cell ? cell.getAttribute(MxCells.ATTR_ID) : "";
            owners.add(orUnknown(owner));
        }
        return new ArrayList<>(owners);
    }

    private static boolean isInPointsArray(Element point) {
        return point.getParentNode() instanceof Element parent
            && MxCells.ARRAY.equals(parent.getTagName())
            && "points".equals(parent.getAttribute(MxCells.ATTR_AS));
    }

    private static String orUnknown(String id) {
        return id == null || id.isEmpty() ? "unknown" : id;
    }

    private static Optional<StructuralViolation> violation(ViolationCode code, String message, List<String> ids,
                                                           String hint) {
        return Optional.of(new StructuralViolation(code, message, ids, hint));
    }
}
