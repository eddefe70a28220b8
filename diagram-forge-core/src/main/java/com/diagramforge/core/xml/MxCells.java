package com.diagramforge.core.xml;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * DOM helpers for the diagram dialect's element vocabulary.
 */
public final class MxCells {

    public static final String CELL = "mxCell";
    public static final String GEOMETRY = "mxGeometry";
    public static final String POINT = "mxPoint";
    public static final String ARRAY = "Array";
    public static final String ROOT = "root";
    public static final String GRAPH_MODEL = "mxGraphModel";

    public static final String ATTR_ID = "id";
    public static final String ATTR_PARENT = "parent";
    public static final String ATTR_VALUE = "value";
    public static final String ATTR_STYLE = "style";
    public static final String ATTR_SOURCE = "source";
    public static final String ATTR_TARGET = "target";
    public static final String ATTR_AS = "as";

    private MxCells() {
    }

    /**
     * Returns every {@code mxCell} element in document order, at any depth.
     *
     * @param document parsed document
     * @return cell elements
     */
    public static List<Element> cells(Document document) {
        return elements(document.getElementsByTagName(CELL));
    }

    /**
     * Finds the first cell with the given id.
     *
     * @param document parsed document
     * @param id cell id
     * @return the cell, or empty
     */
    public static Optional<Element> findCell(Document document, String id) {
        for (Element cell : cells(document)) {
            if (id.equals(cell.getAttribute(ATTR_ID))) {
                return Optional.of(cell);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the {@code root} element cells are appended to. Falls back to the parent of the
     * first cell when the document has no {@code root} element.
     *
     * @param document parsed document
     * @return cell container, or empty if the document has neither
     */
    public static Optional<Element> cellContainer(Document document) {
        NodeList roots = document.getElementsByTagName(ROOT);
        if (roots.getLength() > 0) {
            return Optional.of((Element) roots.item(0));
        }
        List<Element> cells = cells(document);
        if (!cells.isEmpty() && cells.get(0).getParentNode() instanceof Element parent) {
            return Optional.of(parent);
        }
        return Optional.empty();
    }

    /**
     * Returns the direct element children with the given tag name.
     *
     * @param parent parent element
     * @param tagName tag to match
     * @return matching children in order
     */
    public static List<Element> childElements(Element parent, String tagName) {
        List<Element> result = new ArrayList<>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element element && tagName.equals(element.getTagName())) {
                result.add(element);
            }
        }
        return result;
    }

    /**
     * Returns the cell's geometry element: the child {@code mxGeometry as="geometry"}, or the
     * first {@code mxGeometry} child when none is tagged.
     *
     * @param cell cell element
     * @return geometry element, or empty
     */
    public static Optional<Element> geometry(Element cell) {
        List<Element> geometries = childElements(cell, GEOMETRY);
        return geometries.stream()
            .filter(g -> "geometry".equals(g.getAttribute(ATTR_AS)))
            .findFirst()
            .or(() -> geometries.stream().findFirst());
    }

    public static boolean isEdge(Element cell) {
        return "1".equals(cell.getAttribute("edge"));
    }

    public static boolean isVertex(Element cell) {
        return "1".equals(cell.getAttribute("vertex"));
    }

    /**
     * Returns the attribute value, or {@code null} when the attribute is absent.
     * {@link Element#getAttribute(String)} returns an empty string for both cases.
     *
     * @param element element
     * @param name attribute name
     * @return value or {@code null}
     */
    public static String attribute(Element element, String name) {
        return element.hasAttribute(name) ? element.getAttribute(name) : null;
    }

    /**
     * Returns whether the id is one of the two reserved cells.
     *
     * @param id cell id
     * @return {@code true} for {@code "0"} and {@code "1"}
     */
    public static boolean isReserved(String id) {
        return "0".equals(id) || "1".equals(id);
    }

    private static List<Element> elements(NodeList nodes) {
        List<Element> result = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        return result;
    }
}
