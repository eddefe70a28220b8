package com.diagramforge.core.ops;

import com.diagramforge.core.convert.ComponentXmlConverter;
import com.diagramforge.core.model.Connector;
import com.diagramforge.core.model.DiagramComponent;
import com.diagramforge.core.model.Position;
import com.diagramforge.core.style.StyleMap;
import com.diagramforge.core.util.IdGenerator;
import com.diagramforge.core.util.Numbers;
import com.diagramforge.core.xml.MxCells;
import com.diagramforge.core.xml.XmlDocumentCodec;
import com.diagramforge.core.xml.XmlParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.List;
import java.util.Objects;

/**
 * Applies batches of {@link DiagramEditOp} to a diagram document.
 *
 * <p>Every batch runs on a freshly parsed document, so a failing operation leaves nothing
 * behind: the caller either gets the fully edited XML or an error.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * EditResult result = executor.apply(xml, List.of(new DeleteCellOp("old")));
 * if (result.isSuccess()) {
 *     save(result.xml());
 * }
 * }</pre>
 */
public class DiagramOpsExecutor {

    private static final Logger log = LoggerFactory.getLogger(DiagramOpsExecutor.class);

    private final XmlDocumentCodec codec;
    private final ComponentXmlConverter converter;

    public DiagramOpsExecutor(XmlDocumentCodec codec, ComponentXmlConverter converter) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.converter = Objects.requireNonNull(converter, "converter must not be null");
    }

    /**
     * Applies the operations in order.
     *
     * @param xml current document
     * @param ops operations; {@code null} or empty returns the document unchanged
     * @return edited document or the first failure
     */
    public EditResult apply(String xml, List<? extends DiagramEditOp> ops) {
        if (ops == null || ops.isEmpty()) {
            return EditResult.success(xml);
        }

        Document document;
        try {
            document = codec.parse(xml);
        } catch (XmlParseException e) {
            log.debug("Edit rejected, current document does not parse: {}", e.getMessage());
            return EditResult.failure("XML_PARSE_ERROR: Current diagram XML cannot be parsed (" + e.getMessage()
                + "). Regenerate a complete, parseable diagram first.");
        }

        for (int i = 0; i < ops.size(); i++) {
            DiagramEditOp op = ops.get(i);
            try {
                applyOne(document, op);
            } catch (DiagramOperationException e) {
                String type = op == null ? null : op.type();
                log.debug("Operation #{} ({}) failed: {}", i, type, e.getMessage());
                return EditResult.failure("Operation #" + i + " (" + type + ") failed: " + e.getMessage(), i);
            } catch (RuntimeException e) {
                String type = op == null ? null : op.type();
                String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                log.warn("Operation #{} ({}) failed unexpectedly", i, type, e);
                return EditResult.failure("Operation #" + i + " (" + type + ") failed: " + reason, i);
            }
        }

        log.debug("Applied {} edit operations", ops.size());
        return EditResult.success(codec.serialize(document));
    }

    private void applyOne(Document document, DiagramEditOp op) {
        if (op instanceof SetEdgePointsOp setPoints) {
            setEdgePoints(document, setPoints);
        } else if (op instanceof SetCellValueOp setValue) {
            Element cell = requireCell(document, setValue.id());
            MarkupText.assign(cell, setValue.value(), Boolean.FALSE.equals(setValue.escape()));
        } else if (op instanceof UpdateCellOp update) {
            updateCell(document, update);
        } else if (op instanceof AddCellOp add) {
            addCell(document, add);
        } else if (op instanceof DeleteCellOp delete) {
            MxCells.findCell(document, delete.id()).ifPresent(cell -> cell.getParentNode().removeChild(cell));
        } else if (op instanceof AddComponentOp add) {
            addComponent(document, add.component());
        } else if (op instanceof UpdateComponentOp update) {
            updateComponent(document, update);
        } else if (op instanceof ConnectComponentsOp connect) {
            connectComponents(document, connect);
        } else {
            throw new DiagramOperationException("Unsupported op type: " + (op == null ? null : op.type()));
        }
    }

    private void setEdgePoints(Document document, SetEdgePointsOp op) {
        Element cell = requireCell(document, op.id());
        if (!MxCells.isEdge(cell)) {
            throw new DiagramOperationException("Cell id=\"" + op.id() + "\" is not an edge (missing edge=\"1\")");
        }
        Element geometry = ensureGeometry(document, cell);
        if (!geometry.hasAttribute("relative")) {
            geometry.setAttribute("relative", "1");
        }
        if (op.sourcePoint() != null) {
            upsertPoint(document, geometry, "sourcePoint", op.sourcePoint());
        }
        if (op.targetPoint() != null) {
            upsertPoint(document, geometry, "targetPoint", op.targetPoint());
        }
    }

    private void updateCell(Document document, UpdateCellOp op) {
        Element cell = requireCell(document, op.id());
        if (op.style() != null) {
            cell.setAttribute(MxCells.ATTR_STYLE, op.style());
        }
        if (op.value() != null) {
            MarkupText.assign(cell, op.value(), false);
        }
        if (op.geometry() != null) {
            applyGeometry(ensureGeometry(document, cell), op.geometry());
        }
    }

    private void addCell(Document document, AddCellOp op) {
        requireAbsent(document, "Cell", op.id());
        String parent = op.parent() != null ? op.parent() : DiagramComponent.DEFAULT_LAYER_ID;
        if (MxCells.findCell(document, parent).isEmpty()) {
            throw new DiagramOperationException("Parent cell id=\"" + parent + "\" not found");
        }

        Element cell = document.createElement(MxCells.CELL);
        cell.setAttribute(MxCells.ATTR_ID, op.id());
        if (op.style() != null) {
            cell.setAttribute(MxCells.ATTR_STYLE, op.style());
        }
        MarkupText.assign(cell, op.value(), false);
        if (Boolean.TRUE.equals(op.vertex())) {
            cell.setAttribute("vertex", "1");
        }
        if (Boolean.TRUE.equals(op.edge())) {
            cell.setAttribute("edge", "1");
        }
        cell.setAttribute(MxCells.ATTR_PARENT, parent);
        if (op.source() != null) {
            cell.setAttribute(MxCells.ATTR_SOURCE, op.source());
        }
        if (op.target() != null) {
            cell.setAttribute(MxCells.ATTR_TARGET, op.target());
        }

        if (Boolean.TRUE.equals(op.edge()) && op.geometry() == null) {
            Element geometry = ensureGeometry(document, cell);
            geometry.setAttribute("relative", "1");
        } else if (op.geometry() != null || Boolean.TRUE.equals(op.vertex())) {
            CellGeometry requested = op.geometry() != null ? op.geometry() : new CellGeometry(0.0, 0.0, null, null);
            applyGeometry(ensureGeometry(document, cell), requested);
        }
        container(document).appendChild(cell);
    }

    private void addComponent(Document document, DiagramComponent component) {
        requireAbsent(document, "Component", component.id());
        importCell(document, converter.componentToCellXml(component));
    }

    private void updateComponent(Document document, UpdateComponentOp op) {
        Element cell = MxCells.findCell(document, op.id())
            .orElseThrow(() -> new DiagramOperationException("Component id=\"" + op.id() + "\" not found"));
        ComponentUpdates updates = op.updates();

        if (updates.position() != null || updates.size() != null) {
            Element geometry = ensureGeometry(document, cell);
            if (updates.position() != null) {
                geometry.setAttribute("x", Numbers.format(updates.position().x()));
                geometry.setAttribute("y", Numbers.format(updates.position().y()));
            }
            if (updates.size() != null) {
                geometry.setAttribute("width", Numbers.format(updates.size().width()));
                geometry.setAttribute("height", Numbers.format(updates.size().height()));
            }
        }

        StyleMap style = StyleMap.parse(MxCells.attribute(cell, MxCells.ATTR_STYLE));
        putIfSet(style, "fillColor", updates.fill());
        putIfSet(style, "strokeColor", updates.stroke());
        putIfSet(style, "strokeWidth", updates.strokeWidth());
        putIfSet(style, "opacity", updates.opacity());
        putIfSet(style, "fontSize", updates.fontSize());
        putIfSet(style, "fontColor", updates.fontColor());
        putIfSet(style, "shadow", updates.shadow());
        putIfSet(style, "dashed", updates.dashed());
        cell.setAttribute(MxCells.ATTR_STYLE, style.serialize());

        String value = updates.valueUpdate();
        if (value != null) {
            MarkupText.assign(cell, value, false);
        }
    }

    private void connectComponents(Document document, ConnectComponentsOp op) {
        String id = op.id().isBlank() ? "edge-" + IdGenerator.generate(op.source(), op.target()) : op.id();
        requireAbsent(document, "Connector", id);
        if (MxCells.findCell(document, op.source()).isEmpty()) {
            throw new DiagramOperationException("Source component id=\"" + op.source() + "\" not found");
        }
        if (MxCells.findCell(document, op.target()).isEmpty()) {
            throw new DiagramOperationException("Target component id=\"" + op.target() + "\" not found");
        }
        Connector connector = new Connector(id, null, op.source(), op.target(), op.label(), op.style(),
            op.waypoints());
        importCell(document, converter.connectorToCellXml(connector));
    }

    private void importCell(Document document, String cellXml) {
        Document fragment;
        try {
            fragment = codec.parse(cellXml);
        } catch (XmlParseException e) {
            throw new DiagramOperationException("Generated cell is not well-formed: " + e.getMessage());
        }
        Node imported = document.importNode(fragment.getDocumentElement(), true);
        container(document).appendChild(imported);
    }

    private static Element requireCell(Document document, String id) {
        return MxCells.findCell(document, id)
            .orElseThrow(() -> new DiagramOperationException("Cell id=\"" + id + "\" not found"));
    }

    private static void requireAbsent(Document document, String what, String id) {
        if (MxCells.findCell(document, id).isPresent()) {
            throw new DiagramOperationException(what + " id=\"" + id + "\" already exists");
        }
    }

    private static Element container(Document document) {
        return MxCells.cellContainer(document)
            .orElseThrow(() -> new DiagramOperationException("Document has no <root> element"));
    }

    private static Element ensureGeometry(Document document, Element cell) {
        return MxCells.geometry(cell).orElseGet(() -> {
            Element geometry = document.createElement(MxCells.GEOMETRY);
            geometry.setAttribute(MxCells.ATTR_AS, "geometry");
            cell.appendChild(geometry);
            return geometry;
        });
    }

    private static void applyGeometry(Element geometry, CellGeometry requested) {
        setNumber(geometry, "x", requested.x());
        setNumber(geometry, "y", requested.y());
        setNumber(geometry, "width", requested.width());
        setNumber(geometry, "height", requested.height());
    }

    private static void upsertPoint(Document document, Element geometry, String role, Position position) {
        Element point = MxCells.childElements(geometry, MxCells.POINT).stream()
            .filter(p -> role.equals(p.getAttribute(MxCells.ATTR_AS)))
            .findFirst()
            .orElseGet(() -> {
                Element created = document.createElement(MxCells.POINT);
                created.setAttribute(MxCells.ATTR_AS, role);
                geometry.appendChild(created);
                return created;
            });
        point.setAttribute("x", Numbers.format(position.x()));
        point.setAttribute("y", Numbers.format(position.y()));
    }

    private static void setNumber(Element element, String name, Double value) {
        if (value != null) {
            element.setAttribute(name, Numbers.format(value));
        }
    }

    private static void putIfSet(StyleMap style, String key, Object value) {
        if (value instanceof Boolean flag) {
            style.put(key, flag ? "1" : "0");
        } else if (value instanceof Double number) {
            style.put(key, Numbers.format(number));
        } else if (value != null) {
            style.put(key, value.toString());
        }
    }
}
