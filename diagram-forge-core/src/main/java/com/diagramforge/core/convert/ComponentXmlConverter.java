package com.diagramforge.core.convert;

import com.diagramforge.core.catalog.CloudProvider;
import com.diagramforge.core.catalog.ComponentCatalog;
import com.diagramforge.core.config.EngineConfig;
import com.diagramforge.core.model.CalloutComponent;
import com.diagramforge.core.model.CardComponent;
import com.diagramforge.core.model.CloudIconComponent;
import com.diagramforge.core.model.Connector;
import com.diagramforge.core.model.ConnectorStyle;
import com.diagramforge.core.model.DiagramComponent;
import com.diagramforge.core.model.GroupComponent;
import com.diagramforge.core.model.ImageComponent;
import com.diagramforge.core.model.ListComponent;
import com.diagramforge.core.model.Position;
import com.diagramforge.core.model.ProcessComponent;
import com.diagramforge.core.model.ProcessStep;
import com.diagramforge.core.model.RoundedRectComponent;
import com.diagramforge.core.model.ShapeComponent;
import com.diagramforge.core.model.ShapeStyle;
import com.diagramforge.core.model.Size;
import com.diagramforge.core.model.SwimlaneComponent;
import com.diagramforge.core.model.TableComponent;
import com.diagramforge.core.model.TextComponent;
import com.diagramforge.core.model.TextStyle;
import com.diagramforge.core.model.TimelineComponent;
import com.diagramforge.core.model.TriangleComponent;
import com.diagramforge.core.model.UmlClassComponent;
import com.diagramforge.core.model.UmlInterfaceComponent;
import com.diagramforge.core.model.UmlPackageComponent;
import com.diagramforge.core.model.VertexComponent;
import com.diagramforge.core.style.DataUris;
import com.diagramforge.core.style.StyleMap;
import com.diagramforge.core.util.Numbers;
import com.diagramforge.core.xml.XmlEscaper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Converts typed components into diagram XML.
 *
 * <p>Vertices are emitted first in input order, then connectors in input order, so readers
 * of the output can assume every edge endpoint has already been declared.
 *
 * <p>A vertex style is assembled in a fixed order:
 * <ol>
 *   <li>the kind's base fragment from {@link ComponentCatalog}, plus variant tokens</li>
 *   <li>shape style tokens ({@code fillColor}, {@code strokeColor}, ...) that are set</li>
 *   <li>text style tokens ({@code fontSize}, {@code fontColor}, ...) that are set</li>
 *   <li>{@code whiteSpace=wrap;html=1}</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ComponentXmlConverter converter = new ComponentXmlConverter();
 * String xml = converter.componentsToXml(List.of(
 *     ShapeComponent.of(ComponentKind.RECTANGLE, "api", "API"),
 *     ShapeComponent.of(ComponentKind.CYLINDER, "db", "Orders"),
 *     Connector.between("e1", "api", "db")));
 * }</pre>
 */
public class ComponentXmlConverter {

    private static final Logger log = LoggerFactory.getLogger(ComponentXmlConverter.class);

    private static final String CELL_INDENT = "    ";
    private static final String CHILD_INDENT = "      ";
    private static final String LINE_BREAK = "<br>";
    private static final String RULE = "<hr>";

    private final double defaultX;
    private final double defaultY;

    public ComponentXmlConverter() {
        this(EngineConfig.defaults());
    }

    public ComponentXmlConverter(EngineConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        this.defaultX = config.layout().defaultX();
        this.defaultY = config.layout().defaultY();
    }

    /**
     * Converts a component list into a complete {@code mxGraphModel} document containing the
     * two reserved cells, all vertices, then all connectors.
     *
     * @param components components in any order
     * @return graph model XML
     */
    public String componentsToXml(List<? extends DiagramComponent> components) {
        Objects.requireNonNull(components, "components must not be null");

        StringBuilder xml = new StringBuilder();
        xml.append("<mxGraphModel>\n");
        xml.append("  <root>\n");
        xml.append(CELL_INDENT).append("<mxCell id=\"0\"/>\n");
        xml.append(CELL_INDENT).append("<mxCell id=\"1\" parent=\"0\"/>\n");

        List<Connector> connectors = new ArrayList<>();
        for (DiagramComponent component : components) {
            if (component instanceof Connector connector) {
                connectors.add(connector);
            } else {
                xml.append(componentToCellXml(component)).append('\n');
            }
        }
        for (Connector connector : connectors) {
            xml.append(connectorToCellXml(connector)).append('\n');
        }

        xml.append("  </root>\n");
        xml.append("</mxGraphModel>");

        log.debug("Converted {} components ({} connectors) to XML", components.size(), connectors.size());
        return xml.toString();
    }

    /**
     * Converts a single component into one {@code mxCell} element.
     *
     * @param component component to convert
     * @return cell XML, indented for placement inside {@code <root>}
     */
    public String componentToCellXml(DiagramComponent component) {
        Objects.requireNonNull(component, "component must not be null");
        if (component instanceof Connector connector) {
            return connectorToCellXml(connector);
        }
        VertexComponent vertex = (VertexComponent) component;

        Position position = vertex.position();
        Size size = vertex.size() != null ? vertex.size() : ComponentCatalog.defaultSize(vertex.kind());
        double x = position != null ? position.x() : defaultX;
        double y = position != null ? position.y() : defaultY;

        return CELL_INDENT + "<mxCell id=\"" + XmlEscaper.escape(vertex.id()) + "\""
            + " value=\"" + XmlEscaper.escape(labelFor(vertex)) + "\""
            + " style=\"" + XmlEscaper.escape(styleFor(vertex).serialize()) + "\""
            + " vertex=\"1\""
            + " parent=\"" + XmlEscaper.escape(vertex.effectiveParent()) + "\">\n"
            + CHILD_INDENT + "<mxGeometry x=\"" + Numbers.format(x) + "\" y=\"" + Numbers.format(y) + "\""
            + " width=\"" + Numbers.format(size.width()) + "\" height=\"" + Numbers.format(size.height()) + "\""
            + " as=\"geometry\"/>\n"
            + CELL_INDENT + "</mxCell>";
    }

    /**
     * Converts a connector into an edge cell with a relative geometry and optional waypoints.
     *
     * @param connector connector to convert
     * @return edge cell XML
     */
    public String connectorToCellXml(Connector connector) {
        Objects.requireNonNull(connector, "connector must not be null");

        StringBuilder xml = new StringBuilder();
        xml.append(CELL_INDENT)
            .append("<mxCell id=\"").append(XmlEscaper.escape(connector.id())).append('"')
            .append(" value=\"").append(XmlEscaper.escape(connector.label())).append('"')
            .append(" style=\"").append(XmlEscaper.escape(connectorStyleFor(connector.style()).serialize())).append('"')
            .append(" edge=\"1\"")
            .append(" parent=\"").append(XmlEscaper.escape(connector.effectiveParent())).append('"')
            .append(" source=\"").append(XmlEscaper.escape(connector.source())).append('"')
            .append(" target=\"").append(XmlEscaper.escape(connector.target())).append("\">\n");

        if (connector.waypoints().isEmpty()) {
            xml.append(CHILD_INDENT).append("<mxGeometry relative=\"1\" as=\"geometry\"/>\n");
        } else {
            xml.append(CHILD_INDENT).append("<mxGeometry relative=\"1\" as=\"geometry\">\n");
            xml.append(CHILD_INDENT).append("  <Array as=\"points\">\n");
            for (Position point : connector.waypoints()) {
                xml.append(CHILD_INDENT).append("    <mxPoint x=\"").append(Numbers.format(point.x()))
                    .append("\" y=\"").append(Numbers.format(point.y())).append("\"/>\n");
            }
            xml.append(CHILD_INDENT).append("  </Array>\n");
            xml.append(CHILD_INDENT).append("</mxGeometry>\n");
        }
        xml.append(CELL_INDENT).append("</mxCell>");
        return xml.toString();
    }

    /**
     * Builds the style property map for a vertex.
     *
     * @param vertex vertex component
     * @return ordered style map
     */
    public StyleMap styleFor(VertexComponent vertex) {
        StyleMap style = baseStyleFor(vertex);
        applyShapeStyle(vertex, style);
        applyTextStyle(vertex.textStyle(), style);
        style.put("whiteSpace", "wrap");
        style.put("html", "1");
        return style;
    }

    /**
     * Builds the style property map for a connector.
     *
     * @param connectorStyle connector style, may be {@code null}
     * @return ordered style map
     */
    public StyleMap connectorStyleFor(ConnectorStyle connectorStyle) {
        ConnectorStyle s = connectorStyle != null ? connectorStyle : ConnectorStyle.empty();
        StyleMap style = new StyleMap();

        switch (s.lineTypeOrDefault()) {
            case STRAIGHT -> style.put("edgeStyle", "none");
            case ORTHOGONAL -> style.put("edgeStyle", "orthogonalEdgeStyle");
            case CURVED -> style.put("curved", "1");
            case ENTITY_RELATION -> style.put("edgeStyle", "entityRelationEdgeStyle");
        }

        style.put("endArrow", s.endArrowOrDefault());
        style.put("startArrow", s.startArrowOrDefault());

        if (notBlank(s.strokeColor())) {
            style.put("strokeColor", s.strokeColor());
        }
        if (s.strokeWidth() != null) {
            style.put("strokeWidth", Numbers.format(s.strokeWidth()));
        }
        if (Boolean.TRUE.equals(s.dashed())) {
            style.put("dashed", "1");
        }
        if (Boolean.TRUE.equals(s.animated())) {
            style.put("flowAnimation", "1");
        }
        putNumber(style, "exitX", s.exitX());
        putNumber(style, "exitY", s.exitY());
        putNumber(style, "entryX", s.entryX());
        putNumber(style, "entryY", s.entryY());

        style.put("html", "1");
        return style;
    }

    /**
     * Resolves the rendered label for a vertex. Composite kinds compose multi-line markup;
     * the result is unescaped text, escaped once when written into the attribute.
     *
     * @param vertex vertex component
     * @return label text, never {@code null}
     */
    public String labelFor(VertexComponent vertex) {
        if (vertex instanceof ShapeComponent shape) {
            return orEmpty(shape.label());
        }
        if (vertex instanceof TextComponent text) {
            return orEmpty(text.text());
        }
        if (vertex instanceof CalloutComponent callout) {
            return orEmpty(callout.text());
        }
        if (vertex instanceof SwimlaneComponent swimlane) {
            return orEmpty(swimlane.title());
        }
        if (vertex instanceof CardComponent card) {
            String label = orEmpty(card.title());
            if (notBlank(card.subtitle())) {
                label += LINE_BREAK + "<font style=\"font-size:10px\">" + card.subtitle() + "</font>";
            }
            return label;
        }
        if (vertex instanceof ListComponent list) {
            return listLabel(list);
        }
        if (vertex instanceof TableComponent table) {
            return orEmpty(table.title());
        }
        if (vertex instanceof TimelineComponent timeline) {
            return notBlank(timeline.title()) ? timeline.title() : "Timeline";
        }
        if (vertex instanceof ProcessComponent process) {
            String steps = process.steps().stream().map(ProcessStep::label).collect(Collectors.joining(" → "));
            return steps.isEmpty() ? "Process" : steps;
        }
        if (vertex instanceof UmlClassComponent umlClass) {
            String label = notBlank(umlClass.name()) ? umlClass.name() : "ClassName";
            if (!umlClass.attributes().isEmpty()) {
                label += RULE + String.join(LINE_BREAK, umlClass.attributes());
            }
            if (!umlClass.methods().isEmpty()) {
                label += RULE + String.join(LINE_BREAK, umlClass.methods());
            }
            return label;
        }
        if (vertex instanceof UmlInterfaceComponent umlInterface) {
            String label = "«interface»" + LINE_BREAK
                + (notBlank(umlInterface.name()) ? umlInterface.name() : "InterfaceName");
            if (!umlInterface.methods().isEmpty()) {
                label += RULE + String.join(LINE_BREAK, umlInterface.methods());
            }
            return label;
        }
        if (vertex instanceof UmlPackageComponent umlPackage) {
            return orEmpty(umlPackage.name());
        }
        if (vertex instanceof RoundedRectComponent rounded) {
            return orEmpty(rounded.label());
        }
        if (vertex instanceof TriangleComponent triangle) {
            return orEmpty(triangle.label());
        }
        if (vertex instanceof ImageComponent image) {
            return orEmpty(image.label());
        }
        if (vertex instanceof CloudIconComponent icon) {
            return orEmpty(icon.label());
        }
        return "";
    }

    private StyleMap baseStyleFor(VertexComponent vertex) {
        StyleMap style = new StyleMap();

        if (vertex instanceof CloudIconComponent icon) {
            style.put("shape", CloudProvider.forKind(icon.kind()).shapeFor(icon.service()));
        }
        style.putAll(StyleMap.parse(ComponentCatalog.baseStyle(vertex.kind())));

        if (vertex instanceof RoundedRectComponent rounded && rounded.cornerRadius() != null) {
            style.put("arcSize", Numbers.format(rounded.cornerRadius()));
        } else if (vertex instanceof TriangleComponent triangle && triangle.direction() != null) {
            style.put("direction", triangle.direction().wireName());
        } else if (vertex instanceof ImageComponent image) {
            style.put("image", DataUris.toStyleValue(image.src()));
            if (Boolean.TRUE.equals(image.preserveAspect())) {
                style.put("imageAspect", "1");
                style.put("aspect", "fixed");
            }
        } else if (vertex instanceof SwimlaneComponent swimlane) {
            style.put("startSize", swimlane.titleHeight() != null ? Numbers.format(swimlane.titleHeight()) : "30");
            if (Boolean.TRUE.equals(swimlane.horizontal())) {
                style.put("horizontal", "1");
            }
            if (Boolean.TRUE.equals(swimlane.collapsible())) {
                style.put("collapsible", "1");
            }
            if (Boolean.TRUE.equals(swimlane.collapsed())) {
                style.put("collapsed", "1");
            }
        } else if (vertex instanceof GroupComponent group) {
            if (Boolean.TRUE.equals(group.collapsible())) {
                style.put("collapsible", "1");
            }
            if (Boolean.TRUE.equals(group.collapsed())) {
                style.put("collapsed", "1");
            }
        } else if (vertex instanceof CalloutComponent callout && callout.pointerDirection() != null) {
            style.put("base", "20");
            style.put("position", "0.5");
            style.put("position2", "0.5");
            style.put("direction", Integer.toString(callout.pointerDirection().rotation()));
        }
        return style;
    }

    private static void applyShapeStyle(VertexComponent vertex, StyleMap style) {
        ShapeStyle shape = vertex.style();

        String fill = shape.fill();
        if (!notBlank(fill) && vertex instanceof CalloutComponent callout && callout.calloutStyle() != null) {
            fill = callout.calloutStyle().fillColor();
        }
        if (notBlank(fill)) {
            style.put("fillColor", fill);
        }
        if (notBlank(shape.stroke())) {
            style.put("strokeColor", shape.stroke());
        }
        putNumber(style, "strokeWidth", shape.strokeWidth());
        putNumber(style, "opacity", shape.opacity());
        if (Boolean.TRUE.equals(shape.shadow())) {
            style.put("shadow", "1");
        }
        if (Boolean.TRUE.equals(shape.dashed())) {
            style.put("dashed", "1");
        }

        if (vertex instanceof SwimlaneComponent swimlane && notBlank(swimlane.headerFill())) {
            style.put("swimlaneFillColor", swimlane.headerFill());
        } else if (vertex instanceof CardComponent card && notBlank(card.headerColor())) {
            style.put("swimlaneFillColor", card.headerColor());
        }
    }

    private static void applyTextStyle(TextStyle text, StyleMap style) {
        putNumber(style, "fontSize", text.fontSize());
        if (notBlank(text.fontFamily())) {
            style.put("fontFamily", text.fontFamily());
        }
        if (notBlank(text.fontColor())) {
            style.put("fontColor", text.fontColor());
        }
        if (text.fontStyle() != null) {
            style.put("fontStyle", Integer.toString(text.fontStyle().code()));
        }
        if (text.align() != null) {
            style.put("align", text.align().wireName());
        }
        if (text.verticalAlign() != null) {
            style.put("verticalAlign", text.verticalAlign().wireName());
        }
    }

    private static String listLabel(ListComponent list) {
        String label = notBlank(list.title()) ? "<b>" + list.title() + "</b>" + RULE : "";
        boolean numbered = Boolean.TRUE.equals(list.numbered());
        List<String> items = list.items();
        label += IntStream.range(0, items.size())
            .mapToObj(i -> (numbered ? (i + 1) + ". " : "• ") + items.get(i))
            .collect(Collectors.joining(LINE_BREAK));
        return label.isEmpty() ? "List" : label;
    }

    private static void putNumber(StyleMap style, String key, Double value) {
        if (value != null) {
            style.put(key, Numbers.format(value));
        }
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }
}
