package com.diagramforge.core.parse;

import com.diagramforge.core.catalog.CloudProvider;
import com.diagramforge.core.catalog.ComponentCatalog;
import com.diagramforge.core.model.CalloutComponent;
import com.diagramforge.core.model.CardComponent;
import com.diagramforge.core.model.CloudIconComponent;
import com.diagramforge.core.model.ComponentKind;
import com.diagramforge.core.model.Connector;
import com.diagramforge.core.model.ConnectorStyle;
import com.diagramforge.core.model.ContainerComponent;
import com.diagramforge.core.model.DiagramComponent;
import com.diagramforge.core.model.GroupComponent;
import com.diagramforge.core.model.ImageComponent;
import com.diagramforge.core.model.LineType;
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
import com.diagramforge.core.style.DataUris;
import com.diagramforge.core.style.StyleMap;
import com.diagramforge.core.util.Numbers;
import com.diagramforge.core.xml.MxCells;
import com.diagramforge.core.xml.XmlDocumentCodec;
import com.diagramforge.core.xml.XmlParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes diagram XML back into typed components.
 *
 * <p>Every {@code mxCell} except the two reserved cells is decoded: edges become
 * {@link Connector}s, vertices are classified by {@link ComponentKindResolver} and their style
 * tokens are split into the shared style bags and the kind's own fields. Tokens that only
 * repeat the kind's base fragment are not reported as user style.
 *
 * <p>Container membership is not computed here; call
 * {@link #resolveChildRelationships(List)} on the complete result.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * XmlComponentParser parser = new XmlComponentParser(XmlDocumentCodec.load());
 * List<DiagramComponent> components = parser.resolveChildRelationships(parser.xmlToComponents(xml));
 * System.out.println(XmlComponentParser.summarizeComponents(components));
 * }</pre>
 */
public class XmlComponentParser {

    private static final Logger log = LoggerFactory.getLogger(XmlComponentParser.class);

    /** Container kinds whose children lists are derived from parent references. */
    public static final Set<ComponentKind> CHILD_COLLECTING_KINDS = EnumSet.of(ComponentKind.SWIMLANE, ComponentKind.GROUP);

    private static final String LINE_BREAK = "<br>";
    private static final String RULE = "<hr>";
    private static final String INTERFACE_PREFIX = "«interface»" + LINE_BREAK;
    private static final Pattern CARD_LABEL = Pattern.compile("^(.*?)<br><font[^>]*>(.*)</font>$", Pattern.DOTALL);
    private static final Pattern LIST_TITLE = Pattern.compile("^<b>(.*?)</b><hr>", Pattern.DOTALL);
    private static final Pattern NUMBERED_ITEM = Pattern.compile("^\\d+\\.\\s(.*)$", Pattern.DOTALL);
    private static final String BULLET = "• ";

    private final XmlDocumentCodec codec;

    public XmlComponentParser(XmlDocumentCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    /**
     * Parses a document and decodes every non-reserved cell in document order.
     *
     * @param xml diagram XML (bare graph model or full {@code mxfile})
     * @return decoded components; container children are not yet resolved
     * @throws XmlParseException if the XML is not well-formed
     */
    public List<DiagramComponent> xmlToComponents(String xml) throws XmlParseException {
        Document document = codec.parse(xml);
        List<DiagramComponent> components = new ArrayList<>();
        for (Element cell : MxCells.cells(document)) {
            String id = cell.getAttribute(MxCells.ATTR_ID);
            if (id.isEmpty() || MxCells.isReserved(id)) {
                continue;
            }
            cellToComponent(cell).ifPresent(components::add);
        }
        log.debug("Decoded {} components from XML", components.size());
        return components;
    }

    /**
     * Decodes one cell element.
     *
     * @param cell {@code mxCell} element
     * @return component, or empty when the cell has no id
     */
    public Optional<DiagramComponent> cellToComponent(Element cell) {
        String id = cell.getAttribute(MxCells.ATTR_ID);
        if (id.isEmpty()) {
            return Optional.empty();
        }
        StyleMap style = StyleMap.parse(cell.getAttribute(MxCells.ATTR_STYLE));
        String value = cell.getAttribute(MxCells.ATTR_VALUE);
        String parentAttr = cell.getAttribute(MxCells.ATTR_PARENT);
        String parent = parentAttr.isEmpty() || DiagramComponent.DEFAULT_LAYER_ID.equals(parentAttr) ? null : parentAttr;

        if (MxCells.isEdge(cell)) {
            return Optional.of(parseConnector(cell, id, parent, style, value));
        }

        ComponentKind kind = ComponentKindResolver.resolve(style, value);
        StyleMap userStyle = withoutBaseTokens(style, kind);
        Geometry geometry = parseGeometry(cell);
        ShapeStyle shapeStyle = extractShapeStyle(userStyle);
        TextStyle textStyle = extractTextStyle(userStyle);

        return Optional.of(buildVertex(kind, id, parent, geometry, shapeStyle, textStyle, style, value));
    }

    /**
     * Recomputes container children from parent references. Only swimlanes and groups
     * collect children; all other components are returned unchanged. Must run on the complete
     * component list, since a parent may appear after its children.
     *
     * @param components decoded components
     * @return new list with derived children filled in, same order
     */
    public List<DiagramComponent> resolveChildRelationships(List<DiagramComponent> components) {
        Map<String, List<String>> childrenByParent = new LinkedHashMap<>();
        Map<String, ComponentKind> kindById = new LinkedHashMap<>();
        for (DiagramComponent component : components) {
            kindById.putIfAbsent(component.id(), component.kind());
        }
        for (DiagramComponent component : components) {
            String parentId = component.parent();
            if (parentId == null || DiagramComponent.DEFAULT_LAYER_ID.equals(parentId)) {
                continue;
            }
            if (CHILD_COLLECTING_KINDS.contains(kindById.get(parentId))) {
                List<String> children = childrenByParent.computeIfAbsent(parentId, k -> new ArrayList<>());
                if (!children.contains(component.id())) {
                    children.add(component.id());
                }
            }
        }

        List<DiagramComponent> resolved = new ArrayList<>(components.size());
        for (DiagramComponent component : components) {
            if (component instanceof ContainerComponent container && CHILD_COLLECTING_KINDS.contains(container.kind())) {
                resolved.add(container.withChildren(childrenByParent.getOrDefault(container.id(), List.of())));
            } else {
                resolved.add(component);
            }
        }
        return resolved;
    }

    /**
     * Produces a textual count of components by kind, most frequent first.
     *
     * <pre>
     * Total components: 4
     *
     * By type:
     *   Rectangle: 2
     *   Connector: 1
     *   Ellipse: 1
     * </pre>
     *
     * @param components components to summarize
     * @return summary text
     */
    public static String summarizeComponents(List<? extends DiagramComponent> components) {
        Map<ComponentKind, Integer> counts = new LinkedHashMap<>();
        for (DiagramComponent component : components) {
            counts.merge(component.kind(), 1, Integer::sum);
        }

        StringBuilder summary = new StringBuilder();
        summary.append("Total components: ").append(components.size()).append("\n\nBy type:");
        counts.entrySet().stream()
            .sorted(Map.Entry.<ComponentKind, Integer>comparingByValue().reversed())
            .forEach(entry -> summary.append("\n  ").append(entry.getKey().wireName()).append(": ").append(entry.getValue()));
        return summary.toString();
    }

    private DiagramComponent buildVertex(ComponentKind kind, String id, String parent, Geometry geometry,
                                         ShapeStyle shapeStyle, TextStyle textStyle, StyleMap style, String value) {
        Position position = geometry.position();
        Size size = geometry.size();

        return switch (kind) {
            case ROUNDED_RECT -> new RoundedRectComponent(id, parent, position, size, shapeStyle, textStyle, value,
                style.getDouble("arcSize"));
            case TRIANGLE -> new TriangleComponent(id, parent, position, size, shapeStyle, textStyle, value,
                parseDirection(style.get("direction")));
            case TEXT -> new TextComponent(id, parent, position, size, shapeStyle, textStyle, value);
            case IMAGE -> new ImageComponent(id, parent, position, size, shapeStyle, textStyle,
                DataUris.fromStyleValue(style.get("image")),
                style.is("imageAspect", "1") ? Boolean.TRUE : null, value);
            case SWIMLANE -> new SwimlaneComponent(id, parent, position, size, shapeStyle, textStyle, value,
                style.getDouble("startSize"), flag(style, "horizontal"), List.of(), style.get("swimlaneFillColor"),
                flag(style, "collapsible"), flag(style, "collapsed"));
            case GROUP -> new GroupComponent(id, parent, position, size, shapeStyle, textStyle, List.of(),
                flag(style, "collapsible"), flag(style, "collapsed"));
            case AWS_ICON, AZURE_ICON, GCP_ICON -> {
                CloudProvider provider = CloudProvider.forKind(kind);
                String service = provider.serviceFor(style.get("shape")).orElse(provider.defaultService());
                yield new CloudIconComponent(kind, id, parent, position, size, shapeStyle, textStyle, service, value);
            }
            case UML_CLASS -> parseUmlClass(id, parent, position, size, shapeStyle, textStyle, value);
            case UML_INTERFACE -> parseUmlInterface(id, parent, position, size, shapeStyle, textStyle, value);
            case UML_PACKAGE -> new UmlPackageComponent(id, parent, position, size, shapeStyle, textStyle, value, List.of());
            case CARD -> parseCard(id, parent, position, size, shapeStyle, textStyle, style, value);
            case LIST -> parseList(id, parent, position, size, shapeStyle, textStyle, value);
            case TIMELINE -> new TimelineComponent(id, parent, position, size, shapeStyle, textStyle, value, List.of(), null);
            case TABLE -> new TableComponent(id, parent, position, size, shapeStyle, textStyle, value, List.of(), List.of());
            case PROCESS -> new ProcessComponent(id, parent, position, size, shapeStyle, textStyle,
                Arrays.stream(value.split(" → ")).map(label -> new ProcessStep(label, null)).toList(), null);
            case CALLOUT -> parseCallout(id, parent, position, size, shapeStyle, textStyle, style, value);
            case CONNECTOR -> throw new IllegalStateException("Vertex cell resolved to connector kind: " + id);
            default -> new ShapeComponent(kind, id, parent, position, size, shapeStyle, textStyle, value);
        };
    }

    private Connector parseConnector(Element cell, String id, String parent, StyleMap style, String value) {
        String edgeStyle = style.get("edgeStyle");
        LineType lineType;
        if (edgeStyle != null && edgeStyle.contains("orthogonal")) {
            lineType = LineType.ORTHOGONAL;
        } else if (style.is("curved", "1")) {
            lineType = LineType.CURVED;
        } else if (edgeStyle != null && edgeStyle.contains("entityRelation")) {
            lineType = LineType.ENTITY_RELATION;
        } else {
            lineType = LineType.STRAIGHT;
        }

        ConnectorStyle connectorStyle = new ConnectorStyle(
            lineType,
            orDefault(style.get("startArrow"), ConnectorStyle.DEFAULT_START_ARROW),
            orDefault(style.get("endArrow"), ConnectorStyle.DEFAULT_END_ARROW),
            style.get("strokeColor"),
            style.getDouble("strokeWidth"),
            flag(style, "dashed"),
            flag(style, "flowAnimation"),
            style.getDouble("exitX"),
            style.getDouble("exitY"),
            style.getDouble("entryX"),
            style.getDouble("entryY")
        );

        List<Position> waypoints = new ArrayList<>();
        MxCells.geometry(cell).ifPresent(geometry -> {
            for (Element array : MxCells.childElements(geometry, MxCells.ARRAY)) {
                if (!"points".equals(array.getAttribute(MxCells.ATTR_AS))) {
                    continue;
                }
                for (Element point : MxCells.childElements(array, MxCells.POINT)) {
                    waypoints.add(new Position(numberOrZero(point.getAttribute("x")), numberOrZero(point.getAttribute("y"))));
                }
            }
        });

        return new Connector(id, parent, cell.getAttribute(MxCells.ATTR_SOURCE), cell.getAttribute(MxCells.ATTR_TARGET),
            value, connectorStyle, waypoints);
    }

    private static UmlClassComponent parseUmlClass(String id, String parent, Position position, Size size,
                                                   ShapeStyle shapeStyle, TextStyle textStyle, String value) {
        String[] sections = value.split(RULE, -1);
        List<String> attributes = List.of();
        List<String> methods = List.of();
        if (sections.length >= 3) {
            attributes = lines(sections[1]);
            methods = lines(sections[2]);
        } else if (sections.length == 2) {
            List<String> members = lines(sections[1]);
            if (members.stream().anyMatch(member -> member.contains("("))) {
                methods = members;
            } else {
                attributes = members;
            }
        }
        return new UmlClassComponent(id, parent, position, size, shapeStyle, textStyle, sections[0], attributes, methods);
    }

    private static UmlInterfaceComponent parseUmlInterface(String id, String parent, Position position, Size size,
                                                           ShapeStyle shapeStyle, TextStyle textStyle, String value) {
        String body = value.startsWith(INTERFACE_PREFIX) ? value.substring(INTERFACE_PREFIX.length()) : value;
        String[] sections = body.split(RULE, 2);
        List<String> methods = sections.length > 1 ? lines(sections[1]) : List.of();
        return new UmlInterfaceComponent(id, parent, position, size, shapeStyle, textStyle, sections[0], methods);
    }

    private static CardComponent parseCard(String id, String parent, Position position, Size size,
                                           ShapeStyle shapeStyle, TextStyle textStyle, StyleMap style, String value) {
        Matcher matcher = CARD_LABEL.matcher(value);
        String title = value;
        String subtitle = null;
        if (matcher.matches()) {
            title = matcher.group(1);
            subtitle = matcher.group(2);
        }
        return new CardComponent(id, parent, position, size, shapeStyle, textStyle, title, subtitle, null,
            style.get("swimlaneFillColor"));
    }

    private static ListComponent parseList(String id, String parent, Position position, Size size,
                                           ShapeStyle shapeStyle, TextStyle textStyle, String value) {
        String title = null;
        String body = value;
        Matcher titleMatcher = LIST_TITLE.matcher(value);
        if (titleMatcher.find()) {
            title = titleMatcher.group(1);
            body = value.substring(titleMatcher.end());
        } else if ("List".equals(value)) {
            body = "";
        }

        boolean numbered = false;
        List<String> items = new ArrayList<>();
        for (String line : lines(body)) {
            Matcher numberedMatcher = NUMBERED_ITEM.matcher(line);
            if (line.startsWith(BULLET)) {
                items.add(line.substring(BULLET.length()));
            } else if (numberedMatcher.matches()) {
                numbered = true;
                items.add(numberedMatcher.group(1));
            } else {
                items.add(line);
            }
        }
        return new ListComponent(id, parent, position, size, shapeStyle, textStyle, title, items,
            numbered ? Boolean.TRUE : null);
    }

    private static CalloutComponent parseCallout(String id, String parent, Position position, Size size,
                                                 ShapeStyle shapeStyle, TextStyle textStyle, StyleMap style, String value) {
        CalloutComponent.Tone tone = null;
        ShapeStyle effectiveStyle = shapeStyle;
        if (shapeStyle.fill() != null) {
            for (CalloutComponent.Tone candidate : CalloutComponent.Tone.values()) {
                if (candidate.fillColor().equalsIgnoreCase(shapeStyle.fill())) {
                    tone = candidate;
                    effectiveStyle = shapeStyle.withFill(null);
                    break;
                }
            }
        }

        CalloutComponent.PointerDirection pointer = null;
        if (style.has("base")) {
            String rotation = style.get("direction");
            for (CalloutComponent.PointerDirection candidate : CalloutComponent.PointerDirection.values()) {
                if (Integer.toString(candidate.rotation()).equals(rotation)) {
                    pointer = candidate;
                }
            }
        }
        return new CalloutComponent(id, parent, position, size, effectiveStyle, textStyle, value, tone, pointer);
    }

    private static StyleMap withoutBaseTokens(StyleMap style, ComponentKind kind) {
        StyleMap base = StyleMap.parse(ComponentCatalog.baseStyle(kind));
        StyleMap user = new StyleMap();
        style.asMap().forEach((key, value) -> {
            if (!(base.has(key) && Objects.equals(base.get(key), value))) {
                user.put(key, value);
            }
        });
        return user;
    }

    private static ShapeStyle extractShapeStyle(StyleMap style) {
        ShapeStyle shapeStyle = new ShapeStyle(
            style.get("fillColor"),
            style.get("strokeColor"),
            style.getDouble("strokeWidth"),
            style.getDouble("opacity"),
            flag(style, "shadow"),
            flag(style, "dashed")
        );
        return shapeStyle.isEmpty() ? ShapeStyle.empty() : shapeStyle;
    }

    private static TextStyle extractTextStyle(StyleMap style) {
        Double fontStyleCode = style.getDouble("fontStyle");
        TextStyle.FontStyle fontStyle = fontStyleCode == null
            ? null
            : TextStyle.FontStyle.fromCode(fontStyleCode.intValue()).orElse(null);
        return new TextStyle(
            style.getDouble("fontSize"),
            style.get("fontFamily"),
            style.get("fontColor"),
            fontStyle,
            parseEnum(TextStyle.Align.class, style.get("align")),
            parseEnum(TextStyle.VerticalAlign.class, style.get("verticalAlign"))
        );
    }

    private static Geometry parseGeometry(Element cell) {
        Optional<Element> geometry = MxCells.geometry(cell);
        if (geometry.isEmpty()) {
            return new Geometry(null, null);
        }
        Element geo = geometry.get();
        Double x = Numbers.parse(MxCells.attribute(geo, "x"));
        Double y = Numbers.parse(MxCells.attribute(geo, "y"));
        Double width = Numbers.parse(MxCells.attribute(geo, "width"));
        Double height = Numbers.parse(MxCells.attribute(geo, "height"));

        Position position = x != null || y != null
            ? new Position(x != null ? x : 0, y != null ? y : 0)
            : null;
        Size size = width != null && height != null && width >= 0 && height >= 0
            ? new Size(width, height)
            : null;
        return new Geometry(position, size);
    }

    private static TriangleComponent.Direction parseDirection(String direction) {
        return parseEnum(TriangleComponent.Direction.class, direction);
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring unknown {} value: {}", type.getSimpleName(), value);
            return null;
        }
    }

    private static Boolean flag(StyleMap style, String key) {
        return style.is(key, "1") ? Boolean.TRUE : null;
    }

    private static List<String> lines(String section) {
        if (section == null || section.isEmpty()) {
            return List.of();
        }
        return List.of(section.split(LINE_BREAK, -1));
    }

    private static String orDefault(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }

    private static double numberOrZero(String text) {
        Double value = Numbers.parse(text);
        return value != null ? value : 0;
    }

    private record Geometry(Position position, Size size) {
    }
}
