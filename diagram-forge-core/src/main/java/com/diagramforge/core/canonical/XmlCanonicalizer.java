package com.diagramforge.core.canonical;

import com.diagramforge.core.config.EngineConfig;
import com.diagramforge.core.xml.XmlDocumentCodec;
import com.diagramforge.core.xml.XmlEscaper;
import com.diagramforge.core.xml.XmlParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns partial or bare diagram XML into complete documents.
 *
 * <p>{@link #convertToLegalXml(String)} is safe on streaming input: cells that are not yet
 * closed are left out rather than emitted as broken fragments.
 */
public class XmlCanonicalizer {

    private static final Logger log = LoggerFactory.getLogger(XmlCanonicalizer.class);

    private static final Pattern COMPLETE_CELL = Pattern.compile(
        "<mxCell\\b(?:\"[^\"]*\"|'[^']*'|[^>/\"']|/(?!>))*(?:/>|>[\\s\\S]*?</mxCell>)");
    private static final Pattern POINTS_ARRAY = Pattern.compile("<Array\\s+as=\"points\">");
    private static final Pattern POINT = Pattern.compile("<mxPoint\\b[^>]*/>");
    private static final Pattern HAS_ROLE = Pattern.compile("\\sas=");
    private static final Pattern ROOT_TAGS = Pattern.compile("</?root>");
    private static final Pattern RESERVED_ROOT = Pattern.compile("<mxCell\\s+id=\"0\"");
    private static final Pattern RESERVED_LAYER = Pattern.compile("<mxCell\\s+id=\"1\"");

    private static final String CELL_INDENT = "    ";

    private final XmlDocumentCodec codec;
    private final String pageName;
    private final String pageId;

    public XmlCanonicalizer(XmlDocumentCodec codec) {
        this(codec, EngineConfig.defaults());
    }

    public XmlCanonicalizer(XmlDocumentCodec codec, EngineConfig config) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.pageName = config.document().pageName();
        this.pageId = config.document().pageId();
    }

    /**
     * Extracts the complete cells of a possibly truncated document into a {@code <root>}.
     *
     * <p>Only self-closed cells and cells with a matching close tag are kept. Inside a cell
     * without a waypoint array, {@code mxPoint} elements lacking an {@code as} role are
     * dropped.
     *
     * @param streamingXml partial document text
     * @return {@code <root>} element text holding the complete cells
     */
    public String convertToLegalXml(String streamingXml) {
        StringBuilder result = new StringBuilder("<root>\n");
        if (streamingXml != null) {
            Matcher matcher = COMPLETE_CELL.matcher(streamingXml);
            while (matcher.find()) {
                String cell = matcher.group();
                if (!POINTS_ARRAY.matcher(cell).find()) {
                    cell = dropUnroledPoints(cell);
                }
                String indented = Arrays.stream(cell.split("\n"))
                    .map(String::trim)
                    .filter(line -> !line.isEmpty())
                    .map(line -> CELL_INDENT + line)
                    .collect(Collectors.joining("\n"));
                result.append(indented).append('\n');
            }
        }
        return result.append("</root>").toString();
    }

    /**
     * Wraps XML in the full {@code mxfile} envelope.
     *
     * <ul>
     *   <li>empty input gives an empty default document</li>
     *   <li>an existing {@code mxfile} is returned unchanged</li>
     *   <li>a bare {@code mxGraphModel} is wrapped in {@code mxfile}/{@code diagram}</li>
     *   <li>anything else is treated as cell content</li>
     * </ul>
     *
     * @param xml document or fragment
     * @return complete document
     */
    public String wrapWithMxFile(String xml) {
        if (xml == null || xml.isBlank()) {
            return openDiagram() + "<mxGraphModel><root>" + reservedCells() + "</root></mxGraphModel>" + closeDiagram();
        }
        if (xml.contains("<mxfile")) {
            return xml;
        }
        if (xml.contains("<mxGraphModel")) {
            return openDiagram() + xml + closeDiagram();
        }

        String content = ROOT_TAGS.matcher(xml).replaceAll("").trim();
        StringBuilder root = new StringBuilder();
        if (!RESERVED_ROOT.matcher(content).find()) {
            root.append("<mxCell id=\"0\"/>");
        }
        if (!RESERVED_LAYER.matcher(content).find()) {
            root.append("<mxCell id=\"1\" parent=\"0\"/>");
        }
        root.append(content);
        return openDiagram() + "<mxGraphModel><root>" + root + "</root></mxGraphModel>" + closeDiagram();
    }

    /**
     * Pretty-prints a document with two-space indentation.
     *
     * @param xml document text
     * @return indented text, or the input unchanged when it is not well-formed
     */
    public String formatXml(String xml) {
        Document document;
        try {
            document = codec.parse(xml);
        } catch (XmlParseException e) {
            log.debug("Not formatting malformed XML: {}", e.getMessage());
            return xml;
        }
        removeWhitespaceText(document.getDocumentElement());
        return codec.serialize(document, true).trim();
    }

    /**
     * Runs {@link #convertToLegalXml(String)} and {@link #wrapWithMxFile(String)} in turn.
     *
     * @param streamingXml partial document text
     * @return complete document
     */
    public String canonicalize(String streamingXml) {
        return wrapWithMxFile(convertToLegalXml(streamingXml));
    }

    private String openDiagram() {
        return "<mxfile><diagram name=\"" + XmlEscaper.escape(pageName) + "\" id=\"" + XmlEscaper.escape(pageId) + "\">";
    }

    private static String closeDiagram() {
        return "</diagram></mxfile>";
    }

    private static String reservedCells() {
        return "<mxCell id=\"0\"/><mxCell id=\"1\" parent=\"0\"/>";
    }

    private static String dropUnroledPoints(String cell) {
        Matcher matcher = POINT.matcher(cell);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String point = matcher.group();
            matcher.appendReplacement(out, HAS_ROLE.matcher(point).find() ? Matcher.quoteReplacement(point) : "");
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static void removeWhitespaceText(Node node) {
        NodeList children = node.getChildNodes();
        for (int i = children.getLength() - 1; i >= 0; i--) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.TEXT_NODE && child.getTextContent().isBlank()) {
                node.removeChild(child);
            } else if (child.getNodeType() == Node.ELEMENT_NODE) {
                removeWhitespaceText(child);
            }
        }
    }
}
