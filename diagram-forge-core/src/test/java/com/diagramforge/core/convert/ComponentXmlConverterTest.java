package com.diagramforge.core.convert;

import com.diagramforge.core.catalog.ComponentCatalog;
import com.diagramforge.core.config.EngineConfig;
import com.diagramforge.core.model.CloudIconComponent;
import com.diagramforge.core.model.ComponentKind;
import com.diagramforge.core.model.Connector;
import com.diagramforge.core.model.ConnectorStyle;
import com.diagramforge.core.model.ImageComponent;
import com.diagramforge.core.model.LineType;
import com.diagramforge.core.model.ListComponent;
import com.diagramforge.core.model.Position;
import com.diagramforge.core.model.ShapeComponent;
import com.diagramforge.core.model.ShapeStyle;
import com.diagramforge.core.model.Size;
import com.diagramforge.core.model.SwimlaneComponent;
import com.diagramforge.core.model.TextStyle;
import com.diagramforge.core.model.UmlClassComponent;
import com.diagramforge.core.style.StyleMap;
import com.diagramforge.core.xml.DomXmlCodec;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ComponentXmlConverter}.
 */
class ComponentXmlConverterTest {

    private final ComponentXmlConverter converter = new ComponentXmlConverter();

    @Test
    void componentsToXml_emitsReservedCellsFirst() {
        String xml = converter.componentsToXml(List.of());

        assertThat(xml).startsWith("<mxGraphModel>\n  <root>\n    <mxCell id=\"0\"/>\n"
            + "    <mxCell id=\"1\" parent=\"0\"/>\n  </root>");
    }

    @Test
    void componentsToXml_emitsConnectorsAfterVertices() {
        String xml = converter.componentsToXml(List.of(
            Connector.between("e1", "a", "b"),
            ShapeComponent.of(ComponentKind.RECTANGLE, "a", "A"),
            ShapeComponent.of(ComponentKind.ELLIPSE, "b", "B")));

        assertThat(xml.indexOf("id=\"e1\"")).isGreaterThan(xml.indexOf("id=\"b\""));
        assertThat(xml.indexOf("id=\"a\"")).isLessThan(xml.indexOf("id=\"b\""));
    }

    @Test
    void componentsToXml_producesWellFormedXml() {
        String xml = converter.componentsToXml(List.of(
            ShapeComponent.of(ComponentKind.RECTANGLE, "a", "Tom & <Jerry>"),
            Connector.between("e1", "a", "a")));

        assertThat(new DomXmlCodec().isWellFormed(xml)).isTrue();
    }

    @Test
    void componentToCellXml_withoutPosition_usesDefaultPositionAndCatalogSize() {
        String cell = converter.componentToCellXml(ShapeComponent.of(ComponentKind.RECTANGLE, "a", "API"));

        assertThat(cell).contains("style=\"rounded=0;whiteSpace=wrap;html=1;\"")
            .contains("vertex=\"1\" parent=\"1\"")
            .contains("<mxGeometry x=\"100\" y=\"100\" width=\"120\" height=\"60\" as=\"geometry\"/>");
    }

    @Test
    void componentToCellXml_withConfiguredLayout_usesConfiguredDefaults() {
        EngineConfig config = new EngineConfig(null, new EngineConfig.LayoutSettings(10.0, 20.0), null, null);

        String cell = new ComponentXmlConverter(config)
            .componentToCellXml(ShapeComponent.of(ComponentKind.ELLIPSE, "a", "A"));

        assertThat(cell).contains("x=\"10\" y=\"20\" width=\"80\" height=\"80\"");
    }

    @Test
    void componentToCellXml_escapesLabelOnce() {
        String cell = converter.componentToCellXml(ShapeComponent.of(ComponentKind.RECTANGLE, "a", "<b>Bold</b>"));

        assertThat(cell).contains("value=\"&lt;b&gt;Bold&lt;/b&gt;\"");
    }

    @Test
    void componentToCellXml_withExplicitGeometryAndStyle_appendsStyleTokensInOrder() {
        ShapeComponent shape = new ShapeComponent(ComponentKind.CYLINDER, "db", null, new Position(5, 6),
            new Size(70, 90), new ShapeStyle("#fff", "#000", 2.0, null, true, null), null, "Orders");

        String cell = converter.componentToCellXml(shape);

        assertThat(cell).contains("style=\"shape=cylinder3;boundedLbl=1;backgroundOutline=1;size=15;"
                + "fillColor=#fff;strokeColor=#000;strokeWidth=2;shadow=1;whiteSpace=wrap;html=1;\"")
            .contains("x=\"5\" y=\"6\" width=\"70\" height=\"90\"");
    }

    @Test
    void componentToCellXml_withCloudIcon_resolvesServiceShape() {
        String cell = converter.componentToCellXml(
            CloudIconComponent.of(ComponentKind.AWS_ICON, "fn", "Lambda", "Handler"));

        assertThat(cell).contains("style=\"shape=mxgraph.aws4.lambda;sketch=0;");
    }

    @Test
    void componentToCellXml_withSwimlane_writesStartSize() {
        SwimlaneComponent lane = new SwimlaneComponent("lane", null, null, null, null, null, "Backend",
            null, true, List.of(), "#dae8fc", null, null);

        String cell = converter.componentToCellXml(lane);

        assertThat(cell).contains("swimlane;startSize=30;horizontal=1;")
            .contains("swimlaneFillColor=#dae8fc")
            .contains("value=\"Backend\"");
    }

    @Test
    void styleFor_withBase64Image_writesUriWithoutSemicolon() {
        ImageComponent image = new ImageComponent("img", null, null, null, null, null,
            "data:image/png;base64,iVBORw0KGgo=", true, "Logo");

        StyleMap style = converter.styleFor(image);

        assertThat(style.get("image")).isEqualTo("data:image/png,iVBORw0KGgo=");
        assertThat(StyleMap.parse(style.serialize()).get("image")).isEqualTo("data:image/png,iVBORw0KGgo=");
        assertThat(style.is("imageAspect", "1")).isTrue();
    }

    @Test
    void styleFor_withList_keepsKindMarkerWhenBold() {
        ListComponent list = new ListComponent("l", null, null, null, null,
            new TextStyle(null, null, null, TextStyle.FontStyle.BOLD, null, null), "Steps", List.of("a"), null);

        StyleMap style = converter.styleFor(list);

        assertThat(style.is(ComponentCatalog.KIND_MARKER, "List")).isTrue();
        assertThat(style.is("fontStyle", "1")).isTrue();
    }

    @Test
    void labelFor_withUmlClass_joinsSectionsWithRules() {
        UmlClassComponent umlClass = new UmlClassComponent("c", null, null, null, null, null, "Order",
            List.of("+id: long", "+total: int"), List.of("+pay()"));

        assertThat(converter.labelFor(umlClass)).isEqualTo("Order<hr>+id: long<br>+total: int<hr>+pay()");
    }

    @Test
    void connectorToCellXml_writesRelativeGeometry() {
        String cell = converter.connectorToCellXml(Connector.between("e1", "a", "b"));

        assertThat(cell).contains("style=\"edgeStyle=orthogonalEdgeStyle;endArrow=classic;startArrow=none;html=1;\"")
            .contains("edge=\"1\" parent=\"1\" source=\"a\" target=\"b\"")
            .contains("<mxGeometry relative=\"1\" as=\"geometry\"/>");
    }

    @Test
    void connectorToCellXml_withWaypoints_writesPointsArray() {
        Connector connector = new Connector("e1", null, "a", "b", "calls", ConnectorStyle.of(LineType.STRAIGHT),
            List.of(new Position(10, 20), new Position(30.5, 40)));

        String cell = converter.connectorToCellXml(connector);

        assertThat(cell).contains("edgeStyle=none;")
            .contains("value=\"calls\"")
            .contains("<Array as=\"points\">")
            .contains("<mxPoint x=\"10\" y=\"20\"/>")
            .contains("<mxPoint x=\"30.5\" y=\"40\"/>");
    }

    @Test
    void connectorStyleFor_withCurvedDashed_writesFlags() {
        ConnectorStyle style = new ConnectorStyle(LineType.CURVED, null, "block", "#f00", 3.0, true, true,
            1.0, 0.5, null, null);

        assertThat(converter.connectorStyleFor(style).serialize())
            .isEqualTo("curved=1;endArrow=block;startArrow=none;strokeColor=#f00;strokeWidth=3;dashed=1;"
                + "flowAnimation=1;exitX=1;exitY=0.5;html=1;");
    }
}
