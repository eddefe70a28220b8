package com.diagramforge.core.analysis;

import com.diagramforge.core.config.EngineConfig;
import com.diagramforge.core.xml.DomXmlCodec;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DiagramAnalyzer}.
 */
class DiagramAnalyzerTest {

    static final String DIAGRAM = """
        <mxGraphModel><root>
          <mxCell id="0"/>
          <mxCell id="1" parent="0"/>
          <mxCell id="api" value="API" vertex="1" parent="1">
            <mxGeometry x="40" y="40" width="120" height="60" as="geometry"/>
          </mxCell>
          <mxCell id="db" value="Orders DB" vertex="1" parent="1">
            <mxGeometry x="240" y="40" width="120" height="80" as="geometry"/>
          </mxCell>
          <mxCell id="e1" value="reads" edge="1" parent="1" source="api" target="db">
            <mxGeometry relative="1" as="geometry"/>
          </mxCell>
        </root></mxGraphModel>
        """;

    private final DiagramAnalyzer analyzer = new DiagramAnalyzer(new DomXmlCodec());

    @Test
    void analyzeDiagramXml_withValidDiagram_listsNodesAndEdges() {
        String outline = analyzer.analyzeDiagramXml(DIAGRAM);

        assertThat(outline).isEqualTo(String.join("\n",
            "Nodes: 2",
            "- api \"API\" parent=1 (x=40, y=40, w=120, h=60)",
            "- db \"Orders DB\" parent=1 (x=240, y=40, w=120, h=80)",
            "",
            "Edges: 1",
            "- e1 \"reads\" api -> db"));
    }

    @Test
    void analyzeDiagramXml_withSwimlane_listsContainers() {
        String xml = "<mxGraphModel><root><mxCell id=\"0\"/><mxCell id=\"1\" parent=\"0\"/>"
            + "<mxCell id=\"lane\" value=\"Backend\" style=\"swimlane;startSize=30;\" vertex=\"1\" parent=\"1\"/>"
            + "</root></mxGraphModel>";

        String outline = analyzer.analyzeDiagramXml(xml);

        assertThat(outline).contains("Containers/Swimlanes: 1\n- lane \"Backend\"");
    }

    @Test
    void analyzeDiagramXml_withBrokenReferences_reportsWarnings() {
        String xml = "<mxGraphModel><root><mxCell id=\"0\"/><mxCell id=\"1\" parent=\"0\"/>"
            + "<mxCell id=\"a\" vertex=\"1\" parent=\"1\"/>"
            + "<mxCell id=\"a\" vertex=\"1\" parent=\"1\"/>"
            + "<mxCell id=\"orphan\" vertex=\"1\"/>"
            + "<mxCell id=\"child\" vertex=\"1\" parent=\"ghost\"/>"
            + "<mxCell id=\"e1\" edge=\"1\" parent=\"1\" source=\"a\"/>"
            + "<mxCell id=\"e2\" edge=\"1\" parent=\"1\" source=\"a\" target=\"nope\"/>"
            + "</root></mxGraphModel>";

        String outline = analyzer.analyzeDiagramXml(xml);

        assertThat(outline).contains(
            "Warnings:",
            "- Duplicate ids: a",
            "- Nodes without parent: orphan",
            "- Parents referencing missing cells: child->ghost",
            "- Edges without source/target: e1",
            "- Edges referencing missing cells: e2(a->nope)");
        assertThat(outline).contains("- e1 a -> ?");
    }

    @Test
    void analyzeDiagramXml_withLimits_omitsAndTruncates() {
        EngineConfig config = new EngineConfig(null, null,
            new EngineConfig.AnalysisSettings(1, 1, 3, null), null);
        DiagramAnalyzer limited = new DiagramAnalyzer(new DomXmlCodec(), config);

        String outline = limited.analyzeDiagramXml(DIAGRAM);

        assertThat(outline).startsWith("Nodes: 1\n- api \"API\"");
        assertThat(outline).doesNotContain("Orders DB");
        assertThat(outline).endsWith("- Only the first 3 mxCell elements were analyzed.");
    }

    @Test
    void analyzeDiagramXml_withTooManyNodes_reportsOmittedCount() {
        EngineConfig config = new EngineConfig(null, null,
            new EngineConfig.AnalysisSettings(1, null, null, null), null);

        String outline = new DiagramAnalyzer(new DomXmlCodec(), config).analyzeDiagramXml(DIAGRAM);

        assertThat(outline).contains("- ...(1 more nodes omitted)");
    }

    @Test
    void analyzeDiagramXml_withUnparseableInput_returnsWarning() {
        String outline = analyzer.analyzeDiagramXml("<mxGraphModel><root><mxCell id=\"0\">");

        assertThat(outline).startsWith("Warnings:\n- Unable to parse XML (possibly an incomplete fragment).");
    }

    @Test
    void analyzeDiagramXml_withLongLabel_collapsesWhitespaceAndCuts() {
        String label = "a  b " + "x".repeat(100);
        String xml = "<mxGraphModel><root><mxCell id=\"0\"/><mxCell id=\"1\" parent=\"0\"/>"
            + "<mxCell id=\"n\" value=\"" + label + "\" vertex=\"1\" parent=\"1\"/></root></mxGraphModel>";

        String outline = analyzer.analyzeDiagramXml(xml);

        String expected = ("a b " + "x".repeat(100)).substring(0, DiagramAnalyzer.LABEL_LENGTH);
        assertThat(outline).contains("- n \"" + expected + "\" parent=1");
    }
}
