package com.diagramforge.core.analysis;

import com.diagramforge.core.config.EngineConfig;
import com.diagramforge.core.xml.DomXmlCodec;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DiagramDiff}.
 */
class DiagramDiffTest {

    private static final String HEADER = "<mxGraphModel><root><mxCell id=\"0\"/><mxCell id=\"1\" parent=\"0\"/>";
    private static final String FOOTER = "</root></mxGraphModel>";

    private final DiagramDiff diff = new DiagramDiff(new DomXmlCodec());

    private static String doc(String cells) {
        return HEADER + cells + FOOTER;
    }

    private static String node(String id, String value, int x) {
        return "<mxCell id=\"" + id + "\" value=\"" + value + "\" vertex=\"1\" parent=\"1\">"
            + "<mxGeometry x=\"" + x + "\" y=\"0\" width=\"120\" height=\"60\" as=\"geometry\"/></mxCell>";
    }

    @Test
    void generateXmlDiff_withIdenticalDocuments_reportsNoChanges() {
        String xml = doc(node("api", "API", 0));

        assertThat(diff.generateXmlDiff(xml, xml)).isEqualTo("No changes detected");
    }

    @Test
    void generateXmlDiff_withUnparseableSide_reportsParseFailure() {
        String xml = doc(node("api", "API", 0));

        assertThat(diff.generateXmlDiff("<mxGraphModel>", xml)).isEqualTo("Unable to compare XML (parsing failed)");
        assertThat(diff.compare(xml, "")).isEmpty();
    }

    @Test
    void generateXmlDiff_withChanges_listsSections() {
        String before = doc(node("api", "API", 0) + node("db", "Orders DB", 200));
        String after = doc(node("api", "API v2", 0) + node("cache", "Cache", 400));

        String summary = diff.generateXmlDiff(before, after);

        assertThat(summary).isEqualTo(String.join("\n",
            "Changes:",
            "",
            "Added 1 elements:",
            "- node cache \"Cache\"",
            "",
            "Removed 1 elements:",
            "- node db \"Orders DB\"",
            "",
            "Modified 1 elements:",
            "- node api \"API v2\": label: \"API\" → \"API v2\""));
    }

    @Test
    void compare_ignoresReservedCells() {
        String before = "<mxGraphModel><root><mxCell id=\"0\"/></root></mxGraphModel>";
        String after = doc("");

        assertThat(diff.compare(before, after)).hasValueSatisfying(d -> assertThat(d.isEmpty()).isTrue());
    }

    @Test
    void describeChanges_withMovedAndRestyledEdge_listsEachAspect() {
        CellSnapshot before = new CellSnapshot("e", null, "1", "a=1", false, true, "x", "y",
            "0", "0", "10", "10");
        CellSnapshot after = new CellSnapshot("e", null, "lane", "a=2", false, true, "x", "z",
            "5", "0", "20", "10");

        assertThat(DiagramDiff.describeChanges(before, after)).containsExactly(
            "style changed",
            "parent: 1 → lane",
            "connection: x→y to x→z",
            "position changed",
            "size changed");
    }

    @Test
    void generateXmlDiff_withManyAdditions_truncatesSection() {
        EngineConfig config = new EngineConfig(null, null,
            new EngineConfig.AnalysisSettings(null, null, null, 1), null);
        DiagramDiff limited = new DiagramDiff(new DomXmlCodec(), config);

        String summary = limited.generateXmlDiff(doc(""),
            doc(node("n1", "", 0) + node("n2", "", 0) + node("n3", "", 0)));

        assertThat(summary).isEqualTo("Changes:\n\nAdded 3 elements:\n- node n1\n- ...and 2 more");
    }
}
