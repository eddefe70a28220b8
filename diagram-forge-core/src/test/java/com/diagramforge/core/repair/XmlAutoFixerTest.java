package com.diagramforge.core.repair;

import com.diagramforge.core.config.EngineConfig;
import com.diagramforge.core.validate.StructuralValidator;
import com.diagramforge.core.xml.DomXmlCodec;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link XmlAutoFixer}.
 */
class XmlAutoFixerTest {

    private static final String BROKEN_CELL_DOCUMENT = """
        <mxGraphModel><root>
        <mxCell id="0"/>
        <mxCell id="1" parent="0"/>
        <mxCell id="2" value="a" "b" parent="1"/>
        <mxCell id="3" vertex="1" parent="1"/>
        </root></mxGraphModel>""";

    private final DomXmlCodec codec = new DomXmlCodec();
    private final XmlAutoFixer fixer = new XmlAutoFixer(codec);

    @Test
    void fix_withWellFormedXml_appliesNoFixes() {
        String xml = "<mxGraphModel><root><mxCell id=\"0\"/></root></mxGraphModel>";

        RepairResult result = fixer.fix(xml);

        assertThat(result.changed()).isFalse();
        assertThat(result.parses()).isTrue();
        assertThat(result.xml()).isEqualTo(xml);
    }

    @Test
    void fix_withDuplicateParentAttribute_producesValidDocument() {
        String xml = "<mxGraphModel><root><mxCell id=\"0\"/><mxCell id=\"1\" parent=\"0\"/>"
            + "<mxCell id=\"a\" vertex=\"1\" parent=\"1\" parent=\"1\"/></root></mxGraphModel>";

        RepairResult result = fixer.fix(xml);

        assertThat(result.parses()).isTrue();
        assertThat(result.fixes()).containsExactly("Removed duplicate parent/source/target/vertex/edge/connectable attributes");
        assertThat(new StructuralValidator(codec).validate(result.xml())).isEmpty();
    }

    @Test
    void fix_withTruncatedStream_closesDocument() {
        String xml = "Sure! <mxGraphModel><root><mxCell id=\"0\"/><mxCell id=\"1\" parent=\"0\"/><mxCell id=\"a\" va";

        RepairResult result = fixer.fix(xml);

        assertThat(result.parses()).isTrue();
        assertThat(result.xml()).isEqualTo(
            "<mxGraphModel><root><mxCell id=\"0\"/><mxCell id=\"1\" parent=\"0\"/></root></mxGraphModel>");
        assertThat(result.fixes()).contains("Removed text before the first diagram tag", "Closed tags left open at end of document");
    }

    @Test
    void fix_withUnrepairableCell_dropsEnclosingBlock() {
        RepairResult result = fixer.fix(BROKEN_CELL_DOCUMENT);

        assertThat(result.parses()).isTrue();
        assertThat(result.xml()).doesNotContain("id=\"2\"").contains("id=\"3\"");
        assertThat(result.fixes()).contains("Removed unparseable mxCell block near line 4");
    }

    @Test
    void fix_withZeroIterations_reportsUnparseable() {
        EngineConfig config = new EngineConfig(new EngineConfig.RepairSettings(0), null, null, null);
        XmlAutoFixer strict = new XmlAutoFixer(codec, RepairRules.defaults(), config);

        RepairResult result = strict.fix(BROKEN_CELL_DOCUMENT);

        assertThat(result.parses()).isFalse();
        assertThat(result.xml()).contains("id=\"2\"");
    }

    @Test
    void fix_withCustomRules_runsOnlyThoseRules() {
        XmlAutoFixer single = new XmlAutoFixer(codec, List.of(RepairRules.ESCAPE_BARE_AMPERSANDS),
            EngineConfig.defaults());

        RepairResult result = single.fix("<a v=\"R&D\"/>");

        assertThat(result.xml()).isEqualTo("<a v=\"R&amp;D\"/>");
        assertThat(result.fixes()).hasSize(1);
    }

    @Test
    void fix_withNull_returnsEmptyUnparseableResult() {
        RepairResult result = fixer.fix(null);

        assertThat(result.xml()).isEmpty();
        assertThat(result.parses()).isFalse();
    }

    @Test
    void dropEnclosingCell_removesBlockWithChildren() {
        String xml = "<root>\n<mxCell id=\"a\">\n<mxGeometry x=\"?\"/>\n</mxCell>\n<mxCell id=\"b\"/>\n</root>";

        String reduced = XmlAutoFixer.dropEnclosingCell(xml, 3, 5).orElseThrow();

        assertThat(reduced).isEqualTo("<root>\n<mxCell id=\"b\"/>\n</root>");
    }

    @Test
    void dropEnclosingCell_withoutCell_returnsEmpty() {
        assertThat(XmlAutoFixer.dropEnclosingCell("<root><bad</root>", 1, 8)).isEmpty();
    }

    @Test
    void offsetOf_convertsLineAndColumn() {
        assertThat(XmlAutoFixer.offsetOf("ab\ncd\nef", 2, 2)).isEqualTo(4);
        assertThat(XmlAutoFixer.offsetOf("ab", 5, 1)).isEqualTo(2);
    }
}
