package com.diagramforge.core.repair;

import com.diagramforge.core.validate.StructuralValidator;
import com.diagramforge.core.validate.ViolationCode;
import com.diagramforge.core.xml.DomXmlCodec;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link XmlRepairService}.
 */
class XmlRepairServiceTest {

    private final DomXmlCodec codec = new DomXmlCodec();
    private final XmlRepairService service = new XmlRepairService(new StructuralValidator(codec), new XmlAutoFixer(codec));

    @Test
    void validateAndFix_withValidDocument_returnsValidWithoutFixes() {
        String xml = "<mxGraphModel><root><mxCell id=\"0\"/><mxCell id=\"1\" parent=\"0\"/></root></mxGraphModel>";

        ValidationReport report = service.validateAndFix(xml);

        assertThat(report.valid()).isTrue();
        assertThat(report.fixes()).isEmpty();
        assertThat(report.repairedXml()).isEmpty();
        assertThat(report.effectiveXml(xml)).isEqualTo(xml);
    }

    @Test
    void validateAndFix_withDuplicateAttributes_repairsAndRevalidates() {
        String xml = "<mxGraphModel><root><mxCell id=\"0\"/><mxCell id=\"1\" parent=\"0\"/>"
            + "<mxCell id=\"a\" vertex=\"1\" parent=\"1\" parent=\"1\"/></root></mxGraphModel>";

        ValidationReport report = service.validateAndFix(xml);

        assertThat(report.valid()).isTrue();
        assertThat(report.violation()).isEmpty();
        assertThat(report.fixedXml()).contains("<mxCell id=\"a\" vertex=\"1\" parent=\"1\"/>");
        assertThat(report.fixes()).isNotEmpty();
    }

    @Test
    void validateAndFix_withDuplicateIds_renamesCopy() {
        String xml = "<mxGraphModel><root><mxCell id=\"0\"/><mxCell id=\"1\" parent=\"0\"/>"
            + "<mxCell id=\"a\" parent=\"1\"/><mxCell id=\"a\" parent=\"1\"/></root></mxGraphModel>";

        ValidationReport report = service.validateAndFix(xml);

        assertThat(report.valid()).isTrue();
        assertThat(report.effectiveXml(xml)).contains("id=\"a_dup1\"");
    }

    @Test
    void validateAndFix_withUnfixableStructure_reportsRemainingViolation() {
        String xml = "<mxGraphModel><root><mxCell id=\"0\"/><mxCell id=\"a\" parent=\"ghost\"/></root></mxGraphModel>";

        ValidationReport report = service.validateAndFix(xml);

        assertThat(report.valid()).isFalse();
        assertThat(report.error().code()).isEqualTo(ViolationCode.INVALID_PARENT);
        assertThat(report.fixedXml()).isNull();
    }
}
