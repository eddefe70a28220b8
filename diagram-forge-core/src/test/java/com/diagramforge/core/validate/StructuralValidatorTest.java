package com.diagramforge.core.validate;

import com.diagramforge.core.xml.DomXmlCodec;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link StructuralValidator}.
 */
class StructuralValidatorTest {

    private static final String RESERVED = "<mxCell id=\"0\"/><mxCell id=\"1\" parent=\"0\"/>";

    private final StructuralValidator validator = new StructuralValidator(new DomXmlCodec());

    private static String model(String cells) {
        return "<mxGraphModel><root>" + RESERVED + cells + "</root></mxGraphModel>";
    }

    @Test
    void validate_withMinimalDocument_returnsEmpty() {
        assertThat(validator.validate(model(""))).isEmpty();
        assertThat(validator.isValid(model(""))).isTrue();
    }

    @Test
    void validate_withConnectedVertices_returnsEmpty() {
        String xml = model("<mxCell id=\"a\" vertex=\"1\" parent=\"1\"><mxGeometry as=\"geometry\"/></mxCell>"
            + "<mxCell id=\"b\" vertex=\"1\" parent=\"1\"/>"
            + "<mxCell id=\"e\" edge=\"1\" parent=\"1\" source=\"a\" target=\"b\">"
            + "<mxGeometry relative=\"1\" as=\"geometry\"><Array as=\"points\"><mxPoint x=\"1\" y=\"2\"/></Array>"
            + "<mxPoint x=\"0\" y=\"0\" as=\"sourcePoint\"/></mxGeometry></mxCell>");

        assertThat(validator.validate(xml)).isEmpty();
    }

    @Test
    void validate_withMalformedXml_reportsParseError() {
        Optional<StructuralViolation> violation = validator.validate("<mxGraphModel><root>");

        assertThat(violation).map(StructuralViolation::code).contains(ViolationCode.PARSE_ERROR);
        assertThat(violation.get().message()).startsWith("XML syntax error (");
    }

    @Test
    void validate_withNullInput_reportsParseError() {
        assertThat(validator.validate((String) null)).map(StructuralViolation::code).contains(ViolationCode.PARSE_ERROR);
    }

    @Test
    void validate_withNestedCell_reportsNestedCell() {
        String xml = model("<mxCell id=\"a\" parent=\"1\"><mxCell id=\"b\" parent=\"1\"/></mxCell>");

        StructuralViolation violation = validator.validate(xml).orElseThrow();

        assertThat(violation.code()).isEqualTo(ViolationCode.NESTED_CELL);
        assertThat(violation.cellIds()).containsExactly("b");
    }

    @Test
    void validate_withDuplicateId_reportsDuplicate() {
        String xml = model("<mxCell id=\"a\" parent=\"1\"/><mxCell id=\"a\" parent=\"1\"/>");

        StructuralViolation violation = validator.validate(xml).orElseThrow();

        assertThat(violation.code()).isEqualTo(ViolationCode.DUPLICATE_ID);
        assertThat(violation.cellIds()).containsExactly("a");
    }

    @Test
    void validate_withMissingParent_reportsMissingParent() {
        StructuralViolation violation = validator.validate(model("<mxCell id=\"a\" vertex=\"1\"/>")).orElseThrow();

        assertThat(violation.code()).isEqualTo(ViolationCode.MISSING_PARENT);
        assertThat(violation.hint()).contains("parent=\"1\"");
    }

    @Test
    void validate_withEmptyParent_reportsMissingParent() {
        StructuralViolation violation = validator.validate(model("<mxCell id=\"a\" parent=\"\"/>")).orElseThrow();

        assertThat(violation.code()).isEqualTo(ViolationCode.MISSING_PARENT);
    }

    @Test
    void validate_withUnknownParent_reportsInvalidParent() {
        StructuralViolation violation = validator.validate(model("<mxCell id=\"a\" parent=\"ghost\"/>")).orElseThrow();

        assertThat(violation.code()).isEqualTo(ViolationCode.INVALID_PARENT);
        assertThat(violation.cellIds()).containsExactly("a");
    }

    @Test
    void validate_withDanglingEdge_reportsEdgeReference() {
        String xml = model("<mxCell id=\"a\" vertex=\"1\" parent=\"1\"/>"
            + "<mxCell id=\"e\" edge=\"1\" parent=\"1\" source=\"a\" target=\"zz\"/>");

        StructuralViolation violation = validator.validate(xml).orElseThrow();

        assertThat(violation.code()).isEqualTo(ViolationCode.INVALID_EDGE_REF);
        assertThat(violation.cellIds()).containsExactly("e (target:zz)");
    }

    @Test
    void validate_withLooseMxPoint_reportsOrphanedPoint() {
        String xml = model("<mxCell id=\"e\" edge=\"1\" parent=\"1\"><mxGeometry relative=\"1\" as=\"geometry\">"
            + "<mxPoint x=\"1\" y=\"1\"/></mxGeometry></mxCell>");

        StructuralViolation violation = validator.validate(xml).orElseThrow();

        assertThat(violation.code()).isEqualTo(ViolationCode.ORPHANED_MXPOINT);
        assertThat(violation.cellIds()).containsExactly("e");
    }

    @Test
    void validate_reportsEarlierCodeFirst() {
        String xml = model("<mxCell id=\"a\" parent=\"ghost\"/><mxCell id=\"a\" parent=\"1\"/>");

        assertThat(validator.validate(xml)).map(StructuralViolation::code).contains(ViolationCode.DUPLICATE_ID);
    }

    @Test
    void describe_includesCodeIdsAndHint() {
        StructuralViolation violation = new StructuralViolation(ViolationCode.DUPLICATE_ID, "Duplicate.",
            List.of("a", "b"), "Rename.");

        assertThat(violation.describe()).isEqualTo("Invalid XML [DUPLICATE_ID]: Duplicate. IDs: a, b. Hint: Rename.");
    }

    @Test
    void constructor_truncatesReportedIds() {
        StructuralViolation violation = new StructuralViolation(ViolationCode.MISSING_PARENT, "m",
            List.of("1", "2", "3", "4", "5", "6", "7"), null);

        assertThat(violation.cellIds()).hasSize(StructuralViolation.MAX_REPORTED_IDS);
        assertThat(violation.describe()).doesNotContain("Hint");
    }
}
