package com.diagramforge.core.engine;

import com.diagramforge.core.analysis.AnalysisReport;
import com.diagramforge.core.config.ConfigLoader;
import com.diagramforge.core.config.EngineConfig;
import com.diagramforge.core.model.ComponentKind;
import com.diagramforge.core.model.Connector;
import com.diagramforge.core.model.DiagramComponent;
import com.diagramforge.core.model.ShapeComponent;
import com.diagramforge.core.ops.AddCellOp;
import com.diagramforge.core.ops.ConnectComponentsOp;
import com.diagramforge.core.ops.DeleteCellOp;
import com.diagramforge.core.ops.SetCellValueOp;
import com.diagramforge.core.validate.ViolationCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DiagramEngine}.
 */
class DiagramEngineTest {

    private static final List<DiagramComponent> COMPONENTS = List.of(
        ShapeComponent.at(ComponentKind.RECTANGLE, "api", "API", 40, 40),
        ShapeComponent.at(ComponentKind.CYLINDER, "db", "Orders", 240, 40),
        Connector.between("e1", "api", "db"));

    private final DiagramEngine engine = DiagramEngine.create();

    private String diagram;

    @BeforeEach
    void setUp() {
        diagram = engine.generate(COMPONENTS).value();
    }

    @Test
    void generate_withValidComponents_returnsWrappedDocument() {
        assertThat(diagram).startsWith("<mxfile><diagram name=\"Page-1\" id=\"page-1\"><mxGraphModel");
        assertThat(diagram).endsWith("</diagram></mxfile>");
        assertThat(engine.validate(diagram)).isEmpty();
    }

    @Test
    void generate_withConfiguredDocument_usesPageSettings() throws URISyntaxException {
        EngineConfig config = ConfigLoader.load(Path.of(getClass().getResource("/diagramforge.yaml").toURI()));
        DiagramEngine configured = DiagramEngine.create(config);

        EngineResult<String> result = configured.generate(List.of(ShapeComponent.of(ComponentKind.ELLIPSE, "n", "Node")));

        assertThat(result.value()).startsWith("<mxfile><diagram name=\"Architecture\" id=\"arch-1\">");
        assertThat(result.value()).contains("x=\"40\" y=\"60\"");
    }

    @Test
    void generate_withDanglingConnector_returnsOperationError() {
        EngineResult<String> result = engine.generate(List.of(
            ShapeComponent.of(ComponentKind.RECTANGLE, "a", "A"),
            Connector.between("e", "a", "missing")));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.error()).isInstanceOf(EngineError.OperationError.class);
        assertThat(result.error().message())
            .isEqualTo("Invalid components: Connector \"e\" references non-existent target: missing");
    }

    @Test
    void display_withValidDocument_returnsWithoutFixes() {
        EngineResult<DisplayResult> result = engine.display(diagram);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.value().xml()).isEqualTo(diagram);
        assertThat(result.value().fixes()).isEmpty();
    }

    @Test
    void display_withDuplicateAttributes_returnsRepairedDocument() {
        String xml = "<mxGraphModel><root><mxCell id=\"0\"/><mxCell id=\"1\" parent=\"0\"/>"
            + "<mxCell id=\"a\" vertex=\"1\" parent=\"1\" parent=\"1\"/></root></mxGraphModel>";

        EngineResult<DisplayResult> result = engine.display(xml);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.value().fixes()).isNotEmpty();
        assertThat(result.value().xml()).startsWith("<mxfile>");
        assertThat(engine.validate(result.value().xml())).isEmpty();
    }

    @Test
    void display_withUnfixableStructure_returnsStructuralError() {
        String xml = "<mxGraphModel><root><mxCell id=\"0\"/><mxCell id=\"a\" parent=\"ghost\"/></root></mxGraphModel>";

        EngineResult<DisplayResult> result = engine.display(xml);

        assertThat(result.error()).isInstanceOfSatisfying(EngineError.StructuralError.class,
            error -> assertThat(error.violation().code()).isEqualTo(ViolationCode.INVALID_PARENT));
    }

    @Test
    void edit_withValidOps_returnsEditedDocument() {
        EngineResult<String> result = engine.edit(diagram, List.of(
            new SetCellValueOp("api", "Gateway"),
            AddCellOp.vertex("cache", null, "Cache", "rounded=1;", null),
            ConnectComponentsOp.of("e2", "api", "cache")));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.value()).contains("value=\"Gateway\"", "id=\"cache\"", "id=\"e2\"");
    }

    @Test
    void edit_withFailingOp_returnsOperationErrorWithIndex() {
        EngineResult<String> result = engine.edit(diagram, List.of(
            new DeleteCellOp("e1"),
            new SetCellValueOp("ghost", "x")));

        assertThat(result.error()).isInstanceOfSatisfying(EngineError.OperationError.class, error -> {
            assertThat(error.failedIndex()).isEqualTo(1);
            assertThat(error.message()).isEqualTo("Operation #1 (setCellValue) failed: Cell id=\"ghost\" not found");
        });
    }

    @Test
    void edit_withUnparseableDocument_returnsParseError() {
        EngineResult<String> result = engine.edit("<mxGraphModel><root>", List.of(new DeleteCellOp("a")));

        assertThat(result.error()).isInstanceOf(EngineError.ParseError.class);
    }

    @Test
    void edit_producingDanglingEdge_returnsStructuralError() {
        AddCellOp edge = new AddCellOp("e9", "1", null, null, null, Boolean.TRUE, "api", "ghost", null);

        EngineResult<String> result = engine.edit(diagram, List.of(edge));

        assertThat(result.error()).isInstanceOfSatisfying(EngineError.StructuralError.class,
            error -> assertThat(error.violation().code()).isEqualTo(ViolationCode.INVALID_EDGE_REF));
    }

    @Test
    void analyze_withGeneratedDocument_returnsComponentsAndOutline() {
        EngineResult<AnalysisReport> result = engine.analyze(diagram);

        assertThat(result.isSuccess()).isTrue();
        AnalysisReport report = result.value();
        assertThat(report.components()).extracting(DiagramComponent::id).containsExactly("api", "db", "e1");
        assertThat(report.summary()).startsWith("Total components: 3");
        assertThat(report.outline()).startsWith("Nodes: 2").contains("Edges: 1", "- e1 api -> db");
    }

    @Test
    void analyze_withUnparseableDocument_returnsParseError() {
        assertThat(engine.analyze("<mxGraphModel>").error()).isInstanceOf(EngineError.ParseError.class);
    }

    @Test
    void diff_betweenRevisions_summarizesChanges() {
        String edited = engine.edit(diagram, List.of(new SetCellValueOp("api", "Gateway"))).value();

        assertThat(engine.diff(diagram, diagram).value()).isEqualTo("No changes detected");
        assertThat(engine.diff(diagram, edited).value())
            .contains("Modified 1 elements:", "label: \"API\" → \"Gateway\"");
    }

    @Test
    void diff_withUnparseableSide_returnsParseError() {
        EngineResult<String> result = engine.diff("<mxGraphModel>", diagram);

        assertThat(result.error()).isInstanceOf(EngineError.ParseError.class);
        assertThat(result.error().message()).isEqualTo("Unable to compare XML (parsing failed)");
    }

    @Test
    void canonicalize_withTruncatedStream_returnsValidDocument() {
        String streamed = "<mxCell id=\"2\" value=\"a\" vertex=\"1\" parent=\"1\"/><mxCell id=\"3\" val";

        String compact = engine.canonicalize(streamed, false);
        String pretty = engine.canonicalize(streamed, true);

        assertThat(compact).startsWith("<mxfile>").contains("id=\"2\"").doesNotContain("id=\"3\"");
        assertThat(engine.validate(compact)).isEmpty();
        assertThat(pretty.lines().count()).isGreaterThan(1);
    }

    @Test
    void engineResult_requiresExactlyOneSide() {
        assertThatThrownBy(() -> new EngineResult<>("x", new EngineError.ParseError("p")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(EngineResult.success("a").map(String::length).value()).isEqualTo(1);
        assertThat(EngineResult.<String>failure(new EngineError.ParseError("p")).map(String::length).isSuccess())
            .isFalse();
    }
}
