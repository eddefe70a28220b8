package com.diagramforge.core.engine;

import com.diagramforge.core.analysis.AnalysisReport;
import com.diagramforge.core.analysis.DiagramAnalyzer;
import com.diagramforge.core.analysis.DiagramDiff;
import com.diagramforge.core.canonical.XmlCanonicalizer;
import com.diagramforge.core.config.EngineConfig;
import com.diagramforge.core.convert.ComponentValidator;
import com.diagramforge.core.convert.ComponentXmlConverter;
import com.diagramforge.core.model.DiagramComponent;
import com.diagramforge.core.ops.DiagramEditOp;
import com.diagramforge.core.ops.DiagramOpsExecutor;
import com.diagramforge.core.ops.EditResult;
import com.diagramforge.core.parse.XmlComponentParser;
import com.diagramforge.core.repair.RepairRules;
import com.diagramforge.core.repair.ValidationReport;
import com.diagramforge.core.repair.XmlAutoFixer;
import com.diagramforge.core.repair.XmlRepairService;
import com.diagramforge.core.validate.StructuralValidator;
import com.diagramforge.core.validate.StructuralViolation;
import com.diagramforge.core.validate.ViolationCode;
import com.diagramforge.core.xml.XmlDocumentCodec;
import com.diagramforge.core.xml.XmlParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Entry points for generating, displaying, editing and inspecting diagrams.
 *
 * <p>Every method returns a tagged result; no exception escapes. The engine holds no
 * per-call state, so one instance may be shared between threads.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DiagramEngine engine = DiagramEngine.create(ConfigLoader.load(path));
 * EngineResult<String> xml = engine.generate(components);
 * EngineResult<String> edited = engine.edit(xml.value(), ops);
 * }</pre>
 */
public class DiagramEngine {

    private static final Logger log = LoggerFactory.getLogger(DiagramEngine.class);

    private final XmlDocumentCodec codec;
    private final ComponentXmlConverter converter;
    private final XmlComponentParser parser;
    private final DiagramOpsExecutor executor;
    private final StructuralValidator validator;
    private final XmlRepairService repairService;
    private final XmlCanonicalizer canonicalizer;
    private final DiagramAnalyzer analyzer;
    private final DiagramDiff diff;

    public DiagramEngine(XmlDocumentCodec codec, EngineConfig config) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        Objects.requireNonNull(config, "config must not be null");
        this.converter = new ComponentXmlConverter(config);
        this.parser = new XmlComponentParser(codec);
        this.executor = new DiagramOpsExecutor(codec, converter);
        this.validator = new StructuralValidator(codec);
        this.repairService = new XmlRepairService(validator,
            new XmlAutoFixer(codec, RepairRules.defaults(), config));
        this.canonicalizer = new XmlCanonicalizer(codec, config);
        this.analyzer = new DiagramAnalyzer(codec, config);
        this.diff = new DiagramDiff(codec, config);
    }

    /**
     * Creates an engine using the codec discovered through {@link XmlDocumentCodec#load()}.
     *
     * @param config engine configuration
     * @return new engine
     */
    public static DiagramEngine create(EngineConfig config) {
        return new DiagramEngine(XmlDocumentCodec.load(), config);
    }

    public static DiagramEngine create() {
        return create(EngineConfig.defaults());
    }

    /**
     * Converts components into a complete, validated document.
     *
     * @param components components to render
     * @return {@code mxfile} document
     */
    public EngineResult<String> generate(List<? extends DiagramComponent> components) {
        return guarded("generate", () -> {
            List<String> problems = ComponentValidator.validateComponents(components);
            if (!problems.isEmpty()) {
                return EngineResult.failure(new EngineError.OperationError("Invalid components: " + String.join("; ", problems)));
            }
            String xml = converter.componentsToXml(components);
            Optional<StructuralViolation> violation = validator.validate(xml);
            if (violation.isPresent()) {
                return EngineResult.failure(toError(violation.get()));
            }
            log.info("Generated diagram with {} components", components.size());
            return EngineResult.success(canonicalizer.wrapWithMxFile(xml));
        });
    }

    /**
     * Prepares raw XML for rendering: validates, auto-fixes if needed, and wraps the result.
     *
     * @param xml document or cell fragment
     * @return wrapped document and the fixes applied
     */
    public EngineResult<DisplayResult> display(String xml) {
        return guarded("display", () -> {
            ValidationReport report = repairService.validateAndFix(xml);
            if (!report.valid()) {
                return EngineResult.failure(toError(report.error()));
            }
            if (!report.fixes().isEmpty()) {
                log.info("Display repaired the document with {} fixes", report.fixes().size());
            }
            String wrapped = canonicalizer.wrapWithMxFile(report.effectiveXml(xml));
            return EngineResult.success(new DisplayResult(wrapped, report.fixes()));
        });
    }

    /**
     * Applies an edit batch and validates the outcome.
     *
     * @param xml current document
     * @param ops operations, applied all-or-nothing
     * @return edited document
     */
    public EngineResult<String> edit(String xml, List<? extends DiagramEditOp> ops) {
        return guarded("edit", () -> {
            EditResult result = executor.apply(xml, ops);
            if (!result.isSuccess()) {
                if (result.failedIndex() < 0) {
                    return EngineResult.failure(new EngineError.ParseError(result.error()));
                }
                return EngineResult.failure(new EngineError.OperationError(result.error(), result.failedIndex()));
            }
            Optional<StructuralViolation> violation = validator.validate(result.xml());
            if (violation.isPresent()) {
                return EngineResult.failure(toError(violation.get()));
            }
            log.info("Applied {} edit operations", ops == null ? 0 : ops.size());
            return EngineResult.success(result.xml());
        });
    }

    /**
     * Decodes a document into components, with a by-kind summary and a structural outline.
     *
     * @param xml document text
     * @return analysis report
     */
    public EngineResult<AnalysisReport> analyze(String xml) {
        return guarded("analyze", () -> {
            List<DiagramComponent> components;
            try {
                components = parser.resolveChildRelationships(parser.xmlToComponents(xml));
            } catch (XmlParseException e) {
                return EngineResult.failure(new EngineError.ParseError(e.getMessage()));
            }
            return EngineResult.success(new AnalysisReport(components,
                XmlComponentParser.summarizeComponents(components),
                analyzer.analyzeDiagramXml(xml)));
        });
    }

    /**
     * Summarizes the changes between two revisions.
     *
     * @param previousXml older revision
     * @param currentXml newer revision
     * @return change summary
     */
    public EngineResult<String> diff(String previousXml, String currentXml) {
        return guarded("diff", () -> {
            if (diff.compare(previousXml, currentXml).isEmpty()) {
                return EngineResult.failure(new EngineError.ParseError("Unable to compare XML (parsing failed)"));
            }
            return EngineResult.success(diff.generateXmlDiff(previousXml, currentXml));
        });
    }

    /**
     * Checks the structural invariants without repairing anything.
     *
     * @param xml document text
     * @return first violation, or empty when valid
     */
    public Optional<StructuralViolation> validate(String xml) {
        return validator.validate(xml);
    }

    /**
     * Validates and, when invalid, runs the auto-fix pipeline once.
     *
     * @param xml document text
     * @return validation report; never fails
     */
    public ValidationReport validateAndFix(String xml) {
        return repairService.validateAndFix(xml);
    }

    /**
     * Extracts complete cells from streaming input and wraps them into a document.
     *
     * @param streamingXml possibly truncated XML
     * @param pretty whether to indent the result
     * @return complete document
     */
    public String canonicalize(String streamingXml, boolean pretty) {
        String wrapped = canonicalizer.canonicalize(streamingXml);
        return pretty ? canonicalizer.formatXml(wrapped) : wrapped;
    }

    public XmlDocumentCodec codec() {
        return codec;
    }

    private static EngineError toError(StructuralViolation violation) {
        if (violation.code() == ViolationCode.PARSE_ERROR) {
            return new EngineError.ParseError(violation.describe());
        }
        return new EngineError.StructuralError(violation);
    }

    private static <T> EngineResult<T> guarded(String operation, Supplier<EngineResult<T>> action) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            log.error("Unexpected failure in {}: {}", operation, e.getMessage(), e);
            return EngineResult.failure(new EngineError.OperationError(operation + " failed: " + e.getMessage()));
        }
    }
}
