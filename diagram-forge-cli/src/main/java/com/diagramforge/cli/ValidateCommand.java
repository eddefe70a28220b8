package com.diagramforge.cli;

import com.diagramforge.core.engine.DiagramEngine;
import com.diagramforge.core.repair.ValidationReport;
import com.diagramforge.core.validate.StructuralViolation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to check a diagram's structure and optionally repair it.
 *
 * <p>Exits with {@code 0} when the (possibly repaired) document is valid and {@code 1}
 * otherwise. With {@code --fix}, the repaired document is written to {@code --output} or
 * standard output.
 */
@Command(
    name = "validate",
    description = "Validate diagram structure, optionally auto-fixing it",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Mixin
    private EngineOptions engineOptions;

    @Parameters(index = "0", description = "Diagram XML file")
    private Path diagramFile;

    @Option(names = "--fix", description = "Run the auto-fix pipeline when the document is invalid")
    private boolean fix;

    @Option(names = {"-o", "--output"}, description = "Where to write the repaired document (default: stdout)")
    private Path output;

    @Override
    public Integer call() {
        String xml;
        try {
            xml = CliSupport.read(diagramFile);
        } catch (IOException e) {
            return CliSupport.ioError(spec, diagramFile, e);
        }
        DiagramEngine engine = engineOptions.engine();

        if (!fix) {
            Optional<StructuralViolation> violation = engine.validate(xml);
            if (violation.isPresent()) {
                CliSupport.println(spec, violation.get().describe());
                return CliSupport.EXIT_ENGINE_ERROR;
            }
            CliSupport.println(spec, "Valid");
            return CliSupport.EXIT_OK;
        }

        ValidationReport report = engine.validateAndFix(xml);
        log.info("Validation of {} finished: valid={}, fixes={}", diagramFile, report.valid(), report.fixes().size());
        for (String applied : report.fixes()) {
            spec.commandLine().getErr().println("Fixed: " + applied);
        }
        spec.commandLine().getErr().flush();
        report.violation().ifPresent(violation -> CliSupport.println(spec, violation.describe()));

        if (report.repairedXml().isPresent()) {
            try {
                CliSupport.write(spec, report.repairedXml().get(), output);
            } catch (IOException e) {
                return CliSupport.ioError(spec, output, e);
            }
        } else if (report.valid()) {
            CliSupport.println(spec, "Valid");
        }
        return report.valid() ? CliSupport.EXIT_OK : CliSupport.EXIT_ENGINE_ERROR;
    }
}
