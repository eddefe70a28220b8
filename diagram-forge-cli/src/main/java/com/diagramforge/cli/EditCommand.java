package com.diagramforge.cli;

import com.diagramforge.core.engine.EngineResult;
import com.diagramforge.core.ops.DiagramEditOp;
import com.fasterxml.jackson.core.type.TypeReference;
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
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to apply a JSON batch of edit operations to a diagram.
 *
 * <p>The batch is all-or-nothing: when any operation fails, nothing is written.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * diagramforge edit diagram.drawio ops.json -o diagram.drawio
 * }</pre>
 */
@Command(
    name = "edit",
    description = "Apply a batch of edit operations to a diagram",
    mixinStandardHelpOptions = true
)
public class EditCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(EditCommand.class);

    private static final TypeReference<List<DiagramEditOp>> OP_LIST = new TypeReference<>() {
    };

    @Spec
    private CommandSpec spec;

    @Mixin
    private EngineOptions engineOptions;

    @Parameters(index = "0", description = "Diagram XML file")
    private Path diagramFile;

    @Parameters(index = "1", description = "JSON file holding an array of operations")
    private Path opsFile;

    @Option(names = {"-o", "--output"}, description = "Output file (default: stdout)")
    private Path output;

    @Override
    public Integer call() {
        String xml;
        try {
            xml = CliSupport.read(diagramFile);
        } catch (IOException e) {
            return CliSupport.ioError(spec, diagramFile, e);
        }
        List<DiagramEditOp> ops;
        try {
            ops = CliSupport.JSON.readValue(CliSupport.read(opsFile), OP_LIST);
        } catch (IOException e) {
            return CliSupport.ioError(spec, opsFile, e);
        }
        log.debug("Applying {} operations to {}", ops.size(), diagramFile);

        EngineResult<String> result = engineOptions.engine().edit(xml, ops);
        if (!result.isSuccess()) {
            return CliSupport.engineError(spec, result.error());
        }
        try {
            CliSupport.write(spec, result.value(), output);
        } catch (IOException e) {
            return CliSupport.ioError(spec, output, e);
        }
        return CliSupport.EXIT_OK;
    }
}
