package com.diagramforge.cli;

import com.diagramforge.core.engine.EngineResult;
import com.diagramforge.core.model.DiagramComponent;
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
 * Command to convert a JSON array of components into a draw.io document.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * diagramforge generate components.json -o architecture.drawio
 * }</pre>
 */
@Command(
    name = "generate",
    description = "Generate diagram XML from a components JSON file",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    private static final TypeReference<List<DiagramComponent>> COMPONENT_LIST = new TypeReference<>() {
    };

    @Spec
    private CommandSpec spec;

    @Mixin
    private EngineOptions engineOptions;

    @Parameters(index = "0", description = "JSON file holding an array of components")
    private Path componentsFile;

    @Option(names = {"-o", "--output"}, description = "Output file (default: stdout)")
    private Path output;

    @Override
    public Integer call() {
        List<DiagramComponent> components;
        try {
            components = CliSupport.JSON.readValue(CliSupport.read(componentsFile), COMPONENT_LIST);
        } catch (IOException e) {
            return CliSupport.ioError(spec, componentsFile, e);
        }
        log.debug("Read {} components from {}", components.size(), componentsFile);

        EngineResult<String> result = engineOptions.engine().generate(components);
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
