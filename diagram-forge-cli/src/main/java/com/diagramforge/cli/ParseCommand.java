package com.diagramforge.cli;

import com.diagramforge.core.analysis.AnalysisReport;
import com.diagramforge.core.engine.EngineResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to decode diagram XML into components JSON.
 */
@Command(
    name = "parse",
    description = "Decode diagram XML into components JSON",
    mixinStandardHelpOptions = true
)
public class ParseCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Mixin
    private EngineOptions engineOptions;

    @Parameters(index = "0", description = "Diagram XML file")
    private Path diagramFile;

    @Option(names = "--summary", description = "Print the count of components by kind instead of JSON")
    private boolean summary;

    @Override
    public Integer call() {
        String xml;
        try {
            xml = CliSupport.read(diagramFile);
        } catch (IOException e) {
            return CliSupport.ioError(spec, diagramFile, e);
        }

        EngineResult<AnalysisReport> result = engineOptions.engine().analyze(xml);
        if (!result.isSuccess()) {
            return CliSupport.engineError(spec, result.error());
        }
        if (summary) {
            CliSupport.println(spec, result.value().summary());
            return CliSupport.EXIT_OK;
        }
        try {
            CliSupport.println(spec, CliSupport.JSON.writeValueAsString(result.value().components()));
        } catch (JsonProcessingException e) {
            return CliSupport.ioError(spec, diagramFile, e);
        }
        return CliSupport.EXIT_OK;
    }
}
