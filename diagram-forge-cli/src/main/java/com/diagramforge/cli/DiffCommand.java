package com.diagramforge.cli;

import com.diagramforge.core.engine.EngineResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to compare two revisions of a diagram.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * diagramforge diff before.drawio after.drawio
 * }</pre>
 */
@Command(
    name = "diff",
    description = "Summarize cell changes between two diagram revisions",
    mixinStandardHelpOptions = true
)
public class DiffCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Mixin
    private EngineOptions engineOptions;

    @Parameters(index = "0", description = "Older revision")
    private Path before;

    @Parameters(index = "1", description = "Newer revision")
    private Path after;

    @Override
    public Integer call() {
        String previousXml;
        String currentXml;
        try {
            previousXml = CliSupport.read(before);
        } catch (IOException e) {
            return CliSupport.ioError(spec, before, e);
        }
        try {
            currentXml = CliSupport.read(after);
        } catch (IOException e) {
            return CliSupport.ioError(spec, after, e);
        }

        EngineResult<String> result = engineOptions.engine().diff(previousXml, currentXml);
        if (!result.isSuccess()) {
            return CliSupport.engineError(spec, result.error());
        }
        CliSupport.println(spec, result.value());
        return CliSupport.EXIT_OK;
    }
}
