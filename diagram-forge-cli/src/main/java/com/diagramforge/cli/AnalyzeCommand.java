package com.diagramforge.cli;

import com.diagramforge.core.analysis.AnalysisReport;
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
 * Command to print a component summary and structural outline of a diagram.
 */
@Command(
    name = "analyze",
    description = "Summarize a diagram and report structural warnings",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Mixin
    private EngineOptions engineOptions;

    @Parameters(index = "0", description = "Diagram XML file")
    private Path diagramFile;

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
        CliSupport.println(spec, result.value().summary());
        CliSupport.println(spec, "");
        CliSupport.println(spec, result.value().outline());
        return CliSupport.EXIT_OK;
    }
}
