package com.diagramforge.cli;

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
 * Command to turn a partial or bare cell fragment into a complete document.
 */
@Command(
    name = "canonicalize",
    description = "Keep the complete cells of a fragment and wrap them into a full document",
    mixinStandardHelpOptions = true
)
public class CanonicalizeCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Mixin
    private EngineOptions engineOptions;

    @Parameters(index = "0", description = "Fragment file")
    private Path fragmentFile;

    @Option(names = "--pretty", description = "Indent the output")
    private boolean pretty;

    @Option(names = {"-o", "--output"}, description = "Output file (default: stdout)")
    private Path output;

    @Override
    public Integer call() {
        try {
            String fragment = CliSupport.read(fragmentFile);
            CliSupport.write(spec, engineOptions.engine().canonicalize(fragment, pretty), output);
            return CliSupport.EXIT_OK;
        } catch (IOException e) {
            return CliSupport.ioError(spec, fragmentFile, e);
        }
    }
}
