package com.diagramforge.cli;

import com.diagramforge.core.config.ConfigLoader;
import com.diagramforge.core.config.EngineConfig;
import com.diagramforge.core.engine.DiagramEngine;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Options shared by every command that runs the engine.
 */
public class EngineOptions {

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: ./diagramforge.yaml if present)")
    private Path configFile;

    /**
     * Loads the configuration and creates an engine.
     *
     * @return engine configured from {@code --config} or the working directory
     */
    public DiagramEngine engine() {
        EngineConfig config = configFile != null
            ? ConfigLoader.load(configFile)
            : ConfigLoader.loadFromDirectory(Paths.get("."));
        return DiagramEngine.create(config);
    }
}
