package com.diagramforge.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link GenerateCommand}.
 */
class GenerateCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void generate_validComponents_writesDocumentToStdout() throws IOException {
        Path components = tempDir.resolve("components.json");
        Files.writeString(components, """
            [
              {"kind": "Rectangle", "id": "api", "label": "API", "position": {"x": 40, "y": 40}},
              {"kind": "Cylinder", "id": "db", "label": "Orders"},
              {"kind": "Connector", "id": "e1", "source": "api", "target": "db"}
            ]
            """);

        CommandRun run = CommandRun.execute("generate", components.toString());

        assertThat(run.exitCode()).isZero();
        assertThat(run.out()).startsWith("<mxfile>").contains("id=\"api\"", "id=\"db\"", "id=\"e1\"");
    }

    @Test
    void generate_withOutputOption_writesFile() throws IOException {
        Path components = tempDir.resolve("components.json");
        Files.writeString(components, "[{\"kind\": \"Ellipse\", \"id\": \"n\", \"label\": \"Node\"}]");
        Path output = tempDir.resolve("out/diagram.drawio");

        CommandRun run = CommandRun.execute("generate", components.toString(), "-o", output.toString());

        assertThat(run.exitCode()).isZero();
        assertThat(output).exists();
        assertThat(Files.readString(output)).contains("ellipse");
    }

    @Test
    void generate_danglingConnector_reportsEngineError() throws IOException {
        Path components = tempDir.resolve("components.json");
        Files.writeString(components, "[{\"kind\": \"Connector\", \"id\": \"e\", \"source\": \"a\", \"target\": \"b\"}]");

        CommandRun run = CommandRun.execute("generate", components.toString());

        assertThat(run.exitCode()).isEqualTo(CliSupport.EXIT_ENGINE_ERROR);
        assertThat(run.err()).startsWith("Error: Invalid components:");
    }

    @Test
    void generate_missingFile_reportsIoError() {
        CommandRun run = CommandRun.execute("generate", tempDir.resolve("missing.json").toString());

        assertThat(run.exitCode()).isEqualTo(CliSupport.EXIT_IO_ERROR);
        assertThat(run.err()).contains("cannot process");
    }
}
