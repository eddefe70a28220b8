package com.diagramforge.cli;

import com.diagramforge.core.engine.EngineError;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import picocli.CommandLine.Model.CommandSpec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * File, JSON and console helpers shared by the commands.
 */
final class CliSupport {

    static final int EXIT_OK = 0;
    static final int EXIT_ENGINE_ERROR = 1;
    static final int EXIT_IO_ERROR = 2;

    static final ObjectMapper JSON = new ObjectMapper()
        .setSerializationInclusion(JsonInclude.Include.NON_NULL)
        .enable(SerializationFeature.INDENT_OUTPUT)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private CliSupport() {
    }

    static String read(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    /**
     * Writes the text to {@code output}, or to the command's standard output when
     * {@code output} is {@code null}.
     */
    static void write(CommandSpec spec, String text, Path output) throws IOException {
        if (output == null) {
            PrintWriter out = spec.commandLine().getOut();
            out.println(text);
            out.flush();
        } else {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, text, StandardCharsets.UTF_8);
        }
    }

    static void println(CommandSpec spec, String text) {
        PrintWriter out = spec.commandLine().getOut();
        out.println(text);
        out.flush();
    }

    static int engineError(CommandSpec spec, EngineError error) {
        PrintWriter err = spec.commandLine().getErr();
        err.println("Error: " + error.message());
        err.flush();
        return EXIT_ENGINE_ERROR;
    }

    static int ioError(CommandSpec spec, Path file, IOException e) {
        PrintWriter err = spec.commandLine().getErr();
        err.println("Error: cannot process " + file + ": " + e.getMessage());
        err.flush();
        return EXIT_IO_ERROR;
    }
}
