package com.diagramforge.cli;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ListCommand}.
 */
class ListCommandTest {

    @Test
    void list_kinds_printsEveryKind() {
        CommandRun run = CommandRun.execute("list", "kinds");

        assertThat(run.exitCode()).isZero();
        assertThat(run.out()).startsWith("Component Kinds:").contains("Rectangle", "Cylinder", "Swimlane", "AWSIcon");
    }

    @Test
    void list_services_printsProviders() {
        CommandRun run = CommandRun.execute("list", "services");

        assertThat(run.out()).startsWith("Cloud Services:").contains("Lambda");
    }

    @Test
    void list_rules_printsNumberedPipeline() {
        CommandRun run = CommandRun.execute("list", "rules");

        assertThat(run.out()).startsWith("Auto-fix Rules (in order):").contains(" 1. ", "22. ");
    }

    @Test
    void list_unknownType_fails() {
        CommandRun run = CommandRun.execute("list", "widgets");

        assertThat(run.exitCode()).isEqualTo(CliSupport.EXIT_ENGINE_ERROR);
    }
}
