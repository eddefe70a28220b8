package com.diagramforge.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests for the package layering of the engine.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Components and value types are immutable records</li>
 *   <li>Low-level packages (xml, style, util, model) stay free of engine logic</li>
 *   <li>Only the facade wires the pipelines together</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.diagramforge.core");
    }

    /**
     * Component and value types are records; kinds are enums and the variant families are sealed interfaces.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .and().areNotInterfaces()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnCodecs() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..xml..", "..convert..", "..parse..", "..ops..", "..repair..", "..engine..");

        rule.check(classes);
    }

    /**
     * XML plumbing and utilities are reused by every pipeline, so they depend on none of them.
     */
    @Test
    void lowLevelPackages_shouldNotDependOnPipelines() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..xml..", "..style..", "..util..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..convert..", "..parse..", "..ops..", "..validate..", "..repair..",
                "..canonical..", "..analysis..", "..engine..");

        rule.check(classes);
    }

    @Test
    void validator_shouldNotDependOnRepair() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..validate..")
            .should().dependOnClassesThat().resideInAPackage("..repair..");

        rule.check(classes);
    }

    @Test
    void onlyEngine_shouldDependOnEngine() {
        ArchRule rule = noClasses()
            .that().resideOutsideOfPackage("..engine..")
            .should().dependOnClassesThat().resideInAPackage("..engine..");

        rule.check(classes);
    }

    @Test
    void repairRules_shouldResideInRepairPackage() {
        ArchRule rule = classes()
            .that().implement("com.diagramforge.core.repair.RepairRule")
            .should().resideInAPackage("..repair..");

        rule.check(classes);
    }
}
