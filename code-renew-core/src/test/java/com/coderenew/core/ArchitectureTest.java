package com.coderenew.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * ArchUnit tests to validate the package layering.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are immutable records or enums</li>
 *   <li>Models depend on nothing but the version utilities</li>
 *   <li>Detection, optimization and the analysis client stay independent of scan orchestration</li>
 *   <li>Only the orchestration layer reads configuration</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.coderenew.core");
    }

    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .should().beAssignableTo(Record.class);

        rule.check(classes);
    }

    /**
     * Models are shared by every layer, so they must not reach back into any of them.
     */
    @Test
    void models_shouldNotDependOnServices() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..knowledge..", "..analyzer..", "..optimizer..", "..ai..", "..scan..", "..resilience..", "..config..");

        rule.check(classes);
    }

    @Test
    void detectors_shouldNotDependOnScan() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..analyzer..", "..optimizer..", "..knowledge..", "..util..")
            .should().dependOnClassesThat().resideInAnyPackage("..scan..", "..ai..");

        rule.check(classes);
    }

    @Test
    void analysisClient_shouldNotDependOnScan() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..ai..")
            .should().dependOnClassesThat().resideInAPackage("..scan..");

        rule.check(classes);
    }

    @Test
    void resilience_shouldNotDependOnCallers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..resilience..")
            .should().dependOnClassesThat().resideInAnyPackage("..ai..", "..scan..", "..knowledge..");

        rule.check(classes);
    }

    @Test
    void configuration_onlyReadByOrchestration() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..analyzer..", "..optimizer..", "..knowledge..", "..ai..", "..resilience..")
            .should().dependOnClassesThat().resideInAPackage("..config..");

        rule.check(classes);
    }
}
