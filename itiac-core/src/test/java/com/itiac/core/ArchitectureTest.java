package com.itiac.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate architectural rules and design patterns.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>The model depends on nothing but itself</li>
 *   <li>Graph algorithms stay independent of workflows, scoring and the engine</li>
 *   <li>Loading snapshots and configuration never runs an analysis</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.itiac.core");
    }

    /**
     * Verifies all domain models in the model package are implemented as Java records.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnOtherLayers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..graph..", "..workflow..", "..scoring..", "..analysis..",
                "..snapshot..", "..config..", "..validation..");

        rule.check(classes);
    }

    /**
     * Verifies graph traversal only knows about edges and components.
     */
    @Test
    void graph_shouldNotDependOnHigherLayers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..graph..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..workflow..", "..scoring..", "..analysis..", "..config..", "..snapshot..");

        rule.check(classes);
    }

    @Test
    void scoring_shouldNotDependOnTraversal() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..scoring..")
            .should().dependOnClassesThat().resideInAnyPackage("..graph..", "..workflow..", "..analysis..");

        rule.check(classes);
    }

    @Test
    void snapshotLoading_shouldNotRunAnalysis() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..snapshot..")
            .should().dependOnClassesThat().resideInAnyPackage("..analysis..", "..scoring..", "..workflow..");

        rule.check(classes);
    }
}
