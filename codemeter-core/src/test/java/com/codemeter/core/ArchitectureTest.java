package com.codemeter.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * ArchUnit tests to validate package layering.
 *
 * <p>Leaves ({@code language}, {@code counting}, {@code io}, {@code walk}) know nothing about how
 * files are scheduled or reported; only {@code engine} ties the pieces together.
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.codemeter.core");
    }

    /**
     * Verifies all domain models in the model package are implemented as Java records or enums.
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
    void models_shouldNotDependOnOtherPackages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.engine..", "..core.backend..", "..core.renderer..", "..core.aggregate..");

        rule.check(classes);
    }

    @Test
    void leafPackages_shouldNotDependOnEngineOrBackends() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..core.language..", "..core.counting..", "..core.io..", "..core.walk..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.engine..", "..core.backend..", "..core.aggregate..", "..core.renderer..");

        rule.check(classes);
    }

    @Test
    void backends_shouldNotDependOnEngine() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.backend..")
            .should().dependOnClassesThat().resideInAPackage("..core.engine..");

        rule.check(classes);
    }

    @Test
    void renderers_shouldOnlyReadSnapshots() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.renderer..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.engine..", "..core.backend..", "..core.aggregate..");

        rule.check(classes);
    }

    @Test
    void renderers_shouldImplementReportRenderer() {
        ArchRule rule = classes()
            .that().resideInAPackage("..renderer.impl..")
            .and().haveSimpleNameEndingWith("Renderer")
            .should().implement("com.codemeter.core.renderer.ReportRenderer");

        rule.check(classes);
    }
}
