package com.polyfetch;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: common at the bottom, then aggregation, backend, orchestrator; config wires them.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.polyfetch");
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.polyfetch.common..")
                .should().dependOnClassesThat().resideInAnyPackage("com.polyfetch.aggregation..",
                        "com.polyfetch.backend..", "com.polyfetch.orchestrator..", "com.polyfetch.config..");
        rule.check(classes);
    }

    @Test
    void aggregation_must_only_depend_on_common() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.polyfetch.aggregation..")
                .should().dependOnClassesThat().resideInAnyPackage("com.polyfetch.backend..",
                        "com.polyfetch.orchestrator..", "com.polyfetch.config..");
        rule.check(classes);
    }

    @Test
    void stage_model_must_not_depend_on_mongo_driver() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.polyfetch.aggregation")
                .should().dependOnClassesThat().resideInAnyPackage("com.mongodb..", "org.springframework.data..");
        rule.check(classes);
    }

    @Test
    void backend_must_not_depend_on_orchestrator_or_config() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.polyfetch.backend..")
                .should().dependOnClassesThat().resideInAnyPackage("com.polyfetch.orchestrator..",
                        "com.polyfetch.config..");
        rule.check(classes);
    }

    @Test
    void config_must_not_depend_on_orchestrator() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.polyfetch.config..")
                .should().dependOnClassesThat().resideInAPackage("com.polyfetch.orchestrator..");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.polyfetch.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
