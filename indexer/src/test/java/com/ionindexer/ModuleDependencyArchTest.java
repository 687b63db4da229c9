package com.ionindexer;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Keeps the domain model free of ingestion code and the ingestion stages independent of each other.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.ionindexer");
    }

    @Test
    void domain_must_not_depend_on_ingestion() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..domain..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion..", "org.springframework..");
        rule.check(classes);
    }

    @Test
    void decoder_must_not_depend_on_trace_or_action() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ingestion.decoder..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion.trace..", "..ingestion.action..");
        rule.check(classes);
    }

    @Test
    void action_must_not_depend_on_decoder_or_trace() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ingestion.action..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion.decoder..", "..ingestion.trace..");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.ionindexer.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
