package com.seqdraft.core;

import com.seqdraft.core.model.Statement;
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
 *   <li>Statements are implemented as immutable records</li>
 *   <li>The model does not depend on the layers built on top of it</li>
 *   <li>Parser and generator stay independent of each other</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.seqdraft.core");
    }

    /**
     * Verifies every statement type is a record.
     * Records provide immutability, compact constructor validation, and generated equals/hashCode.
     */
    @Test
    void statements_shouldBeRecords() {
        ArchRule rule = classes()
            .that().implement(Statement.class)
            .should().beRecords();

        rule.check(classes);
    }

    /**
     * Verifies the model layer has no dependencies on parser, generator, resolver or config.
     */
    @Test
    void models_shouldNotDependOnOtherLayers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..parser..", "..generator..", "..resolver..", "..config..");

        rule.check(classes);
    }

    /**
     * Verifies the parser does not depend on generators and vice versa.
     */
    @Test
    void parser_shouldNotDependOnGenerators() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..parser..")
            .should().dependOnClassesThat().resideInAnyPackage("..generator..", "..resolver..");

        rule.check(classes);
    }

    @Test
    void generators_shouldNotDependOnParser() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..generator..")
            .should().dependOnClassesThat().resideInAPackage("..parser..");

        rule.check(classes);
    }
}
