package com.seqdraft.core.generator;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.methods;
import static com.tngtech.archunit.library.GeneralCodingRules.NO_CLASSES_SHOULD_USE_FIELD_INJECTION;

/**
 * ArchUnit tests for generator architecture.
 *
 * <p>Generators implement {@link DiagramGenerator}, live in the impl package, are public for
 * ServiceLoader discovery and depend only on the generator API, the model, the resolvers and Jackson.
 */
class GeneratorArchitectureTest {

    private static JavaClasses generatorClasses;

    @BeforeAll
    static void setUp() {
        generatorClasses = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_JARS)
            .withImportOption(location -> !location.contains("/jrt:/"))
            .importPackages("com.seqdraft.core.generator");
    }

    @Test
    void allGeneratorImplementationsShouldImplementDiagramGenerator() {
        ArchRule rule = classes()
            .that().resideInAPackage("..generator.impl..")
            .and().haveSimpleNameEndingWith("Generator")
            .should().implement(DiagramGenerator.class)
            .because("all generator implementations must implement the DiagramGenerator interface");

        rule.check(generatorClasses);
    }

    @Test
    void generatorImplementationsShouldResideInImplPackage() {
        ArchRule rule = classes()
            .that().implement(DiagramGenerator.class)
            .and().areNotInterfaces()
            .should().resideInAPackage("..generator.impl..")
            .andShould().bePublic()
            .because("generator implementations are discovered through ServiceLoader");

        rule.check(generatorClasses);
    }

    @Test
    void generatorsShouldNotUseFieldInjection() {
        NO_CLASSES_SHOULD_USE_FIELD_INJECTION.check(generatorClasses);
    }

    @Test
    void generatorImplementationsShouldOnlyDependOnAllowedLayers() {
        ArchRule rule = classes()
            .that().resideInAPackage("..generator.impl..")
            .should().onlyDependOnClassesThat()
                .resideInAnyPackage(
                    "..generator.impl..",
                    "com.seqdraft.core.generator",
                    "com.seqdraft.core.model..",
                    "com.seqdraft.core.resolver..",
                    "java..",
                    "org.slf4j..",
                    "com.fasterxml.jackson.."
                )
            .because("generators read diagrams through the model and resolvers only, never the parser");

        rule.check(generatorClasses);
    }

    @Test
    void generatorInterfaceShouldNotDependOnImplementations() {
        ArchRule rule = classes()
            .that().resideInAPackage("com.seqdraft.core.generator")
            .and().areInterfaces()
            .should().onlyDependOnClassesThat()
                .resideInAnyPackage(
                    "com.seqdraft.core.generator",
                    "com.seqdraft.core.model..",
                    "java..",
                    "org.slf4j.."
                )
            .because("generator interfaces should not depend on implementations");

        rule.check(generatorClasses);
    }

    @Test
    void generatorsShouldNotThrowGenericExceptions() {
        ArchRule rule = methods()
            .that().areDeclaredInClassesThat().implement(DiagramGenerator.class)
            .should().notDeclareThrowableOfType(Exception.class)
            .andShould().notDeclareThrowableOfType(Throwable.class)
            .because("generators should throw specific exceptions, not generic Exception");

        rule.check(generatorClasses);
    }
}
