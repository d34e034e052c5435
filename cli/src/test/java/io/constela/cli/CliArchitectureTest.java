package io.constela.cli;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

/** Boundaries between the command-line front end and the compiler core. */
@AnalyzeClasses(packages = "io.constela.cli", importOptions = ImportOption.DoNotIncludeTests.class)
class CliArchitectureTest {

    @ArchTest
    static final ArchRule configIsIndependentOfTheCompiler = noClasses()
            .that()
            .resideInAPackage("io.constela.cli.config..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.constela.core..", "picocli..")
            .because("configuration loading is usable without the compiler or the argument parser");

    @ArchTest
    static final ArchRule compilerInternalsStayHidden = noClasses()
            .that()
            .resideInAPackage("io.constela.cli..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.constela.core.analyze..", "io.constela.core.transform..")
            .because("the CLI drives compilation through ConstelaCompiler only");

    @ArchTest
    static final ArchRule onlyTheEntryPointExits = noClasses()
            .that()
            .doNotHaveSimpleName("ConstelaCli")
            .should()
            .callMethod(System.class, "exit", int.class)
            .because("commands report their status as an exit code");
}
