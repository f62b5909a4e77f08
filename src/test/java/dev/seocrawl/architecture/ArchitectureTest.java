package dev.seocrawl.architecture;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

@AnalyzeClasses(packages = "dev.seocrawl", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

    // Feature packages should not depend on adapter packages.
    @ArchTest
    static final ArchRule features_should_not_depend_on_adapters =
        noClasses().that().resideInAnyPackage(
                "..url..", "..fetch..", "..crawl..", "..audit.."
            )
            .should().dependOnClassesThat().resideInAnyPackage(
                "..mcp..", "..api.."
            );

    // Adapter packages should not depend on each other
    @ArchTest
    static final ArchRule adapters_should_not_depend_on_each_other =
        noClasses().that().resideInAPackage("..mcp..")
            .should().dependOnClassesThat().resideInAPackage("..api..");

    @ArchTest
    static final ArchRule rest_adapter_should_not_depend_on_mcp =
        noClasses().that().resideInAPackage("..api..")
            .should().dependOnClassesThat().resideInAPackage("..mcp..");

    // Config package should not depend on feature or adapter packages
    @ArchTest
    static final ArchRule config_should_not_depend_on_features =
        noClasses().that().resideInAPackage("..config..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..url..", "..fetch..", "..crawl..", "..audit..", "..mcp..", "..api.."
            );

    // The auditor and the crawler share the fetch layer, never each other.
    @ArchTest
    static final ArchRule audit_and_crawl_are_independent =
        noClasses().that().resideInAPackage("..audit..")
            .should().dependOnClassesThat().resideInAPackage("..crawl..");

    // No cyclic dependencies between top-level packages
    @ArchTest
    static final ArchRule no_package_cycles =
        slices().matching("dev.seocrawl.(*)..").should().beFreeOfCycles();
}
