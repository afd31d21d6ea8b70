package com.vidnyan.storytest;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

@AnalyzeClasses(packages = "com.vidnyan.storytest", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

    @ArchTest
    static final ArchRule domain_should_not_depend_on_outer_layers =
            noClasses().that().resideInAPackage("..domain..")
                    .should().dependOnClassesThat()
                    .resideInAnyPackage("..application..", "..adapter..", "..config..")
                    .because("the domain model and rules must stay usable without the application layer");

    @ArchTest
    static final ArchRule engine_should_not_depend_on_spring =
            noClasses().that().resideInAnyPackage("..domain..", "..application..", "..adapter..")
                    .should().dependOnClassesThat().resideInAPackage("org.springframework..")
                    .because("the engine is wired explicitly in StoryTestConfiguration");

    @ArchTest
    static final ArchRule application_should_not_depend_on_rule_implementations =
            noClasses().that().resideInAPackage("..application..")
                    .should().dependOnClassesThat().resideInAPackage("..adapter..")
                    .because("rules reach the orchestrator only through the RuleRegistry");
}
