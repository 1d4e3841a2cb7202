package com.fundradar;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Module dependency rules: market data at the bottom, fund accounting above ledgers and bonds, the aggregator on top.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.fundradar");
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.fundradar.common..")
                .should().dependOnClassesThat().resideInAnyPackage("com.fundradar.domain..", "com.fundradar.context..",
                        "com.fundradar.marketdata..", "com.fundradar.timeseries..", "com.fundradar.pricing..",
                        "com.fundradar.ledger..", "com.fundradar.bond..", "com.fundradar.fund..",
                        "com.fundradar.analytics..", "com.fundradar.ingestion..", "com.fundradar.aggregator..",
                        "com.fundradar.config..");
        rule.check(classes);
    }

    @Test
    void domain_must_only_depend_on_common() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.fundradar.domain..")
                .should().dependOnClassesThat().resideInAnyPackage("com.fundradar.marketdata..",
                        "com.fundradar.timeseries..", "com.fundradar.pricing..", "com.fundradar.ledger..",
                        "com.fundradar.bond..", "com.fundradar.fund..", "com.fundradar.analytics..",
                        "com.fundradar.ingestion..", "com.fundradar.aggregator..", "com.fundradar.config..");
        rule.check(classes);
    }

    @Test
    void marketdata_must_not_depend_on_services() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.fundradar.marketdata..")
                .should().dependOnClassesThat().resideInAnyPackage("com.fundradar.timeseries..",
                        "com.fundradar.pricing..", "com.fundradar.ledger..", "com.fundradar.bond..",
                        "com.fundradar.fund..", "com.fundradar.analytics..", "com.fundradar.ingestion..",
                        "com.fundradar.aggregator..");
        rule.check(classes);
    }

    @Test
    void ledger_must_not_depend_on_fund_accounting() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.fundradar.ledger..")
                .should().dependOnClassesThat().resideInAnyPackage("com.fundradar.bond..", "com.fundradar.fund..",
                        "com.fundradar.analytics..", "com.fundradar.ingestion..", "com.fundradar.aggregator..");
        rule.check(classes);
    }

    @Test
    void fund_must_not_depend_on_analytics_ingestion_aggregator() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.fundradar.fund..")
                .should().dependOnClassesThat().resideInAnyPackage("com.fundradar.analytics..",
                        "com.fundradar.ingestion..", "com.fundradar.aggregator..");
        rule.check(classes);
    }

    @Test
    void analytics_must_not_depend_on_ingestion_aggregator() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.fundradar.analytics..")
                .should().dependOnClassesThat().resideInAnyPackage("com.fundradar.ingestion..", "com.fundradar.aggregator..");
        rule.check(classes);
    }

    @Test
    void only_aggregator_depends_on_aggregator() {
        ArchRule rule = noClasses()
                .that().resideOutsideOfPackage("com.fundradar.aggregator..")
                .should().dependOnClassesThat().resideInAPackage("com.fundradar.aggregator..");
        rule.check(classes);
    }

    @Test
    void read_facades_should_not_import_repository_classes() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage("com.fundradar.aggregator..", "com.fundradar.analytics..", "com.fundradar.ingestion..")
                .should().dependOnClassesThat().haveSimpleNameEndingWith("Repository");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.fundradar.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
