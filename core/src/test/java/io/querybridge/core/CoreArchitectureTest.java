package io.querybridge.core;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

/**
 * Layering guardrails for the core module: adapters stay below the connector, the listener SPI
 * stays free of implementation types and nothing here knows about the HTTP service.
 */
@AnalyzeClasses(
        packages = "io.querybridge.core",
        importOptions = {ImportOption.DoNotIncludeTests.class})
class CoreArchitectureTest {

    @ArchTest
    static final ArchRule noServiceDependencies = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.querybridge.proxy..", "io.javalin..")
            .because("the core library must not depend on the proxy service or its web stack");

    @ArchTest
    static final ArchRule adaptersDoNotUseConnector = noClasses()
            .that()
            .resideInAPackage("io.querybridge.core.adapter..")
            .should()
            .dependOnClassesThat()
            .resideInAPackage("io.querybridge.core.connector..")
            .because("adapters are driven by the connector, never the other way round");

    @ArchTest
    static final ArchRule spiIsSelfContained = classes()
            .that()
            .resideInAPackage("io.querybridge.core.spi..")
            .should()
            .onlyDependOnClassesThat()
            .resideInAnyPackage("io.querybridge.core.spi..", "io.querybridge.core.error..", "java..")
            .because("listener implementations must not need adapter or connector internals");

    @ArchTest
    static final ArchRule noReflectionUsage = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("java.lang.reflect..")
            .because("reflection is forbidden by project governance");

    @ArchTest
    static final ArchRule sqlBuildingIsIsolated = noClasses()
            .that()
            .resideInAPackage("io.querybridge.core.sql..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("java.sql..", "io.querybridge.core.adapter..")
            .because("query building must stay pure and independent of any driver");
}
