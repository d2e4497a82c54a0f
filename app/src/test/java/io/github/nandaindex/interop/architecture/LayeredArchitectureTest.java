package io.github.nandaindex.interop.architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

@AnalyzeClasses(
        packages = "io.github.nandaindex.interop",
        importOptions = ImportOption.DoNotIncludeTests.class)
class LayeredArchitectureTest {

    private static final String APP = "io.github.nandaindex.interop.app..";
    private static final String RUNTIME = "io.github.nandaindex.interop.runtime..";
    private static final String INFRA = "io.github.nandaindex.interop.infra..";

    @ArchTest
    static final ArchRule appModuleShouldOnlyDependOnAllowedLayers =
            classes()
                    .that()
                    .resideInAPackage(APP)
                    .should()
                    .onlyDependOnClassesThat()
                    .resideInAnyPackage(
                            APP,
                            RUNTIME,
                            INFRA,
                            "java..",
                            "javax..",
                            "picocli..",
                            "com.fasterxml.jackson..");

    @ArchTest
    static final ArchRule runtimeModuleShouldNotDependOnAppNorOtherLayers =
            classes()
                    .that()
                    .resideInAPackage(RUNTIME)
                    .should()
                    .onlyDependOnClassesThat()
                    .resideInAnyPackage(
                            RUNTIME,
                            INFRA,
                            "java..",
                            "javax..",
                            "org.slf4j..",
                            "org.yaml..",
                            "com.networknt..",
                            "com.fasterxml.jackson..");

    @ArchTest
    static final ArchRule infraModuleShouldBeLeafLayer =
            classes()
                    .that()
                    .resideInAPackage(INFRA)
                    .should()
                    .onlyDependOnClassesThat()
                    .resideInAnyPackage(INFRA, "java..", "javax..", "org.slf4j..", "io.github.cdimascio.dotenv..");

    @ArchTest
    static final ArchRule taxonomyShouldNotKnowAboutRecordFormats =
            noClasses()
                    .that()
                    .resideInAPackage("io.github.nandaindex.interop.runtime.taxonomy..")
                    .should()
                    .dependOnClassesThat()
                    .resideInAnyPackage(
                            "io.github.nandaindex.interop.runtime.translate..",
                            "io.github.nandaindex.interop.runtime.model..",
                            "io.github.nandaindex.interop.runtime.validation..");
}
