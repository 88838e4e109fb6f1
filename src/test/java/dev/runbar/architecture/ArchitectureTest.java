package dev.runbar.architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

@AnalyzeClasses(packages = "dev.runbar", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

  // The ranking core knows nothing about concrete sources or the web layer.
  @ArchTest
  static final ArchRule search_core_is_self_contained =
      noClasses()
          .that()
          .resideInAPackage("..search..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage(
              "..catalog..", "..history..", "..installed..", "..config..", "..api..");

  // Source packages should not depend on the REST adapter.
  @ArchTest
  static final ArchRule sources_should_not_depend_on_api =
      noClasses()
          .that()
          .resideInAnyPackage("..catalog..", "..history..", "..installed..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("..api..");

  // Sources are independent of each other, apart from the shared catalog.
  @ArchTest
  static final ArchRule history_and_installed_are_independent =
      noClasses()
          .that()
          .resideInAPackage("..history..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("..installed..");

  @ArchTest
  static final ArchRule config_should_not_depend_on_api =
      noClasses()
          .that()
          .resideInAPackage("..config..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("..api..");

  // No cyclic dependencies between top-level packages
  @ArchTest
  static final ArchRule no_package_cycles =
      slices().matching("dev.runbar.(*)..").should().beFreeOfCycles();
}
