package com.aknmodel.core;

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
 *   <li>Concrete document classes extend a structure base class</li>
 *   <li>Structure base classes don't depend on concrete document types</li>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>The XML, URI and utility layers don't depend on the document model</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.aknmodel.core");
    }

    /**
     * Verifies every concrete document class extends one of the structure base classes,
     * so its main content accessor matches its structure type.
     */
    @Test
    void documentTypes_shouldExtendStructureBaseClasses() {
        ArchRule rule = classes()
            .that().resideInAPackage("..document.impl..")
            .and().areAssignableTo("com.aknmodel.core.document.StructuredDocument")
            .should().beAssignableTo("com.aknmodel.core.document.structure.HierarchicalStructure")
            .orShould().beAssignableTo("com.aknmodel.core.document.structure.CollectionStructure")
            .orShould().beAssignableTo("com.aknmodel.core.document.structure.OpenStructure")
            .orShould().beAssignableTo("com.aknmodel.core.document.structure.DebateStructure")
            .orShould().beAssignableTo("com.aknmodel.core.document.structure.JudgmentStructure")
            .orShould().beAssignableTo("com.aknmodel.core.document.structure.AmendmentStructure")
            .orShould().beAssignableTo("com.aknmodel.core.document.structure.PortionStructure");

        rule.check(classes);
    }

    /**
     * Verifies concrete document classes are grouped by structure type.
     */
    @Test
    void documentTypes_shouldBeInStructurePackages() {
        ArchRule rule = classes()
            .that().resideInAPackage("..document.impl..")
            .and().areAssignableTo("com.aknmodel.core.document.StructuredDocument")
            .should().resideInAnyPackage(
                "..hierarchical..", "..collection..", "..open..", "..debate..",
                "..judgment..", "..amendment..", "..portion..");

        rule.check(classes);
    }

    /**
     * Verifies all domain models in the model package are implemented as Java records.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .should().beRecords();

        rule.check(classes);
    }

    /**
     * Verifies structure base classes don't depend on concrete document types.
     */
    @Test
    void structures_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..document.structure..")
            .should().dependOnClassesThat().resideInAPackage("..document.impl..");

        rule.check(classes);
    }

    /**
     * Verifies the document model core only reaches concrete types through the registry.
     */
    @Test
    void documentCore_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("com.aknmodel.core.document")
            .should().dependOnClassesThat().resideInAPackage("..document.impl..");

        rule.check(classes);
    }

    /**
     * Verifies the XML, URI and utility layers have no dependencies on the document model.
     */
    @Test
    void lowerLayers_shouldNotDependOnDocuments() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..xml..", "..uri..", "..util..")
            .should().dependOnClassesThat().resideInAPackage("..document..");

        rule.check(classes);
    }

    /**
     * Verifies model records have no dependencies on the DOM library or documents.
     */
    @Test
    void models_shouldNotDependOnDom() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage("org.dom4j..", "..document..");

        rule.check(classes);
    }
}
