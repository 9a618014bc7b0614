package com.aknmodel.core.document;

import com.aknmodel.core.config.ModelConfig;
import com.aknmodel.core.config.ModelConfig.SourceTool;
import com.aknmodel.core.document.impl.hierarchical.Act;
import com.aknmodel.core.document.impl.judgment.Judgment;
import com.aknmodel.core.util.DateStrings;
import com.aknmodel.core.xml.AknValidationException;
import org.dom4j.DocumentException;
import org.dom4j.Element;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link StructuredDocument}, exercised through {@link Act}.
 */
class StructuredDocumentTest {

    private static final String AKN2 = "http://www.akomantoso.org/2.0";
    private static final String AKN3 = "http://docs.oasis-open.org/legaldocml/ns/akn/3.0";

    // ==================== Skeletons ====================

    @Test
    void emptyDocument_version3_hasUntitledTitleAndEmptyBody() throws DocumentException {
        Act act = Act.TYPE.parse(Act.TYPE.emptyDocument("3.0"));
        String today = DateStrings.format(LocalDate.now());

        assertThat(act.getNamespace()).isEqualTo(AKN3);
        assertThat(act.getTitle()).isEqualTo("Untitled");
        assertThat(act.mainContent()).isNotNull();
        assertThat(act.mainContent().content()).isEmpty();
        assertThat(act.getLanguage()).isEqualTo("eng");
        assertThat(act.getWorkDate()).isEqualTo(LocalDate.now());
        assertThat(act.getFrbrUri().workUri(false)).isEqualTo("/akn/za/act/" + today + "/1");
        assertThat(act.work().element(act.qname("FRBRthis")).attributeValue("value")).endsWith("/1/!main");
    }

    @Test
    void emptyDocument_version2_usesLegacyNamespaceAndUris() throws DocumentException {
        Act act = Act.TYPE.parse(Act.TYPE.emptyDocument("2.0"));

        assertThat(act.getNamespace()).isEqualTo(AKN2);
        assertThat(act.getTitle()).isEqualTo("Untitled");
        assertThat(act.mainContent().content()).isEmpty();
        assertThat(act.getFrbrUri().getPrefix()).isEmpty();
        assertThat(act.getFrbrUri().workUri(false)).startsWith("/za/act/");
    }

    @Test
    void emptyDocument_hasNoXmlDeclaration() {
        assertThat(Act.TYPE.emptyDocument()).startsWith("<akomaNtoso");
    }

    @Test
    void emptyDocument_withUnknownVersion_throwsException() {
        assertThatThrownBy(() -> Act.TYPE.emptyDocument("1.0"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Known versions: 2.0, 3.0");
    }

    @Test
    void parse_withNullOrBlank_returnsSkeleton() throws DocumentException {
        assertThat(Act.TYPE.parse((String) null).getTitle()).isEqualTo("Untitled");
        assertThat(Act.TYPE.parse("  \n").getTitle()).isEqualTo("Untitled");
    }

    @Test
    void newDocument_withConfig_usesConfiguredCoordinates() {
        ModelConfig config = new ModelConfig(
            new SourceTool("Indigo", "indigo", "https://indigo.example"),
            new ModelConfig.DocumentDefaults("ke", "swa", "2.0"));

        Act act = Act.TYPE.newDocument(config);

        assertThat(act.getConfig()).isSameAs(config);
        assertThat(act.getNamespace()).isEqualTo(AKN2);
        assertThat(act.getLanguage()).isEqualTo("swa");
        assertThat(act.getFrbrUri().getCountry()).isEqualTo("ke");
        assertThat(act.getElement("meta.identification").attributeValue("source")).isEqualTo("#indigo");
        assertThat(act.getElement("meta.references.TLCOrganization").attributeValue("showAs")).isEqualTo("Indigo");
    }

    // ==================== Structure ====================

    @Test
    void aliases_resolveToMainAndMainContent() {
        Act act = Act.TYPE.newDocument();

        assertThat(act.act()).isSameAs(act.main());
        assertThat(act.body()).isSameAs(act.mainContent());
        assertThat(act.alias("act")).isSameAs(act.main());
        assertThat(act.alias("main")).isSameAs(act.main());
        assertThat(act.alias("body")).isSameAs(act.mainContent());
        assertThat(act.alias("mainContent")).isSameAs(act.mainContent());
        assertThat(act.alias("judgmentBody")).isNull();
    }

    @Test
    void getElement_withAliasOrMeta_startsAtPrimaryDocument() {
        Act act = Act.TYPE.newDocument();

        assertThat(act.getElement("meta")).isSameAs(act.meta());
        assertThat(act.getElement("meta.identification.FRBRWork")).isSameAs(act.work());
        assertThat(act.getElement("act.meta")).isSameAs(act.meta());
        assertThat(act.getElement("meta.lifecycle")).isNull();
    }

    @Test
    void parse_withoutMainContent_returnsNullContent() throws DocumentException {
        Act act = Act.TYPE.parse("<akomaNtoso xmlns=\"" + AKN3 + "\"><act/></akomaNtoso>");

        assertThat(act.mainContent()).isNull();
        assertThat(act.body()).isNull();
        assertThat(act.getElement("meta.identification")).isNull();
        assertThatThrownBy(act::meta).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void parse_withEmptyRoot_throwsValidationException() {
        assertThatThrownBy(() -> Act.TYPE.parse("<akomaNtoso xmlns=\"" + AKN3 + "\"/>"))
            .isInstanceOf(AknValidationException.class)
            .hasMessage("XML root element must have at least one child");
    }

    @Test
    void parse_withOtherDocumentType_throwsValidationException() {
        String judgment = Judgment.TYPE.emptyDocument();

        assertThatThrownBy(() -> Act.TYPE.parse(judgment))
            .isInstanceOf(AknValidationException.class)
            .hasMessage("Expected act as first child of root element, but got judgment instead");
    }

    @Test
    void parse_withOtherRoot_throwsValidationException() {
        assertThatThrownBy(() -> Act.TYPE.parse("<act xmlns=\"" + AKN3 + "\"/>"))
            .isInstanceOf(AknValidationException.class)
            .hasMessage("XML root element must be akomaNtoso, but got act instead");
    }

    @Test
    void forDocumentType_ignoresCase() {
        assertThat(StructuredDocument.forDocumentType("act")).containsSame(Act.TYPE);
        assertThat(StructuredDocument.forDocumentType("ACT")).containsSame(Act.TYPE);
        assertThat(StructuredDocument.forDocumentType("statute")).isEmpty();
    }

    // ==================== Title, dates and language ====================

    @Test
    void setTitle_updatesTitleAlias() {
        Act act = Act.TYPE.newDocument();

        act.setTitle("Fire Safety By-law");

        assertThat(act.getTitle()).isEqualTo("Fire Safety By-law");
        assertThat(act.work().elements(act.qname("FRBRalias"))).hasSize(1);
    }

    @Test
    void setTitle_withoutAlias_createsAliasAfterUri() {
        Act act = Act.TYPE.newDocument();
        act.work().remove(act.work().element(act.qname("FRBRalias")));
        assertThat(act.getTitle()).isNull();

        act.setTitle("Fire Safety By-law");

        Element alias = act.work().element(act.qname("FRBRalias"));
        assertThat(alias.attributeValue("name")).isEqualTo("title");
        assertThat(alias.attributeValue("value")).isEqualTo("Fire Safety By-law");
        assertThat(act.work().elements()).extracting(Element::getName)
            .startsWith("FRBRthis", "FRBRuri", "FRBRalias");
    }

    @Test
    void getTitle_withoutTitleAlias_fallsBackToLastAlias() {
        Act act = Act.TYPE.newDocument();
        Element alias = act.work().element(act.qname("FRBRalias"));
        alias.addAttribute("name", "short");
        Element other = act.makeElement("FRBRalias");
        other.addAttribute("value", "Fire Act");
        act.work().add(other);

        assertThat(act.getTitle()).isEqualTo("Fire Act");
    }

    @Test
    void dates_roundTripThroughMetadata() {
        Act act = Act.TYPE.newDocument();

        act.setWorkDate(LocalDate.of(2009, 1, 1));
        act.setManifestationDate(LocalDate.of(2011, 4, 5));

        assertThat(act.getWorkDate()).isEqualTo(LocalDate.of(2009, 1, 1));
        assertThat(act.getManifestationDate()).isEqualTo(LocalDate.of(2011, 4, 5));
        assertThat(act.work().element(act.qname("FRBRdate")).attributeValue("date")).isEqualTo("2009-01-01");
    }

    @Test
    void setExpressionDate_rewritesFrbrUris() {
        Act act = Act.TYPE.newDocument();

        act.setExpressionDate(LocalDate.of(2012, 3, 4));

        assertThat(act.getExpressionDate()).isEqualTo(LocalDate.of(2012, 3, 4));
        assertThat(act.expressionFrbrUri().getExpressionDate()).isEqualTo("@2012-03-04");
        assertThat(act.getFrbrUri().expressionUri(false)).endsWith("/eng@2012-03-04");
    }

    @Test
    void setLanguage_rewritesFrbrUris() {
        Act act = Act.TYPE.newDocument();

        act.setLanguage("afr");

        assertThat(act.getLanguage()).isEqualTo("afr");
        assertThat(act.getFrbrUri().getLanguage()).isEqualTo("afr");
        assertThat(act.expression().element(act.qname("FRBRthis")).attributeValue("value"))
            .contains("/afr@")
            .endsWith("/!main");
    }

    @Test
    void setLanguage_withoutFrbrUri_onlySetsLanguage() {
        Act act = Act.TYPE.newDocument();
        act.manifestation().element(act.qname("FRBRuri")).addAttribute("value", "");
        String expressionUri = act.expression().element(act.qname("FRBRuri")).attributeValue("value");

        act.setLanguage("fra");

        assertThat(act.getLanguage()).isEqualTo("fra");
        assertThat(act.getFrbrUri()).isNull();
        assertThat(act.expression().element(act.qname("FRBRuri")).attributeValue("value")).isEqualTo(expressionUri);
    }

    @Test
    void getLanguage_withoutLanguageAttribute_defaultsToEnglish() {
        Act act = Act.TYPE.newDocument();
        Element language = act.expression().element(act.qname("FRBRlanguage"));
        language.remove(language.attribute("language"));

        assertThat(act.getLanguage()).isEqualTo("eng");
    }

    @Test
    void expressionFrbrUri_withoutValue_returnsEmptyUri() {
        Act act = Act.TYPE.newDocument();
        Element uri = act.expression().element(act.qname("FRBRuri"));
        uri.remove(uri.attribute("value"));

        assertThat(act.expressionFrbrUri().getCountry()).isNull();
        assertThat(act.expressionFrbrUri().getNumber()).isNull();
    }

    // ==================== Lifecycle and references ====================

    @Test
    void ensureLifecycle_calledTwice_createsOneLifecycleAndOneOrganization() {
        Act act = Act.TYPE.newDocument();

        Element first = act.ensureLifecycle();
        Element second = act.ensureLifecycle();

        assertThat(second).isSameAs(first);
        assertThat(first.attributeValue("source")).isEqualTo("#aknmodel");
        assertThat(act.meta().elements(act.qname("lifecycle"))).hasSize(1);
        assertThat(act.getElement("meta.references").elements(act.qname("TLCOrganization")))
            .hasSize(1)
            .allSatisfy(org -> assertThat(org.attributeValue("eId")).isEqualTo("aknmodel"));
        assertThat(act.meta().elements()).extracting(Element::getName)
            .containsExactly("identification", "lifecycle", "references");
    }

    @Test
    void ensureLifecycle_withoutReferences_createsReferencesAfterLifecycle() {
        Act act = Act.TYPE.newDocument();
        act.meta().remove(act.getElement("meta.references"));

        act.ensureLifecycle();

        assertThat(act.meta().elements()).extracting(Element::getName)
            .containsExactly("identification", "lifecycle", "references");
        assertThat(act.getElement("meta.references.TLCOrganization").attributeValue("href"))
            .isEqualTo(SourceTool.DEFAULT_URL);
    }

    @Test
    void ensureReference_withSameId_reusesReference() {
        Act act = Act.TYPE.newDocument();

        Element first = act.ensureReference("TLCPerson", "Jane Doe", "jane", "/ontology/person/jane");
        Element second = act.ensureReference("TLCPerson", "Someone Else", "jane", "/ontology/person/other");

        assertThat(second).isSameAs(first);
        assertThat(first.attributeValue("showAs")).isEqualTo("Jane Doe");
        assertThat(act.getElement("meta.references").elements().get(0)).isSameAs(first);
    }

    // ==================== Serialization ====================

    @Test
    void toXml_thenParse_preservesMetadata() throws DocumentException {
        Act act = Act.TYPE.newDocument();
        act.setTitle("Fire Safety By-law");
        act.setFrbrUri("/akn/za-cpt/act/by-law/2009/2");

        Act reparsed = Act.TYPE.parse(act.toXml());

        assertThat(reparsed.getTitle()).isEqualTo("Fire Safety By-law");
        assertThat(reparsed.getFrbrUri()).isEqualTo(act.getFrbrUri());
        assertThat(reparsed.getWorkDate()).isEqualTo(act.getWorkDate());
        assertThat(reparsed.getExpressionDate()).isEqualTo(act.getExpressionDate());
        assertThat(reparsed.getManifestationDate()).isEqualTo(act.getManifestationDate());
        assertThat(reparsed.components()).containsOnlyKeys("main");
    }
}
