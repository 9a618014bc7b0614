package com.aknmodel.core.document;

import com.aknmodel.core.document.impl.collection.OfficialGazette;
import com.aknmodel.core.document.impl.hierarchical.Act;
import com.aknmodel.core.document.impl.judgment.Judgment;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DocumentTypeRegistry}.
 */
class DocumentTypeRegistryTest {

    @Test
    void getDefault_discoversStandardTypesInOrder() {
        DocumentTypeRegistry registry = DocumentTypeRegistry.getDefault();

        assertThat(registry.documentTypes())
            .extracting(DocumentType::getName)
            .containsExactly(
                "act", "bill", "collection", "amendmentList", "officialGazette", "documentCollection",
                "doc", "statement", "debateReport", "debate", "judgment", "amendment", "portion");
    }

    @Test
    void getDefault_returnsSharedInstance() {
        assertThat(DocumentTypeRegistry.getDefault()).isSameAs(DocumentTypeRegistry.getDefault());
    }

    @Test
    void fromServiceLoader_buildsIndependentRegistry() {
        DocumentTypeRegistry registry = DocumentTypeRegistry.fromServiceLoader(getClass().getClassLoader());

        assertThat(registry).isNotSameAs(DocumentTypeRegistry.getDefault());
        assertThat(registry.documentTypes()).hasSize(13);
        assertThat(registry.forDocumentType("judgment")).containsSame(Judgment.TYPE);
    }

    @Test
    void forDocumentType_ignoresCase() {
        DocumentTypeRegistry registry = DocumentTypeRegistry.getDefault();

        assertThat(registry.forDocumentType("ACT")).containsSame(Act.TYPE);
        assertThat(registry.forDocumentType("officialgazette")).containsSame(OfficialGazette.TYPE);
        assertThat(registry.forDocumentType("OfficialGazette")).containsSame(OfficialGazette.TYPE);
    }

    @Test
    void forDocumentType_withUnknownOrNullName_returnsEmpty() {
        DocumentTypeRegistry registry = DocumentTypeRegistry.getDefault();

        assertThat(registry.forDocumentType("statute")).isEmpty();
        assertThat(registry.forDocumentType("")).isEmpty();
        assertThat(registry.forDocumentType(null)).isEmpty();
    }

    @Test
    void register_withDuplicateName_keepsFirstRegistration() {
        DocumentTypeRegistry registry = new DocumentTypeRegistry();
        DocumentType<Act> duplicate = new DocumentType<>("hierarchicalStructure", "body", "ACT", Act::new);

        assertThat(registry.register(Act.TYPE)).isTrue();
        assertThat(registry.register(duplicate)).isFalse();

        assertThat(registry.documentTypes()).containsExactly(Act.TYPE);
        assertThat(registry.forDocumentType("Act")).containsSame(Act.TYPE);
    }

    @Test
    void documentTypes_isUnmodifiable() {
        DocumentTypeRegistry registry = new DocumentTypeRegistry();
        registry.register(Act.TYPE);

        assertThatThrownBy(() -> registry.documentTypes().clear())
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
