package com.aknmodel.core.document.structure;

import com.aknmodel.core.config.ModelConfig;
import com.aknmodel.core.document.DocumentType;
import com.aknmodel.core.document.StructuredDocument;
import org.dom4j.Document;
import org.dom4j.Element;

/**
 * Base class for document types of the Akoma Ntoso {@code collectionStructure}
 * structure, a container of other documents.
 */
public abstract class CollectionStructure extends StructuredDocument {

    public static final String STRUCTURE_TYPE = "collectionStructure";
    public static final String MAIN_CONTENT_TAG = "collectionBody";

    protected CollectionStructure(DocumentType<?> documentType, Document document, ModelConfig config) {
        super(documentType, document, config);
    }

    /**
     * Returns the {@code <collectionBody>} element; same as {@link #mainContent()}.
     *
     * @return main content element, or null if absent
     */
    public Element collectionBody() {
        return mainContent();
    }
}
