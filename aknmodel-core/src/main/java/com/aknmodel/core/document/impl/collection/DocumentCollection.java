package com.aknmodel.core.document.impl.collection;

import com.aknmodel.core.config.ModelConfig;
import com.aknmodel.core.document.DocumentType;
import com.aknmodel.core.document.structure.CollectionStructure;
import org.dom4j.Document;
import org.dom4j.Element;

/**
 * A collection of documents published together.
 */
public class DocumentCollection extends CollectionStructure {

    public static final String DOCUMENT_TYPE = "documentCollection";

    public static final DocumentType<DocumentCollection> TYPE =
        new DocumentType<>(STRUCTURE_TYPE, MAIN_CONTENT_TAG, DOCUMENT_TYPE, DocumentCollection::new);

    public DocumentCollection(Document document, ModelConfig config) {
        super(TYPE, document, config);
    }

    public Element documentCollection() {
        return main();
    }
}
