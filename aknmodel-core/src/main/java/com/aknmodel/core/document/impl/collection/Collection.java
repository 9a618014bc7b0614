package com.aknmodel.core.document.impl.collection;

import com.aknmodel.core.config.ModelConfig;
import com.aknmodel.core.document.DocumentType;
import com.aknmodel.core.document.structure.CollectionStructure;
import org.dom4j.Document;
import org.dom4j.Element;

/**
 * A generic collection of documents.
 */
public class Collection extends CollectionStructure {

    public static final String DOCUMENT_TYPE = "collection";

    public static final DocumentType<Collection> TYPE =
        new DocumentType<>(STRUCTURE_TYPE, MAIN_CONTENT_TAG, DOCUMENT_TYPE, Collection::new);

    public Collection(Document document, ModelConfig config) {
        super(TYPE, document, config);
    }

    public Element collection() {
        return main();
    }
}
