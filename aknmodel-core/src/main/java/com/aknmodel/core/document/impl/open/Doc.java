package com.aknmodel.core.document.impl.open;

import com.aknmodel.core.config.ModelConfig;
import com.aknmodel.core.document.DocumentType;
import com.aknmodel.core.document.structure.OpenStructure;
import org.dom4j.Document;
import org.dom4j.Element;

/**
 * A generic document with no specific document type.
 */
public class Doc extends OpenStructure {

    public static final String DOCUMENT_TYPE = "doc";

    public static final DocumentType<Doc> TYPE =
        new DocumentType<>(STRUCTURE_TYPE, MAIN_CONTENT_TAG, DOCUMENT_TYPE, Doc::new);

    public Doc(Document document, ModelConfig config) {
        super(TYPE, document, config);
    }

    public Element doc() {
        return main();
    }
}
