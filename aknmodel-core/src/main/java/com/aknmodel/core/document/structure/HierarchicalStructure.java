package com.aknmodel.core.document.structure;

import com.aknmodel.core.config.ModelConfig;
import com.aknmodel.core.document.DocumentType;
import com.aknmodel.core.document.StructuredDocument;
import org.dom4j.Document;
import org.dom4j.Element;

/**
 * Base class for document types of the Akoma Ntoso {@code hierarchicalStructure}
 * structure, whose content is a hierarchy of numbered provisions.
 */
public abstract class HierarchicalStructure extends StructuredDocument {

    public static final String STRUCTURE_TYPE = "hierarchicalStructure";
    public static final String MAIN_CONTENT_TAG = "body";

    protected HierarchicalStructure(DocumentType<?> documentType, Document document, ModelConfig config) {
        super(documentType, document, config);
    }

    /**
     * Returns the {@code <body>} element; same as {@link #mainContent()}.
     *
     * @return main content element, or null if absent
     */
    public Element body() {
        return mainContent();
    }
}
