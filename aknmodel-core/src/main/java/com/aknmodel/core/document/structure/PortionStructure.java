package com.aknmodel.core.document.structure;

import com.aknmodel.core.config.ModelConfig;
import com.aknmodel.core.document.DocumentType;
import com.aknmodel.core.document.StructuredDocument;
import org.dom4j.Document;
import org.dom4j.Element;

/**
 * Base class for document types of the Akoma Ntoso {@code portionStructure}
 * structure, for fragments of a larger document.
 */
public abstract class PortionStructure extends StructuredDocument {

    public static final String STRUCTURE_TYPE = "portionStructure";
    public static final String MAIN_CONTENT_TAG = "portionBody";

    protected PortionStructure(DocumentType<?> documentType, Document document, ModelConfig config) {
        super(documentType, document, config);
    }

    /**
     * Returns the {@code <portionBody>} element; same as {@link #mainContent()}.
     *
     * @return main content element, or null if absent
     */
    public Element portionBody() {
        return mainContent();
    }
}
