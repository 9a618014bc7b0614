package com.aknmodel.core.document.structure;

import com.aknmodel.core.config.ModelConfig;
import com.aknmodel.core.document.DocumentType;
import com.aknmodel.core.document.StructuredDocument;
import org.dom4j.Document;
import org.dom4j.Element;

/**
 * Base class for document types of the Akoma Ntoso {@code openStructure}
 * structure, for documents with no prescribed internal structure.
 */
public abstract class OpenStructure extends StructuredDocument {

    public static final String STRUCTURE_TYPE = "openStructure";
    public static final String MAIN_CONTENT_TAG = "mainBody";

    protected OpenStructure(DocumentType<?> documentType, Document document, ModelConfig config) {
        super(documentType, document, config);
    }

    /**
     * Returns the {@code <mainBody>} element; same as {@link #mainContent()}.
     *
     * @return main content element, or null if absent
     */
    public Element mainBody() {
        return mainContent();
    }
}
