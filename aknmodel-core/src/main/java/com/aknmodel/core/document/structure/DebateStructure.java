package com.aknmodel.core.document.structure;

import com.aknmodel.core.config.ModelConfig;
import com.aknmodel.core.document.DocumentType;
import com.aknmodel.core.document.StructuredDocument;
import org.dom4j.Document;
import org.dom4j.Element;

/**
 * Base class for document types of the Akoma Ntoso {@code debateStructure}
 * structure, for records of proceedings.
 */
public abstract class DebateStructure extends StructuredDocument {

    public static final String STRUCTURE_TYPE = "debateStructure";
    public static final String MAIN_CONTENT_TAG = "debateBody";

    protected DebateStructure(DocumentType<?> documentType, Document document, ModelConfig config) {
        super(documentType, document, config);
    }

    /**
     * Returns the {@code <debateBody>} element; same as {@link #mainContent()}.
     *
     * @return main content element, or null if absent
     */
    public Element debateBody() {
        return mainContent();
    }
}
