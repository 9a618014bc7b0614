package com.aknmodel.core.document.structure;

import com.aknmodel.core.config.ModelConfig;
import com.aknmodel.core.document.DocumentType;
import com.aknmodel.core.document.StructuredDocument;
import org.dom4j.Document;
import org.dom4j.Element;

/**
 * Base class for document types of the Akoma Ntoso {@code judgmentStructure}
 * structure, for court decisions.
 */
public abstract class JudgmentStructure extends StructuredDocument {

    public static final String STRUCTURE_TYPE = "judgmentStructure";
    public static final String MAIN_CONTENT_TAG = "judgmentBody";

    protected JudgmentStructure(DocumentType<?> documentType, Document document, ModelConfig config) {
        super(documentType, document, config);
    }

    /**
     * Returns the {@code <judgmentBody>} element; same as {@link #mainContent()}.
     *
     * @return main content element, or null if absent
     */
    public Element judgmentBody() {
        return mainContent();
    }
}
