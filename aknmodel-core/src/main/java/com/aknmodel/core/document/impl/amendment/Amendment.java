package com.aknmodel.core.document.impl.amendment;

import com.aknmodel.core.config.ModelConfig;
import com.aknmodel.core.document.DocumentType;
import com.aknmodel.core.document.structure.AmendmentStructure;
import org.dom4j.Document;
import org.dom4j.Element;

/**
 * An amendment proposed to another document.
 */
public class Amendment extends AmendmentStructure {

    public static final String DOCUMENT_TYPE = "amendment";

    public static final DocumentType<Amendment> TYPE =
        new DocumentType<>(STRUCTURE_TYPE, MAIN_CONTENT_TAG, DOCUMENT_TYPE, Amendment::new);

    public Amendment(Document document, ModelConfig config) {
        super(TYPE, document, config);
    }

    public Element amendment() {
        return main();
    }
}
