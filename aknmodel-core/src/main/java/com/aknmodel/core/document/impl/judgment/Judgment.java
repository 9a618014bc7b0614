package com.aknmodel.core.document.impl.judgment;

import com.aknmodel.core.config.ModelConfig;
import com.aknmodel.core.document.DocumentType;
import com.aknmodel.core.document.structure.JudgmentStructure;
import org.dom4j.Document;
import org.dom4j.Element;

/**
 * A court judgment.
 */
public class Judgment extends JudgmentStructure {

    public static final String DOCUMENT_TYPE = "judgment";

    public static final DocumentType<Judgment> TYPE =
        new DocumentType<>(STRUCTURE_TYPE, MAIN_CONTENT_TAG, DOCUMENT_TYPE, Judgment::new);

    public Judgment(Document document, ModelConfig config) {
        super(TYPE, document, config);
    }

    public Element judgment() {
        return main();
    }
}
