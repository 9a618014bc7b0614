package com.aknmodel.core.document.impl.debate;

import com.aknmodel.core.config.ModelConfig;
import com.aknmodel.core.document.DocumentType;
import com.aknmodel.core.document.structure.DebateStructure;
import org.dom4j.Document;
import org.dom4j.Element;

/**
 * The record of a debate in a legislative assembly.
 */
public class Debate extends DebateStructure {

    public static final String DOCUMENT_TYPE = "debate";

    public static final DocumentType<Debate> TYPE =
        new DocumentType<>(STRUCTURE_TYPE, MAIN_CONTENT_TAG, DOCUMENT_TYPE, Debate::new);

    public Debate(Document document, ModelConfig config) {
        super(TYPE, document, config);
    }

    public Element debate() {
        return main();
    }
}
