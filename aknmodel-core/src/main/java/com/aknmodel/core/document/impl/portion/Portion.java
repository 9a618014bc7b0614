package com.aknmodel.core.document.impl.portion;

import com.aknmodel.core.config.ModelConfig;
import com.aknmodel.core.document.DocumentType;
import com.aknmodel.core.document.structure.PortionStructure;
import org.dom4j.Document;
import org.dom4j.Element;

/**
 * A portion of a larger document, carried on its own.
 */
public class Portion extends PortionStructure {

    public static final String DOCUMENT_TYPE = "portion";

    public static final DocumentType<Portion> TYPE =
        new DocumentType<>(STRUCTURE_TYPE, MAIN_CONTENT_TAG, DOCUMENT_TYPE, Portion::new);

    public Portion(Document document, ModelConfig config) {
        super(TYPE, document, config);
    }

    public Element portion() {
        return main();
    }
}
