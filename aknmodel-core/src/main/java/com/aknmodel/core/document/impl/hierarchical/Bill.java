package com.aknmodel.core.document.impl.hierarchical;

import com.aknmodel.core.config.ModelConfig;
import com.aknmodel.core.document.DocumentType;
import com.aknmodel.core.document.structure.HierarchicalStructure;
import org.dom4j.Document;
import org.dom4j.Element;

/**
 * A draft act under consideration by a legislature.
 */
public class Bill extends HierarchicalStructure {

    public static final String DOCUMENT_TYPE = "bill";

    public static final DocumentType<Bill> TYPE =
        new DocumentType<>(STRUCTURE_TYPE, MAIN_CONTENT_TAG, DOCUMENT_TYPE, Bill::new);

    public Bill(Document document, ModelConfig config) {
        super(TYPE, document, config);
    }

    public Element bill() {
        return main();
    }
}
