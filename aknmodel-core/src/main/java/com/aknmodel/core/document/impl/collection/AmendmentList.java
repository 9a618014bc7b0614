package com.aknmodel.core.document.impl.collection;

import com.aknmodel.core.config.ModelConfig;
import com.aknmodel.core.document.DocumentType;
import com.aknmodel.core.document.structure.CollectionStructure;
import org.dom4j.Document;
import org.dom4j.Element;

/**
 * A list of amendments to a bill, as voted by a legislature.
 */
public class AmendmentList extends CollectionStructure {

    public static final String DOCUMENT_TYPE = "amendmentList";

    public static final DocumentType<AmendmentList> TYPE =
        new DocumentType<>(STRUCTURE_TYPE, MAIN_CONTENT_TAG, DOCUMENT_TYPE, AmendmentList::new);

    public AmendmentList(Document document, ModelConfig config) {
        super(TYPE, document, config);
    }

    public Element amendmentList() {
        return main();
    }
}
