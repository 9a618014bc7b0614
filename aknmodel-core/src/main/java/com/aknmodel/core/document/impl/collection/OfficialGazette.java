package com.aknmodel.core.document.impl.collection;

import com.aknmodel.core.config.ModelConfig;
import com.aknmodel.core.document.DocumentType;
import com.aknmodel.core.document.structure.CollectionStructure;
import org.dom4j.Document;
import org.dom4j.Element;

/**
 * An issue of an official gazette.
 */
public class OfficialGazette extends CollectionStructure {

    public static final String DOCUMENT_TYPE = "officialGazette";

    public static final DocumentType<OfficialGazette> TYPE =
        new DocumentType<>(STRUCTURE_TYPE, MAIN_CONTENT_TAG, DOCUMENT_TYPE, OfficialGazette::new);

    public OfficialGazette(Document document, ModelConfig config) {
        super(TYPE, document, config);
    }

    public Element officialGazette() {
        return main();
    }
}
