package com.aknmodel.core.document.impl.open;

import com.aknmodel.core.config.ModelConfig;
import com.aknmodel.core.document.DocumentType;
import com.aknmodel.core.document.structure.OpenStructure;
import org.dom4j.Document;
import org.dom4j.Element;

/**
 * A report of a debate without the detailed debate structure.
 */
public class DebateReport extends OpenStructure {

    public static final String DOCUMENT_TYPE = "debateReport";

    public static final DocumentType<DebateReport> TYPE =
        new DocumentType<>(STRUCTURE_TYPE, MAIN_CONTENT_TAG, DOCUMENT_TYPE, DebateReport::new);

    public DebateReport(Document document, ModelConfig config) {
        super(TYPE, document, config);
    }

    public Element debateReport() {
        return main();
    }
}
