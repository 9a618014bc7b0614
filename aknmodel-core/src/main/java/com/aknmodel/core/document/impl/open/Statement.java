package com.aknmodel.core.document.impl.open;

import com.aknmodel.core.config.ModelConfig;
import com.aknmodel.core.document.DocumentType;
import com.aknmodel.core.document.structure.OpenStructure;
import org.dom4j.Document;
import org.dom4j.Element;

/**
 * A formal statement, such as a resolution or declaration.
 */
public class Statement extends OpenStructure {

    public static final String DOCUMENT_TYPE = "statement";

    public static final DocumentType<Statement> TYPE =
        new DocumentType<>(STRUCTURE_TYPE, MAIN_CONTENT_TAG, DOCUMENT_TYPE, Statement::new);

    public Statement(Document document, ModelConfig config) {
        super(TYPE, document, config);
    }

    public Element statement() {
        return main();
    }
}
