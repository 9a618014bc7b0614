package com.aknmodel.core.document;

import java.util.List;

/**
 * Service provider contributing document types to the {@link DocumentTypeRegistry}.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.aknmodel.core.document.DocumentTypeProvider}. Providers
 * are loaded in file order, and within a provider types register in list order.
 */
public interface DocumentTypeProvider {

    /**
     * Returns the document types this provider contributes.
     *
     * @return document types in registration order
     */
    List<DocumentType<?>> documentTypes();
}
