package com.aknmodel.core.document;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Registration table from document type name to {@link DocumentType}.
 *
 * <p>Names are matched case-insensitively. When two types share a name, the first one
 * registered wins and the later one is ignored.
 *
 * <p>The default registry is populated once from every {@link DocumentTypeProvider}
 * found via {@link ServiceLoader}. Registering into it afterwards is allowed but must not
 * race with lookups.
 */
public class DocumentTypeRegistry {

    private static final Logger log = LoggerFactory.getLogger(DocumentTypeRegistry.class);

    private final Map<String, DocumentType<?>> types = new LinkedHashMap<>();

    /**
     * Returns the registry populated from the registered providers.
     *
     * @return shared default registry
     */
    public static DocumentTypeRegistry getDefault() {
        return Holder.DEFAULT;
    }

    /**
     * Creates a registry populated from the providers visible to a class loader.
     *
     * @param classLoader class loader to search
     * @return new registry
     */
    public static DocumentTypeRegistry fromServiceLoader(ClassLoader classLoader) {
        DocumentTypeRegistry registry = new DocumentTypeRegistry();
        for (DocumentTypeProvider provider : ServiceLoader.load(DocumentTypeProvider.class, classLoader)) {
            log.debug("Loading document types from {}", provider.getClass().getName());
            provider.documentTypes().forEach(registry::register);
        }
        log.info("Registered {} document types", registry.types.size());
        return registry;
    }

    /**
     * Registers a document type.
     *
     * @param type type to register
     * @return true if registered, false if a type with the same name was already present
     */
    public boolean register(DocumentType<?> type) {
        Objects.requireNonNull(type, "type must not be null");
        String key = type.getName().toLowerCase(Locale.ROOT);

        DocumentType<?> existing = types.putIfAbsent(key, type);
        if (existing != null) {
            log.warn("Document type '{}' is already registered as {}; ignoring {}", type.getName(), existing, type);
            return false;
        }
        return true;
    }

    /**
     * Finds the type for a document type name, ignoring case.
     *
     * @param documentType name such as {@code act} or {@code ACT}
     * @return the first type registered under that name, or empty
     */
    public Optional<DocumentType<?>> forDocumentType(String documentType) {
        if (documentType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(types.get(documentType.toLowerCase(Locale.ROOT)));
    }

    /**
     * Returns every registered type.
     *
     * @return types in registration order
     */
    public List<DocumentType<?>> documentTypes() {
        return Collections.unmodifiableList(new ArrayList<>(types.values()));
    }

    private static final class Holder {
        private static final DocumentTypeRegistry DEFAULT =
            fromServiceLoader(DocumentTypeRegistry.class.getClassLoader());
    }
}
