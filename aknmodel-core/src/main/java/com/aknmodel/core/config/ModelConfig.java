package com.aknmodel.core.config;

import com.aknmodel.core.xml.AknVersion;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Configuration for the document model.
 *
 * <p>Loaded from {@code aknmodel.yaml} by {@link ConfigLoader}. Any section or field left
 * out falls back to its default.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * source:
 *   name: "aknmodel"
 *   id: "aknmodel"
 *   url: "https://github.com/aknmodel/aknmodel"
 *
 * defaults:
 *   country: "za"
 *   language: "eng"
 *   version: "3.0"
 * }</pre>
 *
 * @param source tool recorded as the provenance of generated metadata
 * @param skeleton coordinates used for new skeleton documents
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelConfig(
    @JsonProperty("source") SourceTool source,
    @JsonProperty("defaults") DocumentDefaults skeleton
) {
    /**
     * Compact constructor filling in missing sections.
     */
    public ModelConfig {
        source = source == null ? SourceTool.defaults() : source;
        skeleton = skeleton == null ? DocumentDefaults.defaults() : skeleton;
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static ModelConfig defaults() {
        return new ModelConfig(SourceTool.defaults(), DocumentDefaults.defaults());
    }

    /**
     * Identity of the tool that produced a document's lifecycle and reference metadata.
     *
     * @param name display name, written to {@code showAs}
     * @param id identifier, written to {@code eId} and referenced as {@code #id}
     * @param url tool URL, written to {@code href}
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SourceTool(
        @JsonProperty("name") String name,
        @JsonProperty("id") String id,
        @JsonProperty("url") String url
    ) {
        public static final String DEFAULT_NAME = "aknmodel";
        public static final String DEFAULT_ID = "aknmodel";
        public static final String DEFAULT_URL = "https://github.com/aknmodel/aknmodel";

        public SourceTool {
            name = name == null ? DEFAULT_NAME : name;
            id = id == null ? DEFAULT_ID : id;
            url = url == null ? DEFAULT_URL : url;
        }

        public static SourceTool defaults() {
            return new SourceTool(DEFAULT_NAME, DEFAULT_ID, DEFAULT_URL);
        }
    }

    /**
     * Coordinates for new skeleton documents.
     *
     * @param country jurisdiction code
     * @param language 3-letter ISO-639-2 language code
     * @param version Akoma Ntoso version label
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DocumentDefaults(
        @JsonProperty("country") String country,
        @JsonProperty("language") String language,
        @JsonProperty("version") String version
    ) {
        public static final String DEFAULT_COUNTRY = "za";
        public static final String DEFAULT_LANGUAGE = "eng";

        public DocumentDefaults {
            country = country == null ? DEFAULT_COUNTRY : country;
            language = language == null ? DEFAULT_LANGUAGE : language;
            version = version == null ? AknVersion.DEFAULT.label() : version;
        }

        public static DocumentDefaults defaults() {
            return new DocumentDefaults(DEFAULT_COUNTRY, DEFAULT_LANGUAGE, AknVersion.DEFAULT.label());
        }

        /**
         * Returns the configured version.
         *
         * @return the version
         * @throws IllegalArgumentException if the configured label is unknown
         */
        public AknVersion aknVersion() {
            return AknVersion.fromLabel(version);
        }
    }
}
