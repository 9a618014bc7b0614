package com.aknmodel.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * An amendment recorded in a document's lifecycle.
 *
 * @param date date the amendment took effect
 * @param amendingTitle title of the amending work
 * @param amendingUri FRBR URI of the amending work
 */
public record AmendmentEvent(
    LocalDate date,
    String amendingTitle,
    String amendingUri
) {
    /**
     * Compact constructor with validation.
     */
    public AmendmentEvent {
        Objects.requireNonNull(date, "date must not be null");
    }
}
