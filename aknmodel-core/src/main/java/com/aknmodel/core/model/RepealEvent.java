package com.aknmodel.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * The repeal of a document, recorded in its lifecycle.
 *
 * @param date date of the repeal
 * @param repealingTitle title of the repealing work
 * @param repealingUri FRBR URI of the repealing work
 */
public record RepealEvent(
    LocalDate date,
    String repealingTitle,
    String repealingUri
) {
    public RepealEvent {
        Objects.requireNonNull(date, "date must not be null");
    }
}
