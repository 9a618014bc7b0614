package com.aknmodel.core;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Loads markup fixtures from {@code src/test/resources/fixtures}.
 */
public final class Fixtures {

    public static final String ACT_WITH_COMPONENT = "act-with-component.xml";
    public static final String ACT_WITH_ATTACHMENTS = "act-with-attachments.xml";

    private Fixtures() {
        // Utility class
    }

    public static byte[] load(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("No such fixture: " + name);
            }
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
