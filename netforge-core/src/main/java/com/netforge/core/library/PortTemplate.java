package com.netforge.core.library;

import java.util.Objects;

/**
 * A port declared by a component template, positioned relative to the
 * component origin before rotation.
 *
 * @param name port name ("A", "B", "1", "C", ...)
 * @param x horizontal offset
 * @param y vertical offset
 */
public record PortTemplate(
    String name,
    double x,
    double y
) {
    /**
     * Compact constructor with validation.
     */
    public PortTemplate {
        Objects.requireNonNull(name, "name must not be null");
    }
}
