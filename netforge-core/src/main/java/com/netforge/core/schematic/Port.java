package com.netforge.core.schematic;

import com.netforge.core.geometry.Point;

import java.util.Objects;

/**
 * A component port at its absolute scene position.
 *
 * @param name port name
 * @param position absolute scene coordinate
 */
public record Port(
    String name,
    Point position
) {
    /**
     * Compact constructor with validation.
     */
    public Port {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(position, "position must not be null");
    }
}
