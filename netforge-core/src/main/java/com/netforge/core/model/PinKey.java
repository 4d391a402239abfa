package com.netforge.core.model;

import java.util.Objects;

/**
 * Identifies one pin across a schematic: component refdes plus port name.
 *
 * @param refdes component reference designator
 * @param portName port name on that component
 */
public record PinKey(
    String refdes,
    String portName
) {
    /**
     * Compact constructor with validation.
     */
    public PinKey {
        Objects.requireNonNull(refdes, "refdes must not be null");
        Objects.requireNonNull(portName, "portName must not be null");
    }
}
