package com.netforge.core.model;

import java.util.Objects;

/**
 * A component port and the net it resolved to.
 *
 * @param name port name
 * @param net net name, or {@link #OPEN} when unconnected
 */
public record Pin(
    String name,
    String net
) {
    /** Net value of a pin that is not wired to anything. */
    public static final String OPEN = "OPEN";

    /**
     * Compact constructor with validation.
     */
    public Pin {
        Objects.requireNonNull(name, "name must not be null");
        if (net == null || net.isBlank()) {
            net = OPEN;
        }
    }

    /**
     * Returns whether this pin is unconnected.
     *
     * @return true when the net is {@link #OPEN}
     */
    public boolean isOpen() {
        return OPEN.equals(net);
    }
}
