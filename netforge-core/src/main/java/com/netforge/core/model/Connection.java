package com.netforge.core.model;

import java.util.Objects;

/**
 * One component pin's participation in a net.
 *
 * @param componentRefdes reference designator of the component (may be empty)
 * @param componentKind template kind of the component
 * @param portName name of the port on the component
 */
public record Connection(
    String componentRefdes,
    String componentKind,
    String portName
) {
    /**
     * Compact constructor with validation.
     */
    public Connection {
        if (componentRefdes == null) {
            componentRefdes = "";
        }
        Objects.requireNonNull(componentKind, "componentKind must not be null");
        Objects.requireNonNull(portName, "portName must not be null");
    }

    /**
     * Returns the designator used to address this pin: the refdes, or the kind
     * when the component has no refdes.
     *
     * @return refdes or kind
     */
    public String displayRefdes() {
        return componentRefdes.isEmpty() ? componentKind : componentRefdes;
    }

    /**
     * Returns the lookup key of this connection's pin.
     *
     * @return pin key
     */
    public PinKey key() {
        return new PinKey(componentRefdes, portName);
    }
}
