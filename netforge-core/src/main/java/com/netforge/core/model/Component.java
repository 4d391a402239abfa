package com.netforge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A physical part emitted into a netlist.
 *
 * @param refdes reference designator (e.g. "R1"), may be empty
 * @param kind component template kind
 * @param value free-form value text ("10k", "4.7uF", a part number)
 * @param spiceType SPICE element letter from the template, empty when unknown
 * @param pins one entry per declared port, in declaration order
 */
public record Component(
    String refdes,
    String kind,
    String value,
    String spiceType,
    List<Pin> pins
) {
    /**
     * Compact constructor with validation.
     */
    public Component {
        if (refdes == null) {
            refdes = "";
        }
        Objects.requireNonNull(kind, "kind must not be null");
        if (value == null) {
            value = "";
        }
        if (spiceType == null) {
            spiceType = "";
        }
        pins = pins == null ? List.of() : List.copyOf(pins);
    }

    /**
     * Returns the refdes, or the kind when no refdes was assigned.
     *
     * @return sort and display name
     */
    public String displayName() {
        return refdes.isEmpty() ? kind : refdes;
    }
}
