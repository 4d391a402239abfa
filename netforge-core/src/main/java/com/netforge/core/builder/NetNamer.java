package com.netforge.core.builder;

/**
 * Names the nets discovered from raw geometry.
 *
 * <p>Groups are named in order of their smallest point, so a namer sees a
 * stable sequence for a given schematic.
 */
@FunctionalInterface
public interface NetNamer {

    /**
     * Names one net.
     *
     * @param sequence 1-based position among the non-ground nets named so far
     * @param ground whether the net is tied to a ground symbol
     * @return net name
     */
    String name(int sequence, boolean ground);

    /**
     * Returns the default namer: "0" for ground, otherwise the sequence number.
     *
     * @return default namer
     */
    static NetNamer defaults() {
        return (sequence, ground) -> ground ? "0" : Integer.toString(sequence);
    }
}
