package com.netforge.core.model;

/**
 * What a placed component contributes to a netlist.
 */
public enum ComponentRole {
    /** Physical part emitted as a {@link Component} */
    PART,

    /** Net-naming anchor (GND, VDD, chip boundary numbers); never emitted */
    NET_LABEL,

    /** Hierarchical instance whose body is a nested schematic; flattened away */
    CHIP
}
