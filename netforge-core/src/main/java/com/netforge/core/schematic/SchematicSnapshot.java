package com.netforge.core.schematic;

import com.netforge.core.geometry.Point;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable {@link Schematic}.
 *
 * @param components placed components
 * @param wires wires
 * @param nets editor-computed nets, or null when absent
 * @param junctions explicit wire junctions
 * @param netNameOverrides manual net names keyed by smallest net point
 */
public record SchematicSnapshot(
    List<SchematicComponent> components,
    List<Wire> wires,
    List<NetData> nets,
    List<Point> junctions,
    Map<Point, String> netNameOverrides
) implements Schematic {

    /**
     * Compact constructor with validation.
     */
    public SchematicSnapshot {
        components = components == null ? List.of() : List.copyOf(components);
        wires = wires == null ? List.of() : List.copyOf(wires);
        nets = nets == null ? null : List.copyOf(nets);
        junctions = junctions == null ? List.of() : List.copyOf(junctions);
        netNameOverrides = netNameOverrides == null ? Map.of() : Map.copyOf(netNameOverrides);
    }

    /**
     * Creates a geometry-only snapshot.
     *
     * @param components placed components
     * @param wires wires
     * @return snapshot without net data
     */
    public static SchematicSnapshot ofGeometry(List<SchematicComponent> components, List<Wire> wires) {
        return new SchematicSnapshot(components, wires, null, List.of(), Map.of());
    }

    /**
     * Returns a copy of this snapshot carrying the given nets.
     *
     * @param netData nets to attach
     * @return snapshot with net data
     */
    public SchematicSnapshot withNets(List<NetData> netData) {
        return new SchematicSnapshot(components, wires, netData, junctions, netNameOverrides);
    }

    @Override
    public Optional<List<NetData>> netData() {
        return Optional.ofNullable(nets);
    }
}
