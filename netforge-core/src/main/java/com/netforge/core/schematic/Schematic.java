package com.netforge.core.schematic;

import com.netforge.core.geometry.Point;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of a schematic taken at one instant.
 *
 * <p>A snapshot either carries nets already computed by the editor
 * ({@link #netData()}), which the net builder treats as authoritative, or only
 * raw geometry, in which case continuity is computed from wires and ports.
 */
public interface Schematic {

    List<SchematicComponent> components();

    List<Wire> wires();

    /**
     * Returns the editor-computed nets.
     *
     * @return nets, or empty when the snapshot holds geometry only
     */
    Optional<List<NetData>> netData();

    /**
     * Returns points where crossing wires are explicitly joined.
     *
     * @return junction points
     */
    default List<Point> junctions() {
        return List.of();
    }

    /**
     * Returns user-assigned net names keyed by the net's smallest point.
     *
     * @return manual net name overrides
     */
    default Map<Point, String> netNameOverrides() {
        return Map.of();
    }
}
