package com.netforge.core.schematic;

import com.netforge.core.model.Connection;

import java.util.List;

/**
 * A net as computed by the editor: its name and every pin on it, net labels
 * and chip pins included.
 *
 * @param name net name supplied by the scene, empty when the scene left it unnamed
 * @param connections member pins
 */
public record NetData(
    String name,
    List<Connection> connections
) {
    /**
     * Compact constructor with validation.
     */
    public NetData {
        name = name == null ? "" : name.trim();
        connections = connections == null ? List.of() : List.copyOf(connections);
    }
}
