package com.netforge.core.model;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A named set of component pins sharing electrical continuity.
 *
 * @param name net name, unique within one {@link Netlist}
 * @param connections pins on this net, in discovery order
 */
public record Net(
    String name,
    List<Connection> connections
) {
    /**
     * Compact constructor with validation.
     */
    public Net {
        Objects.requireNonNull(name, "name must not be null");
        connections = connections == null ? List.of() : List.copyOf(connections);
    }

    /**
     * Returns the connections sorted by refdes then port name.
     *
     * @return sorted copy of the connections
     */
    public List<Connection> sortedConnections() {
        return connections.stream()
            .sorted(Comparator.comparing(Connection::componentRefdes).thenComparing(Connection::portName))
            .toList();
    }
}
