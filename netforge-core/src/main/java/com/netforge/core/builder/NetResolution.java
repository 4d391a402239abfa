package com.netforge.core.builder;

import com.netforge.core.model.Connection;
import com.netforge.core.model.Pin;
import com.netforge.core.model.PinKey;
import com.netforge.core.schematic.NetData;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Raw nets of one schematic level, net-label and chip pins included, plus the
 * net each pin resolved to.
 *
 * @param nets nets with unique names and at least one connection each
 * @param pinNets net name per pin; a pin listed twice keeps its first net
 */
public record NetResolution(
    List<NetData> nets,
    Map<PinKey, String> pinNets
) {
    /**
     * Compact constructor with validation.
     */
    public NetResolution {
        nets = nets == null ? List.of() : List.copyOf(nets);
        pinNets = pinNets == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(pinNets));
    }

    /**
     * Normalizes scene nets: entries sharing a name are merged, entries without
     * connections are dropped and unnamed entries get a name from the namer.
     *
     * @param raw nets as supplied by the scene or computed from geometry
     * @param namer namer for unnamed entries
     * @return resolution
     */
    public static NetResolution of(List<NetData> raw, NetNamer namer) {
        Objects.requireNonNull(raw, "raw must not be null");
        Objects.requireNonNull(namer, "namer must not be null");

        Set<String> taken = new HashSet<>();
        for (NetData net : raw) {
            if (!net.name().isEmpty()) {
                taken.add(net.name());
            }
        }

        Map<String, List<Connection>> merged = new LinkedHashMap<>();
        int sequence = 0;
        for (NetData net : raw) {
            if (net.connections().isEmpty()) {
                continue;
            }
            String name = net.name();
            if (name.isEmpty()) {
                do {
                    name = namer.name(++sequence, false);
                } while (taken.contains(name));
                taken.add(name);
            }
            merged.computeIfAbsent(name, k -> new ArrayList<>()).addAll(net.connections());
        }

        List<NetData> nets = new ArrayList<>();
        Map<PinKey, String> pinNets = new LinkedHashMap<>();
        merged.forEach((name, connections) -> {
            nets.add(new NetData(name, connections));
            for (Connection connection : connections) {
                pinNets.putIfAbsent(connection.key(), name);
            }
        });
        return new NetResolution(nets, pinNets);
    }

    /**
     * Returns the net of a pin.
     *
     * @param refdes component refdes
     * @param portName port name
     * @return net name, or {@link Pin#OPEN} when the pin is on no net
     */
    public String netOf(String refdes, String portName) {
        return pinNets.getOrDefault(new PinKey(refdes == null ? "" : refdes, portName), Pin.OPEN);
    }
}
