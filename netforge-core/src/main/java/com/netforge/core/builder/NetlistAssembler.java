package com.netforge.core.builder;

import com.netforge.core.model.Component;
import com.netforge.core.model.Connection;
import com.netforge.core.model.Net;
import com.netforge.core.model.Netlist;
import com.netforge.core.model.Pin;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Mutable accumulator behind {@link Netlist} construction.
 *
 * <p>Net names can be declared before any connection lands on them, which
 * reserves the name; declared nets that end up empty are left out of the
 * built netlist.
 */
public class NetlistAssembler {

    private final List<Component> components = new ArrayList<>();
    private final Map<String, List<Connection>> nets = new LinkedHashMap<>();

    public void declareNet(String name) {
        Objects.requireNonNull(name, "name must not be null");
        nets.computeIfAbsent(name, k -> new ArrayList<>());
    }

    public boolean hasNet(String name) {
        return nets.containsKey(name);
    }

    /**
     * Appends a connection to a net, creating the net when needed. Connections
     * to {@link Pin#OPEN} are ignored.
     *
     * @param net net name
     * @param connection pin joining the net
     */
    public void connect(String net, Connection connection) {
        Objects.requireNonNull(connection, "connection must not be null");
        if (net == null || Pin.OPEN.equals(net)) {
            return;
        }
        nets.computeIfAbsent(net, k -> new ArrayList<>()).add(connection);
    }

    public void addComponent(Component component) {
        components.add(Objects.requireNonNull(component, "component must not be null"));
    }

    /**
     * Reserves a net name not used so far: {@code base} itself, else
     * {@code base_2}, {@code base_3} and so on.
     *
     * @param base preferred name
     * @return reserved name
     */
    public String uniqueNetName(String base) {
        String candidate = base;
        int suffix = 2;
        while (nets.containsKey(candidate)) {
            candidate = base + "_" + suffix++;
        }
        declareNet(candidate);
        return candidate;
    }

    public int componentCount() {
        return components.size();
    }

    public Netlist toNetlist() {
        List<Net> out = new ArrayList<>();
        nets.forEach((name, connections) -> {
            if (!connections.isEmpty()) {
                out.add(new Net(name, connections));
            }
        });
        return new Netlist(components, out);
    }
}
