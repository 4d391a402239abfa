package com.netforge.core.model;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Components and the nets that join them.
 *
 * <p>Built fresh for each export and immutable once built. Every connection
 * listed in a net has a matching {@link Pin} on its component whose
 * {@code net} equals the net's name.
 *
 * @param components emitted physical components
 * @param nets nets with unique names
 */
public record Netlist(
    List<Component> components,
    List<Net> nets
) {
    /** Order used by every formatter: refdes, or kind when the refdes is empty. */
    public static final Comparator<Component> COMPONENT_ORDER =
        Comparator.comparing(Component::displayName);

    /**
     * Compact constructor with validation.
     */
    public Netlist {
        components = components == null ? List.of() : List.copyOf(components);
        nets = nets == null ? List.of() : List.copyOf(nets);
    }

    /**
     * Creates an empty netlist.
     *
     * @return netlist with no components and no nets
     */
    public static Netlist empty() {
        return new Netlist(List.of(), List.of());
    }

    /**
     * Returns the components sorted in formatter order.
     *
     * @return sorted copy of the components
     */
    public List<Component> sortedComponents() {
        return components.stream().sorted(COMPONENT_ORDER).toList();
    }

    /**
     * Looks up a net by name.
     *
     * @param name net name
     * @return the net, if present
     */
    public Optional<Net> findNet(String name) {
        return nets.stream().filter(net -> net.name().equals(name)).findFirst();
    }

    /**
     * Looks up a component by refdes.
     *
     * @param refdes reference designator
     * @return the component, if present
     */
    public Optional<Component> findComponent(String refdes) {
        return components.stream().filter(c -> c.refdes().equals(refdes)).findFirst();
    }
}
