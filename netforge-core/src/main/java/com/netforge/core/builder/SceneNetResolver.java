package com.netforge.core.builder;

import com.netforge.core.geometry.DisjointSet;
import com.netforge.core.geometry.Point;
import com.netforge.core.library.ComponentLibrary;
import com.netforge.core.library.ComponentTemplate;
import com.netforge.core.model.ComponentRole;
import com.netforge.core.model.Connection;
import com.netforge.core.schematic.NetData;
import com.netforge.core.schematic.Port;
import com.netforge.core.schematic.Schematic;
import com.netforge.core.schematic.SchematicComponent;
import com.netforge.core.schematic.Wire;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Computes named nets from schematic geometry the way the editor does.
 *
 * <p>Unlike the plain fallback in {@link NetlistBuilder}, this resolver
 * <ul>
 *   <li>attaches a port to every wire it touches anywhere along a segment,</li>
 *   <li>joins two wires only at a declared junction point or through a port
 *       touching both, never merely because they share a corner or end,</li>
 *   <li>names a net after the net label on it, with ground labels giving "0",</li>
 *   <li>applies manual names keyed by a net's smallest point,</li>
 *   <li>merges separate groups carrying the same label into one net.</li>
 * </ul>
 * Remaining nets are named {@code N1}, {@code N2}, ... in order of their
 * smallest point.
 */
public class SceneNetResolver {

    private static final Logger log = LoggerFactory.getLogger(SceneNetResolver.class);

    /** Distance within which a point counts as lying on a wire. */
    public static final double TOLERANCE = 1e-4;

    private final ComponentLibrary library;

    public SceneNetResolver(ComponentLibrary library) {
        this.library = Objects.requireNonNull(library, "library must not be null");
    }

    /**
     * Resolves the nets of a schematic from its geometry, ignoring any net data
     * it carries.
     *
     * @param schematic schematic to resolve
     * @return named nets, net-label and chip pins included
     */
    public List<NetData> resolve(Schematic schematic) {
        Objects.requireNonNull(schematic, "schematic must not be null");
        // nodes are WireNode per wire and Point per port position
        DisjointSet<Object> unionFind = new DisjointSet<>();

        List<Wire> wires = new ArrayList<>();
        for (Wire wire : schematic.wires()) {
            if (!wire.points().isEmpty()) {
                unionFind.add(new WireNode(wires.size()));
                wires.add(wire);
            }
        }

        for (Point junction : schematic.junctions()) {
            WireNode first = null;
            for (int i = 0; i < wires.size(); i++) {
                if (wires.get(i).contains(junction, TOLERANCE)) {
                    if (first == null) {
                        first = new WireNode(i);
                    } else {
                        unionFind.union(first, new WireNode(i));
                    }
                }
            }
        }

        Map<Point, List<Terminal>> terminals = new LinkedHashMap<>();
        for (SchematicComponent component : schematic.components()) {
            for (Port port : component.ports()) {
                Point position = port.position();
                unionFind.add(position);
                for (int i = 0; i < wires.size(); i++) {
                    if (wires.get(i).contains(position, TOLERANCE)) {
                        unionFind.union(position, new WireNode(i));
                    }
                }
                terminals.computeIfAbsent(position, k -> new ArrayList<>())
                    .add(new Terminal(component, port.name()));
            }
        }

        List<Group> groups = new ArrayList<>();
        for (List<Object> members : unionFind.groups().values()) {
            List<Terminal> onGroup = new ArrayList<>();
            List<Point> points = new ArrayList<>();
            for (Object member : members) {
                if (member instanceof WireNode node) {
                    points.addAll(wires.get(node.index()).points());
                } else {
                    Point point = (Point) member;
                    points.add(point);
                    onGroup.addAll(terminals.getOrDefault(point, List.of()));
                }
            }
            if (!onGroup.isEmpty()) {
                groups.add(new Group(Collections.min(points), onGroup));
            }
        }
        groups.sort((a, b) -> a.anchor().compareTo(b.anchor()));

        List<String> names = new ArrayList<>();
        Set<String> taken = new HashSet<>();
        for (Group group : groups) {
            String name = labelName(group);
            if (name == null) {
                name = schematic.netNameOverrides().get(group.anchor());
            }
            names.add(name);
            if (name != null) {
                taken.add(name);
            }
        }

        Map<String, List<Connection>> nets = new LinkedHashMap<>();
        int sequence = 0;
        for (int i = 0; i < groups.size(); i++) {
            String name = names.get(i);
            if (name == null) {
                do {
                    name = "N" + ++sequence;
                } while (taken.contains(name));
                taken.add(name);
            }
            List<Connection> connections = nets.computeIfAbsent(name, k -> new ArrayList<>());
            for (Terminal terminal : groups.get(i).terminals()) {
                connections.add(new Connection(
                    terminal.component().refdes(), terminal.component().kind(), terminal.port()));
            }
        }

        log.debug("Resolved {} nets from {} point groups", nets.size(), groups.size());
        List<NetData> out = new ArrayList<>();
        nets.forEach((name, connections) -> out.add(new NetData(name, connections)));
        return out;
    }

    private String labelName(Group group) {
        for (Terminal terminal : group.terminals()) {
            SchematicComponent component = terminal.component();
            if (library.roleOf(component.kind()) != ComponentRole.NET_LABEL) {
                continue;
            }
            if (library.isGround(component.kind())) {
                return "0";
            }
            String name = library.get(component.kind())
                .map(ComponentTemplate::netName)
                .filter(n -> !n.isBlank())
                .orElse(component.value().isBlank() ? labelRefdes(component) : component.value().trim());
            if (name.isBlank()) {
                continue;
            }
            return ComponentTemplate.isGroundName(name) ? "0" : name;
        }
        return null;
    }

    private static String labelRefdes(SchematicComponent label) {
        return ChipFlattener.isPlaceholder(label.refdes()) ? "" : label.refdes();
    }

    private record WireNode(int index) {}

    private record Terminal(SchematicComponent component, String port) {}

    private record Group(Point anchor, List<Terminal> terminals) {}
}
