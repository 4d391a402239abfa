package com.netforge.core.builder;

import com.netforge.core.config.ExportConfig;
import com.netforge.core.config.FlattenConfig;
import com.netforge.core.geometry.Point;
import com.netforge.core.geometry.PointUnionFind;
import com.netforge.core.library.ComponentLibrary;
import com.netforge.core.model.Component;
import com.netforge.core.model.ComponentRole;
import com.netforge.core.model.Connection;
import com.netforge.core.model.Netlist;
import com.netforge.core.model.Pin;
import com.netforge.core.schematic.NetData;
import com.netforge.core.schematic.Port;
import com.netforge.core.schematic.Schematic;
import com.netforge.core.schematic.SchematicComponent;
import com.netforge.core.schematic.SchematicReader;
import com.netforge.core.schematic.Wire;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a {@link Schematic} into a {@link Netlist}.
 *
 * <p><b>Net resolution</b> runs in one of three modes:
 * <ol>
 *   <li><b>Preferred</b>: the schematic carries editor-computed nets, which are
 *       taken as they are.</li>
 *   <li><b>Labels</b>: when configured, nets are computed from geometry by the
 *       {@link SceneNetResolver}, named after the labels on them.</li>
 *   <li><b>Fallback</b>: wire points and port positions are joined in a
 *       union-find; every group holding at least two pins becomes a net, named
 *       by the {@link NetNamer} in order of the group's smallest point.</li>
 * </ol>
 *
 * <p><b>Emission</b> keeps physical parts only. Net labels and chip instances
 * name and join nets but never appear as components or connections. Each
 * part gets one pin per port, in port order, set to its net or
 * {@link Pin#OPEN}.
 *
 * <p>Chip instances are then expanded by the {@link ChipFlattener} unless
 * flattening is disabled.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ComponentLibrary library = ComponentLibraryLoader.loadDefaults();
 * Netlist netlist = new NetlistBuilder(library).build(schematic);
 * }</pre>
 */
public class NetlistBuilder {

    private static final Logger log = LoggerFactory.getLogger(NetlistBuilder.class);

    private final ComponentLibrary library;
    private final NetNamer namer;
    private final FlattenConfig flatten;
    private final boolean resolveLabels;
    private final SceneNetResolver sceneResolver;

    /**
     * Creates a builder with default naming and recursive flattening.
     *
     * @param library component templates
     */
    public NetlistBuilder(ComponentLibrary library) {
        this(library, NetNamer.defaults(), FlattenConfig.defaults(), false);
    }

    /**
     * Creates a builder.
     *
     * @param library component templates
     * @param namer names for nets computed from geometry
     * @param flatten chip flattening settings
     * @param resolveLabels compute geometry-only nets with the scene resolver
     */
    public NetlistBuilder(ComponentLibrary library, NetNamer namer, FlattenConfig flatten, boolean resolveLabels) {
        this.library = Objects.requireNonNull(library, "library must not be null");
        this.namer = Objects.requireNonNull(namer, "namer must not be null");
        this.flatten = flatten != null ? flatten : FlattenConfig.defaults();
        this.resolveLabels = resolveLabels;
        this.sceneResolver = new SceneNetResolver(library);
    }

    /**
     * Creates a builder from export configuration.
     *
     * @param library component templates
     * @param config export configuration
     * @return configured builder
     */
    public static NetlistBuilder fromConfig(ComponentLibrary library, ExportConfig config) {
        return new NetlistBuilder(library, NetNamer.defaults(), config.flattenOrDefault(),
            config.netlistOrDefault().isResolveLabels());
    }

    /**
     * Resolves the nets of one schematic level without emitting components.
     *
     * @param schematic schematic to resolve
     * @return raw nets and the net of every pin
     */
    public NetResolution resolve(Schematic schematic) {
        Objects.requireNonNull(schematic, "schematic must not be null");
        if (schematic.netData().isPresent()) {
            log.debug("Using {} editor-computed nets", schematic.netData().get().size());
            return NetResolution.of(schematic.netData().get(), namer);
        }
        if (resolveLabels) {
            log.debug("Resolving nets from geometry with label naming");
            return NetResolution.of(sceneResolver.resolve(schematic), namer);
        }
        log.debug("Resolving nets from geometry");
        return NetResolution.of(fallbackNets(schematic), namer);
    }

    /**
     * Builds the netlist of a schematic, chips flattened.
     *
     * @param schematic schematic to convert
     * @return netlist
     */
    public Netlist build(Schematic schematic) {
        Objects.requireNonNull(schematic, "schematic must not be null");
        // unnamed parts would share pin keys while nets come from geometry
        Schematic keyed = schematic.netData().isPresent() ? schematic : ChipFlattener.withDistinctRefdes(schematic);
        NetResolution resolution = resolve(keyed);
        NetlistAssembler assembler = new NetlistAssembler();
        emit(schematic, keyed, resolution, assembler);

        if (flatten.isEnabled()) {
            RefdesAllocator allocator = new RefdesAllocator();
            for (SchematicComponent component : schematic.components()) {
                if (library.roleOf(component.kind()) == ComponentRole.PART) {
                    allocator.reserve(library.prefixFor(component.kind()), component.refdes());
                }
            }
            ChipFlattener flattener = new ChipFlattener(
                library, new SchematicReader(library), this, flatten.effectiveMaxDepth());
            flattener.flatten(keyed, resolution, assembler, allocator);
        } else {
            log.debug("Chip flattening disabled");
        }

        Netlist netlist = assembler.toNetlist();
        log.info("Built netlist: {} components, {} nets", netlist.components().size(), netlist.nets().size());
        return netlist;
    }

    /**
     * Emits the parts of one level and their connections.
     *
     * <p>Every net of the resolution is declared so that local names made up
     * later cannot collide with it. {@code keyed} is the schematic the
     * resolution was computed from; its components line up one to one with
     * {@code schematic}, whose designators are the ones emitted.
     */
    void emit(Schematic schematic, Schematic keyed, NetResolution resolution, NetlistAssembler assembler) {
        List<SchematicComponent> originals = schematic.components();
        List<SchematicComponent> keys = keyed.components();
        Map<String, SchematicComponent> parts = new LinkedHashMap<>();
        for (int i = 0; i < keys.size(); i++) {
            if (library.roleOf(keys.get(i).kind()) == ComponentRole.PART) {
                parts.putIfAbsent(keys.get(i).refdes(), originals.get(i));
            }
        }

        for (NetData net : resolution.nets()) {
            assembler.declareNet(net.name());
            for (Connection connection : net.connections()) {
                SchematicComponent part = parts.get(connection.componentRefdes());
                if (part == null || !hasPort(part, connection.portName())
                        || !net.name().equals(resolution.pinNets().get(connection.key()))) {
                    continue;
                }
                assembler.connect(net.name(), new Connection(part.refdes(), part.kind(), connection.portName()));
            }
        }

        for (int i = 0; i < keys.size(); i++) {
            SchematicComponent component = originals.get(i);
            if (library.roleOf(component.kind()) != ComponentRole.PART) {
                continue;
            }
            String key = keys.get(i).refdes();
            List<Pin> pins = new ArrayList<>();
            for (Port port : component.ports()) {
                pins.add(new Pin(port.name(), resolution.netOf(key, port.name())));
            }
            assembler.addComponent(new Component(
                component.refdes(), component.kind(), component.value(),
                library.spiceTypeFor(component.kind()), pins));
        }
    }

    NetResolution resolveNested(Schematic schematic) {
        if (schematic.netData().isPresent()) {
            return NetResolution.of(schematic.netData().get(), namer);
        }
        return NetResolution.of(sceneResolver.resolve(schematic), namer);
    }

    private List<NetData> fallbackNets(Schematic schematic) {
        PointUnionFind unionFind = new PointUnionFind();
        for (Wire wire : schematic.wires()) {
            unionFind.addPath(wire.points());
        }

        Map<Point, List<Connection>> connectionsAt = new LinkedHashMap<>();
        for (SchematicComponent component : schematic.components()) {
            for (Port port : component.ports()) {
                unionFind.add(port.position());
                connectionsAt.computeIfAbsent(port.position(), k -> new ArrayList<>())
                    .add(new Connection(component.refdes(), component.kind(), port.name()));
            }
        }

        List<Map.Entry<Point, List<Connection>>> groups = new ArrayList<>();
        for (List<Point> members : unionFind.groups().values()) {
            List<Connection> connections = new ArrayList<>();
            for (Point member : members) {
                connections.addAll(connectionsAt.getOrDefault(member, List.of()));
            }
            if (connections.size() >= 2) {
                groups.add(Map.entry(Collections.min(members), connections));
            }
        }
        groups.sort(Map.Entry.comparingByKey());

        List<NetData> nets = new ArrayList<>();
        int sequence = 0;
        for (Map.Entry<Point, List<Connection>> group : groups) {
            boolean ground = group.getValue().stream()
                .anyMatch(c -> library.isGround(c.componentKind()));
            String name = ground ? namer.name(sequence, true) : namer.name(++sequence, false);
            nets.add(new NetData(name, group.getValue()));
        }
        log.debug("Fallback resolution: {} point groups, {} nets", unionFind.groups().size(), nets.size());
        return nets;
    }

    private static boolean hasPort(SchematicComponent component, String portName) {
        for (Port port : component.ports()) {
            if (port.name().equals(portName)) {
                return true;
            }
        }
        return false;
    }
}
