package com.netforge.core.schematic;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netforge.core.geometry.Point;
import com.netforge.core.library.ComponentLibrary;
import com.netforge.core.library.ComponentTemplate;
import com.netforge.core.library.PortTemplate;
import com.netforge.core.model.Connection;
import com.netforge.core.model.ComponentRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads saved schematic snapshots into {@link Schematic} instances.
 *
 * <p>Port positions are taken from the snapshot when it lists them explicitly;
 * otherwise they are derived from the component template: each template offset
 * is mirrored, rotated by the component's rotation and translated to its
 * position. Templates without ports fall back to the two-terminal A/B pair.
 *
 * <p>Wire endpoints attached to ports resolve to the port's absolute position,
 * so a wire's routed points always start and end where its terminals are.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SchematicReader reader = new SchematicReader(ComponentLibraryLoader.loadDefaults());
 * Schematic schematic = reader.read(Path.of("amplifier.json"));
 * }</pre>
 */
public class SchematicReader {

    private static final Logger log = LoggerFactory.getLogger(SchematicReader.class);

    private final ObjectMapper objectMapper;
    private final ComponentLibrary library;

    /**
     * Creates a reader resolving kinds against the given library.
     *
     * @param library component templates
     */
    public SchematicReader(ComponentLibrary library) {
        this.library = Objects.requireNonNull(library, "library must not be null");
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Reads a snapshot file.
     *
     * @param file path to a JSON snapshot
     * @return parsed schematic
     * @throws SchematicReadException if the file cannot be read or parsed
     */
    public SchematicSnapshot read(Path file) {
        Objects.requireNonNull(file, "file must not be null");
        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            throw new SchematicReadException("Schematic file not readable: " + file);
        }
        try {
            log.debug("Reading schematic from: {}", file);
            return toSnapshot(objectMapper.readValue(file.toFile(), SchematicDocument.class));
        } catch (IOException e) {
            throw new SchematicReadException("Failed to parse schematic " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads a snapshot from JSON text.
     *
     * @param json snapshot content
     * @return parsed schematic
     * @throws SchematicReadException if the content cannot be parsed
     */
    public SchematicSnapshot readString(String json) {
        try {
            return toSnapshot(objectMapper.readValue(json, SchematicDocument.class));
        } catch (JsonProcessingException e) {
            throw new SchematicReadException("Failed to parse schematic: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Reads a snapshot embedded in another document, such as a chip payload.
     *
     * @param tree snapshot as a JSON tree
     * @return parsed schematic
     * @throws SchematicReadException if the tree is not a snapshot object
     */
    public SchematicSnapshot readTree(JsonNode tree) {
        if (tree == null || !tree.isObject()) {
            throw new SchematicReadException("Schematic payload is not a JSON object");
        }
        try {
            return toSnapshot(objectMapper.treeToValue(tree, SchematicDocument.class));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SchematicReadException("Failed to parse schematic payload: " + e.getMessage(), e);
        }
    }

    /**
     * Converts a parsed document into a snapshot.
     *
     * @param document parsed document
     * @return snapshot
     */
    public SchematicSnapshot toSnapshot(SchematicDocument document) {
        List<SchematicComponent> components = new ArrayList<>();
        if (document.components() != null) {
            for (SchematicDocument.ComponentEntry entry : document.components()) {
                if (entry == null || entry.kind() == null || entry.kind().isBlank()) {
                    log.warn("Skipping component entry without kind");
                    continue;
                }
                components.add(toComponent(entry));
            }
        }

        List<Wire> wires = new ArrayList<>();
        if (document.wires() != null) {
            for (SchematicDocument.WireEntry entry : document.wires()) {
                if (entry == null) {
                    continue;
                }
                Wire wire = toWire(entry, components);
                if (!wire.points().isEmpty()) {
                    wires.add(wire);
                }
            }
        }

        List<NetData> nets = document.nets() == null ? null : toNets(document.nets(), components);

        List<Point> junctions = new ArrayList<>();
        Map<Point, String> overrides = new LinkedHashMap<>();
        if (document.settings() != null) {
            SchematicDocument.SettingsEntry settings = document.settings();
            if (settings.wireJunctions() != null) {
                settings.wireJunctions().stream()
                    .map(SchematicReader::toPoint)
                    .flatMap(Optional::stream)
                    .forEach(junctions::add);
            }
            if (settings.netNames() != null) {
                for (SchematicDocument.NetNameEntry entry : settings.netNames()) {
                    if (entry == null || entry.key() == null || entry.key().size() != 2
                            || entry.name() == null || entry.name().isBlank()) {
                        continue;
                    }
                    overrides.put(Point.of(orZero(entry.key().get(0)), orZero(entry.key().get(1))), entry.name().trim());
                }
            }
        }

        log.debug("Read schematic: {} components, {} wires, {} precomputed nets",
            components.size(), wires.size(), nets == null ? "no" : nets.size());
        return new SchematicSnapshot(components, wires, nets, junctions, overrides);
    }

    private PlacedComponent toComponent(SchematicDocument.ComponentEntry entry) {
        String kind = entry.kind().trim();
        Optional<ComponentTemplate> template = library.get(kind);
        return new PlacedComponent(
            entry.refdes(),
            kind,
            valueOf(entry, template),
            portsOf(entry, template),
            entry.chip()
        );
    }

    private static String valueOf(SchematicDocument.ComponentEntry entry, Optional<ComponentTemplate> template) {
        String value = entry.value() == null ? "" : entry.value().trim();
        if (!value.isEmpty() || template.isEmpty()) {
            return value;
        }
        ComponentTemplate t = template.get();
        if (t.role() == ComponentRole.NET_LABEL && !t.netName().isEmpty()) {
            return t.netName();
        }
        return t.defaultValue();
    }

    private static List<Port> portsOf(SchematicDocument.ComponentEntry entry, Optional<ComponentTemplate> template) {
        List<Port> ports = new ArrayList<>();
        if (entry.ports() != null && !entry.ports().isEmpty()) {
            int index = 0;
            for (SchematicDocument.PointEntry port : entry.ports()) {
                index++;
                if (port == null) {
                    continue;
                }
                String name = port.name() == null || port.name().isBlank() ? "P" + index : port.name().trim();
                ports.add(new Port(name, Point.of(orZero(port.x()), orZero(port.y()))));
            }
            return ports;
        }

        double originX = entry.pos() != null && entry.pos().size() > 0 ? orZero(entry.pos().get(0)) : 0.0;
        double originY = entry.pos() != null && entry.pos().size() > 1 ? orZero(entry.pos().get(1)) : 0.0;
        double radians = Math.toRadians(entry.rotation() == null ? 0.0 : entry.rotation());
        double cos = Math.cos(radians);
        double sin = Math.sin(radians);
        double mx = entry.mirror() == null || entry.mirror().mx() == null ? 1.0 : entry.mirror().mx();
        double my = entry.mirror() == null || entry.mirror().my() == null ? 1.0 : entry.mirror().my();

        List<PortTemplate> declared = template.map(ComponentTemplate::ports).orElse(ComponentTemplate.DEFAULT_PORTS);
        for (PortTemplate port : declared) {
            double x = port.x() * mx;
            double y = port.y() * my;
            ports.add(new Port(port.name(), Point.of(originX + x * cos - y * sin, originY + x * sin + y * cos)));
        }
        return ports;
    }

    private static Wire toWire(SchematicDocument.WireEntry entry, List<SchematicComponent> components) {
        List<Point> points = new ArrayList<>();
        Optional<Point> start = portPosition(entry.a(), components).or(() -> toPoint(entry.aPoint()));
        Optional<Point> end = portPosition(entry.b(), components).or(() -> toPoint(entry.bPoint()));

        start.ifPresent(points::add);
        if (entry.points() != null) {
            for (SchematicDocument.PointEntry waypoint : entry.points()) {
                toPoint(waypoint).ifPresent(p -> appendDistinct(points, p));
            }
        }
        end.ifPresent(p -> appendDistinct(points, p));
        return new Wire(points);
    }

    private static void appendDistinct(List<Point> points, Point p) {
        if (points.isEmpty() || !points.get(points.size() - 1).equals(p)) {
            points.add(p);
        }
    }

    /**
     * Resolves a {@code [componentIndex, portName]} reference. A name of "A" or
     * "B" that the component does not declare maps to its first or second port.
     */
    private static Optional<Point> portPosition(JsonNode ref, List<SchematicComponent> components) {
        if (ref == null || !ref.isArray() || ref.size() < 2 || !ref.get(0).canConvertToInt()) {
            return Optional.empty();
        }
        int index = ref.get(0).asInt();
        String name = ref.get(1).asText("");
        if (index < 0 || index >= components.size()) {
            log.warn("Wire references missing component index {}", index);
            return Optional.empty();
        }
        List<Port> ports = components.get(index).ports();
        for (Port port : ports) {
            if (port.name().equals(name)) {
                return Optional.of(port.position());
            }
        }
        if ("A".equals(name) && !ports.isEmpty()) {
            return Optional.of(ports.get(0).position());
        }
        if ("B".equals(name) && ports.size() > 1) {
            return Optional.of(ports.get(1).position());
        }
        return Optional.empty();
    }

    private static List<NetData> toNets(List<SchematicDocument.NetEntry> entries, List<SchematicComponent> components) {
        Map<String, String> kindByRefdes = new LinkedHashMap<>();
        for (SchematicComponent component : components) {
            kindByRefdes.putIfAbsent(component.refdes(), component.kind());
        }

        List<NetData> nets = new ArrayList<>();
        for (SchematicDocument.NetEntry entry : entries) {
            if (entry == null) {
                continue;
            }
            List<Connection> connections = new ArrayList<>();
            if (entry.connections() != null) {
                for (SchematicDocument.ConnectionEntry c : entry.connections()) {
                    if (c == null || c.port() == null) {
                        continue;
                    }
                    String refdes = c.refdes() == null ? "" : c.refdes().trim();
                    String kind = c.kind() != null ? c.kind().trim() : kindByRefdes.getOrDefault(refdes, "");
                    connections.add(new Connection(refdes, kind, c.port().trim()));
                }
            }
            nets.add(new NetData(entry.name(), connections));
        }
        return nets;
    }

    private static Optional<Point> toPoint(SchematicDocument.PointEntry entry) {
        if (entry == null || entry.x() == null || entry.y() == null) {
            return Optional.empty();
        }
        return Optional.of(Point.of(entry.x(), entry.y()));
    }

    private static double orZero(Double value) {
        return value == null ? 0.0 : value;
    }
}
