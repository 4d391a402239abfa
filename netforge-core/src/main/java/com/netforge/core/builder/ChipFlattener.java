package com.netforge.core.builder;

import com.fasterxml.jackson.databind.JsonNode;
import com.netforge.core.library.ComponentLibrary;
import com.netforge.core.library.ComponentTemplate;
import com.netforge.core.model.Component;
import com.netforge.core.model.ComponentRole;
import com.netforge.core.model.Connection;
import com.netforge.core.model.Pin;
import com.netforge.core.model.PinKey;
import com.netforge.core.schematic.NetData;
import com.netforge.core.schematic.PlacedComponent;
import com.netforge.core.schematic.Port;
import com.netforge.core.schematic.Schematic;
import com.netforge.core.schematic.SchematicComponent;
import com.netforge.core.schematic.SchematicReadException;
import com.netforge.core.schematic.SchematicReader;
import com.netforge.core.schematic.SchematicSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Expands chip instances into the parts of their nested schematics.
 *
 * <p>For every chip the nested schematic is read from the instance payload,
 * or from the template's default payload, and its nets are resolved. A net
 * carrying a label whose text matches one of the chip's port names joins the
 * parent net wired to that port. Ground nets join the top level's ground net,
 * the first net with a ground name, or "0" when it has none. Every other net
 * stays local to the chip, named {@code <chipPath>_<name>}.
 *
 * <p>Internal parts are renamed with fresh designators from the
 * {@link RefdesAllocator} and appended to the parent netlist; the chip itself
 * leaves no trace.
 *
 * <p>Nested chips go through the same work queue with the nets they were
 * wired to in their parent. A chip sitting deeper than the depth limit is
 * skipped with a warning, as is a chip taking its template's default payload
 * while a chip of the same kind already encloses it. Inline payloads are finite
 * trees and only the depth limit bounds them.
 */
public class ChipFlattener {

    private static final Logger log = LoggerFactory.getLogger(ChipFlattener.class);

    private static final String GLOBAL_GROUND = "0";

    private static final String PLACEHOLDER_PREFIX = "#";

    private final ComponentLibrary library;
    private final SchematicReader reader;
    private final NetlistBuilder builder;
    private final int maxDepth;

    /**
     * Creates a flattener.
     *
     * @param library component templates
     * @param reader reader for chip payloads
     * @param builder builder resolving the nets of chip internals
     * @param maxDepth deepest nesting level expanded, top-level chips being level 1
     */
    public ChipFlattener(ComponentLibrary library, SchematicReader reader, NetlistBuilder builder, int maxDepth) {
        this.library = Objects.requireNonNull(library, "library must not be null");
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
        this.builder = Objects.requireNonNull(builder, "builder must not be null");
        this.maxDepth = maxDepth;
    }

    /**
     * Flattens every chip of a schematic into the target.
     *
     * @param parent top-level schematic
     * @param resolution nets of the top level
     * @param target netlist under construction, top-level parts already emitted
     * @param allocator allocator seeded with the top-level designators
     * @return number of chip instances expanded
     */
    public int flatten(Schematic parent, NetResolution resolution, NetlistAssembler target, RefdesAllocator allocator) {
        String groundNet = resolution.nets().stream()
            .map(NetData::name)
            .filter(ComponentTemplate::isGroundName)
            .findFirst()
            .orElse(GLOBAL_GROUND);

        Deque<ChipInstance> queue = new ArrayDeque<>();
        for (SchematicComponent component : parent.components()) {
            if (library.roleOf(component.kind()) == ComponentRole.CHIP) {
                queue.add(new ChipInstance(component, resolution.pinNets(), nameOf(component), List.of(), 1));
            }
        }

        int expanded = 0;
        while (!queue.isEmpty()) {
            if (expand(queue.poll(), groundNet, target, allocator, queue)) {
                expanded++;
            }
        }
        if (expanded > 0) {
            log.debug("Flattened {} chip instances", expanded);
        }
        return expanded;
    }

    private boolean expand(ChipInstance instance, String groundNet, NetlistAssembler target,
                           RefdesAllocator allocator, Deque<ChipInstance> queue) {
        SchematicComponent chip = instance.chip();

        if (instance.depth() > maxDepth) {
            log.warn("Skipping chip {}: nesting depth {} exceeds limit {}", instance.path(), instance.depth(), maxDepth);
            return false;
        }

        Optional<JsonNode> payload = chip.chipPayload();
        if (payload.isEmpty()) {
            // a template default can contain its own kind and recurse forever
            if (instance.ancestry().contains(chip.kind())) {
                log.warn("Skipping chip {}: kind {} is nested inside itself", instance.path(), chip.kind());
                return false;
            }
            payload = library.get(chip.kind()).flatMap(ComponentTemplate::chipPayload);
        }
        if (payload.isEmpty()) {
            log.warn("Skipping chip {}: no nested schematic", instance.path());
            return false;
        }

        SchematicSnapshot inner;
        try {
            inner = reader.readTree(payload.get());
        } catch (SchematicReadException e) {
            log.warn("Skipping chip {}: {}", instance.path(), e.getMessage());
            return false;
        }
        if (inner.netData().isEmpty()) {
            inner = withDistinctRefdes(inner);
        }

        Map<String, String> boundary = new LinkedHashMap<>();
        for (Port port : chip.ports()) {
            boundary.putIfAbsent(normalize(port.name()),
                instance.parentPinNets().getOrDefault(new PinKey(chip.refdes(), port.name()), Pin.OPEN));
        }

        NetResolution local = builder.resolveNested(inner);
        Map<String, SchematicComponent> byRefdes = new HashMap<>();
        for (SchematicComponent component : inner.components()) {
            byRefdes.putIfAbsent(component.refdes(), component);
        }
        Map<String, String> effective = new HashMap<>();
        for (NetData net : local.nets()) {
            effective.put(net.name(), effectiveNet(net, byRefdes, boundary, instance.path(), groundNet, target));
        }

        List<String> ancestry = new ArrayList<>(instance.ancestry());
        ancestry.add(chip.kind());

        for (SchematicComponent component : inner.components()) {
            ComponentRole role = library.roleOf(component.kind());
            if (role == ComponentRole.PART) {
                emitPart(component, local, effective, target, allocator);
            } else if (role == ComponentRole.CHIP) {
                Map<PinKey, String> nestedPins = new LinkedHashMap<>();
                for (Port port : component.ports()) {
                    nestedPins.put(new PinKey(component.refdes(), port.name()),
                        mapNet(local.netOf(component.refdes(), port.name()), effective));
                }
                queue.add(new ChipInstance(component, nestedPins,
                    instance.path() + "_" + nameOf(component), ancestry, instance.depth() + 1));
            }
        }
        return true;
    }

    private void emitPart(SchematicComponent component, NetResolution local, Map<String, String> effective,
                          NetlistAssembler target, RefdesAllocator allocator) {
        String refdes = allocator.allocate(library.prefixFor(component.kind()));
        List<Pin> pins = new ArrayList<>();
        for (Port port : component.ports()) {
            String net = mapNet(local.netOf(component.refdes(), port.name()), effective);
            pins.add(new Pin(port.name(), net));
            target.connect(net, new Connection(refdes, component.kind(), port.name()));
        }
        target.addComponent(new Component(
            refdes, component.kind(), component.value(), library.spiceTypeFor(component.kind()), pins));
    }

    private String effectiveNet(NetData net, Map<String, SchematicComponent> byRefdes, Map<String, String> boundary,
                                String path, String groundNet, NetlistAssembler target) {
        boolean ground = ComponentTemplate.isGroundName(net.name());
        for (Connection connection : net.connections()) {
            SchematicComponent label = byRefdes.get(connection.componentRefdes());
            if (label == null || library.roleOf(label.kind()) != ComponentRole.NET_LABEL) {
                continue;
            }
            ground |= library.isGround(label.kind());
            for (String text : labelTexts(label)) {
                String parentNet = boundary.get(normalize(text));
                if (parentNet != null && !Pin.OPEN.equals(parentNet)) {
                    return parentNet;
                }
            }
        }
        if (ground) {
            return groundNet;
        }
        return target.uniqueNetName(path + "_" + net.name());
    }

    /**
     * Texts a label can match a boundary port by: its value, its template net
     * name, then its refdes.
     */
    private List<String> labelTexts(SchematicComponent label) {
        List<String> texts = new ArrayList<>();
        if (!label.value().isBlank()) {
            texts.add(label.value());
        }
        library.get(label.kind())
            .map(ComponentTemplate::netName)
            .filter(name -> !name.isBlank())
            .ifPresent(texts::add);
        if (!label.refdes().isBlank() && !isPlaceholder(label.refdes())) {
            texts.add(label.refdes());
        }
        return texts;
    }

    private static String mapNet(String localNet, Map<String, String> effective) {
        if (Pin.OPEN.equals(localNet)) {
            return Pin.OPEN;
        }
        return effective.getOrDefault(localNet, Pin.OPEN);
    }

    /**
     * Gives components without a designator a placeholder one so their pins
     * stay distinguishable while nets are resolved from geometry.
     */
    static SchematicSnapshot withDistinctRefdes(Schematic snapshot) {
        List<SchematicComponent> components = new ArrayList<>();
        int index = 0;
        for (SchematicComponent component : snapshot.components()) {
            index++;
            if (component.refdes().isEmpty()) {
                components.add(new PlacedComponent(PLACEHOLDER_PREFIX + index, component.kind(), component.value(),
                    component.ports(), component.chipPayload().orElse(null)));
            } else {
                components.add(component);
            }
        }
        return new SchematicSnapshot(components, snapshot.wires(), null,
            snapshot.junctions(), snapshot.netNameOverrides());
    }

    static boolean isPlaceholder(String refdes) {
        return refdes.startsWith(PLACEHOLDER_PREFIX);
    }

    private static String nameOf(SchematicComponent component) {
        String refdes = component.refdes();
        return refdes.isEmpty() || isPlaceholder(refdes) ? component.kind() : refdes;
    }

    private static String normalize(String text) {
        return text.trim().toLowerCase(Locale.ROOT);
    }

    private record ChipInstance(
        SchematicComponent chip,
        Map<PinKey, String> parentPinNets,
        String path,
        List<String> ancestry,
        int depth
    ) {}
}
