package com.netforge.core.formatter.impl;

import com.netforge.core.config.SpiceConfig;
import com.netforge.core.formatter.FormatterConfig;
import com.netforge.core.formatter.NetlistFormatter;
import com.netforge.core.formatter.SpiceValueNormalizer;
import com.netforge.core.library.ComponentTemplate;
import com.netforge.core.model.Component;
import com.netforge.core.model.Netlist;
import com.netforge.core.model.Pin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Writes a SPICE-compatible netlist.
 *
 * <p>Each component becomes one element line
 * {@code <type><refdes> <node>... [value] [part]}, nodes in pin order:
 * <pre>
 * * NetForge Netlist
 * rR1 1 2 1e3
 * rR2 2 0 2.2e3
 * .end
 * </pre>
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code spice.title} - Comment on the first line (default: "NetForge Netlist")</li>
 *   <li>{@code spice.groundNode} - Node written for GND, GROUND and 0 nets (default: "0")</li>
 *   <li>{@code spice.floatingNode} - Node written for unconnected pins (default: "NC")</li>
 *   <li>{@code spice.partTypes} - Type letters whose value is a part name, written
 *       unnormalized in the part slot (default: none)</li>
 * </ul>
 *
 * <p>The type letter is the component's lower-cased SPICE type, else the first
 * letter of its kind, else "x". Values of resistors, capacitors and inductors
 * go through {@link SpiceValueNormalizer}.
 */
public class SpiceFormatter implements NetlistFormatter {

    private static final Logger log = LoggerFactory.getLogger(SpiceFormatter.class);

    private static final String END = ".end";
    private static final Set<String> NORMALIZED_TYPES = Set.of("r", "c", "l");

    @Override
    public String getId() {
        return "spice";
    }

    @Override
    public String getDisplayName() {
        return "SPICE Netlist";
    }

    @Override
    public String getFileExtension() {
        return "cir";
    }

    @Override
    public String format(Netlist netlist, FormatterConfig config) {
        Objects.requireNonNull(netlist, "netlist must not be null");
        Objects.requireNonNull(config, "config must not be null");

        String title = config.getSettingOrDefault("spice.title", SpiceConfig.DEFAULT_TITLE);
        String groundNode = config.getSettingOrDefault("spice.groundNode", SpiceConfig.DEFAULT_GROUND_NODE);
        String floatingNode = config.getSettingOrDefault("spice.floatingNode", SpiceConfig.DEFAULT_FLOATING_NODE);
        List<String> partTypeList = config.getSettingOrDefault("spice.partTypes", List.of());
        Set<String> partTypes = partTypeList.stream()
            .map(t -> t.trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());

        List<String> lines = new ArrayList<>();
        lines.add("* " + title);
        for (Component component : netlist.sortedComponents()) {
            String type = typeLetter(component);
            List<String> tokens = new ArrayList<>();
            tokens.add(type + component.displayName());
            for (Pin pin : component.pins()) {
                tokens.add(node(pin, groundNode, floatingNode));
            }

            String value = component.value().trim();
            if (partTypes.contains(type)) {
                if (!value.isEmpty()) {
                    tokens.add(value);
                }
            } else {
                String written = NORMALIZED_TYPES.contains(type) ? SpiceValueNormalizer.normalize(value) : value;
                if (!written.isEmpty()) {
                    tokens.add(written);
                }
            }
            lines.add(String.join(" ", tokens));
        }
        lines.add(END);

        log.debug("Formatted {} SPICE element lines", netlist.components().size());
        return String.join("\n", lines);
    }

    private static String typeLetter(Component component) {
        String spiceType = component.spiceType().trim();
        if (!spiceType.isEmpty()) {
            return spiceType.toLowerCase(Locale.ROOT);
        }
        String kind = component.kind().trim();
        return kind.isEmpty() ? "x" : kind.substring(0, 1).toLowerCase(Locale.ROOT);
    }

    private static String node(Pin pin, String groundNode, String floatingNode) {
        if (pin.isOpen()) {
            return floatingNode;
        }
        return ComponentTemplate.isGroundName(pin.net()) ? groundNode : pin.net();
    }
}
