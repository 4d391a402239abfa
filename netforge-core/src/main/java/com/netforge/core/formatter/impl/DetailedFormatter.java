package com.netforge.core.formatter.impl;

import com.netforge.core.formatter.FormatterConfig;
import com.netforge.core.formatter.NetlistFormatter;
import com.netforge.core.model.Component;
import com.netforge.core.model.Netlist;
import com.netforge.core.model.Pin;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Component-oriented listing with the net of every pin.
 *
 * <pre>
 * R1: Resistor 1k
 *   A -&gt; OPEN
 *   B -&gt; 1
 * </pre>
 */
public class DetailedFormatter implements NetlistFormatter {

    @Override
    public String getId() {
        return "detailed";
    }

    @Override
    public String getDisplayName() {
        return "Detailed Pin Listing";
    }

    @Override
    public String getFileExtension() {
        return "txt";
    }

    @Override
    public String format(Netlist netlist, FormatterConfig config) {
        Objects.requireNonNull(netlist, "netlist must not be null");
        Objects.requireNonNull(config, "config must not be null");

        List<String> lines = new ArrayList<>();
        for (Component component : netlist.sortedComponents()) {
            String value = component.value().isEmpty() ? "" : " " + component.value();
            lines.add(component.displayName() + ": " + component.kind() + value);
            for (Pin pin : component.pins()) {
                lines.add("  " + pin.name() + " -> " + pin.net());
            }
        }
        return String.join("\n", lines);
    }
}
