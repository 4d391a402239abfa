package com.netforge.core.formatter.impl;

import com.netforge.core.formatter.FormatterConfig;
import com.netforge.core.formatter.NetlistFormatter;
import com.netforge.core.model.Component;
import com.netforge.core.model.Netlist;
import com.netforge.core.model.Pin;

import java.util.Objects;

/**
 * Keyword-delimited netlist meant for ad hoc tooling.
 *
 * <pre>
 * BEGIN NETLIST
 * COMPONENT R1 Resistor 1k
 *   PIN A 1
 *   PIN B 0
 * END NETLIST
 * </pre>
 */
public class FreeformFormatter implements NetlistFormatter {

    private static final String BEGIN = "BEGIN NETLIST";
    private static final String END = "END NETLIST";

    @Override
    public String getId() {
        return "freeform";
    }

    @Override
    public String getDisplayName() {
        return "Freeform Netlist";
    }

    @Override
    public String getFileExtension() {
        return "txt";
    }

    @Override
    public String format(Netlist netlist, FormatterConfig config) {
        Objects.requireNonNull(netlist, "netlist must not be null");
        Objects.requireNonNull(config, "config must not be null");

        StringBuilder sb = new StringBuilder(BEGIN).append('\n');
        for (Component component : netlist.sortedComponents()) {
            sb.append("COMPONENT ").append(component.displayName()).append(' ').append(component.kind());
            if (!component.value().isEmpty()) {
                sb.append(' ').append(component.value());
            }
            sb.append('\n');
            for (Pin pin : component.pins()) {
                sb.append("  PIN ").append(pin.name()).append(' ').append(pin.net()).append('\n');
            }
        }
        return sb.append(END).toString();
    }
}
