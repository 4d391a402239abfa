package com.netforge.core.formatter.impl;

import com.netforge.core.formatter.FormatterConfig;
import com.netforge.core.formatter.NetlistFormatter;
import com.netforge.core.model.Component;
import com.netforge.core.model.Net;
import com.netforge.core.model.Netlist;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Plain two-section netlist.
 *
 * <pre>
 * [Components]
 * R1: Resistor 1k
 * R2: Resistor 2k
 *
 * [Nets]
 * 1: R1.B, R2.A
 * </pre>
 */
public class SimpleFormatter implements NetlistFormatter {

    @Override
    public String getId() {
        return "simple";
    }

    @Override
    public String getDisplayName() {
        return "Simple Netlist";
    }

    @Override
    public String getFileExtension() {
        return "net";
    }

    @Override
    public String format(Netlist netlist, FormatterConfig config) {
        Objects.requireNonNull(netlist, "netlist must not be null");
        Objects.requireNonNull(config, "config must not be null");

        List<String> lines = new ArrayList<>();
        lines.add("[Components]");
        for (Component component : netlist.sortedComponents()) {
            String value = component.value().isEmpty() ? "" : " " + component.value();
            lines.add(component.displayName() + ": " + component.kind() + value);
        }

        lines.add("");
        lines.add("[Nets]");
        for (Net net : netlist.nets()) {
            String pins = net.sortedConnections().stream()
                .map(c -> c.displayRefdes() + "." + c.portName())
                .collect(Collectors.joining(", "));
            lines.add(net.name() + ": " + pins);
        }
        return String.join("\n", lines);
    }
}
