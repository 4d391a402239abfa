package com.netforge.cli;

import com.netforge.core.config.ExportConfig;
import com.netforge.core.model.Net;
import com.netforge.core.model.Netlist;
import picocli.CommandLine.Command;

import java.util.stream.Collectors;

/**
 * Command to print a summary of the nets of a schematic.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * netforge nets amplifier.json
 * }</pre>
 */
@Command(
    name = "nets",
    description = "Print the nets of a schematic",
    mixinStandardHelpOptions = true
)
public class NetsCommand extends SchematicCommand {

    @Override
    protected int run(Netlist netlist, ExportConfig config) {
        System.out.printf("Nets: %d  Components: %d%n", netlist.nets().size(), netlist.components().size());
        System.out.println();

        if (netlist.nets().isEmpty()) {
            System.out.println("  No nets found.");
            return 0;
        }

        int width = netlist.nets().stream().mapToInt(n -> n.name().length()).max().orElse(4);
        for (Net net : netlist.nets()) {
            String pins = net.sortedConnections().stream()
                .map(c -> c.displayRefdes() + "." + c.portName())
                .collect(Collectors.joining(", "));
            System.out.printf("  %-" + width + "s  %3d  %s%n", net.name(), net.connections().size(), pins);
        }
        return 0;
    }

    @Override
    protected String commandName() {
        return "Nets";
    }
}
