package com.netforge.core.builder;

import com.netforge.core.builder.ValidationIssue.Severity;
import com.netforge.core.model.Component;
import com.netforge.core.model.Connection;
import com.netforge.core.model.Net;
import com.netforge.core.model.Netlist;
import com.netforge.core.model.Pin;
import com.netforge.core.model.PinKey;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Checks the structural guarantees of a {@link Netlist}.
 *
 * <p>Errors:
 * <ul>
 *   <li>{@code DUPLICATE_NET}: two nets share a name</li>
 *   <li>{@code DUPLICATE_REFDES}: two components share a designator</li>
 *   <li>{@code UNKNOWN_PIN}: a net lists a pin no component has</li>
 *   <li>{@code NET_MISMATCH}: a net lists a pin whose component places it on another net</li>
 *   <li>{@code MISSING_CONNECTION}: a pin names a net that does not list it</li>
 * </ul>
 * Warnings:
 * <ul>
 *   <li>{@code SINGLE_PIN_NET}: a net joins only one pin</li>
 *   <li>{@code UNCONNECTED}: a component has no connected pin</li>
 * </ul>
 */
public class NetlistValidator {

    /**
     * Validates a netlist.
     *
     * @param netlist netlist to check
     * @return issues found, errors first, empty when the netlist is sound
     */
    public List<ValidationIssue> validate(Netlist netlist) {
        Objects.requireNonNull(netlist, "netlist must not be null");
        List<ValidationIssue> errors = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();

        Set<String> netNames = new HashSet<>();
        Map<PinKey, Set<String>> listed = new HashMap<>();
        for (Net net : netlist.nets()) {
            if (!netNames.add(net.name())) {
                errors.add(new ValidationIssue(Severity.ERROR, "DUPLICATE_NET", net.name(),
                    "Net name used more than once: " + net.name()));
            }
            for (Connection connection : net.connections()) {
                listed.computeIfAbsent(connection.key(), k -> new HashSet<>()).add(net.name());
            }
            if (net.connections().size() == 1) {
                Connection only = net.connections().get(0);
                warnings.add(new ValidationIssue(Severity.WARNING, "SINGLE_PIN_NET", net.name(),
                    "Net " + net.name() + " only joins " + only.displayRefdes() + "." + only.portName()));
            }
        }

        // unnamed components share keys, so a key can sit on several nets
        Map<PinKey, Set<String>> pinNets = new HashMap<>();
        Set<String> refdes = new HashSet<>();
        for (Component component : netlist.components()) {
            if (!component.refdes().isEmpty() && !refdes.add(component.refdes())) {
                errors.add(new ValidationIssue(Severity.ERROR, "DUPLICATE_REFDES", component.refdes(),
                    "Designator used more than once: " + component.refdes()));
            }
            boolean connected = false;
            for (Pin pin : component.pins()) {
                PinKey key = new PinKey(component.refdes(), pin.name());
                pinNets.computeIfAbsent(key, k -> new HashSet<>()).add(pin.net());
                if (pin.isOpen()) {
                    continue;
                }
                connected = true;
                if (!listed.getOrDefault(key, Set.of()).contains(pin.net())) {
                    errors.add(new ValidationIssue(Severity.ERROR, "MISSING_CONNECTION", pinName(key),
                        "Pin " + pinName(key) + " is on net " + pin.net() + " but the net does not list it"));
                }
            }
            if (!connected && !component.pins().isEmpty()) {
                warnings.add(new ValidationIssue(Severity.WARNING, "UNCONNECTED", component.displayName(),
                    "Component " + component.displayName() + " has no connected pins"));
            }
        }

        for (Net net : netlist.nets()) {
            for (Connection connection : net.connections()) {
                Set<String> onNets = pinNets.get(connection.key());
                if (onNets == null) {
                    errors.add(new ValidationIssue(Severity.ERROR, "UNKNOWN_PIN", pinName(connection.key()),
                        "Net " + net.name() + " lists unknown pin " + pinName(connection.key())));
                } else if (!onNets.contains(net.name())) {
                    errors.add(new ValidationIssue(Severity.ERROR, "NET_MISMATCH", pinName(connection.key()),
                        "Net " + net.name() + " lists pin " + pinName(connection.key()) + " which is on "
                            + String.join(", ", new TreeSet<>(onNets))));
                }
            }
        }

        List<ValidationIssue> issues = new ArrayList<>(errors);
        issues.addAll(warnings);
        return issues;
    }

    private static String pinName(PinKey key) {
        return key.refdes() + "." + key.portName();
    }
}
