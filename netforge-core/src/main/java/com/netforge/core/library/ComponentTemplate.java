package com.netforge.core.library;

import com.fasterxml.jackson.databind.JsonNode;
import com.netforge.core.model.ComponentRole;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Definition of a component kind: how it is named, which ports it has and
 * what it contributes to a netlist.
 *
 * @param kind unique template key
 * @param displayName human-readable name
 * @param prefix refdes prefix ("R", "C", "U")
 * @param spiceType SPICE element letter, empty when the kind has none
 * @param role part, net label or chip
 * @param netName fixed net name for net labels (e.g. "GND"), empty otherwise
 * @param defaultValue value given to placed instances that have none
 * @param category library category
 * @param ports declared ports, never empty
 * @param chip default nested schematic for chip kinds, or null
 */
public record ComponentTemplate(
    String kind,
    String displayName,
    String prefix,
    String spiceType,
    ComponentRole role,
    String netName,
    String defaultValue,
    String category,
    List<PortTemplate> ports,
    JsonNode chip
) {
    /** Names that identify the ground node. */
    public static final Set<String> GROUND_NAMES = Set.of("GND", "GROUND", "0");

    /** Two-terminal port pair used when a template declares no ports. */
    public static final List<PortTemplate> DEFAULT_PORTS = List.of(
        new PortTemplate("A", -50.0, 0.0),
        new PortTemplate("B", 50.0, 0.0)
    );

    /**
     * Compact constructor with validation and defaults.
     */
    public ComponentTemplate {
        Objects.requireNonNull(kind, "kind must not be null");
        if (displayName == null || displayName.isBlank()) {
            displayName = kind;
        }
        if (prefix == null || prefix.isBlank()) {
            prefix = defaultPrefix(kind);
        }
        if (spiceType == null) {
            spiceType = "";
        }
        if (role == null) {
            role = ComponentRole.PART;
        }
        if (netName == null) {
            netName = "";
        }
        if (defaultValue == null) {
            defaultValue = "";
        }
        if (category == null || category.isBlank()) {
            category = "General";
        }
        ports = ports == null || ports.isEmpty() ? DEFAULT_PORTS : List.copyOf(ports);
    }

    /**
     * Prefix used for kinds without a declared one: the first character
     * upper-cased, or "X" for an empty kind.
     *
     * @param kind component kind
     * @return derived prefix
     */
    public static String defaultPrefix(String kind) {
        String trimmed = kind == null ? "" : kind.trim();
        return trimmed.isEmpty() ? "X" : trimmed.substring(0, 1).toUpperCase(Locale.ROOT);
    }

    /**
     * Returns whether a net name designates ground.
     *
     * @param name net or label name
     * @return true for GND, GROUND or 0 in any case
     */
    public static boolean isGroundName(String name) {
        return name != null && GROUND_NAMES.contains(name.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Returns whether instances of this template tie their net to ground.
     *
     * @return true for ground labels
     */
    public boolean isGround() {
        if (role != ComponentRole.NET_LABEL) {
            return false;
        }
        if (isGroundName(netName)) {
            return true;
        }
        return isGroundKind(kind);
    }

    /**
     * Returns whether a kind string names a ground symbol.
     *
     * @param kind component kind
     * @return true when the kind starts with "gnd" or "ground"
     */
    public static boolean isGroundKind(String kind) {
        String lower = kind == null ? "" : kind.trim().toLowerCase(Locale.ROOT);
        return lower.startsWith("gnd") || lower.startsWith("ground");
    }

    /**
     * Returns the default nested schematic of a chip kind.
     *
     * @return payload, if the template carries one
     */
    public Optional<JsonNode> chipPayload() {
        return chip == null || chip.isNull() || chip.isMissingNode() ? Optional.empty() : Optional.of(chip);
    }
}
