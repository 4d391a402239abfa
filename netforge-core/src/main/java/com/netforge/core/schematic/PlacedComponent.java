package com.netforge.core.schematic;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable {@link SchematicComponent} read from a snapshot.
 *
 * @param refdes reference designator
 * @param kind template kind
 * @param value value text
 * @param ports ports with absolute positions
 * @param chip embedded nested schematic, or null
 */
public record PlacedComponent(
    String refdes,
    String kind,
    String value,
    List<Port> ports,
    JsonNode chip
) implements SchematicComponent {

    /**
     * Compact constructor with validation.
     */
    public PlacedComponent {
        refdes = refdes == null ? "" : refdes.trim();
        Objects.requireNonNull(kind, "kind must not be null");
        if (value == null) {
            value = "";
        }
        ports = ports == null ? List.of() : List.copyOf(ports);
    }

    @Override
    public Optional<JsonNode> chipPayload() {
        if (chip == null || chip.isNull() || chip.isMissingNode()) {
            return Optional.empty();
        }
        if (chip.isObject() && chip.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(chip);
    }
}
