package com.netforge.core.library;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * On-disk shape of a component library file.
 *
 * <p><b>Example JSON:</b>
 * <pre>{@code
 * {
 *   "components": [
 *     {"kind": "Resistor", "prefix": "R", "spice_type": "R",
 *      "ports": [{"name": "A", "x": -50, "y": 0}, {"name": "B", "x": 50, "y": 0}]},
 *     {"kind": "Ground", "comp_type": "net", "net_name": "GND",
 *      "ports": [{"name": "A", "x": 0, "y": 0}]}
 *   ]
 * }
 * }</pre>
 *
 * @param components template entries
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LibraryDocument(
    @JsonProperty("components") List<TemplateEntry> components
) {
    /**
     * One template entry.
     *
     * @param kind template key
     * @param displayName display name
     * @param prefix refdes prefix
     * @param spiceType SPICE element letter
     * @param compType "component" or "net"
     * @param isChip hierarchical chip flag
     * @param netName fixed net name for labels
     * @param defaultValue default instance value
     * @param category library category
     * @param ports declared ports
     * @param chip default nested schematic for chips
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TemplateEntry(
        @JsonProperty("kind") String kind,
        @JsonProperty("display_name") String displayName,
        @JsonProperty("prefix") String prefix,
        @JsonProperty("spice_type") String spiceType,
        @JsonProperty("comp_type") String compType,
        @JsonProperty("is_chip") Boolean isChip,
        @JsonProperty("net_name") String netName,
        @JsonProperty("default_value") String defaultValue,
        @JsonProperty("category") String category,
        @JsonProperty("ports") List<PortEntry> ports,
        @JsonProperty("chip") JsonNode chip
    ) {}

    /**
     * One declared port.
     *
     * @param name port name
     * @param x horizontal offset
     * @param y vertical offset
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PortEntry(
        @JsonProperty("name") String name,
        @JsonProperty("x") Double x,
        @JsonProperty("y") Double y
    ) {}
}
