package com.netforge.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SPICE formatter settings.
 *
 * @param title text of the leading comment line
 * @param groundNode token written for ground nodes
 * @param floatingNode token written for unconnected pins
 * @param partTypes SPICE type letters whose value is written in the part slot
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SpiceConfig(
    @JsonProperty("title") String title,
    @JsonProperty("groundNode") String groundNode,
    @JsonProperty("floatingNode") String floatingNode,
    @JsonProperty("partTypes") List<String> partTypes
) {
    public static final String DEFAULT_TITLE = "NetForge Netlist";
    public static final String DEFAULT_GROUND_NODE = "0";
    public static final String DEFAULT_FLOATING_NODE = "NC";

    public static SpiceConfig defaults() {
        return new SpiceConfig(DEFAULT_TITLE, DEFAULT_GROUND_NODE, DEFAULT_FLOATING_NODE, List.of());
    }

    /**
     * Converts these settings into formatter custom settings, leaving out
     * anything not configured.
     *
     * @return settings keyed as the SPICE formatter expects
     */
    public Map<String, Object> toSettings() {
        Map<String, Object> settings = new LinkedHashMap<>();
        if (title != null) {
            settings.put("spice.title", title);
        }
        if (groundNode != null && !groundNode.isBlank()) {
            settings.put("spice.groundNode", groundNode.trim());
        }
        if (floatingNode != null && !floatingNode.isBlank()) {
            settings.put("spice.floatingNode", floatingNode.trim());
        }
        if (partTypes != null && !partTypes.isEmpty()) {
            settings.put("spice.partTypes", List.copyOf(partTypes));
        }
        return settings;
    }
}
