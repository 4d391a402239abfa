package com.netforge.core.schematic;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * On-disk shape of a saved schematic, as written by the editor.
 *
 * <p>Wire endpoints reference ports as {@code [componentIndex, portName]}; free
 * endpoints use {@code a_point}/{@code b_point}. The optional {@code nets}
 * array carries nets already computed by the editor.
 *
 * @param components placed components
 * @param wires wires
 * @param nets editor-computed nets, null when absent
 * @param settings scene settings (junctions, net name overrides)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SchematicDocument(
    @JsonProperty("components") List<ComponentEntry> components,
    @JsonProperty("wires") List<WireEntry> wires,
    @JsonProperty("nets") List<NetEntry> nets,
    @JsonProperty("settings") SettingsEntry settings
) {

    /**
     * A placed component.
     *
     * @param kind template kind
     * @param refdes reference designator
     * @param value value text
     * @param pos origin as {@code [x, y]}
     * @param rotation rotation in degrees, clockwise on screen
     * @param mirror mirror factors {@code mx}/{@code my}
     * @param ports explicit absolute port positions, overriding the template
     * @param chip nested schematic of a chip instance
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ComponentEntry(
        @JsonProperty("kind") String kind,
        @JsonProperty("refdes") String refdes,
        @JsonProperty("value") String value,
        @JsonProperty("pos") List<Double> pos,
        @JsonProperty("rotation") Double rotation,
        @JsonProperty("mirror") MirrorEntry mirror,
        @JsonProperty("ports") List<PointEntry> ports,
        @JsonProperty("chip") JsonNode chip
    ) {}

    /**
     * Mirror factors, each 1 or -1.
     *
     * @param mx horizontal factor
     * @param my vertical factor
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MirrorEntry(
        @JsonProperty("mx") Double mx,
        @JsonProperty("my") Double my
    ) {}

    /**
     * A named or anonymous coordinate.
     *
     * @param name port name, null for plain points
     * @param x horizontal coordinate
     * @param y vertical coordinate
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PointEntry(
        @JsonProperty("name") String name,
        @JsonProperty("x") Double x,
        @JsonProperty("y") Double y
    ) {}

    /**
     * A wire.
     *
     * @param a start port reference {@code [componentIndex, portName]}
     * @param b end port reference
     * @param aPoint free start point
     * @param bPoint free end point
     * @param points waypoints between the endpoints
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WireEntry(
        @JsonProperty("a") JsonNode a,
        @JsonProperty("b") JsonNode b,
        @JsonProperty("a_point") PointEntry aPoint,
        @JsonProperty("b_point") PointEntry bPoint,
        @JsonProperty("points") List<PointEntry> points
    ) {}

    /**
     * An editor-computed net.
     *
     * @param name net name
     * @param connections member pins
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NetEntry(
        @JsonProperty("name") String name,
        @JsonProperty("connections") List<ConnectionEntry> connections
    ) {}

    /**
     * A pin on an editor-computed net.
     *
     * @param refdes component refdes
     * @param kind component kind
     * @param port port name
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ConnectionEntry(
        @JsonProperty("refdes") String refdes,
        @JsonProperty("kind") String kind,
        @JsonProperty("port") String port
    ) {}

    /**
     * Scene settings relevant to connectivity.
     *
     * @param wireJunctions explicit junction points
     * @param netNames manual net names
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SettingsEntry(
        @JsonProperty("wire_junctions") List<PointEntry> wireJunctions,
        @JsonProperty("net_names") List<NetNameEntry> netNames
    ) {}

    /**
     * A manual net name keyed by the net's smallest point.
     *
     * @param key point as {@code [x, y]}
     * @param name assigned name
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NetNameEntry(
        @JsonProperty("key") List<Double> key,
        @JsonProperty("name") String name
    ) {}
}
