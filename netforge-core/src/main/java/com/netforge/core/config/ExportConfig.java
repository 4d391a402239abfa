package com.netforge.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root configuration for netlist export.
 *
 * <p>Loaded from {@code netforge.yaml}. Every section is optional; the
 * {@code *OrDefault()} accessors substitute the default section when a file
 * leaves one out.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * library:
 *   paths:
 *     - "./components/custom.json"
 *
 * netlist:
 *   resolveLabels: false
 *
 * flatten:
 *   enabled: true
 *   recursive: true
 *   maxDepth: 8
 *
 * formatter:
 *   default: spice
 *
 * spice:
 *   title: "NetForge Netlist"
 *   groundNode: "0"
 *   floatingNode: "NC"
 *
 * output:
 *   directory: "./build/netlist"
 *   renderer: filesystem
 * }</pre>
 *
 * @param library component library settings
 * @param netlist net resolution settings
 * @param flatten chip flattening settings
 * @param formatter formatter selection
 * @param spice SPICE formatter settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExportConfig(
    @JsonProperty("library") LibraryConfig library,
    @JsonProperty("netlist") NetlistConfig netlist,
    @JsonProperty("flatten") FlattenConfig flatten,
    @JsonProperty("formatter") FormatterSelection formatter,
    @JsonProperty("spice") SpiceConfig spice,
    @JsonProperty("output") OutputConfig output
) {
    /**
     * Creates the default configuration: bundled library only, fallback net
     * naming, recursive flattening up to depth 8, SPICE output to the console.
     *
     * @return default configuration
     */
    public static ExportConfig defaults() {
        return new ExportConfig(
            new LibraryConfig(List.of()),
            new NetlistConfig(false),
            FlattenConfig.defaults(),
            new FormatterSelection("spice"),
            SpiceConfig.defaults(),
            new OutputConfig("./build/netlist", "console")
        );
    }

    public LibraryConfig libraryOrDefault() {
        return library != null ? library : defaults().library();
    }

    public NetlistConfig netlistOrDefault() {
        return netlist != null ? netlist : defaults().netlist();
    }

    public FlattenConfig flattenOrDefault() {
        return flatten != null ? flatten : FlattenConfig.defaults();
    }

    public FormatterSelection formatterOrDefault() {
        return formatter != null ? formatter : defaults().formatter();
    }

    public SpiceConfig spiceOrDefault() {
        return spice != null ? spice : SpiceConfig.defaults();
    }

    public OutputConfig outputOrDefault() {
        return output != null ? output : defaults().output();
    }

    /**
     * Component library settings.
     *
     * @param paths user library files layered over the bundled one
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LibraryConfig(
        @JsonProperty("paths") List<String> paths
    ) {
        public LibraryConfig {
            paths = paths == null ? List.of() : List.copyOf(paths);
        }
    }

    /**
     * Net resolution settings.
     *
     * @param resolveLabels name geometry-only nets after the net labels they
     *                      touch instead of sequential numbers
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NetlistConfig(
        @JsonProperty("resolveLabels") Boolean resolveLabels
    ) {
        public boolean isResolveLabels() {
            return Boolean.TRUE.equals(resolveLabels);
        }
    }

    /**
     * Formatter selection.
     *
     * @param defaultFormatter formatter id used when none is requested
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FormatterSelection(
        @JsonProperty("default") String defaultFormatter
    ) {}

    /**
     * Output settings.
     *
     * @param directory target directory for the filesystem renderer
     * @param renderer renderer id ("console" or "filesystem")
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("renderer") String renderer
    ) {}
}
