package com.netforge.core.builder;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netforge.core.config.FlattenConfig;
import com.netforge.core.library.ComponentLibrary;
import com.netforge.core.library.ComponentTemplate;
import com.netforge.core.library.PortTemplate;
import com.netforge.core.model.Component;
import com.netforge.core.model.ComponentRole;
import com.netforge.core.model.Net;
import com.netforge.core.model.Netlist;
import com.netforge.core.model.Pin;
import com.netforge.core.schematic.SchematicReader;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for chip flattening through {@link NetlistBuilder#build}.
 */
class ChipFlattenerTest extends BuilderTestBase {

    /** Two resistors in series between labels "1" and "2", with editor nets. */
    private static final String DIVIDER_PAYLOAD = """
        {
          "components": [
            {"kind": "NetLabel", "refdes": "NL1", "value": "1", "ports": [{"name": "A", "x": 0, "y": 0}]},
            {"kind": "NetLabel", "refdes": "NL2", "value": "2", "ports": [{"name": "A", "x": 300, "y": 0}]},
            {"kind": "Resistor", "refdes": "R1", "value": "1k",
             "ports": [{"name": "A", "x": 0, "y": 0}, {"name": "B", "x": 100, "y": 0}]},
            {"kind": "Resistor", "refdes": "R2", "value": "2k",
             "ports": [{"name": "A", "x": 200, "y": 0}, {"name": "B", "x": 300, "y": 0}]}
          ],
          "nets": [
            {"name": "IN", "connections": [{"refdes": "NL1", "port": "A"}, {"refdes": "R1", "port": "A"}]},
            {"name": "MID", "connections": [{"refdes": "R1", "port": "B"}, {"refdes": "R2", "port": "A"}]},
            {"name": "OUT", "connections": [{"refdes": "R2", "port": "B"}, {"refdes": "NL2", "port": "A"}]}
          ]
        }
        """;

    /** Same divider drawn as geometry only, labels without designators. */
    private static final String GEOMETRY_PAYLOAD = """
        {
          "components": [
            {"kind": "NetLabel", "value": "1", "ports": [{"name": "A", "x": 0, "y": 0}]},
            {"kind": "Resistor", "refdes": "R1", "value": "1k",
             "ports": [{"name": "A", "x": 0, "y": 0}, {"name": "B", "x": 100, "y": 0}]},
            {"kind": "Resistor", "refdes": "R2", "value": "2k",
             "ports": [{"name": "A", "x": 100, "y": 0}, {"name": "B", "x": 200, "y": 0}]},
            {"kind": "NetLabel", "value": "2", "ports": [{"name": "A", "x": 200, "y": 0}]}
          ]
        }
        """;

    @Test
    void build_chipWithNetData_replacedByItsParts() {
        Netlist netlist = new NetlistBuilder(library).build(read(topLevel("Chip2", DIVIDER_PAYLOAD)));

        assertThat(netlist.findComponent("U1")).isEmpty();
        assertThat(netlist.sortedComponents()).extracting(Component::refdes).containsExactly("R1", "R2", "V1");
        assertThat(netlist.nets()).extracting(Net::name).containsExactly("N1", "N2", "U1_MID");
        assertThat(netlist.findNet("N1").orElseThrow().connections())
            .containsExactly(pin("V1", "VSource", "P"), pin("R1", "Resistor", "A"));
        assertThat(netlist.findNet("N2").orElseThrow().connections())
            .containsExactly(pin("V1", "VSource", "N"), pin("R2", "Resistor", "B"));
        assertThat(netlist.findNet("U1_MID").orElseThrow().connections())
            .containsExactly(pin("R1", "Resistor", "B"), pin("R2", "Resistor", "A"));
        assertThat(netlist.findComponent("R2").orElseThrow().value()).isEqualTo("2k");
    }

    @Test
    void build_chipWithGeometryOnly_resolvesInternalNets() {
        Netlist netlist = new NetlistBuilder(library).build(read(topLevel("Chip2", GEOMETRY_PAYLOAD)));

        assertThat(netlist.findComponent("R1").orElseThrow().pins())
            .containsExactly(new Pin("A", "N1"), new Pin("B", "U1_N1"));
        assertThat(netlist.findComponent("R2").orElseThrow().pins())
            .containsExactly(new Pin("A", "U1_N1"), new Pin("B", "N2"));
        assertThat(netlist.components()).extracting(Component::kind).doesNotContain("NetLabel");
    }

    @Test
    void build_nestedChips_flattenedRecursively() {
        Netlist netlist = new NetlistBuilder(library).build(read(topLevel("Chip4", nestingPayload(DIVIDER_PAYLOAD))));

        assertThat(netlist.sortedComponents()).extracting(Component::refdes).containsExactly("R1", "R2", "V1");
        assertThat(netlist.findComponent("R1").orElseThrow().pins())
            .containsExactly(new Pin("A", "N1"), new Pin("B", "U1_U1_MID"));
        assertThat(netlist.findComponent("R2").orElseThrow().pins())
            .containsExactly(new Pin("A", "U1_U1_MID"), new Pin("B", "N2"));
    }

    @Test
    void build_singleLevel_leavesNestedChipsOut() {
        NetlistBuilder builder = new NetlistBuilder(library, NetNamer.defaults(), FlattenConfig.singleLevel(), false);

        Netlist netlist = builder.build(read(topLevel("Chip4", nestingPayload(DIVIDER_PAYLOAD))));

        assertThat(netlist.components()).extracting(Component::refdes).containsExactly("V1");
        assertThat(netlist.findNet("N1").orElseThrow().connections()).containsExactly(pin("V1", "VSource", "P"));
    }

    @Test
    void build_flatteningDisabled_keepsOnlyTopLevelParts() {
        NetlistBuilder builder = new NetlistBuilder(library, NetNamer.defaults(), FlattenConfig.disabled(), false);

        Netlist netlist = builder.build(read(topLevel("Chip2", DIVIDER_PAYLOAD)));

        assertThat(netlist.components()).extracting(Component::refdes).containsExactly("V1");
    }

    @Test
    void build_inlineChipNestedInItsOwnKind_bothExpanded() {
        String outer = """
            {
              "components": [
                {"kind": "NetLabel", "refdes": "NL1", "value": "1", "ports": [{"name": "A", "x": 0, "y": 0}]},
                {"kind": "NetLabel", "refdes": "NL2", "value": "2", "ports": [{"name": "A", "x": 100, "y": 0}]},
                {"kind": "Resistor", "refdes": "R1", "value": "10k",
                 "ports": [{"name": "A", "x": 0, "y": 0}, {"name": "B", "x": 100, "y": 0}]},
                {"kind": "Chip2", "refdes": "U2", "chip": %s}
              ],
              "nets": [
                {"name": "IN", "connections": [{"refdes": "NL1", "port": "A"}, {"refdes": "R1", "port": "A"},
                                              {"refdes": "U2", "port": "1"}]},
                {"name": "OUT", "connections": [{"refdes": "NL2", "port": "A"}, {"refdes": "R1", "port": "B"},
                                               {"refdes": "U2", "port": "2"}]}
              ]
            }
            """.formatted(DIVIDER_PAYLOAD);

        Netlist netlist = new NetlistBuilder(library).build(read(topLevel("Chip2", outer)));

        assertThat(netlist.sortedComponents()).extracting(Component::refdes).containsExactly("R1", "R2", "R3", "V1");
        assertThat(netlist.findComponent("R1").orElseThrow().value()).isEqualTo("10k");
        assertThat(netlist.findComponent("R2").orElseThrow().pins())
            .containsExactly(new Pin("A", "N1"), new Pin("B", "U1_U2_MID"));
        assertThat(netlist.findComponent("R3").orElseThrow().pins())
            .containsExactly(new Pin("A", "U1_U2_MID"), new Pin("B", "N2"));
    }

    @Test
    void build_templatePayloadContainingItsOwnKind_innerCopySkipped() throws Exception {
        JsonNode payload = new ObjectMapper().readTree("""
            {
              "components": [
                {"kind": "NetLabel", "refdes": "NL1", "value": "1", "ports": [{"name": "A", "x": 0, "y": 0}]},
                {"kind": "NetLabel", "refdes": "NL2", "value": "2", "ports": [{"name": "A", "x": 100, "y": 0}]},
                {"kind": "Resistor", "refdes": "R1", "value": "10k",
                 "ports": [{"name": "A", "x": 0, "y": 0}, {"name": "B", "x": 100, "y": 0}]},
                {"kind": "Loop", "refdes": "U1", "pos": [300, 0]}
              ],
              "nets": [
                {"name": "IN", "connections": [{"refdes": "NL1", "port": "A"}, {"refdes": "R1", "port": "A"},
                                              {"refdes": "U1", "port": "1"}]},
                {"name": "OUT", "connections": [{"refdes": "NL2", "port": "A"}, {"refdes": "R1", "port": "B"},
                                               {"refdes": "U1", "port": "2"}]}
              ]
            }
            """);
        ComponentLibrary custom = withChipTemplate("Loop", payload);
        String json = """
            {
              "components": [
                {"kind": "VSource", "refdes": "V1", "ports": [{"name": "P", "x": 0, "y": 0}, {"name": "N", "x": 0, "y": 100}]},
                {"kind": "Loop", "refdes": "U7", "pos": [100, 50]}
              ],
              "nets": [
                {"name": "IN", "connections": [{"refdes": "V1", "port": "P"}, {"refdes": "U7", "port": "1"}]},
                {"name": "GND", "connections": [{"refdes": "V1", "port": "N"}, {"refdes": "U7", "port": "2"}]}
              ]
            }
            """;

        Netlist netlist = new NetlistBuilder(custom).build(new SchematicReader(custom).readString(json));

        assertThat(netlist.sortedComponents()).extracting(Component::refdes).containsExactly("R1", "V1");
        assertThat(netlist.findComponent("R1").orElseThrow().pins())
            .containsExactly(new Pin("A", "IN"), new Pin("B", "GND"));
    }

    @Test
    void build_chipGroundLabel_joinsTopLevelGroundNet() {
        String payload = """
            {
              "components": [
                {"kind": "NetLabel", "refdes": "NL1", "value": "1", "ports": [{"name": "A", "x": 0, "y": 0}]},
                {"kind": "Resistor", "refdes": "R1", "value": "1k",
                 "ports": [{"name": "A", "x": 0, "y": 0}, {"name": "B", "x": 100, "y": 0}]},
                {"kind": "Ground", "refdes": "GND1", "ports": [{"name": "A", "x": 100, "y": 0}]}
              ],
              "nets": [
                {"name": "A", "connections": [{"refdes": "NL1", "port": "A"}, {"refdes": "R1", "port": "A"}]},
                {"name": "B", "connections": [{"refdes": "R1", "port": "B"}, {"refdes": "GND1", "port": "A"}]}
              ]
            }
            """;
        String json = """
            {
              "components": [
                {"kind": "VSource", "refdes": "V1", "ports": [{"name": "P", "x": 0, "y": 0}, {"name": "N", "x": 0, "y": 100}]},
                {"kind": "Chip2", "refdes": "U1", "chip": %s,
                 "ports": [{"name": "1", "x": 100, "y": 0}, {"name": "2", "x": 100, "y": 100}]}
              ],
              "nets": [
                {"name": "IN", "connections": [{"refdes": "V1", "port": "P"}, {"refdes": "U1", "port": "1"}]},
                {"name": "GND", "connections": [{"refdes": "V1", "port": "N"}]}
              ]
            }
            """.formatted(payload);

        Netlist netlist = new NetlistBuilder(library).build(read(json));

        assertThat(netlist.nets()).extracting(Net::name).containsExactly("IN", "GND");
        assertThat(netlist.findNet("0")).isEmpty();
        assertThat(netlist.findNet("GND").orElseThrow().connections())
            .containsExactly(pin("V1", "VSource", "N"), pin("R1", "Resistor", "B"));
    }

    @Test
    void build_chipGroundLabelWithoutTopLevelGround_usesNetZero() {
        String payload = """
            {
              "components": [
                {"kind": "NetLabel", "refdes": "NL1", "value": "1", "ports": [{"name": "A", "x": 0, "y": 0}]},
                {"kind": "Resistor", "refdes": "R1", "value": "1k",
                 "ports": [{"name": "A", "x": 0, "y": 0}, {"name": "B", "x": 100, "y": 0}]},
                {"kind": "Ground", "refdes": "GND1", "ports": [{"name": "A", "x": 100, "y": 0}]}
              ],
              "nets": [
                {"name": "A", "connections": [{"refdes": "NL1", "port": "A"}, {"refdes": "R1", "port": "A"}]},
                {"name": "B", "connections": [{"refdes": "R1", "port": "B"}, {"refdes": "GND1", "port": "A"}]}
              ]
            }
            """;

        Netlist netlist = new NetlistBuilder(library).build(read(topLevel("Chip2", payload)));

        assertThat(netlist.findComponent("R1").orElseThrow().pins())
            .containsExactly(new Pin("A", "N1"), new Pin("B", "0"));
    }

    @Test
    void build_malformedOrMissingPayload_chipSkipped() {
        String json = """
            {
              "components": [
                {"kind": "VSource", "refdes": "V1", "ports": [{"name": "P", "x": 0, "y": 0}, {"name": "N", "x": 0, "y": 100}]},
                {"kind": "Chip2", "refdes": "U1", "chip": [1, 2, 3],
                 "ports": [{"name": "1", "x": 100, "y": 0}, {"name": "2", "x": 100, "y": 100}]},
                {"kind": "Chip2", "refdes": "U2",
                 "ports": [{"name": "1", "x": 200, "y": 0}, {"name": "2", "x": 200, "y": 100}]}
              ],
              "nets": [
                {"name": "N1", "connections": [{"refdes": "V1", "port": "P"}, {"refdes": "U1", "port": "1"},
                                              {"refdes": "U2", "port": "1"}]}
              ]
            }
            """;

        Netlist netlist = new NetlistBuilder(library).build(read(json));

        assertThat(netlist.components()).extracting(Component::refdes).containsExactly("V1");
        assertThat(netlist.findNet("N1").orElseThrow().connections()).containsExactly(pin("V1", "VSource", "P"));
    }

    @Test
    void build_internalPartsGetFreshDesignators() {
        String json = """
            {
              "components": [
                {"kind": "VSource", "refdes": "V1", "ports": [{"name": "P", "x": 0, "y": 0}, {"name": "N", "x": 0, "y": 100}]},
                {"kind": "Resistor", "refdes": "R1", "ports": [{"name": "A", "x": 500, "y": 0}, {"name": "B", "x": 600, "y": 0}]},
                {"kind": "Resistor", "refdes": "R3", "ports": [{"name": "A", "x": 500, "y": 100}, {"name": "B", "x": 600, "y": 100}]},
                {"kind": "Chip2", "refdes": "U1", "chip": %s,
                 "ports": [{"name": "1", "x": 100, "y": 0}, {"name": "2", "x": 100, "y": 100}]}
              ],
              "nets": [
                {"name": "N1", "connections": [{"refdes": "V1", "port": "P"}, {"refdes": "U1", "port": "1"}]},
                {"name": "N2", "connections": [{"refdes": "V1", "port": "N"}, {"refdes": "U1", "port": "2"}]}
              ]
            }
            """.formatted(DIVIDER_PAYLOAD);

        Netlist netlist = new NetlistBuilder(library).build(read(json));

        assertThat(netlist.sortedComponents()).extracting(Component::refdes)
            .containsExactly("R1", "R2", "R3", "R4", "V1");
        assertThat(netlist.findComponent("R2").orElseThrow().value()).isEqualTo("1k");
        assertThat(netlist.findComponent("R4").orElseThrow().value()).isEqualTo("2k");
        assertThat(netlist.findComponent("R1").orElseThrow().pins()).allMatch(Pin::isOpen);
    }

    @Test
    void build_chipKindWithDefaultPayload_usesTemplateSchematic() throws Exception {
        ComponentLibrary custom = withChipTemplate("Buffer", new ObjectMapper().readTree(DIVIDER_PAYLOAD));
        String json = """
            {
              "components": [
                {"kind": "VSource", "refdes": "V1", "ports": [{"name": "P", "x": 0, "y": 0}, {"name": "N", "x": 0, "y": 100}]},
                {"kind": "Buffer", "refdes": "U7", "pos": [100, 50]}
              ],
              "nets": [
                {"name": "IN", "connections": [{"refdes": "V1", "port": "P"}, {"refdes": "U7", "port": "1"}]},
                {"name": "GND", "connections": [{"refdes": "V1", "port": "N"}, {"refdes": "U7", "port": "2"}]}
              ]
            }
            """;

        Netlist netlist = new NetlistBuilder(custom).build(new SchematicReader(custom).readString(json));

        assertThat(netlist.nets()).extracting(Net::name).containsExactly("IN", "GND", "U7_MID");
        assertThat(netlist.findComponent("R2").orElseThrow().pins())
            .containsExactly(new Pin("A", "U7_MID"), new Pin("B", "GND"));
    }

    /**
     * The default library plus a two-pin chip kind whose template carries the payload.
     */
    private ComponentLibrary withChipTemplate(String kind, JsonNode payload) {
        List<ComponentTemplate> templates = new ArrayList<>(library.sorted());
        templates.add(new ComponentTemplate(kind, kind, "U", "X", ComponentRole.CHIP, null, null,
            "Hierarchy", List.of(new PortTemplate("1", -60.0, 0.0), new PortTemplate("2", 60.0, 0.0)), payload));
        return ComponentLibrary.of(templates);
    }

    /**
     * A voltage source wired to ports 1 and 2 of a chip carrying the payload.
     */
    private static String topLevel(String chipKind, String payload) {
        return """
            {
              "components": [
                {"kind": "VSource", "refdes": "V1", "value": "5",
                 "ports": [{"name": "P", "x": 0, "y": 0}, {"name": "N", "x": 0, "y": 100}]},
                {"kind": "%s", "refdes": "U1", "chip": %s,
                 "ports": [{"name": "1", "x": 100, "y": 0}, {"name": "2", "x": 100, "y": 100}]}
              ],
              "nets": [
                {"name": "N1", "connections": [{"refdes": "V1", "port": "P"}, {"refdes": "U1", "port": "1"}]},
                {"name": "N2", "connections": [{"refdes": "V1", "port": "N"}, {"refdes": "U1", "port": "2"}]}
              ]
            }
            """.formatted(chipKind, payload);
    }

    /**
     * Wraps a payload in a two-pin chip placed inside another schematic.
     */
    private static String nestingPayload(String innerPayload) {
        return """
            {
              "components": [
                {"kind": "NetLabel", "refdes": "NL1", "value": "1", "ports": [{"name": "A", "x": 0, "y": 0}]},
                {"kind": "NetLabel", "refdes": "NL2", "value": "2", "ports": [{"name": "A", "x": 0, "y": 100}]},
                {"kind": "Chip2", "refdes": "U1", "pos": [100, 50], "chip": %s}
              ],
              "nets": [
                {"name": "A", "connections": [{"refdes": "NL1", "port": "A"}, {"refdes": "U1", "port": "1"}]},
                {"name": "B", "connections": [{"refdes": "NL2", "port": "A"}, {"refdes": "U1", "port": "2"}]}
              ]
            }
            """.formatted(innerPayload);
    }
}
