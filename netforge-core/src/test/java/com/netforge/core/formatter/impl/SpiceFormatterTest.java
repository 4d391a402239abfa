package com.netforge.core.formatter.impl;

import com.netforge.core.config.SpiceConfig;
import com.netforge.core.formatter.FormatterConfig;
import com.netforge.core.formatter.FormatterTestBase;
import com.netforge.core.model.Netlist;
import com.netforge.core.model.Pin;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link SpiceFormatter}.
 */
class SpiceFormatterTest extends FormatterTestBase {

    private SpiceFormatter formatter;

    @BeforeEach
    void setUp() {
        formatter = new SpiceFormatter();
    }

    @Test
    void metadata_identifiesSpice() {
        assertThat(formatter.getId()).isEqualTo("spice");
        assertThat(formatter.getFileExtension()).isEqualTo("cir");
    }

    @Test
    void format_divider_writesSortedElementLines() {
        String output = formatter.format(divider(), FormatterConfig.defaults());

        assertThat(output).isEqualTo("""
            * NetForge Netlist
            rR1 1 2 1e3
            rR2 2 0 2.2e3
            vV1 1 0 5
            .end""");
    }

    @Test
    void format_openAndGroundPins_useConfiguredNodes() {
        Netlist netlist = new Netlist(List.of(
            component("D1", "Diode", "1N4148", "D", pin("A", Pin.OPEN), pin("K", "GND")),
            component("C1", "Capacitor", "100nF", "C", pin("A", "ground"), pin("B", "VOUT"))
        ), List.of());
        FormatterConfig config = FormatterConfig.of(new SpiceConfig("Amp", "gnd", "FLOAT", null));

        String output = formatter.format(netlist, config);

        assertThat(output.lines()).containsExactly(
            "* Amp",
            "cC1 gnd VOUT 100e-9",
            "dD1 FLOAT gnd 1N4148",
            ".end");
    }

    @Test
    void format_defaultNodes_writeZeroAndNc() {
        Netlist netlist = new Netlist(List.of(
            component("L1", "Inductor", "10uH", "L", pin("A", "0"), pin("B", Pin.OPEN))
        ), List.of());

        assertThat(formatter.format(netlist, FormatterConfig.defaults()))
            .contains("lL1 0 NC 10e-6");
    }

    @Test
    void format_partTypes_writeRawValue() {
        FormatterConfig config = new FormatterConfig(Map.of("spice.partTypes", List.of("R", " q ")));

        String output = formatter.format(divider(), config);

        assertThat(output).contains("rR1 1 2 1k", "rR2 2 0 2.2k");
    }

    @Test
    void format_typeLetterFallbacks() {
        Netlist netlist = new Netlist(List.of(
            component("U1", "Opamp", "", "", pin("IN", "1"), pin("OUT", "2")),
            component("X1", "", "sub", "", pin("A", "1"))
        ), List.of());

        String output = formatter.format(netlist, FormatterConfig.defaults());

        assertThat(output.lines()).contains("oU1 1 2", "xX1 1 sub");
    }

    @Test
    void format_emptyNetlist_writesTitleAndEnd() {
        assertThat(formatter.format(Netlist.empty(), FormatterConfig.defaults()))
            .isEqualTo("* NetForge Netlist\n.end");
    }

    @Test
    void format_withNullNetlist_throwsException() {
        assertThatThrownBy(() -> formatter.format(null, FormatterConfig.defaults()))
            .isInstanceOf(NullPointerException.class);
    }
}
