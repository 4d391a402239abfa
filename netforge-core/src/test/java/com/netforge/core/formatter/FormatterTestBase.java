package com.netforge.core.formatter;

import com.netforge.core.model.Component;
import com.netforge.core.model.Connection;
import com.netforge.core.model.Net;
import com.netforge.core.model.Netlist;
import com.netforge.core.model.Pin;

import java.util.List;

/**
 * Shared netlist fixtures for formatter tests.
 */
public abstract class FormatterTestBase {

    /**
     * Voltage divider: V1 drives R1 and R2 in series to ground. Components and
     * connections are deliberately out of order.
     *
     * @return netlist
     */
    protected static Netlist divider() {
        return new Netlist(
            List.of(
                component("V1", "VSource", "5", "V", pin("P", "1"), pin("N", "0")),
                component("R2", "Resistor", "2.2k", "R", pin("A", "2"), pin("B", "0")),
                component("R1", "Resistor", "1k", "R", pin("A", "1"), pin("B", "2"))
            ),
            List.of(
                new Net("1", List.of(connection("V1", "VSource", "P"), connection("R1", "Resistor", "A"))),
                new Net("2", List.of(connection("R2", "Resistor", "A"), connection("R1", "Resistor", "B"))),
                new Net("0", List.of(connection("V1", "VSource", "N"), connection("R2", "Resistor", "B")))
            ));
    }

    protected static Component component(String refdes, String kind, String value, String spiceType, Pin... pins) {
        return new Component(refdes, kind, value, spiceType, List.of(pins));
    }

    protected static Pin pin(String name, String net) {
        return new Pin(name, net);
    }

    protected static Connection connection(String refdes, String kind, String port) {
        return new Connection(refdes, kind, port);
    }
}
