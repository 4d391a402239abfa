package com.netforge.core.builder;

import com.netforge.core.geometry.Point;
import com.netforge.core.library.ComponentLibrary;
import com.netforge.core.library.ComponentLibraryLoader;
import com.netforge.core.schematic.NetData;
import com.netforge.core.schematic.PlacedComponent;
import com.netforge.core.schematic.Port;
import com.netforge.core.schematic.SchematicReader;
import com.netforge.core.schematic.SchematicSnapshot;
import com.netforge.core.schematic.Wire;
import com.netforge.core.model.Connection;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Shared fixtures for builder tests.
 */
abstract class BuilderTestBase {

    protected final ComponentLibrary library = ComponentLibraryLoader.loadDefaults();

    protected SchematicSnapshot read(String json) {
        return new SchematicReader(library).readString(json);
    }

    protected static PlacedComponent component(String refdes, String kind, String value, Port... ports) {
        return new PlacedComponent(refdes, kind, value, List.of(ports), null);
    }

    protected static Port port(String name, double x, double y) {
        return new Port(name, Point.of(x, y));
    }

    protected static Wire wire(double... coordinates) {
        List<Point> points = new ArrayList<>();
        for (int i = 0; i + 1 < coordinates.length; i += 2) {
            points.add(Point.of(coordinates[i], coordinates[i + 1]));
        }
        return new Wire(points);
    }

    protected static NetData net(String name, Connection... connections) {
        return new NetData(name, Arrays.asList(connections));
    }

    protected static Connection pin(String refdes, String kind, String port) {
        return new Connection(refdes, kind, port);
    }

    /**
     * Two resistors in series across a voltage source, with a ground symbol on
     * the return wire. Only geometry, no nets.
     */
    protected static SchematicSnapshot seriesDivider() {
        return SchematicSnapshot.ofGeometry(
            List.of(
                component("V1", "VSource", "5", port("P", 0, -50), port("N", 0, 50)),
                component("R1", "Resistor", "1k", port("A", 50, -50), port("B", 150, -50)),
                component("R2", "Resistor", "2.2k", port("A", 150, -50), port("B", 250, -50)),
                component("", "Ground", "GND", port("A", 100, 50))
            ),
            List.of(
                wire(0, -50, 50, -50),
                wire(250, -50, 250, 50, 100, 50, 0, 50)
            )
        );
    }
}
