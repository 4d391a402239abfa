package com.netforge.cli;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ValidateCommand}.
 */
class ValidateCommandTest extends CommandTestBase {

    private static final String FLOATING_RESISTOR = """
        {
          "components": [
            {"kind": "Resistor", "refdes": "R1", "ports": [{"name": "A", "x": 0, "y": 0}, {"name": "B", "x": 100, "y": 0}]},
            {"kind": "Resistor", "refdes": "R2", "ports": [{"name": "A", "x": 100, "y": 0}, {"name": "B", "x": 200, "y": 0}]},
            {"kind": "Resistor", "refdes": "R3", "ports": [{"name": "A", "x": 500, "y": 500}, {"name": "B", "x": 600, "y": 500}]}
          ]
        }
        """;

    @Test
    void validate_soundNetlist_returnsZero() {
        Path schematic = fixture("divider.json");

        int exitCode = run("validate", schematic.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("✓ Netlist is valid (3 components, 3 nets, 0 warning(s))");
    }

    @Test
    void validate_warningsOnly_passWithoutStrict() {
        Path schematic = writeFile("floating.json", FLOATING_RESISTOR);

        int exitCode = run("validate", schematic.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("⚠ [UNCONNECTED] R3").contains("1 warning(s)");
    }

    @Test
    void validate_strict_failsOnWarnings() {
        Path schematic = writeFile("floating.json", FLOATING_RESISTOR);

        int exitCode = run("validate", schematic.toString(), "--strict");

        assertThat(exitCode).isEqualTo(ValidateCommand.EXIT_INVALID);
        assertThat(stdout()).contains("✗ Validation failed: 0 error(s), 1 warning(s)");
    }

    @Test
    void validate_missingSchematic_returnsOne() {
        int exitCode = run("validate", tempDir.resolve("missing.json").toString());

        assertThat(exitCode).isEqualTo(1);
    }
}
