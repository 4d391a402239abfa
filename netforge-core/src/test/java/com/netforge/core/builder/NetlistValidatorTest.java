package com.netforge.core.builder;

import com.netforge.core.model.Component;
import com.netforge.core.model.Net;
import com.netforge.core.model.Netlist;
import com.netforge.core.model.Pin;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link NetlistValidator}.
 */
class NetlistValidatorTest extends BuilderTestBase {

    private final NetlistValidator validator = new NetlistValidator();

    @Test
    void validate_builtNetlist_hasNoIssues() {
        Netlist netlist = new NetlistBuilder(library).build(seriesDivider());

        assertThat(validator.validate(netlist)).isEmpty();
    }

    @Test
    void validate_duplicateNamesAndDesignators_reportedAsErrors() {
        Netlist netlist = new Netlist(
            List.of(resistor("R1", "1", "2"), resistor("R1", "1", "2")),
            List.of(
                new Net("1", List.of(pin("R1", "Resistor", "A"))),
                new Net("1", List.of(pin("R1", "Resistor", "A"))),
                new Net("2", List.of(pin("R1", "Resistor", "B")))
            ));

        List<ValidationIssue> issues = validator.validate(netlist);

        assertThat(issues).extracting(ValidationIssue::code).contains("DUPLICATE_NET", "DUPLICATE_REFDES");
    }

    @Test
    void validate_unknownPin_reported() {
        Netlist netlist = new Netlist(
            List.of(resistor("R1", "1", "2")),
            List.of(
                new Net("1", List.of(pin("R1", "Resistor", "A"), pin("R9", "Resistor", "A"))),
                new Net("2", List.of(pin("R1", "Resistor", "B"), pin("R1", "Resistor", "C")))
            ));

        List<ValidationIssue> issues = validator.validate(netlist);

        assertThat(issues).filteredOn(i -> i.code().equals("UNKNOWN_PIN"))
            .extracting(ValidationIssue::subject)
            .containsExactly("R9.A", "R1.C");
    }

    @Test
    void validate_pinAndNetDisagree_reportsMismatchAndMissingConnection() {
        Netlist netlist = new Netlist(
            List.of(resistor("R1", "1", "2"), resistor("R2", "2", "1")),
            List.of(
                new Net("1", List.of(pin("R1", "Resistor", "A"), pin("R2", "Resistor", "A"))),
                new Net("2", List.of(pin("R1", "Resistor", "B"), pin("R2", "Resistor", "B")))
            ));

        List<ValidationIssue> issues = validator.validate(netlist);

        assertThat(issues).filteredOn(i -> i.code().equals("MISSING_CONNECTION"))
            .extracting(ValidationIssue::subject)
            .containsExactly("R2.A", "R2.B");
        assertThat(issues).filteredOn(i -> i.code().equals("NET_MISMATCH"))
            .extracting(ValidationIssue::subject)
            .containsExactly("R2.A", "R2.B");
        assertThat(issues).allMatch(ValidationIssue::isError);
    }

    @Test
    void validate_unnamedPartsOnDifferentNets_noErrors() {
        Netlist netlist = new Netlist(
            List.of(resistor("", "1", Pin.OPEN), resistor("", "2", Pin.OPEN)),
            List.of(
                new Net("1", List.of(pin("", "Resistor", "A"))),
                new Net("2", List.of(pin("", "Resistor", "A")))
            ));

        assertThat(validator.validate(netlist)).noneMatch(ValidationIssue::isError);
    }

    @Test
    void validate_singlePinNetAndOpenComponent_warnedAfterErrors() {
        Netlist netlist = new Netlist(
            List.of(resistor("R1", "1", Pin.OPEN), resistor("R2", Pin.OPEN, Pin.OPEN)),
            List.of(
                new Net("1", List.of(pin("R1", "Resistor", "A"))),
                new Net("9", List.of(pin("R9", "Resistor", "A")))
            ));

        List<ValidationIssue> issues = validator.validate(netlist);

        assertThat(issues).extracting(ValidationIssue::code)
            .containsExactly("UNKNOWN_PIN", "SINGLE_PIN_NET", "SINGLE_PIN_NET", "UNCONNECTED");
        assertThat(issues.get(3).subject()).isEqualTo("R2");
        assertThat(issues.get(3).severity()).isEqualTo(ValidationIssue.Severity.WARNING);
    }

    private static Component resistor(String refdes, String netA, String netB) {
        return new Component(refdes, "Resistor", "1k", "R", List.of(new Pin("A", netA), new Pin("B", netB)));
    }
}
