package com.netforge.cli;

import com.netforge.core.builder.NetlistValidator;
import com.netforge.core.builder.ValidationIssue;
import com.netforge.core.config.ExportConfig;
import com.netforge.core.model.Netlist;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Command to check the netlist built from a schematic.
 *
 * <p>Exit codes: 0 when no errors were found, 2 when the netlist has errors
 * (or warnings with {@code --strict}), 1 when the schematic cannot be read.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * netforge validate amplifier.json
 * netforge validate amplifier.json --strict
 * }</pre>
 */
@Command(
    name = "validate",
    description = "Check the netlist of a schematic for inconsistencies",
    mixinStandardHelpOptions = true
)
public class ValidateCommand extends SchematicCommand {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    /** Exit code for a netlist with problems. */
    static final int EXIT_INVALID = 2;

    @Option(
        names = {"--strict"},
        description = "Treat warnings as errors"
    )
    private boolean strict;

    @Override
    protected int run(Netlist netlist, ExportConfig config) {
        List<ValidationIssue> issues = new NetlistValidator().validate(netlist);
        long errors = issues.stream().filter(ValidationIssue::isError).count();
        long warnings = issues.size() - errors;

        for (ValidationIssue issue : issues) {
            String marker = issue.isError() ? "✗" : "⚠";
            System.out.printf("%s [%s] %s: %s%n", marker, issue.code(), issue.subject(), issue.message());
        }

        log.debug("Validation found {} errors and {} warnings", errors, warnings);
        if (errors > 0 || (strict && warnings > 0)) {
            System.out.printf("✗ Validation failed: %d error(s), %d warning(s)%n", errors, warnings);
            return EXIT_INVALID;
        }
        System.out.printf("✓ Netlist is valid (%d components, %d nets, %d warning(s))%n",
            netlist.components().size(), netlist.nets().size(), warnings);
        return 0;
    }

    @Override
    protected String commandName() {
        return "Validation";
    }
}
