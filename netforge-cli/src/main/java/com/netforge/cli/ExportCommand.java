package com.netforge.cli;

import com.netforge.core.config.ExportConfig;
import com.netforge.core.formatter.FormatterConfig;
import com.netforge.core.formatter.NetlistFormatter;
import com.netforge.core.formatter.NetlistFormatters;
import com.netforge.core.model.Netlist;
import com.netforge.core.renderer.OutputRenderer;
import com.netforge.core.renderer.RenderContext;
import com.netforge.core.renderer.RenderedNetlist;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;

/**
 * Command to build a schematic's netlist and write it out.
 *
 * <p>The formatter defaults to {@code formatter.default} from the
 * configuration. Output goes to standard output unless an output directory is
 * given on the command line or {@code output.renderer} is "filesystem".
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # SPICE netlist on stdout
 * netforge export amplifier.json --stdout
 *
 * # Detailed listing written to ./out/amplifier.txt
 * netforge export amplifier.json -f detailed -o out
 * }</pre>
 */
@Command(
    name = "export",
    description = "Build the netlist of a schematic and write it",
    mixinStandardHelpOptions = true
)
public class ExportCommand extends SchematicCommand {

    private static final Logger log = LoggerFactory.getLogger(ExportCommand.class);

    @Option(
        names = {"-f", "--format"},
        description = "Formatter id: spice, simple, detailed, freeform (overrides config)"
    )
    private String format;

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (overrides config, implies file output)"
    )
    private Path outputDir;

    @Option(
        names = {"--stdout"},
        description = "Print the netlist instead of writing a file"
    )
    private boolean stdout;

    @Option(
        names = {"--name"},
        description = "Output file base name (default: schematic file name)"
    )
    private String name;

    @Override
    protected int run(Netlist netlist, ExportConfig config) {
        String formatterId = format != null ? format : config.formatterOrDefault().defaultFormatter();
        NetlistFormatter formatter = NetlistFormatters.require(formatterId);
        String content = formatter.format(netlist, FormatterConfig.of(config.spiceOrDefault()));

        String baseName = name != null && !name.isBlank() ? name.trim() : schematicBaseName();
        RenderedNetlist rendered = new RenderedNetlist(
            baseName + "." + formatter.getFileExtension(), content, formatter.getId());

        String rendererId = rendererId(config);
        OutputRenderer renderer = OutputRenderer.find(rendererId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown renderer: " + rendererId));
        String directory = outputDir != null ? outputDir.toString() : config.outputOrDefault().directory();
        log.debug("Rendering {} with {} into {}", rendered.fileName(), renderer.getId(), directory);
        renderer.render(rendered, new RenderContext(directory, Map.of()));

        if (!"console".equals(renderer.getId())) {
            System.out.println("✓ Wrote " + Path.of(directory).resolve(rendered.fileName()));
        }
        return 0;
    }

    private String rendererId(ExportConfig config) {
        if (stdout) {
            return "console";
        }
        if (outputDir != null) {
            return "filesystem";
        }
        String configured = config.outputOrDefault().renderer();
        return configured == null || configured.isBlank() ? "console" : configured.trim();
    }

    @Override
    protected String commandName() {
        return "Export";
    }
}
