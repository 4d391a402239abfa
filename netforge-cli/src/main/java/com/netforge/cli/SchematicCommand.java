package com.netforge.cli;

import com.netforge.core.builder.NetNamer;
import com.netforge.core.builder.NetlistBuilder;
import com.netforge.core.config.ConfigLoader;
import com.netforge.core.config.ExportConfig;
import com.netforge.core.config.FlattenConfig;
import com.netforge.core.library.ComponentLibrary;
import com.netforge.core.library.ComponentLibraryLoader;
import com.netforge.core.model.Netlist;
import com.netforge.core.schematic.Schematic;
import com.netforge.core.schematic.SchematicReadException;
import com.netforge.core.schematic.SchematicReader;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Base for commands that read one schematic and build its netlist.
 *
 * <p>Loads {@code netforge.yaml}, layers the configured and command-line
 * component libraries over the bundled one and reports unreadable schematics
 * as exit code 1.
 */
abstract class SchematicCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SchematicCommand.class);

    @Parameters(
        index = "0",
        description = "Schematic snapshot (JSON)"
    )
    protected Path schematicPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: netforge.yaml)"
    )
    protected Path configPath = Paths.get(ConfigLoader.DEFAULT_CONFIG_FILE);

    @Option(
        names = {"--library"},
        description = "Additional component library (repeatable, later files win)"
    )
    protected List<Path> libraries = new ArrayList<>();

    @Option(
        names = {"--no-flatten"},
        description = "Drop chip instances instead of expanding them"
    )
    protected boolean noFlatten;

    @Option(
        names = {"--single-level"},
        description = "Expand top-level chips only"
    )
    protected boolean singleLevel;

    @Override
    public Integer call() {
        try {
            ExportConfig config = ConfigLoader.load(configPath);
            ComponentLibrary library = loadLibrary(config);
            Schematic schematic = new SchematicReader(library).read(schematicPath);
            Netlist netlist = new NetlistBuilder(library, NetNamer.defaults(),
                flattenConfig(config), config.netlistOrDefault().isResolveLabels()).build(schematic);
            return run(netlist, config);
        } catch (SchematicReadException e) {
            log.error("Cannot read schematic: {}", e.getMessage());
            System.err.println("✗ " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.error("{} failed", commandName(), e);
            System.err.println("✗ " + commandName() + " failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Acts on the built netlist.
     *
     * @param netlist netlist of the schematic
     * @param config loaded configuration
     * @return exit code
     */
    protected abstract int run(Netlist netlist, ExportConfig config);

    protected abstract String commandName();

    private ComponentLibrary loadLibrary(ExportConfig config) {
        List<Path> paths = new ArrayList<>();
        Path base = configPath.toAbsolutePath().getParent();
        for (String configured : config.libraryOrDefault().paths()) {
            Path path = Paths.get(configured);
            paths.add(path.isAbsolute() || base == null ? path : base.resolve(path));
        }
        paths.addAll(libraries);
        log.debug("Component libraries: {}", paths);
        return ComponentLibraryLoader.load(paths);
    }

    private FlattenConfig flattenConfig(ExportConfig config) {
        if (noFlatten) {
            return FlattenConfig.disabled();
        }
        if (singleLevel) {
            return FlattenConfig.singleLevel();
        }
        return config.flattenOrDefault();
    }

    /**
     * Returns the schematic file name without its extension.
     *
     * @return base name for output files
     */
    protected String schematicBaseName() {
        String name = schematicPath.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
