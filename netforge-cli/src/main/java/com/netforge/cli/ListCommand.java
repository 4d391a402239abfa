package com.netforge.cli;

import com.netforge.core.formatter.NetlistFormatter;
import com.netforge.core.formatter.NetlistFormatters;
import com.netforge.core.library.ComponentLibrary;
import com.netforge.core.library.ComponentLibraryLoader;
import com.netforge.core.library.ComponentTemplate;
import com.netforge.core.renderer.OutputRenderer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list available formatters, renderers or component kinds.
 *
 * <p>Formatters and renderers are discovered via Java Service Provider
 * Interface (SPI); component kinds come from the bundled library plus any
 * {@code --library} files.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * netforge list formatters
 * netforge list renderers
 * netforge list components --library custom.json
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available formatters, renderers or components",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: formatters, renderers or components"
    )
    private String type;

    @Option(
        names = {"--library"},
        description = "Additional component library (repeatable)"
    )
    private List<Path> libraries = new ArrayList<>();

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "formatters", "formatter" -> listFormatters();
            case "renderers", "renderer" -> listRenderers();
            case "components", "component" -> listComponents();
            default -> {
                log.error("Unknown type: {}. Use: formatters, renderers or components", type);
                yield 1;
            }
        };
    }

    private int listFormatters() {
        System.out.println("Available Formatters:");
        System.out.println();

        List<NetlistFormatter> formatters = NetlistFormatters.all();
        for (NetlistFormatter formatter : formatters) {
            System.out.printf("  • %s (ID: %s)%n", formatter.getDisplayName(), formatter.getId());
            System.out.printf("    File Extension: .%s%n", formatter.getFileExtension());
            System.out.println();
        }

        if (formatters.isEmpty()) {
            System.out.println("  No formatters found.");
        }
        return 0;
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        List<OutputRenderer> renderers = OutputRenderer.all();
        for (OutputRenderer renderer : renderers) {
            System.out.printf("  • %s%n", renderer.getId());
        }

        if (renderers.isEmpty()) {
            System.out.println("  No renderers found.");
        }
        return 0;
    }

    private int listComponents() {
        ComponentLibrary library = ComponentLibraryLoader.load(libraries);
        System.out.println("Available Components:");
        System.out.println();

        String category = null;
        for (ComponentTemplate template : library.sorted()) {
            if (!template.category().equals(category)) {
                category = template.category();
                System.out.println("  " + category);
            }
            System.out.printf("    • %s (kind: %s, prefix: %s, role: %s, ports: %d)%n",
                template.displayName(), template.kind(), template.prefix(),
                template.role().name().toLowerCase(Locale.ROOT), template.ports().size());
        }
        return 0;
    }
}
