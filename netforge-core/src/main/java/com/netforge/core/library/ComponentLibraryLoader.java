package com.netforge.core.library;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.netforge.core.model.ComponentRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads component templates from JSON library files.
 *
 * <p>The bundled {@code components/defaults.json} is read first, then every user
 * file in order; an entry replaces any earlier entry with the same kind. A file
 * that is missing or cannot be parsed is logged and skipped, so a broken custom
 * library never prevents an export.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ComponentLibrary library = ComponentLibraryLoader.load(List.of(Path.of("custom.json")));
 * String prefix = library.prefixFor("Resistor"); // "R"
 * }</pre>
 */
public final class ComponentLibraryLoader {

    private static final Logger log = LoggerFactory.getLogger(ComponentLibraryLoader.class);

    /** Classpath location of the bundled library. */
    public static final String DEFAULT_LIBRARY_RESOURCE = "components/defaults.json";

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private ComponentLibraryLoader() {
        // Utility class
    }

    /**
     * Loads the bundled library only.
     *
     * @return default library
     */
    public static ComponentLibrary loadDefaults() {
        return load(List.of());
    }

    /**
     * Loads the bundled library followed by the given user libraries.
     *
     * @param userLibraries additional library files, later files win
     * @return merged library
     */
    public static ComponentLibrary load(List<Path> userLibraries) {
        List<ComponentTemplate> templates = new ArrayList<>(readBundled());
        for (Path path : userLibraries) {
            templates.addAll(readFile(path));
        }
        ComponentLibrary library = ComponentLibrary.of(templates);
        log.debug("Loaded component library with {} kinds", library.size());
        return library;
    }

    /**
     * Converts a parsed document into templates, dropping entries without a kind.
     *
     * @param document parsed library document
     * @return templates in document order
     */
    public static List<ComponentTemplate> toTemplates(LibraryDocument document) {
        List<ComponentTemplate> out = new ArrayList<>();
        if (document == null || document.components() == null) {
            return out;
        }
        for (LibraryDocument.TemplateEntry entry : document.components()) {
            if (entry == null || entry.kind() == null || entry.kind().isBlank()) {
                continue;
            }
            out.add(toTemplate(entry));
        }
        return out;
    }

    private static ComponentTemplate toTemplate(LibraryDocument.TemplateEntry entry) {
        List<PortTemplate> ports = new ArrayList<>();
        if (entry.ports() != null) {
            for (LibraryDocument.PortEntry port : entry.ports()) {
                if (port == null) {
                    continue;
                }
                String name = port.name() == null || port.name().isBlank() ? "P" : port.name().trim();
                ports.add(new PortTemplate(name, orZero(port.x()), orZero(port.y())));
            }
        }
        return new ComponentTemplate(
            entry.kind().trim(),
            trimmed(entry.displayName()),
            trimmed(entry.prefix()),
            trimmed(entry.spiceType()),
            roleOf(entry),
            trimmed(entry.netName()),
            entry.defaultValue(),
            trimmed(entry.category()),
            ports,
            entry.chip()
        );
    }

    private static ComponentRole roleOf(LibraryDocument.TemplateEntry entry) {
        if (Boolean.TRUE.equals(entry.isChip())) {
            return ComponentRole.CHIP;
        }
        if ("net".equalsIgnoreCase(trimmed(entry.compType()))) {
            return ComponentRole.NET_LABEL;
        }
        return ComponentRole.PART;
    }

    private static List<ComponentTemplate> readBundled() {
        try (InputStream in = ComponentLibraryLoader.class.getClassLoader()
                .getResourceAsStream(DEFAULT_LIBRARY_RESOURCE)) {
            if (in == null) {
                log.warn("Bundled component library not found on classpath: {}", DEFAULT_LIBRARY_RESOURCE);
                return List.of();
            }
            return toTemplates(JSON_MAPPER.readValue(in, LibraryDocument.class));
        } catch (IOException e) {
            log.error("Failed to parse bundled component library. Error: {}", e.getMessage());
            return List.of();
        }
    }

    private static List<ComponentTemplate> readFile(Path path) {
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            log.warn("Component library not readable: {}. Skipping.", path);
            return List.of();
        }
        try {
            List<ComponentTemplate> templates = toTemplates(JSON_MAPPER.readValue(path.toFile(), LibraryDocument.class));
            log.info("Loaded {} component templates from: {}", templates.size(), path);
            return templates;
        } catch (IOException e) {
            log.error("Failed to parse component library: {}. Skipping. Error: {}", path, e.getMessage());
            return List.of();
        }
    }

    private static String trimmed(String value) {
        return value == null ? null : value.trim();
    }

    private static double orZero(Double value) {
        return value == null ? 0.0 : value;
    }
}
