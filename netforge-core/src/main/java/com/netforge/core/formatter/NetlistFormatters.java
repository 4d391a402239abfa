package com.netforge.core.formatter;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

/**
 * Lookup of the formatters registered through {@link ServiceLoader}.
 */
public final class NetlistFormatters {

    private NetlistFormatters() {
        // Utility class
    }

    /**
     * Returns every registered formatter sorted by id.
     *
     * @return formatters
     */
    public static List<NetlistFormatter> all() {
        return ServiceLoader.load(NetlistFormatter.class).stream()
            .map(ServiceLoader.Provider::get)
            .sorted(Comparator.comparing(NetlistFormatter::getId))
            .toList();
    }

    public static Optional<NetlistFormatter> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String wanted = id.trim();
        return all().stream().filter(f -> f.getId().equalsIgnoreCase(wanted)).findFirst();
    }

    /**
     * Returns the formatter with the given id.
     *
     * @param id formatter id, case-insensitive
     * @return the formatter
     * @throws IllegalArgumentException if no formatter has that id
     */
    public static NetlistFormatter require(String id) {
        return find(id).orElseThrow(() -> new IllegalArgumentException(
            "Unknown formatter: " + id + " (available: "
                + all().stream().map(NetlistFormatter::getId).collect(Collectors.joining(", ")) + ")"));
    }
}
