package com.netforge.core.renderer;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Interface for output renderers that deliver a formatted netlist.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI) and
 * selected by id ("console", "filesystem").
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.netforge.core.renderer.OutputRenderer}
 *
 * @see RenderedNetlist
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * @return lowercase renderer identifier
     */
    String getId();

    /**
     * Writes the netlist to this renderer's destination.
     *
     * @param netlist formatted netlist
     * @param context rendering context with output directory and settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(RenderedNetlist netlist, RenderContext context);

    /**
     * Returns every registered renderer sorted by id.
     *
     * @return renderers
     */
    static List<OutputRenderer> all() {
        return ServiceLoader.load(OutputRenderer.class).stream()
            .map(ServiceLoader.Provider::get)
            .sorted(Comparator.comparing(OutputRenderer::getId))
            .toList();
    }

    static Optional<OutputRenderer> find(String id) {
        return all().stream().filter(r -> r.getId().equalsIgnoreCase(id == null ? "" : id.trim())).findFirst();
    }
}
