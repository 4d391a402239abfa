package com.netforge.core.renderer;

import java.util.Objects;

/**
 * A formatted netlist ready to be written out.
 *
 * @param fileName file name including extension (e.g., "amplifier.cir")
 * @param content formatted netlist text
 * @param formatterId id of the formatter that produced the content
 */
public record RenderedNetlist(
    String fileName,
    String content,
    String formatterId
) {
    /**
     * Compact constructor with validation.
     */
    public RenderedNetlist {
        Objects.requireNonNull(fileName, "fileName must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (formatterId == null) {
            formatterId = "";
        }
    }
}
