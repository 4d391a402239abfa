package com.netforge.core.renderer.impl;

import com.netforge.core.renderer.OutputRenderer;
import com.netforge.core.renderer.RenderContext;
import com.netforge.core.renderer.RenderedNetlist;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Renderer that prints the netlist to standard output.
 *
 * <p>By default only the netlist text is printed so the output can be piped
 * into a simulator. A colored header can be switched on for interactive use.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.showHeaders} - Print a file header ("true"/"false", default: "false")</li>
 *   <li>{@code console.colors} - Use ANSI colors in the header ("true"/"false", default: "true")</li>
 *   <li>{@code console.separator} - Header underline pattern (default: "---")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private static final String DEFAULT_SEPARATOR = "---";

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(RenderedNetlist netlist, RenderContext context) {
        boolean showHeaders = Boolean.parseBoolean(context.getSettingOrDefault("console.showHeaders", "false"));
        boolean useColors = Boolean.parseBoolean(context.getSettingOrDefault("console.colors", "true"));
        String separator = context.getSettingOrDefault("console.separator", DEFAULT_SEPARATOR);

        PrintStream out = System.out;
        if (showHeaders) {
            String pathColor = useColors ? ANSI_BOLD + ANSI_CYAN : "";
            String lineColor = useColors ? ANSI_YELLOW : "";
            String reset = useColors ? ANSI_RESET : "";
            out.println(pathColor + netlist.fileName() + " (" + netlist.formatterId() + ")" + reset);
            int repeatCount = Math.max(1, 80 / Math.max(1, separator.length()));
            out.println(lineColor + separator.repeat(repeatCount) + reset);
        }
        out.println(netlist.content());
        out.flush();

        logger.debug("Rendered {} to console ({} characters)", netlist.fileName(), netlist.content().length());
    }
}
