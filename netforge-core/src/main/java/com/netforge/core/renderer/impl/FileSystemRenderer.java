package com.netforge.core.renderer.impl;

import com.netforge.core.renderer.OutputRenderer;
import com.netforge.core.renderer.RenderContext;
import com.netforge.core.renderer.RenderedNetlist;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Renderer that writes the netlist into the output directory.
 *
 * <p>Creates the directory when missing and overwrites an existing file. The
 * written file always ends with a newline.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * RenderContext context = new RenderContext("./build/netlist", Map.of());
 * new FileSystemRenderer().render(new RenderedNetlist("amp.cir", spice, "spice"), context);
 * // Creates: ./build/netlist/amp.cir
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(RenderedNetlist netlist, RenderContext context) {
        Path outputDir = Paths.get(context.outputDirectory());
        Path target = outputDir.resolve(netlist.fileName());
        logger.debug("Writing netlist to: {}", target);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        String content = netlist.content().endsWith("\n") ? netlist.content() : netlist.content() + "\n";
        try {
            Files.writeString(target, content, StandardCharsets.UTF_8);
            logger.info("Wrote netlist: {} ({} bytes)", target, content.length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + target, e);
        }
    }
}
