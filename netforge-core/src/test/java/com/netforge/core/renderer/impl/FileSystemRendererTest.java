package com.netforge.core.renderer.impl;

import com.netforge.core.renderer.OutputRenderer;
import com.netforge.core.renderer.RenderContext;
import com.netforge.core.renderer.RendererTestBase;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest extends RendererTestBase {

    private final FileSystemRenderer renderer = new FileSystemRenderer();

    @Test
    void render_writesContentWithTrailingNewline() throws IOException {
        renderer.render(netlist("divider.cir", "* NetForge Netlist\n.end"), context);

        assertThat(readFile("divider.cir")).isEqualTo("* NetForge Netlist\n.end\n");
    }

    @Test
    void render_contentEndingInNewline_notDoubled() throws IOException {
        renderer.render(netlist("a.net", "line\n"), context);

        assertThat(readFile("a.net")).isEqualTo("line\n");
    }

    @Test
    void render_missingDirectory_created() throws IOException {
        Path nested = tempDir.resolve("build/netlist");
        RenderContext nestedContext = createContext(nested.toString(), Map.of());

        renderer.render(netlist("amp.cir", "x"), nestedContext);

        assertThat(fileExists("build/netlist/amp.cir")).isTrue();
    }

    @Test
    void render_overwritesExistingFile() throws IOException {
        Files.writeString(tempDir.resolve("amp.cir"), "old content");

        renderer.render(netlist("amp.cir", "new"), context);

        assertThat(readFile("amp.cir")).isEqualTo("new\n");
    }

    @Test
    void render_outputDirectoryIsAFile_throwsIllegalState() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "");
        RenderContext blocked = createContext(blocker.toString(), Map.of());

        assertThatThrownBy(() -> renderer.render(netlist("amp.cir", "x"), blocked))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("blocker");
    }

    @Test
    void serviceLoader_findsBothRenderers() {
        assertThat(OutputRenderer.all()).extracting(OutputRenderer::getId).containsExactly("console", "filesystem");
        assertThat(OutputRenderer.find("FileSystem")).get().isInstanceOf(FileSystemRenderer.class);
        assertThat(OutputRenderer.find(null)).isEmpty();
    }
}
