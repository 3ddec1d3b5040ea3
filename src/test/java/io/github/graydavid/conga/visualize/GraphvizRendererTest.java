package io.github.graydavid.conga.visualize;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Path;

import org.apache.commons.lang3.RandomStringUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class GraphvizRendererTest {

    @Test
    public void commandPipesToDotWithFormatAndOutput() {
        GraphvizRenderer renderer = new GraphvizRenderer("/usr/local/bin/dot");
        Path output = Path.of("out", "graph.svg");

        assertThat(renderer.command(RenderFormat.SVG, output),
                contains("/usr/local/bin/dot", "-Tsvg", "-o", output.toString()));
    }

    @Test
    public void defaultExecutableIsDotFromThePath() {
        assertThat(new GraphvizRenderer().command(RenderFormat.PNG, Path.of("graph.png")),
                contains("dot", "-Tpng", "-o", "graph.png"));
    }

    @Test
    public void missingExecutableFailsToRender(@TempDir Path directory) {
        String executable = "no-such-graphviz-" + RandomStringUtils.randomAlphanumeric(12);
        GraphvizRenderer renderer = new GraphvizRenderer(executable);

        RenderException thrown = assertThrows(RenderException.class,
                () -> renderer.render(GraphView.empty(), RenderFormat.PNG, directory.resolve("graph.png")));

        assertThat(thrown.getMessage(), containsString(executable));
        assertThat(thrown.getCause(), instanceOf(IOException.class));
    }
}
