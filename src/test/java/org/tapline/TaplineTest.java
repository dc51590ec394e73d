package org.tapline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.tapline.compiler.Compiler;
import org.tapline.compiler.MultiStats;
import org.tapline.compiler.Stats;
import org.tapline.compiler.Watching;
import org.tapline.compiler.options.CompilerOptions;
import org.tapline.junit.extensions.logging.LogWatchExtension;

import com.typesafe.config.ConfigFactory;

/**
 * Integration tests of fully wired compilers on the local disk.
 */
@ExtendWith(LogWatchExtension.class)
class TaplineTest {

    @TempDir
    Path projectDir;

    private Path source;

    @BeforeEach
    void setUp() throws Exception {
        source = projectDir.resolve("src/main.txt");
        Files.createDirectories(source.getParent());
        Files.writeString(source, "hello tapline");
    }

    private CompilerOptions options(String extra) {
        return CompilerOptions.fromConfig(ConfigFactory.parseString(
                "context = \"" + projectDir.toString().replace("\\", "/") + "\"\n"
                        + "entry { main = \"./src/main.txt\" }\n"
                        + "watchOptions { aggregateTimeout = 20ms, poll = 10ms }\n"
                        + extra));
    }

    @Test
    @Tag("integration")
    void testRun_WritesEntryAssetAndRecords() throws Exception {
        Stats stats = Tapline.run(options("records.path = \"build/records.json\"")).get(10, TimeUnit.SECONDS);

        assertEquals("hello tapline", Files.readString(projectDir.resolve("dist/main.js")));
        assertThat(stats.getCompilation().getEmittedAssets()).containsExactly("main.js");
        assertThat(projectDir.resolve("build/records.json")).exists();
    }

    @Test
    @Tag("integration")
    void testCreate_AppliesConfiguredPlugins() throws Exception {
        Compiler compiler = Tapline.create(options(
                "plugins = [ { className = \"" + PluginLoaderTest.ConfiguredPlugin.class.getName()
                        + "\", options { banner = \"site\" } } ]\n"
                        + "output.path = \"dist/[name]\""));

        compiler.run().get(10, TimeUnit.SECONDS);

        assertEquals("site", compiler.getName());
        assertThat(projectDir.resolve("dist/site/main.js")).exists();
    }

    @Test
    @Tag("integration")
    void testRun_SameCompilerSkipsUnchangedAssets() throws Exception {
        Compiler compiler = Tapline.create(options(""));

        compiler.run().get(10, TimeUnit.SECONDS);
        Stats second = compiler.run().get(10, TimeUnit.SECONDS);

        assertThat(second.getCompilation().getEmittedAssets()).isEmpty();
        assertThat(second.getCompilation().getAssets()).containsOnlyKeys("main.js");
    }

    @Test
    @Tag("integration")
    void testRunAll_BuildsEveryConfiguration() throws Exception {
        List<CompilerOptions> all = CompilerOptions.listFromApplicationConfig(ConfigFactory.parseString(
                "tapline {\n"
                        + "  context = \"" + projectDir.toString().replace("\\", "/") + "\"\n"
                        + "  output.path = \"dist/[name]\"\n"
                        + "  compilers = [\n"
                        + "    { name = \"site\", entry { main = \"./src/main.txt\" } }\n"
                        + "    { name = \"docs\", entry { index = \"./src/main.txt\" } }\n"
                        + "  ]\n"
                        + "}"));

        MultiStats stats = Tapline.runAll(all).get(10, TimeUnit.SECONDS);

        assertThat(stats.getStats()).hasSize(2);
        assertEquals("hello tapline", Files.readString(projectDir.resolve("dist/site/main.js")));
        assertEquals("hello tapline", Files.readString(projectDir.resolve("dist/docs/index.js")));
    }

    @Test
    @Tag("integration")
    void testWatch_RebuildsOnSourceChange() throws Exception {
        List<Stats> builds = new CopyOnWriteArrayList<>();
        Watching watching = Tapline.watch(options(""), (error, stats) -> {
            if (stats != null) {
                builds.add(stats);
            }
        });
        try {
            await().atMost(10, TimeUnit.SECONDS).until(() -> !builds.isEmpty());

            Files.writeString(source, "changed", StandardCharsets.UTF_8);
            Files.setLastModifiedTime(source, FileTime.fromMillis(System.currentTimeMillis() + 5_000));

            await().atMost(10, TimeUnit.SECONDS)
                    .until(() -> "changed".equals(Files.readString(projectDir.resolve("dist/main.js"))));
            assertThat(builds.size()).isGreaterThanOrEqualTo(2);
        } finally {
            watching.close().get(10, TimeUnit.SECONDS);
        }
    }
}
