package org.tapline.compiler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.tapline.compiler.options.CompilerOptions;
import org.tapline.fs.MemoryFileSystem;
import org.tapline.junit.extensions.logging.ExpectLog;
import org.tapline.junit.extensions.logging.LogLevel;
import org.tapline.junit.extensions.logging.LogWatchExtension;
import org.tapline.records.Records;

import com.google.gson.JsonPrimitive;
import com.typesafe.config.ConfigFactory;

/**
 * Tests for child compilers: index assignment, records nesting, tap inheritance and merging
 * of child output into the parent compilation.
 */
@ExtendWith(LogWatchExtension.class)
class ChildCompilerTest {

    private MemoryFileSystem fs;
    private Compiler parent;

    @BeforeEach
    void setUp() {
        fs = new MemoryFileSystem();
        parent = new Compiler(CompilerOptions.fromConfig(ConfigFactory.parseString(
                "context = \"/project\"\noutput.path = \"/out\"\nrecords.path = \"/state/records.json\"")));
        parent.setInputFileSystem(fs);
        parent.setOutputFileSystem(fs);
        parent.setExecutor(Runnable::run);
    }

    private static Stats await(CompletableFuture<Stats> build) throws Exception {
        return build.get(5, TimeUnit.SECONDS);
    }

    /**
     * Taps {@code make} of the parent so that every build spawns {@code count} children named
     * {@code name} and runs them to completion.
     */
    private void spawning(String name, int count, List<Compiler> spawned, Plugin... plugins) {
        parent.hooks.make.tapAsync("spawn-" + name, compilation -> {
            CompletableFuture<?> chain = CompletableFuture.completedFuture(null);
            for (int i = 0; i < count; i++) {
                chain = chain.thenCompose(ignored -> {
                    Compiler child = compilation.createChildCompiler(name, ConfigFactory.empty(), List.of(plugins));
                    spawned.add(child);
                    return child.runAsChild();
                });
            }
            return chain.thenApply(ignored -> null);
        });
    }

    @Test
    @Tag("unit")
    void testCreateChildCompiler_AssignsIndexesPerName() throws Exception {
        List<ChildCompilerEvent> events = new CopyOnWriteArrayList<>();
        parent.hooks.thisCompilation.tap("events", compilation ->
                compilation.hooks.childCompiler.tap("events", events::add));
        List<Compiler> spawned = new CopyOnWriteArrayList<>();
        spawning("manifest", 2, spawned);
        spawning("worker", 1, spawned);

        await(parent.run());

        assertThat(events).extracting(ChildCompilerEvent::name, ChildCompilerEvent::index)
                .containsExactlyInAnyOrder(
                        tuple("manifest", 0),
                        tuple("manifest", 1),
                        tuple("worker", 0));
        assertThat(spawned).allSatisfy(child -> {
            assertTrue(child.isChild());
            assertThat(child.getOutputFileSystem()).isNull();
        });
        assertThat(parent.getRecords().childCount("manifest")).isEqualTo(2);
        assertThat(parent.getRecords().childCount("worker")).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void testChildRecords_ReusedByIndexAcrossBuilds() throws Exception {
        List<Integer> seenRuns = new CopyOnWriteArrayList<>();
        Plugin counting = compiler -> compiler.hooks.compile.tap("count", params -> {
            Records records = compiler.getRecords();
            int runs = records.has("runs") ? records.get("runs").getAsInt() : 0;
            seenRuns.add(runs);
            records.put("runs", new JsonPrimitive(runs + 1));
        });
        spawning("manifest", 2, new CopyOnWriteArrayList<>(), counting);

        await(parent.run());
        await(parent.run());

        assertThat(seenRuns).containsExactly(0, 0, 1, 1);
        String persisted = new String(fs.readFile("/state/records.json"), StandardCharsets.UTF_8);
        assertThat(Records.parse(persisted).childCount("manifest")).isEqualTo(2);
    }

    @Test
    @Tag("unit")
    void testChildRecords_PathLikeNameShortenedRelativeToContext() throws Exception {
        spawning("/project/plugins/html", 1, new CopyOnWriteArrayList<>());

        await(parent.run());

        assertThat(parent.getRecords().keys()).contains("plugins/html");
    }

    @Test
    @Tag("unit")
    void testChild_InheritsTapsExceptExcludedHooks() throws Exception {
        List<String> calls = new CopyOnWriteArrayList<>();
        parent.hooks.compilation.tap("inherited", compilation -> calls.add("compilation:" + compilation.getName()));
        parent.hooks.thisCompilation.tap("own", compilation -> calls.add("thisCompilation:" + compilation.getName()));
        parent.hooks.done.tap("own", stats -> calls.add("done:" + stats.getCompilation().getName()));
        parent.hooks.afterCompile.tap("inherited",
                compilation -> calls.add("afterCompile:" + compilation.getName()));
        spawning("child", 1, new CopyOnWriteArrayList<>());

        await(parent.run());

        assertThat(calls).containsExactlyInAnyOrder(
                "thisCompilation:null",
                "compilation:null",
                "compilation:child",
                "afterCompile:child",
                "afterCompile:null",
                "done:null");
    }

    @Test
    @Tag("unit")
    void testChild_OwnPluginsAppliedAfterInheritedTaps() throws Exception {
        List<String> order = new CopyOnWriteArrayList<>();
        parent.hooks.compilation.tap("parent", compilation -> {
            if (compilation.getCompiler().isChild()) {
                order.add("parent");
            }
        });
        Plugin own = compiler -> compiler.hooks.compilation.tap("child", compilation -> order.add("child"));
        spawning("child", 1, new CopyOnWriteArrayList<>(), own);

        await(parent.run());

        assertThat(order).containsExactly("parent", "child");
    }

    @Test
    @Tag("unit")
    void testChild_SharesTimestampsAndCollaborators() throws Exception {
        AtomicReference<Compiler> childRef = new AtomicReference<>();
        parent.hooks.make.tap("spawn", compilation ->
                childRef.set(compilation.createChildCompiler("child", ConfigFactory.empty(), List.of())));

        await(parent.run());

        Compiler child = childRef.get();
        assertSame(parent.getFileTimestamps(), child.getFileTimestamps());
        assertSame(parent.getContextTimestamps(), child.getContextTimestamps());
        assertSame(parent.getResolverFactory(), child.getResolverFactory());
        assertSame(parent.getInputFileSystem(), child.getInputFileSystem());
        assertSame(parent.getModuleFactory(), child.getModuleFactory());
        assertEquals("child", child.getName());
    }

    @Test
    @Tag("unit")
    void testChild_OutputOverridesLayeredOnParent() throws Exception {
        AtomicReference<Compiler> childRef = new AtomicReference<>();
        parent.hooks.make.tap("spawn", compilation -> childRef.set(compilation.createChildCompiler("child",
                ConfigFactory.parseString("path = \"/out/child\""), List.of())));

        await(parent.run());

        Compiler child = childRef.get();
        assertEquals("/out/child", child.getOutputPath());
        assertEquals(parent.getOptions().output().filename(), child.getOptions().output().filename());
        assertEquals("/out", parent.getOutputPath());
    }

    @Test
    @Tag("unit")
    void testChild_RecordsStayInParentStore() throws Exception {
        AtomicReference<Compiler> childRef = new AtomicReference<>();
        parent.hooks.make.tap("spawn", compilation -> {
            Compiler child = compilation.createChildCompiler("manifest", ConfigFactory.empty(), List.of());
            child.getRecords().put("seen", new JsonPrimitive(true));
            childRef.set(child);
        });
        await(parent.run());
        String written = new String(fs.readFile("/state/records.json"), StandardCharsets.UTF_8);

        Compiler child = childRef.get();
        Records nested = child.getRecords();
        assertThat(child.getOptions().recordsInputPath()).isNull();
        assertThat(child.getOptions().recordsOutputPath()).isNull();

        child.readRecords().get(5, TimeUnit.SECONDS);
        child.emitRecords().get(5, TimeUnit.SECONDS);

        assertSame(nested, child.getRecords());
        assertTrue(child.getRecords().get("seen").getAsBoolean());
        assertEquals(written, new String(fs.readFile("/state/records.json"), StandardCharsets.UTF_8));
    }

    @Test
    @Tag("unit")
    void testRunAsChild_MergesAssetsIntoParent() throws Exception {
        Plugin manifest = compiler -> compiler.hooks.thisCompilation.tap("manifest", compilation ->
                compilation.hooks.additionalAssets.tap("manifest",
                        c -> c.emitAsset("manifest.json", new RawSource("{\"entries\":[]}"))));
        AtomicReference<ChildCompilation> result = new AtomicReference<>();
        parent.hooks.make.tapAsync("spawn", compilation -> compilation
                .createChildCompiler("manifest", ConfigFactory.empty(), List.of(manifest))
                .runAsChild()
                .thenAccept(result::set));

        Stats stats = await(parent.run());

        Compilation parentCompilation = stats.getCompilation();
        assertThat(result.get().entries()).isEmpty();
        assertThat(parentCompilation.getChildren()).containsExactly(result.get().compilation());
        assertThat(parentCompilation.getAssets()).containsKey("manifest.json");
        assertThat(new String(fs.readFile("/out/manifest.json"), StandardCharsets.UTF_8))
                .isEqualTo("{\"entries\":[]}");
    }

    @Test
    @Tag("unit")
    void testRunAsChild_ReturnsEntryModules() throws Exception {
        parent.setModuleFactory((context, dependency) ->
                CompletableFuture.completedFuture(() -> "entry:" + dependency.request()));
        Plugin entry = compiler -> compiler.hooks.make.tapAsync("entry",
                compilation -> compilation.addEntry("/project", new Dependency("./worker"), "worker")
                        .thenApply(module -> null));
        AtomicReference<ChildCompilation> result = new AtomicReference<>();
        parent.hooks.make.tapAsync("spawn", compilation -> compilation
                .createChildCompiler("worker", ConfigFactory.empty(), List.of(entry))
                .runAsChild()
                .thenAccept(result::set));

        await(parent.run());

        assertThat(result.get().entries()).extracting(Module::identifier).containsExactly("entry:./worker");
    }

    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*Compiler", messagePattern = "Build of compiler failed: child broke")
    void testRunAsChild_FailurePropagatesToParentBuild() throws Exception {
        Plugin broken = compiler -> compiler.hooks.afterCompile.tapAsync("broken",
                compilation -> CompletableFuture.failedFuture(new IllegalStateException("child broke")));
        AtomicInteger parentEmits = new AtomicInteger();
        parent.hooks.emit.tap("count", compilation -> parentEmits.incrementAndGet());
        parent.hooks.make.tapAsync("spawn", compilation -> compilation
                .createChildCompiler("broken", ConfigFactory.empty(), List.of(broken))
                .runAsChild()
                .thenApply(child -> null));

        assertThatThrownBy(() -> await(parent.run()))
                .isInstanceOf(ExecutionException.class)
                .hasRootCauseMessage("child broke");
        assertEquals(0, parentEmits.get());
    }

    @Test
    @Tag("unit")
    void testRunAsChild_OnTopLevelCompilerFails() {
        CompletableFuture<ChildCompilation> result = parent.runAsChild();

        assertThatThrownBy(() -> result.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IllegalStateException.class)
                .hasMessageContaining("is not a child compiler");
    }
}
