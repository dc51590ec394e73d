package org.tapline.compiler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.tapline.compiler.options.CompilerOptions;
import org.tapline.fs.InputFileSystem;
import org.tapline.fs.MemoryFileSystem;
import org.tapline.junit.extensions.logging.ExpectLog;
import org.tapline.junit.extensions.logging.LogLevel;
import org.tapline.junit.extensions.logging.LogWatchExtension;
import org.tapline.watch.WatchFileSystem;
import org.tapline.watch.Watcher;

import com.typesafe.config.ConfigFactory;

/**
 * Tests for running and watching several compilers together.
 */
@ExtendWith(LogWatchExtension.class)
class MultiCompilerTest {

    private MemoryFileSystem fs;
    private Compiler web;
    private Compiler worker;
    private MultiCompiler multiCompiler;

    @BeforeEach
    void setUp() {
        fs = new MemoryFileSystem();
        web = compiler("web");
        worker = compiler("worker");
        multiCompiler = new MultiCompiler(List.of(web, worker));
    }

    private Compiler compiler(String name) {
        Compiler compiler = new Compiler(CompilerOptions.fromConfig(ConfigFactory.parseString(
                "name = \"" + name + "\"\noutput.path = \"/out/[name]\"")));
        compiler.setInputFileSystem(fs);
        compiler.setOutputFileSystem(fs);
        compiler.setExecutor(Runnable::run);
        compiler.hooks.thisCompilation.tap("asset", compilation ->
                compilation.hooks.additionalAssets.tap("asset", c -> c.emitAsset(name + ".js", new RawSource(name))));
        return compiler;
    }

    @Test
    @Tag("unit")
    void testRun_BuildsEveryCompilerAndAggregatesStats() throws Exception {
        List<MultiStats> reported = new CopyOnWriteArrayList<>();
        multiCompiler.hooks.done.tap("record", reported::add);

        MultiStats stats = multiCompiler.run().get(5, TimeUnit.SECONDS);

        assertThat(stats.getStats()).extracting(s -> s.getCompilation().getName()).containsExactly("web", "worker");
        assertThat(fs.exists("/out/web/web.js")).isTrue();
        assertThat(fs.exists("/out/worker/worker.js")).isTrue();
        assertFalse(stats.hasErrors());
        assertThat(stats.toSummary().lines()).hasSize(2);
        assertThat(reported).hasSize(1);
        assertThat(reported.get(0).getStats()).isEqualTo(stats.getStats());
        assertFalse(multiCompiler.isRunning());
    }

    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*Compiler", messagePattern = "Build of compiler 'worker' failed: worker broke")
    void testRun_OneFailingCompilerFailsTheRunAfterAllSettle() {
        worker.hooks.make.tap("broken", compilation -> {
            throw new IllegalStateException("worker broke");
        });

        assertThatThrownBy(() -> multiCompiler.run().get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IllegalStateException.class)
                .hasRootCauseMessage("worker broke");
        assertThat(fs.exists("/out/web/web.js")).isTrue();
        assertFalse(web.isRunning());
        assertFalse(worker.isRunning());
    }

    @Test
    @Tag("unit")
    void testRun_WhileOneCompilerRunning_StartsNothing() throws Exception {
        CompletableFuture<Void> gate = new CompletableFuture<>();
        web.hooks.afterCompile.tapAsync("gate", compilation -> gate);
        AtomicInteger workerCompiles = new AtomicInteger();
        worker.hooks.compile.tap("count", params -> workerCompiles.incrementAndGet());
        CompletableFuture<Stats> webBuild = web.run();

        assertThatThrownBy(() -> multiCompiler.run().get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(ConcurrentCompilationException.class);
        assertThat(workerCompiles).hasValue(0);

        gate.complete(null);
        webBuild.get(5, TimeUnit.SECONDS);
    }

    @Test
    @Tag("unit")
    void testInvalid_FiresOnceAndWithholdsStatsUntilRebuilt() throws Exception {
        AtomicInteger invalidations = new AtomicInteger();
        multiCompiler.hooks.invalid.tap("count", v -> invalidations.incrementAndGet());
        multiCompiler.run().get(5, TimeUnit.SECONDS);

        web.hooks.invalid.call(new InvalidEvent("/src/web.txt", 1L));
        worker.hooks.invalid.call(new InvalidEvent("/src/worker.txt", 2L));

        assertThat(invalidations).hasValue(1);
        assertNull(multiCompiler.completedStats());
    }

    @Test
    @Tag("unit")
    void testWatch_ReportsWhenEveryCompilerFinishedAndClosesAll() throws Exception {
        WatchFileSystem watchFileSystem = mock(WatchFileSystem.class);
        when(watchFileSystem.watch(any(), any(), any(), anyLong(), any(), any(), any()))
                .thenAnswer(invocation -> mock(Watcher.class));
        web.setWatchFileSystem(watchFileSystem);
        worker.setWatchFileSystem(watchFileSystem);
        AtomicInteger closeCalls = new AtomicInteger();
        multiCompiler.hooks.watchClose.tap("count", v -> closeCalls.incrementAndGet());
        List<MultiStats> reported = new CopyOnWriteArrayList<>();

        MultiWatching watching = multiCompiler.watch((error, stats) -> reported.add(stats));

        await().atMost(5, TimeUnit.SECONDS).until(() -> !reported.isEmpty());
        assertThat(reported.get(0).getStats()).hasSize(2);
        assertThat(watching.getWatchings()).hasSize(2);
        assertTrue(multiCompiler.isRunning());

        watching.close().get(5, TimeUnit.SECONDS);

        assertThat(watching.whenClosed()).isCompleted();
        assertThat(closeCalls).hasValue(1);
        assertFalse(web.isRunning());
        assertFalse(worker.isRunning());
    }

    @Test
    @Tag("unit")
    void testWatch_CompilerAlreadyRunning_OpensNoSession() throws Exception {
        CompletableFuture<Void> gate = new CompletableFuture<>();
        worker.hooks.afterCompile.tapAsync("gate", compilation -> gate);
        CompletableFuture<Stats> workerBuild = worker.run();

        assertThatThrownBy(() -> multiCompiler.watch((error, stats) -> { }))
                .isInstanceOf(ConcurrentCompilationException.class);
        assertFalse(web.isRunning());

        gate.complete(null);
        workerBuild.get(5, TimeUnit.SECONDS);
    }

    @Test
    @Tag("unit")
    void testPurgeInputFileSystem_PurgesEveryCompiler() {
        InputFileSystem webInput = mock(InputFileSystem.class);
        InputFileSystem workerInput = mock(InputFileSystem.class);
        web.setInputFileSystem(webInput);
        worker.setInputFileSystem(workerInput);

        multiCompiler.purgeInputFileSystem();

        verify(webInput).purge();
        verify(workerInput).purge();
    }

    @Test
    @Tag("unit")
    void testConstructor_RejectsEmptyList() {
        assertThatThrownBy(() -> new MultiCompiler(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
