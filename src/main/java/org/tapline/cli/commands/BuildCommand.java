package org.tapline.cli.commands;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tapline.Tapline;
import org.tapline.cli.CommandLineInterface;
import org.tapline.compiler.Compiler;
import org.tapline.compiler.MultiCompiler;
import org.tapline.compiler.MultiStats;
import org.tapline.compiler.MultiWatching;
import org.tapline.compiler.Stats;
import org.tapline.compiler.Watching;
import org.tapline.compiler.options.CompilerOptions;
import org.tapline.util.Futures;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValueFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Runs one build, or a watch session with {@code --watch}.
 * <p>
 * Command line values override the {@code tapline} section of the configuration. A
 * configuration with {@code tapline.compilers} builds every listed configuration.
 */
@Command(
    name = "build",
    description = "Build the configured entries"
)
public class BuildCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BuildCommand.class);

    @Option(
        names = {"-w", "--watch"},
        description = "Rebuild on changes until interrupted"
    )
    private boolean watch;

    @Option(
        names = {"-e", "--entry"},
        description = "Entry as name=request, may be repeated (replaces configured entries)"
    )
    private Map<String, String> entries = new LinkedHashMap<>();

    @Option(
        names = {"-o", "--output-path"},
        description = "Output directory"
    )
    private String outputPath;

    @Option(
        names = {"--context"},
        description = "Project directory"
    )
    private String context;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        List<CompilerOptions> options;
        Compiler compiler = null;
        MultiCompiler multiCompiler = null;
        try {
            options = CompilerOptions.listFromApplicationConfig(applyOverrides(parent.getConfig()));
            if (options.size() > 1) {
                multiCompiler = Tapline.createAll(options);
            } else {
                compiler = Tapline.create(options.get(0));
            }
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            return 2;
        }

        boolean watchMode = watch || options.stream().anyMatch(CompilerOptions::watch);
        if (multiCompiler != null) {
            return watchMode ? watchAll(multiCompiler) : buildAll(multiCompiler, out, err);
        }
        return watchMode ? watch(compiler, options.get(0)) : build(compiler, out, err);
    }

    private Integer build(Compiler compiler, PrintWriter out, PrintWriter err) {
        try {
            Stats stats = compiler.run().join();
            printStats(stats, out, err);
            return stats.hasErrors() ? 1 : 0;
        } catch (CompletionException e) {
            return reportFailure(e, err);
        } finally {
            // nothing reads the cached files after a one-shot build
            compiler.purgeInputFileSystem();
        }
    }

    private Integer buildAll(MultiCompiler multiCompiler, PrintWriter out, PrintWriter err) {
        try {
            MultiStats stats = multiCompiler.run().join();
            stats.getStats().forEach(each -> printStats(each, out, err));
            return stats.hasErrors() ? 1 : 0;
        } catch (CompletionException e) {
            return reportFailure(e, err);
        } finally {
            multiCompiler.purgeInputFileSystem();
        }
    }

    private static void printStats(Stats stats, PrintWriter out, PrintWriter err) {
        out.println(stats.toSummary());
        stats.getCompilation().getErrors().forEach(error -> err.println("ERROR " + error.getMessage()));
        stats.getCompilation().getWarnings().forEach(warning -> err.println("WARNING " + warning.getMessage()));
    }

    private static Integer reportFailure(CompletionException e, PrintWriter err) {
        Throwable cause = Futures.unwrap(e);
        err.println("Build failed: " + cause.getMessage());
        log.debug("Exception details:", cause);
        return 1;
    }

    private Integer watch(Compiler compiler, CompilerOptions options) {
        Watching watching = compiler.watch(options.watchOptions(), (error, stats) -> {
            if (error != null) {
                log.error("Build failed: {}", error.getMessage());
                compiler.purgeInputFileSystem();
            } else {
                log.info(stats.toSummary());
            }
        });
        Runtime.getRuntime().addShutdownHook(new Thread(() -> watching.close().join(), "tapline-watch-shutdown"));
        log.info("Watching for changes, press Ctrl+C to stop");
        watching.whenClosed().join();
        return 0;
    }

    private Integer watchAll(MultiCompiler multiCompiler) {
        MultiWatching watching = multiCompiler.watch((error, stats) -> {
            if (error != null) {
                log.error("Build failed: {}", error.getMessage());
                multiCompiler.purgeInputFileSystem();
            } else {
                stats.getStats().forEach(each -> log.info(each.toSummary()));
            }
        });
        Runtime.getRuntime().addShutdownHook(new Thread(() -> watching.close().join(), "tapline-watch-shutdown"));
        log.info("Watching {} configurations for changes, press Ctrl+C to stop", multiCompiler.getCompilers().size());
        watching.whenClosed().join();
        return 0;
    }

    /**
     * Applies the command line values to the {@code tapline} section and, when present, to
     * every element of {@code tapline.compilers}.
     *
     * @throws IllegalArgumentException if entries are given together with a list of compilers.
     */
    Config applyOverrides(Config config) {
        if (entries.isEmpty() && outputPath == null && context == null) {
            return config;
        }
        Config section = config.hasPath("tapline") ? config.getConfig("tapline") : ConfigFactory.empty();
        if (section.hasPath("compilers")) {
            if (!entries.isEmpty()) {
                throw new IllegalArgumentException("--entry cannot be combined with tapline.compilers");
            }
            List<ConfigObject> compilers = new ArrayList<>();
            for (Config compiler : section.getConfigList("compilers")) {
                compilers.add(overrideSection(compiler).root());
            }
            section = section.withValue("compilers", ConfigValueFactory.fromIterable(compilers));
        }
        return config.withValue("tapline", overrideSection(section).root());
    }

    private Config overrideSection(Config section) {
        Config result = section;
        if (!entries.isEmpty()) {
            result = result.withValue("entry", ConfigValueFactory.fromMap(entries));
        }
        if (outputPath != null) {
            result = result.withValue("output.path", ConfigValueFactory.fromAnyRef(outputPath));
        }
        if (context != null) {
            result = result.withValue("context", ConfigValueFactory.fromAnyRef(context));
        }
        return result;
    }
}
