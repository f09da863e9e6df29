/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Targets.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.targets.app;

import com.hellblazer.targets.color.LookupTables;
import com.hellblazer.targets.color.TransferFunction;
import com.hellblazer.targets.io.ImageSink;
import com.hellblazer.targets.io.PngImageSink;
import com.hellblazer.targets.job.RenderCatalog;
import com.hellblazer.targets.job.RenderException;
import com.hellblazer.targets.job.RenderScheduler;
import com.hellblazer.targets.pattern.PatternRegistry;
import com.hellblazer.targets.post.PostProcessMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Targets command line.
 *
 * <p>Usage:
 * <pre>
 *   java TargetsCommandLine [render] [sizeClass] [options]
 *   java TargetsCommandLine list | --list
 *   java TargetsCommandLine help | --help
 * </pre>
 * With no size class every configured size class is rendered.
 */
public class TargetsCommandLine {
    private static final Logger log = LoggerFactory.getLogger(TargetsCommandLine.class);

    public enum Mode {
        RENDER("render", "Render the test target catalog"),
        LIST("list", "List size classes, densities and patterns"),
        HELP("help", "Show help information");

        private final String command;
        private final String description;

        Mode(String command, String description) {
            this.command = command;
            this.description = description;
        }

        public String getCommand() { return command; }
        public String getDescription() { return description; }

        public static Mode fromString(String command) {
            for (Mode mode : values()) {
                if (mode.command.equals(command)) {
                    return mode;
                }
            }
            return null;
        }
    }

    /**
     * Command line overrides of the static render configuration
     */
    public static class Config {
        public Mode             mode        = Mode.RENDER;
        public String           sizeClass;
        public Path             outputDir   = Path.of(".");
        public int              threads     = Runtime.getRuntime().availableProcessors();
        public PostProcessMode  postProcess = PostProcessMode.CLAMP;
        public TransferFunction transfer    = TransferFunction.SRGB_ENCODE;

        public RenderScheduler.Config toSchedulerConfig() {
            return new RenderScheduler.Config(threads, transfer, postProcess);
        }

        @Override
        public String toString() {
            return String.format("Config[mode=%s, sizeClass=%s, output=%s, threads=%d, post=%s, transfer=%s]", mode,
                                 sizeClass == null ? "all" : sizeClass, outputDir, threads, postProcess, transfer);
        }
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * @return process exit status
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        Config config;
        try {
            config = parseArguments(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println();
            printUsage(err);
            return 1;
        }

        switch (config.mode) {
            case HELP:
                printUsage(out);
                return 0;
            case LIST:
                printCatalog(RenderCatalog.standard(PatternRegistry.standard(LookupTables.build())), out);
                return 0;
            default:
                return render(config, err);
        }
    }

    static Config parseArguments(String[] args) {
        var config = new Config();
        int i = 0;
        if (args.length > 0) {
            var mode = Mode.fromString(args[0].startsWith("--") ? args[0].substring(2) : args[0]);
            if (mode != null && (mode != Mode.RENDER || !args[0].startsWith("--"))) {
                config.mode = mode;
                i = 1;
            }
        }
        if (config.mode != Mode.RENDER) {
            if (args.length > 1) {
                throw new IllegalArgumentException("Mode " + config.mode.getCommand() + " takes no options");
            }
            return config;
        }

        for (; i < args.length; i++) {
            switch (args[i]) {
                case "--output":
                    config.outputDir = Path.of(getArgValue(args, ++i));
                    break;
                case "--threads":
                    config.threads = parseThreads(getArgValue(args, ++i));
                    break;
                case "--post":
                    config.postProcess = PostProcessMode.fromString(getArgValue(args, ++i));
                    break;
                case "--transfer":
                    config.transfer = TransferFunction.fromString(getArgValue(args, ++i));
                    break;
                default:
                    if (args[i].startsWith("--")) {
                        throw new IllegalArgumentException("Unknown render option: " + args[i]);
                    }
                    if (config.sizeClass != null) {
                        throw new IllegalArgumentException("Only one size class may be selected, got: "
                                                           + config.sizeClass + " and " + args[i]);
                    }
                    config.sizeClass = args[i];
            }
        }
        return config;
    }

    private static String getArgValue(String[] args, int index) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for argument: " + args[index - 1]);
        }
        return args[index];
    }

    private static int parseThreads(String value) {
        int threads;
        try {
            threads = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Threads must be an integer, got: " + value);
        }
        if (threads < 1) {
            throw new IllegalArgumentException("Threads must be at least 1, got: " + threads);
        }
        return threads;
    }

    private static int render(Config config, PrintStream err) {
        log.info("Targets: {}", config);
        try {
            var tables = LookupTables.build();
            var catalog = RenderCatalog.standard(PatternRegistry.standard(tables));
            ImageSink sink = new PngImageSink(config.outputDir);
            var scheduler = new RenderScheduler(catalog, tables, sink, config.toSchedulerConfig());
            var report = scheduler.run(config.sizeClass);
            log.info("{}", report);
            return 0;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException | RenderException e) {
            log.error("Render failed", e);
            err.println("Render failed: " + e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Render interrupted");
            return 1;
        }
    }

    static void printCatalog(RenderCatalog catalog, PrintStream out) {
        out.println("Size classes:");
        for (var sizeClass : catalog.getSizeClasses()) {
            out.printf("  %-8s %dx%d%n", sizeClass.name(), sizeClass.width(), sizeClass.height());
        }
        out.println("Densities: " + catalog.getDensities());
        out.println("Patterns:");
        for (var pattern : catalog.getPatterns().patterns()) {
            out.printf("  %-20s %s%n", pattern.name(), pattern.family());
        }
    }

    private static void printUsage(PrintStream out) {
        out.println("Targets - procedural test target synthesis");
        out.println("Usage: java TargetsCommandLine [mode] [sizeClass] [options]");
        out.println("       java TargetsCommandLine --list | --help");
        out.println();
        out.println("Modes:");
        for (Mode mode : Mode.values()) {
            out.printf("  %-12s %s%n", mode.getCommand(), mode.getDescription());
        }
        out.println();
        out.println("render [sizeClass] [options]");
        out.println("  sizeClass            Render only this size class (default: all)");
        out.println("  --output <dir>       Output directory (default: .)");
        out.println("  --threads <n>        Worker threads (default: CPU cores)");
        out.println("  --post <mode>        dither | clamp | none (default: clamp)");
        out.println("  --transfer <fn>      linear | srgb | srgb-inverse | gamma22 | gamma22-inverse (default: srgb)");
    }
}
