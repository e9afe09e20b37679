package com.diffdash.extractor;

import com.diffdash.extractor.config.ExtractorConfig;
import com.diffdash.extractor.config.ExtractorConfigReader;
import com.diffdash.extractor.signal.SignalBundle;
import com.diffdash.extractor.signal.SignalReportWriter;
import com.diffdash.extractor.static_analysis.CollectionResult;
import com.diffdash.extractor.static_analysis.SignalCollector;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line entry point.
 *
 * Usage:
 *   java -jar diffdash-extractor-java.jar scan \
 *     --root   <repository-root> \
 *     --output <report.json> \
 *     [--config <config.json>] [--exclude-interpolated] \
 *     <changed-file>...
 */
public class ExtractorMain {

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[diffdash] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar diffdash-extractor-java.jar scan " +
                               "--root <dir> --output <file> [--config <file>] [--exclude-interpolated] <file>...");
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[diffdash] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static Path run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        if (!args[0].equals("scan")) {
            throw new UsageException("Unknown subcommand: " + args[0]);
        }

        // Parse flags
        String rootDir = null;
        String outputPath = null;
        String configPath = null;
        boolean excludeInterpolated = false;
        List<String> files = new ArrayList<>();

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--root"                 -> rootDir    = requireNext(args, i++, "--root");
                case "--output"               -> outputPath = requireNext(args, i++, "--output");
                case "--config"               -> configPath = requireNext(args, i++, "--config");
                case "--exclude-interpolated" -> excludeInterpolated = true;
                default -> {
                    if (args[i].startsWith("--")) throw new UsageException("Unknown flag: " + args[i]);
                    files.add(args[i]);
                }
            }
        }

        if (rootDir == null)    throw new UsageException("--root is required");
        if (outputPath == null) throw new UsageException("--output is required");
        if (files.isEmpty())    throw new UsageException("At least one changed file is required");

        Path root = Paths.get(rootDir).toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new UsageException("--root is not a directory: " + root);
        }

        // 1. Configuration
        ExtractorConfig config = new ExtractorConfig();
        if (configPath != null) {
            System.err.println("[diffdash] Reading config: " + configPath);
            config = new ExtractorConfigReader().read(Paths.get(configPath));
        }
        if (excludeInterpolated) {
            config.setExcludeInterpolatedLogs(true);
        }

        // 2. Collect; relative file arguments are taken from the repository root
        List<Path> changedFiles = new ArrayList<>();
        for (String file : files) {
            changedFiles.add(root.resolve(file).normalize());
        }
        System.err.println("[diffdash] Scanning " + changedFiles.size() + " file(s) under: " + root);
        CollectionResult result = new SignalCollector(root, config).collect(changedFiles);

        // 3. Report
        SignalBundle bundle = SignalBundle.of(result.signals(), result.dynamicMetricCalls());
        if (config.isExcludeInterpolatedLogs()) {
            bundle = bundle.withoutInterpolatedLogs();
        }
        Path written = new SignalReportWriter().write(bundle, Paths.get(outputPath));

        System.err.println("[diffdash] Done.");
        return written;
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
