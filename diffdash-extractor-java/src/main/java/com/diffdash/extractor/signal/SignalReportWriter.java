package com.diffdash.extractor.signal;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.annotations.SerializedName;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Serializes a {@link SignalBundle} to a JSON report ({@code signals.json} by default).
 * Signals keep collection order, which is already deterministic for a given input.
 */
public class SignalReportWriter {

    public static final String REPORT_FILE = "signals.json";

    public static class ReportWriteException extends RuntimeException {
        public ReportWriteException(String msg, Throwable cause) { super(msg, cause); }
    }

    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    /**
     * Writes {@code bundle} to {@code reportPath}, creating parent directories if absent.
     * An existing directory is written into as {@code <dir>/signals.json}.
     *
     * @return path of the written report
     */
    public Path write(SignalBundle bundle, Path reportPath) {
        if (Files.isDirectory(reportPath)) {
            reportPath = reportPath.resolve(REPORT_FILE);
        }
        Path parent = reportPath.toAbsolutePath().getParent();
        try {
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new ReportWriteException("Could not create output directory: " + parent, e);
        }

        Report report = new Report(
            new Summary(bundle.logs().size(), bundle.metrics().size(), bundle.dynamicMetricCalls().size()),
            bundle.logs(),
            bundle.metrics(),
            bundle.dynamicMetricCalls()
        );

        try (Writer w = Files.newBufferedWriter(reportPath, StandardCharsets.UTF_8)) {
            gson.toJson(report, w);
        } catch (IOException e) {
            throw new ReportWriteException("Failed to write " + reportPath + ": " + e.getMessage(), e);
        }
        System.err.println("[diffdash] Report written: " + reportPath);
        return reportPath;
    }

    private record Report(
        @SerializedName("summary")         Summary summary,
        @SerializedName("logs")            List<Signal> logs,
        @SerializedName("metrics")         List<Signal> metrics,
        @SerializedName("dynamic_metrics") List<DynamicMetricCall> dynamicMetrics
    ) {}

    private record Summary(
        @SerializedName("logs")            int logs,
        @SerializedName("metrics")         int metrics,
        @SerializedName("dynamic_metrics") int dynamicMetrics
    ) {}
}
