package io.tally.core.runtime;

import io.tally.api.config.ReportConfig;
import io.tally.api.engine.ExecutionEngine;
import io.tally.api.registry.TestRegistry;
import io.tally.api.report.ReportCapability;
import io.tally.api.report.ReportContext;
import io.tally.api.report.ReportFormat;
import io.tally.api.report.ReportStatus;
import io.tally.core.metrics.ReportMetrics;
import io.tally.core.report.ReportFormatRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

/**
 * Runs every registered suite and writes the report of the active format.
 * <p>
 * Usage:
 * <pre>{@code
 * var runner = AutomatedRunner.configure(new DefaultExecutionEngine(),
 *         ReportConfig.create().outputRoot("build/MyTests").format("junit"));
 * runner.setRegistry(registry);
 * ReportStatus status = runner.runAutomated();
 * }</pre>
 * <p>
 * A report that cannot be opened skips the run; a report that cannot be closed is
 * reported after the run. Both are logged and returned as a {@link ReportStatus}.
 * A missing registry or format is a programming error and throws. An exception
 * escaping the engine still closes the report before it propagates.
 */
public class AutomatedRunner {

    private static final Logger log = LoggerFactory.getLogger(AutomatedRunner.class);

    private final ExecutionEngine engine;
    private final ReportFormatRegistry formats;
    private final ReportMetrics metrics;
    private TestRegistry registry;
    private String outputRoot;
    private String packageName = "";

    public AutomatedRunner(ExecutionEngine engine) {
        this(engine, ReportFormatRegistry.withBuiltins(), new ReportMetrics());
    }

    public AutomatedRunner(ExecutionEngine engine, ReportFormatRegistry formats, ReportMetrics metrics) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.formats = Objects.requireNonNull(formats, "formats");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Create a runner with the built-in formats, configured from {@code config}.
     */
    public static AutomatedRunner configure(ExecutionEngine engine, ReportConfig config) {
        AutomatedRunner runner = new AutomatedRunner(engine);
        runner.formats.activate(config.format());
        runner.setOutputFilename(config.outputRoot());
        runner.setPackageName(config.packageName());
        return runner;
    }

    public AutomatedRunner setRegistry(TestRegistry registry) {
        this.registry = registry;
        return this;
    }

    /**
     * Replace the active report format.
     *
     * @throws IllegalStateException if a run is in progress
     */
    public AutomatedRunner setReportFormat(ReportFormat format) {
        formats.activate(format);
        if (outputRoot != null) {
            format.setOutputFilename(outputRoot);
        }
        return this;
    }

    /**
     * Set the root used to derive output file names. Null or empty selects the default root.
     */
    public AutomatedRunner setOutputFilename(String root) {
        this.outputRoot = root;
        formats.active().ifPresent(f -> f.setOutputFilename(root));
        return this;
    }

    public AutomatedRunner setPackageName(String packageName) {
        this.packageName = ReportConfig.normalizePackageName(packageName);
        return this;
    }

    public String packageName() {
        return packageName;
    }

    public ReportFormatRegistry formats() {
        return formats;
    }

    public ReportMetrics metrics() {
        return metrics;
    }

    /**
     * Run all tests, reporting through the active format.
     */
    public ReportStatus runAutomated() {
        return runAutomated(formats.requireActive());
    }

    /**
     * Run all tests, reporting through the given format.
     */
    public ReportStatus runAutomated(ReportFormat format) {
        Objects.requireNonNull(format, "format");
        TestRegistry runRegistry = requireRegistry();

        if (outputRoot != null) {
            format.setOutputFilename(outputRoot);
        }
        formats.beginRun();
        try {
            try {
                format.openReport(new ReportContext(runRegistry, packageName));
            } catch (IOException e) {
                log.error("Failed to create/initialize the result file for format {}", format.name(), e);
                metrics.recordFailure(format.name(), "open");
                return ReportStatus.OPEN_FAILED;
            }

            log.info("Running {} suites with {} report", runRegistry.numberOfSuites(), format.name());
            long start = System.nanoTime();
            try {
                engine.runAllTests(runRegistry, new FormatRunListener(format, metrics));
            } catch (RuntimeException | Error e) {
                log.error("Run aborted, closing the result files for format {}", format.name(), e);
                closeAfterAbort(format, e);
                throw e;
            }
            ReportStatus status = ReportStatus.OK;

            try {
                format.closeReport();
            } catch (IOException e) {
                log.error("Failed to close/uninitialize the result files for format {}", format.name(), e);
                metrics.recordFailure(format.name(), "close");
                status = ReportStatus.CLOSE_FAILED;
            }
            metrics.recordRun(format.name(), Duration.ofNanos(System.nanoTime() - start));
            return status;
        } finally {
            formats.endRun();
        }
    }

    /**
     * Write the static test listing of the active format.
     *
     * @return {@link ReportStatus#NOT_SUPPORTED} if the format has no listing
     */
    public ReportStatus listTestsToFile() {
        ReportFormat format = formats.requireActive();
        TestRegistry listRegistry = requireRegistry();

        if (!format.supports(ReportCapability.LIST_ALL_TESTS)) {
            log.debug("Report format {} does not support test listings", format.name());
            return ReportStatus.NOT_SUPPORTED;
        }
        ReportStatus status = format.listAllTests(listRegistry);
        if (!status.isSuccess()) {
            metrics.recordFailure(format.name(), "listing");
        }
        return status;
    }

    /**
     * Close the report of an aborted run; close failures are attached to {@code cause}.
     */
    private void closeAfterAbort(ReportFormat format, Throwable cause) {
        try {
            format.closeReport();
        } catch (IOException | RuntimeException e) {
            metrics.recordFailure(format.name(), "close");
            cause.addSuppressed(e);
        }
    }

    private TestRegistry requireRegistry() {
        if (registry == null) {
            throw new IllegalStateException("Test registry is not set");
        }
        return registry;
    }
}
