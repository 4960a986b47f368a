package io.tally.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.tally.api.result.TestStatus;

import java.time.Duration;
import java.util.Locale;

/**
 * Report metrics using Micrometer.
 * Counts automated runs, report failures by phase and reported tests by outcome,
 * and times each run, all tagged with the report format.
 */
public class ReportMetrics {

    public static final String RUNS = "tally.report.runs";
    public static final String FAILURES = "tally.report.failures";
    public static final String TESTS = "tally.report.tests";
    public static final String DURATION = "tally.report.duration";

    private final MeterRegistry registry;

    public ReportMetrics() {
        this(new SimpleMeterRegistry());
    }

    public ReportMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRun(String format, Duration duration) {
        Counter.builder(RUNS)
                .tag("format", format)
                .register(registry)
                .increment();
        Timer.builder(DURATION)
                .tag("format", format)
                .register(registry)
                .record(duration);
    }

    /**
     * @param phase the failed step: "open", "close" or "listing"
     */
    public void recordFailure(String format, String phase) {
        Counter.builder(FAILURES)
                .tag("format", format)
                .tag("phase", phase)
                .register(registry)
                .increment();
    }

    public void recordTest(String format, TestStatus status) {
        Counter.builder(TESTS)
                .tag("format", format)
                .tag("outcome", status.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public MeterRegistry registry() {
        return registry;
    }
}
