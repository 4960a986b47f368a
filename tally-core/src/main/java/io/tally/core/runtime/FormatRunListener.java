package io.tally.core.runtime;

import io.tally.api.engine.RunListener;
import io.tally.api.registry.Suite;
import io.tally.api.registry.TestCase;
import io.tally.api.report.ReportCapability;
import io.tally.api.report.ReportFormat;
import io.tally.api.result.FailureRecord;
import io.tally.api.result.FailureType;
import io.tally.api.result.RunSummary;
import io.tally.api.result.TestStatus;
import io.tally.core.metrics.ReportMetrics;

import java.util.List;
import java.util.Objects;

/**
 * Binds a report format's handlers to the engine's lifecycle hooks.
 * Only handlers the format declares in its capabilities are invoked.
 * Reported test outcomes are counted regardless of format.
 */
class FormatRunListener implements RunListener {

    private final ReportFormat format;
    private final ReportMetrics metrics;

    FormatRunListener(ReportFormat format, ReportMetrics metrics) {
        this.format = Objects.requireNonNull(format, "format");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public void testStarted(TestCase test, Suite suite) {
        if (format.supports(ReportCapability.TEST_START)) {
            format.onTestStart(test, suite);
        }
    }

    @Override
    public void testCompleted(TestCase test, Suite suite, List<FailureRecord> failures) {
        metrics.recordTest(format.name(), outcome(failures));
        if (format.supports(ReportCapability.TEST_COMPLETE)) {
            format.onTestComplete(test, suite, failures);
        }
    }

    @Override
    public void allTestsCompleted(RunSummary summary, List<FailureRecord> failures) {
        if (format.supports(ReportCapability.ALL_TESTS_COMPLETE)) {
            format.onAllTestsComplete(summary, failures);
        }
    }

    @Override
    public void suiteInitFailed(Suite suite) {
        if (format.supports(ReportCapability.SUITE_INIT_FAILURE)) {
            format.onSuiteInitFailure(suite);
        }
    }

    @Override
    public void suiteCleanupFailed(Suite suite) {
        if (format.supports(ReportCapability.SUITE_CLEANUP_FAILURE)) {
            format.onSuiteCleanupFailure(suite);
        }
    }

    @Override
    public void suiteCompleted(Suite suite, List<FailureRecord> failures) {
        if (!failures.isEmpty() && failures.get(0).type() == FailureType.SUITE_SETUP_FAILED) {
            for (int i = 0; i < suite.testCount(); i++) {
                metrics.recordTest(format.name(), TestStatus.ERRORED);
            }
        }
        if (format.supports(ReportCapability.SUITE_COMPLETE)) {
            format.onSuiteComplete(suite, failures);
        }
    }

    private static TestStatus outcome(List<FailureRecord> failures) {
        if (failures.isEmpty()) {
            return TestStatus.PASSED;
        }
        return failures.get(0).type() == FailureType.TEST_INACTIVE ? TestStatus.SKIPPED : TestStatus.FAILED;
    }
}
