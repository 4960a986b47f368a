package io.tally.core.engine;

import io.tally.api.engine.ExecutionEngine;
import io.tally.api.engine.RunListener;
import io.tally.api.engine.SuiteAction;
import io.tally.api.engine.TestAbortedException;
import io.tally.api.registry.Suite;
import io.tally.api.registry.TestCase;
import io.tally.api.registry.TestRegistry;
import io.tally.api.result.FailureRecord;
import io.tally.api.result.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs suites in registry order on the calling thread.
 * <p>
 * For each active suite: setup, every test in order, teardown. A failed setup
 * skips the suite's tests and teardown. Inactive tests are not run and leave a
 * {@code TEST_INACTIVE} record. Failure records are emitted grouped by suite and
 * in test order, so formats can rely on the chain ordering.
 */
public class DefaultExecutionEngine implements ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultExecutionEngine.class);

    @Override
    public RunSummary runAllTests(TestRegistry registry, RunListener listener) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(listener, "listener");

        Counters counters = new Counters();
        List<FailureRecord> chain = new ArrayList<>();

        for (Suite suite : registry) {
            runSuite(suite, listener, counters, chain);
        }

        RunSummary summary = counters.toSummary();
        log.info("Run complete: {} suites run ({} failed), {} tests run ({} failed), {} assertions ({} failed)",
                summary.suitesRun(), summary.suitesFailed(), summary.testsRun(), summary.testsFailed(),
                summary.assertsRun(), summary.assertsFailed());
        listener.allTestsCompleted(summary, List.copyOf(chain));
        return summary;
    }

    private void runSuite(Suite suite, RunListener listener, Counters counters, List<FailureRecord> chain) {
        if (!suite.isActive()) {
            counters.suitesInactive++;
            log.debug("Suite '{}' is inactive, skipping", suite.name());
            return;
        }

        List<FailureRecord> suiteFailures = new ArrayList<>();

        Optional<String> setupError = runSuiteAction(suite.setup());
        if (setupError.isPresent()) {
            log.debug("Setup of suite '{}' failed: {}", suite.name(), setupError.get());
            counters.suitesFailed++;
            suiteFailures.add(FailureRecord.suiteSetupFailed(suite,
                    "Suite Initialization failed - " + setupError.get()));
            chain.addAll(suiteFailures);
            listener.suiteInitFailed(suite);
            listener.suiteCompleted(suite, List.copyOf(suiteFailures));
            return;
        }

        counters.suitesRun++;
        for (TestCase test : suite) {
            listener.testStarted(test, suite);
            List<FailureRecord> testFailures = runTest(suite, test, counters);
            suiteFailures.addAll(testFailures);
            listener.testCompleted(test, suite, testFailures);
        }

        Optional<String> teardownError = runSuiteAction(suite.teardown());
        if (teardownError.isPresent()) {
            log.debug("Teardown of suite '{}' failed: {}", suite.name(), teardownError.get());
            counters.suitesFailed++;
            suiteFailures.add(FailureRecord.suiteTeardownFailed(suite,
                    "Suite Cleanup failed - " + teardownError.get()));
            listener.suiteCleanupFailed(suite);
        }

        chain.addAll(suiteFailures);
        listener.suiteCompleted(suite, List.copyOf(suiteFailures));
    }

    private List<FailureRecord> runTest(Suite suite, TestCase test, Counters counters) {
        if (!test.isActive()) {
            counters.testsInactive++;
            return List.of(FailureRecord.testInactive(suite, test));
        }

        DefaultTestContext context = new DefaultTestContext(suite, test);
        try {
            test.body().run(context);
        } catch (TestAbortedException e) {
            log.debug("Test '{}' aborted: {}", test.name(), e.getMessage());
        } catch (Exception | AssertionError e) {
            context.recordException(e);
        }

        counters.testsRun++;
        counters.assertsRun += context.assertions();
        counters.assertsFailed += context.failedAssertions();
        if (!context.failures().isEmpty()) {
            counters.testsFailed++;
        }
        return List.copyOf(context.failures());
    }

    /**
     * @return the failure message if the action threw or failed an assertion,
     *         empty if it is absent or succeeded
     */
    private static Optional<String> runSuiteAction(Optional<SuiteAction> action) {
        if (action.isEmpty()) {
            return Optional.empty();
        }
        try {
            action.get().run();
            return Optional.empty();
        } catch (Exception | AssertionError e) {
            return Optional.of(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private static final class Counters {
        int suitesRun;
        int suitesFailed;
        int suitesInactive;
        int testsRun;
        int testsFailed;
        int testsInactive;
        int assertsRun;
        int assertsFailed;

        RunSummary toSummary() {
            return new RunSummary(suitesRun, suitesFailed, suitesInactive,
                    testsRun, testsFailed, testsInactive, assertsRun, assertsFailed);
        }
    }
}
