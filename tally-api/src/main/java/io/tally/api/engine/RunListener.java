package io.tally.api.engine;

import io.tally.api.registry.Suite;
import io.tally.api.registry.TestCase;
import io.tally.api.result.FailureRecord;
import io.tally.api.result.RunSummary;

import java.util.List;

/**
 * Lifecycle hooks an {@link ExecutionEngine} calls synchronously, on the thread
 * running the tests. All methods are optional.
 * <p>
 * Order for a suite whose setup succeeds: {@code testStarted}/{@code testCompleted}
 * per test, then {@code suiteCleanupFailed} if teardown fails, then
 * {@code suiteCompleted}. A failed setup produces {@code suiteInitFailed} followed
 * by {@code suiteCompleted} and no test events. {@code allTestsCompleted} is last.
 */
public interface RunListener {

    default void testStarted(TestCase test, Suite suite) {}

    /**
     * @param failures the test's failure records in chain order, empty if it passed
     */
    default void testCompleted(TestCase test, Suite suite, List<FailureRecord> failures) {}

    /**
     * @param failures every failure record of the run in chain order
     */
    default void allTestsCompleted(RunSummary summary, List<FailureRecord> failures) {}

    default void suiteInitFailed(Suite suite) {}

    default void suiteCleanupFailed(Suite suite) {}

    /**
     * @param failures the suite's failure records in chain order, empty if nothing failed
     */
    default void suiteCompleted(Suite suite, List<FailureRecord> failures) {}
}
