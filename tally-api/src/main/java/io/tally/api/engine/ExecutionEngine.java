package io.tally.api.engine;

import io.tally.api.registry.TestRegistry;
import io.tally.api.result.RunSummary;

/**
 * Runs the suites of a registry and reports progress through a {@link RunListener}.
 * <p>
 * Implementations must emit failure records grouped by suite and, within a
 * suite, in the order of the suite's tests.
 */
public interface ExecutionEngine {

    /**
     * Run every suite of the registry.
     *
     * @param registry the suites to run
     * @param listener receives lifecycle events in order
     * @return counters for the completed run
     */
    RunSummary runAllTests(TestRegistry registry, RunListener listener);
}
