package io.tally.api.result;

/**
 * Aggregate counters for one completed run, produced by the execution engine.
 */
public record RunSummary(
        int suitesRun,
        int suitesFailed,
        int suitesInactive,
        int testsRun,
        int testsFailed,
        int testsInactive,
        int assertsRun,
        int assertsFailed
) {

    public static final RunSummary EMPTY = new RunSummary(0, 0, 0, 0, 0, 0, 0, 0);

    public RunSummary {
        if (suitesRun < 0 || suitesFailed < 0 || suitesInactive < 0
                || testsRun < 0 || testsFailed < 0 || testsInactive < 0
                || assertsRun < 0 || assertsFailed < 0) {
            throw new IllegalArgumentException("Run summary counters must be non-negative");
        }
    }

    public int testsSucceeded() {
        return testsRun - testsFailed;
    }

    public int assertsSucceeded() {
        return assertsRun - assertsFailed;
    }
}
