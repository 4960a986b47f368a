package io.tally.api.result;

/**
 * Outcome of a single test as seen by the per-suite report formats.
 */
public enum TestStatus {
    PASSED,
    FAILED,
    SKIPPED,
    /** The suite setup failed, so the test never ran. */
    ERRORED
}
