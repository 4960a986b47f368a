package io.tally.api.result;

import io.tally.api.registry.Suite;
import io.tally.api.registry.TestCase;

import java.util.*;

/**
 * The failure chain of one suite, grouped by where each record belongs.
 * <p>
 * Grouping replaces a lock-step walk of the suite's tests against the chain:
 * classification no longer depends on the chain following test order. Records
 * are consumed from the head of the chain while they belong to the suite; a
 * record that names a test the suite does not contain is rejected.
 * Once a setup failure is seen no further records are consulted, because
 * none of the suite's tests ran.
 */
public final class SuiteFailures {

    private final Suite suite;
    private final FailureRecord setupFailure;
    private final FailureRecord teardownFailure;
    private final Map<TestCase, List<FailureRecord>> byTest;

    private SuiteFailures(Suite suite, FailureRecord setupFailure, FailureRecord teardownFailure,
                          Map<TestCase, List<FailureRecord>> byTest) {
        this.suite = suite;
        this.setupFailure = setupFailure;
        this.teardownFailure = teardownFailure;
        this.byTest = byTest;
    }

    /**
     * Group the records of a suite's failure chain.
     *
     * @param suite the suite that completed
     * @param chain the chain starting at the suite's first record (may be empty, never null)
     * @return the grouped failures
     * @throws IllegalStateException if a record names a test outside the suite
     */
    public static SuiteFailures group(Suite suite, List<FailureRecord> chain) {
        Objects.requireNonNull(suite, "suite");
        Objects.requireNonNull(chain, "chain");

        FailureRecord setup = null;
        FailureRecord teardown = null;
        Map<TestCase, List<FailureRecord>> byTest = new IdentityHashMap<>();

        for (FailureRecord record : chain) {
            if (record.suite() != suite) {
                break;
            }
            switch (record.type()) {
                case SUITE_SETUP_FAILED -> setup = record;
                case SUITE_TEARDOWN_FAILED -> {
                    if (teardown == null) {
                        teardown = record;
                    }
                }
                default -> {
                    if (!suite.contains(record.test())) {
                        throw new IllegalStateException("Failure record for test '" + record.test().name()
                                + "' is not part of suite '" + suite.name() + "'");
                    }
                    byTest.computeIfAbsent(record.test(), t -> new ArrayList<>()).add(record);
                }
            }
            if (setup != null) {
                break;
            }
        }

        if (setup != null) {
            return new SuiteFailures(suite, setup, null, Map.of());
        }
        return new SuiteFailures(suite, null, teardown, byTest);
    }

    public Suite suite() { return suite; }

    public Optional<FailureRecord> setupFailure() {
        return Optional.ofNullable(setupFailure);
    }

    public Optional<FailureRecord> teardownFailure() {
        return Optional.ofNullable(teardownFailure);
    }

    /**
     * @return the records of the given test in chain order, empty if it passed
     */
    public List<FailureRecord> failuresFor(TestCase test) {
        List<FailureRecord> records = byTest.get(test);
        return records == null ? List.of() : Collections.unmodifiableList(records);
    }

    public TestStatus statusOf(TestCase test) {
        if (setupFailure != null) {
            return TestStatus.ERRORED;
        }
        List<FailureRecord> records = failuresFor(test);
        if (records.isEmpty()) {
            return TestStatus.PASSED;
        }
        return records.get(0).type() == FailureType.TEST_INACTIVE ? TestStatus.SKIPPED : TestStatus.FAILED;
    }

    public boolean isEmpty() {
        return setupFailure == null && teardownFailure == null && byTest.isEmpty();
    }
}
