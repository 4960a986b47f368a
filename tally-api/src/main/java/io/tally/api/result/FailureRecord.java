package io.tally.api.result;

import io.tally.api.registry.Suite;
import io.tally.api.registry.TestCase;

import java.util.Objects;

/**
 * One detected failure: an assertion, a setup/teardown failure, or an inactive-test marker.
 * <p>
 * The records of a run form an ordered chain. Records are grouped by suite and,
 * within a suite, follow the suite's test order. Suite-level kinds carry no test.
 */
public record FailureRecord(
        FailureType type,
        Suite suite,
        TestCase test,
        String condition,
        String fileName,
        int lineNumber
) {

    public FailureRecord {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(suite, "suite");
        if (type.isSuiteLevel() && test != null) {
            throw new IllegalArgumentException(type + " must not reference a test");
        }
        if (!type.isSuiteLevel() && test == null) {
            throw new IllegalArgumentException(type + " requires a test");
        }
        condition = condition == null ? "" : condition;
        fileName = fileName == null ? "" : fileName;
        if (lineNumber < 0) {
            throw new IllegalArgumentException("Line number must be non-negative");
        }
    }

    public static FailureRecord suiteSetupFailed(Suite suite, String condition) {
        return new FailureRecord(FailureType.SUITE_SETUP_FAILED, suite, null, condition, "", 0);
    }

    public static FailureRecord suiteTeardownFailed(Suite suite, String condition) {
        return new FailureRecord(FailureType.SUITE_TEARDOWN_FAILED, suite, null, condition, "", 0);
    }

    public static FailureRecord testInactive(Suite suite, TestCase test) {
        return new FailureRecord(FailureType.TEST_INACTIVE, suite, test, "Test inactive", "", 0);
    }

    public static FailureRecord assertion(Suite suite, TestCase test, String condition,
                                          String fileName, int lineNumber) {
        return new FailureRecord(FailureType.ASSERTION_FAILED, suite, test, condition, fileName, lineNumber);
    }

    /**
     * @return true if this record was raised for exactly the given test instance
     */
    public boolean belongsTo(TestCase other) {
        return test != null && test == other;
    }
}
