package io.tally.api.report;

/**
 * The optional handlers a {@link ReportFormat} may implement.
 * A format that does not declare a capability is never called for it.
 */
public enum ReportCapability {
    TEST_START,
    TEST_COMPLETE,
    ALL_TESTS_COMPLETE,
    SUITE_INIT_FAILURE,
    SUITE_CLEANUP_FAILURE,
    SUITE_COMPLETE,
    LIST_ALL_TESTS
}
