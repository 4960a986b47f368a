package io.tally.api.result;

/**
 * Kind of problem a {@link FailureRecord} describes.
 */
public enum FailureType {

    ASSERTION_FAILED(false),
    SUITE_SETUP_FAILED(true),
    SUITE_TEARDOWN_FAILED(true),
    TEST_INACTIVE(false);

    private final boolean suiteLevel;

    FailureType(boolean suiteLevel) {
        this.suiteLevel = suiteLevel;
    }

    /**
     * @return true if records of this kind are attached to a suite rather than a test
     */
    public boolean isSuiteLevel() {
        return suiteLevel;
    }
}
