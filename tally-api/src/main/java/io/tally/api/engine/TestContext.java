package io.tally.api.engine;

/**
 * Assertion surface handed to a running {@link TestBody}.
 * <p>
 * Every call counts as one assertion. A failed assertion becomes a failure
 * record carrying the source file and line of the caller.
 */
public interface TestContext {

    /**
     * Record a non-fatal assertion; the test keeps running when it fails.
     *
     * @param condition  outcome of the check
     * @param expression text describing the check, used as the failure condition
     * @return the value of {@code condition}
     */
    boolean check(boolean condition, String expression);

    /**
     * Record a fatal assertion; a failure aborts the rest of the test body.
     *
     * @throws TestAbortedException if {@code condition} is false
     */
    void require(boolean condition, String expression);

    /**
     * Record an unconditional failure and keep running.
     */
    void fail(String message);

    default boolean checkEquals(Object expected, Object actual) {
        return check(java.util.Objects.equals(expected, actual),
                "expected <" + expected + "> but was <" + actual + ">");
    }
}
