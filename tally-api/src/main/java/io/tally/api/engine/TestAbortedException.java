package io.tally.api.engine;

/**
 * Thrown by {@link TestContext#require} to stop a test after a fatal assertion.
 * The failure itself is already recorded when this is thrown.
 */
public class TestAbortedException extends RuntimeException {

    public TestAbortedException(String message) {
        super(message);
    }
}
