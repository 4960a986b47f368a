package io.tally.core.engine;

import io.tally.api.engine.TestAbortedException;
import io.tally.api.engine.TestContext;
import io.tally.api.registry.Suite;
import io.tally.api.registry.TestCase;
import io.tally.api.result.FailureRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Collects the assertions of one running test.
 * The source location of a failure is taken from the frame that called into the context.
 */
public class DefaultTestContext implements TestContext {

    private static final Set<String> CONTEXT_CLASSES = Set.of(
            DefaultTestContext.class.getName(),
            TestContext.class.getName());

    private final Suite suite;
    private final TestCase test;
    private final List<FailureRecord> failures = new ArrayList<>();
    private int assertions;

    public DefaultTestContext(Suite suite, TestCase test) {
        this.suite = suite;
        this.test = test;
    }

    @Override
    public boolean check(boolean condition, String expression) {
        assertions++;
        if (!condition) {
            StackWalker.StackFrame caller = callerFrame().orElse(null);
            failures.add(FailureRecord.assertion(suite, test, expression,
                    caller != null ? caller.getFileName() : "",
                    caller != null ? Math.max(caller.getLineNumber(), 0) : 0));
        }
        return condition;
    }

    @Override
    public void require(boolean condition, String expression) {
        if (!check(condition, expression)) {
            throw new TestAbortedException(expression);
        }
    }

    @Override
    public void fail(String message) {
        check(false, message);
    }

    /**
     * Record an exception that escaped the test body as a failed assertion.
     */
    public void recordException(Throwable error) {
        assertions++;
        StackTraceElement origin = error.getStackTrace().length > 0 ? error.getStackTrace()[0] : null;
        failures.add(FailureRecord.assertion(suite, test,
                "Unexpected exception: " + error,
                origin != null ? origin.getFileName() : "",
                origin != null ? Math.max(origin.getLineNumber(), 0) : 0));
    }

    public List<FailureRecord> failures() {
        return Collections.unmodifiableList(failures);
    }

    public int assertions() {
        return assertions;
    }

    public int failedAssertions() {
        return failures.size();
    }

    private static Optional<StackWalker.StackFrame> callerFrame() {
        return StackWalker.getInstance().walk(frames -> frames
                .filter(f -> !CONTEXT_CLASSES.contains(f.getClassName()))
                .findFirst());
    }
}
