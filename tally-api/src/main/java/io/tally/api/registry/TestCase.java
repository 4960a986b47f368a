package io.tally.api.registry;

import io.tally.api.engine.TestBody;

import java.util.Objects;

/**
 * A single named test within a {@link Suite}.
 * <p>
 * Identity is reference identity: failure records point at the exact
 * instance they were raised for, so two tests that share a name in
 * different suites never compare equal.
 */
public final class TestCase {

    private final String name;
    private final TestBody body;
    private final boolean active;

    private TestCase(String name, TestBody body, boolean active) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Test name must not be blank");
        }
        this.name = name;
        this.body = Objects.requireNonNull(body, "body");
        this.active = active;
    }

    public static TestCase of(String name, TestBody body) {
        return new TestCase(name, body, true);
    }

    public static TestCase inactive(String name, TestBody body) {
        return new TestCase(name, body, false);
    }

    public String name() { return name; }
    public TestBody body() { return body; }
    public boolean isActive() { return active; }

    @Override
    public String toString() {
        return "TestCase[" + name + (active ? "" : ", inactive") + "]";
    }
}
