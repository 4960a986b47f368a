package io.tally.api.registry;

import io.tally.api.engine.SuiteAction;
import io.tally.api.engine.TestBody;

import java.util.*;

/**
 * A named group of tests sharing optional setup and teardown.
 * Tests keep their registration order; the failure chain produced by an
 * engine follows the same order.
 */
public final class Suite implements Iterable<TestCase> {

    private final String name;
    private final List<TestCase> tests;
    private final SuiteAction setup;
    private final SuiteAction teardown;
    private final boolean active;

    private Suite(Builder builder) {
        this.name = builder.name;
        this.tests = Collections.unmodifiableList(new ArrayList<>(builder.tests));
        this.setup = builder.setup;
        this.teardown = builder.teardown;
        this.active = builder.active;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() { return name; }
    public List<TestCase> tests() { return tests; }
    public int testCount() { return tests.size(); }
    public boolean isActive() { return active; }
    public boolean hasSetup() { return setup != null; }
    public boolean hasTeardown() { return teardown != null; }
    public Optional<SuiteAction> setup() { return Optional.ofNullable(setup); }
    public Optional<SuiteAction> teardown() { return Optional.ofNullable(teardown); }

    /**
     * @return true if the given test instance is registered in this suite
     */
    public boolean contains(TestCase test) {
        for (TestCase t : tests) {
            if (t == test) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Iterator<TestCase> iterator() {
        return tests.iterator();
    }

    @Override
    public String toString() {
        return "Suite[" + name + ", tests=" + tests.size() + "]";
    }

    public static final class Builder {
        private final String name;
        private final List<TestCase> tests = new ArrayList<>();
        private final Set<String> testNames = new HashSet<>();
        private SuiteAction setup;
        private SuiteAction teardown;
        private boolean active = true;

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Suite name must not be blank");
            }
            this.name = name;
        }

        public Builder setup(SuiteAction setup) {
            this.setup = setup;
            return this;
        }

        public Builder teardown(SuiteAction teardown) {
            this.teardown = teardown;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder test(String testName, TestBody body) {
            return test(TestCase.of(testName, body));
        }

        /**
         * Add a pre-built test. Names must be unique within the suite.
         */
        public Builder test(TestCase test) {
            if (!testNames.add(test.name())) {
                throw new IllegalArgumentException(
                        "Duplicate test '" + test.name() + "' in suite '" + name + "'");
            }
            tests.add(test);
            return this;
        }

        public Suite build() {
            return new Suite(this);
        }
    }
}
