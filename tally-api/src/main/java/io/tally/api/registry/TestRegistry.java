package io.tally.api.registry;

import java.util.*;

/**
 * The ordered set of suites known to a run.
 */
public final class TestRegistry implements Iterable<Suite> {

    private final List<Suite> suites;

    private TestRegistry(List<Suite> suites) {
        this.suites = Collections.unmodifiableList(suites);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Suite> suites() {
        return suites;
    }

    public int numberOfSuites() {
        return suites.size();
    }

    public int numberOfTests() {
        return suites.stream().mapToInt(Suite::testCount).sum();
    }

    public Optional<Suite> suite(String name) {
        return suites.stream().filter(s -> s.name().equals(name)).findFirst();
    }

    @Override
    public Iterator<Suite> iterator() {
        return suites.iterator();
    }

    public static final class Builder {
        private final Map<String, Suite> suites = new LinkedHashMap<>();

        private Builder() {}

        public Builder add(Suite suite) {
            Objects.requireNonNull(suite, "suite");
            if (suites.putIfAbsent(suite.name(), suite) != null) {
                throw new IllegalArgumentException("Duplicate suite '" + suite.name() + "'");
            }
            return this;
        }

        public TestRegistry build() {
            return new TestRegistry(new ArrayList<>(suites.values()));
        }
    }
}
