package io.tally.api.engine;

/**
 * The logic of a single test. Assertions are made through the supplied context.
 */
@FunctionalInterface
public interface TestBody {

    void run(TestContext context) throws Exception;
}
