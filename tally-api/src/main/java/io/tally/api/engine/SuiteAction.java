package io.tally.api.engine;

/**
 * Suite setup or teardown. Throwing marks the suite as failed.
 */
@FunctionalInterface
public interface SuiteAction {

    void run() throws Exception;
}
