package io.tally.api.report;

import io.tally.api.registry.Suite;
import io.tally.api.registry.TestCase;
import io.tally.api.registry.TestRegistry;
import io.tally.api.result.FailureRecord;
import io.tally.api.result.RunSummary;

import java.io.IOException;
import java.util.List;
import java.util.Set;

/**
 * A pluggable report format that turns run events into one concrete document format.
 * <p>
 * The lifecycle is {@link #openReport} → event handlers → {@link #closeReport}.
 * Event handlers are optional: a format lists the ones it implements in
 * {@link #capabilities()} and the runner installs only those. The default
 * implementations do nothing.
 * <p>
 * Formats keep their per-run state in a session created by {@code openReport}
 * and released by {@code closeReport}. Calling an event handler without an open
 * session is a programming error and fails with {@link IllegalStateException}.
 */
public interface ReportFormat {

    /**
     * @return the format name (e.g., "cunit", "junit")
     */
    String name();

    /**
     * @return the handlers this format implements
     */
    Set<ReportCapability> capabilities();

    default boolean supports(ReportCapability capability) {
        return capabilities().contains(capability);
    }

    /**
     * Derive the concrete output file names from a root. No I/O happens here.
     *
     * @param root the filename root, or null/empty for the default root
     */
    void setOutputFilename(String root);

    /**
     * Open the output document(s) and write any static header.
     *
     * @throws IOException if the output cannot be created
     */
    void openReport(ReportContext context) throws IOException;

    /**
     * Write the trailer, flush and close the output. Always the last call of a run.
     *
     * @throws IOException if closing fails or a record could not be written during the run
     */
    void closeReport() throws IOException;

    default void onTestStart(TestCase test, Suite suite) {}

    default void onTestComplete(TestCase test, Suite suite, List<FailureRecord> failures) {}

    default void onAllTestsComplete(RunSummary summary, List<FailureRecord> failures) {}

    default void onSuiteInitFailure(Suite suite) {}

    default void onSuiteCleanupFailure(Suite suite) {}

    default void onSuiteComplete(Suite suite, List<FailureRecord> failures) {}

    /**
     * Write a static listing of every suite and test, independent of any run.
     * I/O problems are reported through the returned status, not thrown.
     *
     * @return {@link ReportStatus#OK} on success, {@link ReportStatus#NOT_SUPPORTED} if the
     *         format has no listing, otherwise the failed step
     */
    default ReportStatus listAllTests(TestRegistry registry) {
        return ReportStatus.NOT_SUPPORTED;
    }
}
