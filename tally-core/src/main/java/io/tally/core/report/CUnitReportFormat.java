package io.tally.core.report;

import io.tally.api.registry.Suite;
import io.tally.api.registry.TestCase;
import io.tally.api.registry.TestRegistry;
import io.tally.api.report.ReportCapability;
import io.tally.api.report.ReportContext;
import io.tally.api.report.ReportFormat;
import io.tally.api.report.ReportStatus;
import io.tally.api.result.FailureRecord;
import io.tally.api.result.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * CUnit-style XML report, written test by test.
 * <p>
 * Produces two documents:
 * <ul>
 *   <li>{root}-Results.xml: the run report, streamed while tests execute</li>
 *   <li>{root}-Listing.xml: a static dump of the registry, see {@link #listAllTests}</li>
 * </ul>
 * The engine never announces a suite start, so suites are regrouped from the
 * flat test events: a test whose suite differs from the open one closes the
 * open suite block and starts a new one.
 */
public class CUnitReportFormat implements ReportFormat {

    public static final String NAME = "cunit";
    public static final String VERSION = "1.0.0";

    private static final Logger log = LoggerFactory.getLogger(CUnitReportFormat.class);
    private static final DateTimeFormatter CTIME_FMT =
            DateTimeFormatter.ofPattern("EEE MMM d HH:mm:ss yyyy", Locale.US);

    private static final Set<ReportCapability> CAPABILITIES = EnumSet.of(
            ReportCapability.TEST_START,
            ReportCapability.TEST_COMPLETE,
            ReportCapability.ALL_TESTS_COMPLETE,
            ReportCapability.SUITE_INIT_FAILURE,
            ReportCapability.SUITE_CLEANUP_FAILURE,
            ReportCapability.LIST_ALL_TESTS);

    private final Clock clock;
    private ReportFileNames fileNames;
    private RunSession session;

    public CUnitReportFormat() {
        this(Clock.systemDefaultZone());
    }

    public CUnitReportFormat(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<ReportCapability> capabilities() {
        return CAPABILITIES;
    }

    @Override
    public void setOutputFilename(String root) {
        this.fileNames = ReportFileNames.derive(root);
    }

    public ReportFileNames fileNames() {
        if (fileNames == null) {
            setOutputFilename(null);
        }
        return fileNames;
    }

    @Override
    public void openReport(ReportContext context) throws IOException {
        if (session != null) {
            throw new IllegalStateException("CUnit report is already open: " + session.path());
        }
        session = new RunSession(Path.of(fileNames().results()), context);
        session.write("""
                <?xml version="1.0" ?>
                <?xml-stylesheet type="text/xsl" href="CUnit-Run.xsl" ?>
                <!DOCTYPE CUNIT_TEST_RUN_REPORT SYSTEM "CUnit-Run.dtd">
                <CUNIT_TEST_RUN_REPORT>
                  <CUNIT_HEADER/>
                  <CUNIT_RESULT_LISTING>
                """);
        log.debug("Opened CUnit results file {}", session.path());
    }

    @Override
    public void closeReport() throws IOException {
        RunSession s = requireSession();
        session = null;
        try {
            s.closeListing();
            s.writef("  <CUNIT_FOOTER> File Generated By Tally v%s - %s </CUNIT_FOOTER>\n</CUNIT_TEST_RUN_REPORT>\n",
                    VERSION, timestamp());
        } finally {
            s.close();
        }
        log.info("Report generated: {}", s.path().toAbsolutePath());
    }

    @Override
    public void onTestStart(TestCase test, Suite suite) {
        requireSession().enterSuite(suite);
    }

    @Override
    public void onTestComplete(TestCase test, Suite suite, List<FailureRecord> failures) {
        RunSession s = requireSession();
        s.enterSuite(suite);

        if (failures.isEmpty()) {
            s.writef("""
                            <CUNIT_RUN_TEST_RECORD>
                              <CUNIT_RUN_TEST_SUCCESS>
                                <TEST_NAME> %s </TEST_NAME>
                              </CUNIT_RUN_TEST_SUCCESS>
                            </CUNIT_RUN_TEST_RECORD>
                    """, s.text(test.name()));
            return;
        }

        for (FailureRecord failure : failures) {
            if (!failure.belongsTo(test)) {
                break;
            }
            s.writef("""
                            <CUNIT_RUN_TEST_RECORD>
                              <CUNIT_RUN_TEST_FAILURE>
                                <TEST_NAME> %s </TEST_NAME>
                                <FILE_NAME> %s </FILE_NAME>
                                <LINE_NUMBER> %d </LINE_NUMBER>
                                <CONDITION> %s </CONDITION>
                              </CUNIT_RUN_TEST_FAILURE>
                            </CUNIT_RUN_TEST_RECORD>
                    """,
                    s.text(test.name()),
                    s.text(failure.fileName()),
                    failure.lineNumber(),
                    s.text(failure.condition()));
        }
    }

    @Override
    public void onSuiteInitFailure(Suite suite) {
        requireSession().suiteFailure(suite, "Suite Initialization Failed");
    }

    @Override
    public void onSuiteCleanupFailure(Suite suite) {
        requireSession().suiteFailure(suite, "Suite Cleanup Failed");
    }

    @Override
    public void onAllTestsComplete(RunSummary summary, List<FailureRecord> failures) {
        RunSession s = requireSession();
        TestRegistry registry = s.context.registry();
        s.closeListing();

        s.write("  <CUNIT_RUN_SUMMARY>\n");
        s.summaryRecord("Suites", registry.numberOfSuites(), summary.suitesRun(),
                "n/a", summary.suitesFailed(), String.valueOf(summary.suitesInactive()));
        s.summaryRecord("Test Cases", registry.numberOfTests(), summary.testsRun(),
                String.valueOf(summary.testsSucceeded()), summary.testsFailed(),
                String.valueOf(summary.testsInactive()));
        s.summaryRecord("Assertions", summary.assertsRun(), summary.assertsRun(),
                String.valueOf(summary.assertsSucceeded()), summary.assertsFailed(), "n/a");
        s.write("  </CUNIT_RUN_SUMMARY>\n");
    }

    /**
     * Write {root}-Listing.xml describing every suite and test of the registry.
     * Independent of any run; may be called with or without an open report.
     */
    @Override
    public ReportStatus listAllTests(TestRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("Registry must not be null");
        }
        Path path = Path.of(fileNames().listing());

        ListingSession listing;
        try {
            listing = new ListingSession(path);
        } catch (IOException e) {
            log.error("Failed to create test listing file {}", path, e);
            return ReportStatus.OPEN_FAILED;
        }

        listing.write("""
                <?xml version="1.0" ?>
                <?xml-stylesheet type="text/xsl" href="CUnit-List.xsl" ?>
                <!DOCTYPE CUNIT_TEST_LIST_REPORT SYSTEM "CUnit-List.dtd">
                <CUNIT_TEST_LIST_REPORT>
                  <CUNIT_HEADER/>
                  <CUNIT_LIST_TOTAL_SUMMARY>
                """);
        listing.totalRecord("Total Number of Suites", registry.numberOfSuites());
        listing.totalRecord("Total Number of Test Cases", registry.numberOfTests());
        listing.write("  </CUNIT_LIST_TOTAL_SUMMARY>\n  <CUNIT_ALL_TEST_LISTING>\n");

        for (Suite suite : registry) {
            listing.writef("""
                        <CUNIT_ALL_TEST_LISTING_SUITE>
                          <CUNIT_ALL_TEST_LISTING_SUITE_DEFINITION>
                            <SUITE_NAME> %s </SUITE_NAME>
                            <INITIALIZE_VALUE> %s </INITIALIZE_VALUE>
                            <CLEANUP_VALUE> %s </CLEANUP_VALUE>
                            <ACTIVE_VALUE> %s </ACTIVE_VALUE>
                            <TEST_COUNT_VALUE> %d </TEST_COUNT_VALUE>
                          </CUNIT_ALL_TEST_LISTING_SUITE_DEFINITION>
                          <CUNIT_ALL_TEST_LISTING_SUITE_TESTS>
                    """,
                    listing.text(suite.name()),
                    yesNo(suite.hasSetup()),
                    yesNo(suite.hasTeardown()),
                    yesNo(suite.isActive()),
                    suite.testCount());

            for (TestCase test : suite) {
                listing.writef("""
                                <TEST_CASE_DEFINITION>
                                  <TEST_CASE_NAME> %s </TEST_CASE_NAME>
                                  <TEST_ACTIVE_VALUE> %s </TEST_ACTIVE_VALUE>
                                </TEST_CASE_DEFINITION>
                        """, listing.text(test.name()), yesNo(test.isActive()));
            }

            listing.write("      </CUNIT_ALL_TEST_LISTING_SUITE_TESTS>\n    </CUNIT_ALL_TEST_LISTING_SUITE>\n");
        }

        listing.writef("  </CUNIT_ALL_TEST_LISTING>\n"
                        + "  <CUNIT_FOOTER> File Generated By Tally v%s - %s </CUNIT_FOOTER>\n"
                        + "</CUNIT_TEST_LIST_REPORT>\n",
                VERSION, timestamp());

        try {
            listing.close();
        } catch (IOException e) {
            log.error("Failed to close test listing file {}", path, e);
            return ReportStatus.CLOSE_FAILED;
        }
        log.info("Test listing generated: {}", path.toAbsolutePath());
        return ReportStatus.OK;
    }

    private RunSession requireSession() {
        if (session == null) {
            throw new IllegalStateException("CUnit report is not open");
        }
        return session;
    }

    private String timestamp() {
        return ZonedDateTime.now(clock).format(CTIME_FMT);
    }

    private static String yesNo(boolean value) {
        return value ? "Yes" : "No";
    }

    // ─── Sessions ───

    /**
     * Position of the results document within the result listing.
     */
    private enum State {
        NO_SUITE_OPEN,
        SUITE_OPEN,
        LISTING_CLOSED
    }

    private static final class RunSession extends FormatterSession {

        private final ReportContext context;
        private State state = State.NO_SUITE_OPEN;
        private Suite currentSuite;

        RunSession(Path path, ReportContext context) throws IOException {
            super(path);
            this.context = context;
        }

        void enterSuite(Suite suite) {
            if (state == State.LISTING_CLOSED) {
                throw new IllegalStateException("Test event for suite '" + suite.name() + "' after all tests completed");
            }
            if (state == State.SUITE_OPEN && currentSuite == suite) {
                return;
            }
            closeSuite();
            writef("""
                        <CUNIT_RUN_SUITE>
                          <CUNIT_RUN_SUITE_SUCCESS>
                            <SUITE_NAME> %s </SUITE_NAME>
                    """, text(suite.name()));
            state = State.SUITE_OPEN;
            currentSuite = suite;
        }

        void suiteFailure(Suite suite, String reason) {
            if (state == State.LISTING_CLOSED) {
                throw new IllegalStateException("Suite event for '" + suite.name() + "' after all tests completed");
            }
            closeSuite();
            writef("""
                        <CUNIT_RUN_SUITE>
                          <CUNIT_RUN_SUITE_FAILURE>
                            <SUITE_NAME> %s </SUITE_NAME>
                            <FAILURE_REASON> %s </FAILURE_REASON>
                          </CUNIT_RUN_SUITE_FAILURE>
                        </CUNIT_RUN_SUITE>
                    """, text(suite.name()), text(reason));
        }

        void closeSuite() {
            if (state == State.SUITE_OPEN) {
                write("      </CUNIT_RUN_SUITE_SUCCESS>\n    </CUNIT_RUN_SUITE>\n");
            }
            if (state != State.LISTING_CLOSED) {
                state = State.NO_SUITE_OPEN;
            }
            currentSuite = null;
        }

        void closeListing() {
            if (state == State.LISTING_CLOSED) {
                return;
            }
            closeSuite();
            write("  </CUNIT_RESULT_LISTING>\n");
            state = State.LISTING_CLOSED;
        }

        void summaryRecord(String type, int total, int run, String succeeded, int failed, String inactive) {
            writef("""
                        <CUNIT_RUN_SUMMARY_RECORD>
                          <TYPE> %s </TYPE>
                          <TOTAL> %d </TOTAL>
                          <RUN> %d </RUN>
                          <SUCCEEDED> %s </SUCCEEDED>
                          <FAILED> %d </FAILED>
                          <INACTIVE> %s </INACTIVE>
                        </CUNIT_RUN_SUMMARY_RECORD>
                    """, type, total, run, succeeded, failed, inactive);
        }
    }

    private static final class ListingSession extends FormatterSession {

        ListingSession(Path path) throws IOException {
            super(path);
        }

        void totalRecord(String text, int value) {
            writef("""
                        <CUNIT_LIST_TOTAL_SUMMARY_RECORD>
                          <CUNIT_LIST_TOTAL_SUMMARY_RECORD_TEXT> %s </CUNIT_LIST_TOTAL_SUMMARY_RECORD_TEXT>
                          <CUNIT_LIST_TOTAL_SUMMARY_RECORD_VALUE> %d </CUNIT_LIST_TOTAL_SUMMARY_RECORD_VALUE>
                        </CUNIT_LIST_TOTAL_SUMMARY_RECORD>
                    """, text, value);
        }
    }
}
