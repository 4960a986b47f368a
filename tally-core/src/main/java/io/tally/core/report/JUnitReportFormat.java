package io.tally.core.report;

import io.tally.api.registry.Suite;
import io.tally.api.registry.TestCase;
import io.tally.api.report.ReportCapability;
import io.tally.api.report.ReportContext;
import io.tally.api.report.ReportFormat;
import io.tally.api.result.FailureRecord;
import io.tally.api.result.FailureType;
import io.tally.api.result.RunSummary;
import io.tally.api.result.SuiteFailures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * JUnit-style XML report, written one suite at a time.
 * <p>
 * Produces {root}-Results.xml with a single {@code testsuites} root holding one
 * {@code testsuite} per completed suite. Each test is classified from the suite's
 * grouped failures:
 * <ul>
 *   <li>setup failed: a dummy "Initialization" failure, then every test as an error</li>
 *   <li>inactive: skipped</li>
 *   <li>any other record: failed, with one detail block per record</li>
 *   <li>no record: passed</li>
 * </ul>
 * A teardown failure adds a dummy "Cleanup" failure after the tests.
 * Nothing is carried between suites except the output document.
 */
public class JUnitReportFormat implements ReportFormat {

    public static final String NAME = "junit";

    private static final Logger log = LoggerFactory.getLogger(JUnitReportFormat.class);

    private static final Set<ReportCapability> CAPABILITIES = EnumSet.of(
            ReportCapability.SUITE_COMPLETE,
            ReportCapability.ALL_TESTS_COMPLETE);

    private ReportFileNames fileNames;
    private Session session;

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
            throw new IllegalStateException("JUnit report is already open: " + session.path());
        }
        session = new Session(Path.of(fileNames().results()), context.packageName());
        session.writef("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<testsuites name=\"%s\">\n",
                session.text(context.packageName()));
        log.debug("Opened JUnit results file {}", session.path());
    }

    @Override
    public void closeReport() throws IOException {
        Session s = requireSession();
        session = null;
        try {
            s.closeRoot();
        } finally {
            s.close();
        }
        log.info("Report generated: {}", s.path().toAbsolutePath());
    }

    @Override
    public void onAllTestsComplete(RunSummary summary, List<FailureRecord> failures) {
        requireSession().closeRoot();
    }

    @Override
    public void onSuiteComplete(Suite suite, List<FailureRecord> failures) {
        Session s = requireSession();
        if (s.rootClosed) {
            throw new IllegalStateException("Suite '" + suite.name() + "' completed after all tests completed");
        }
        SuiteFailures grouped = SuiteFailures.group(suite, failures);
        String suiteName = s.text(suite.name());
        String className = s.className(suite);

        s.writef("  <testsuite name=\"%s\" tests=\"%d\">\n", suiteName, suite.testCount());

        if (grouped.setupFailure().isPresent()) {
            s.dummyTest(className, suiteName, grouped.setupFailure().get());
            for (TestCase test : suite) {
                s.testcaseOpen(className, test, true);
                s.write("      <error message=\"Suite initialization failed\"/>\n");
                s.write("    </testcase>\n");
            }
        } else {
            for (TestCase test : suite) {
                switch (grouped.statusOf(test)) {
                    case PASSED -> s.testcaseOpen(className, test, false);
                    case SKIPPED -> {
                        s.testcaseOpen(className, test, true);
                        s.write("      <skipped/>\n");
                        s.write("    </testcase>\n");
                    }
                    default -> s.failedTest(className, test, grouped.failuresFor(test));
                }
            }
            grouped.teardownFailure().ifPresent(f -> s.dummyTest(className, suiteName, f));
        }

        s.write("  </testsuite>\n");
    }

    private Session requireSession() {
        if (session == null) {
            throw new IllegalStateException("JUnit report is not open");
        }
        return session;
    }

    private static final class Session extends FormatterSession {

        private final String packageName;
        private boolean rootClosed;

        Session(Path path, String packageName) throws IOException {
            super(path);
            this.packageName = packageName;
        }

        String className(Suite suite) {
            String qualified = packageName.isEmpty() ? suite.name() : packageName + "." + suite.name();
            return text(qualified);
        }

        void closeRoot() {
            if (!rootClosed) {
                write("</testsuites>\n");
                rootClosed = true;
            }
        }

        void testcaseOpen(String className, TestCase test, boolean hasChildren) {
            writef("    <testcase classname=\"%s\" name=\"%s\" time=\"0\"%s>\n",
                    className, text(test.name()), hasChildren ? "" : "/");
        }

        void failedTest(String className, TestCase test, List<FailureRecord> records) {
            if (records.isEmpty()) {
                throw new IllegalStateException("Test '" + test.name() + "' classified as failed without records");
            }
            testcaseOpen(className, test, true);
            writef("      <failure message=\"%s\" type=\"Failure\">\n", text(records.get(0).condition()));
            for (FailureRecord record : records) {
                failureDetails(record);
            }
            write("      </failure>\n");
            write("    </testcase>\n");
        }

        void dummyTest(String className, String suiteName, FailureRecord failure) {
            boolean setup = failure.type() == FailureType.SUITE_SETUP_FAILED;
            writef("    <testcase classname=\"%s\" name=\"%s - %s\" time=\"0\">\n",
                    className, suiteName, setup ? "Initialization" : "Cleanup");
            writef("      <failure message=\"%s\" type=\"Failure\">\n",
                    setup ? "Suite Initialization failed" : "Suite Cleanup failed");
            failureDetails(failure);
            write("      </failure>\n");
            write("    </testcase>\n");
        }

        void failureDetails(FailureRecord record) {
            writef("""
                            Condition: %s
                            File     : %s
                            Line     : %d
                    """, text(record.condition()), text(record.fileName()), record.lineNumber());
        }
    }
}
