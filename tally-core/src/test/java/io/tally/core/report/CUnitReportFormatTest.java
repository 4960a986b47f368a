package io.tally.core.report;

import io.tally.api.registry.Suite;
import io.tally.api.registry.TestCase;
import io.tally.api.registry.TestRegistry;
import io.tally.api.report.ReportCapability;
import io.tally.api.report.ReportContext;
import io.tally.api.report.ReportStatus;
import io.tally.api.result.FailureRecord;
import io.tally.api.result.RunSummary;
import io.tally.core.engine.DefaultExecutionEngine;
import io.tally.core.runtime.AutomatedRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static io.tally.core.report.XmlDocuments.elements;
import static io.tally.core.report.XmlDocuments.parse;
import static io.tally.core.report.XmlDocuments.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CUnitReportFormatTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-14T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private CUnitReportFormat format;
    private TestCase t1;
    private TestCase t2;
    private Suite suiteA;

    @BeforeEach
    void setUp() {
        format = new CUnitReportFormat(CLOCK);
        format.setOutputFilename(tempDir.resolve("Run").toString());
        t1 = TestCase.of("t1", ctx -> {});
        t2 = TestCase.of("t2", ctx -> {});
        suiteA = Suite.builder("SuiteA").test(t1).test(t2).build();
    }

    private Path results() {
        return tempDir.resolve("Run-Results.xml");
    }

    private void open(Suite... suites) throws IOException {
        var builder = TestRegistry.builder();
        for (Suite suite : suites) {
            builder.add(suite);
        }
        format.openReport(ReportContext.of(builder.build()));
    }

    // ─── End to end ───

    @Test
    void shouldReportPassingFailingAndSetupFailedSuites() throws Exception {
        Suite suiteX = Suite.builder("SuiteX")
                .test("t1", ctx -> ctx.check(true, "always"))
                .test("t2", ctx -> ctx.check("abc".isEmpty(), "1 + 1 == 3"))
                .build();
        Suite suiteY = Suite.builder("SuiteY")
                .setup(() -> {
                    throw new IllegalStateException("database unavailable");
                })
                .test("t3", ctx -> ctx.fail("must not run"))
                .build();
        TestRegistry registry = TestRegistry.builder().add(suiteX).add(suiteY).build();
        var runner = new AutomatedRunner(new DefaultExecutionEngine());
        runner.setReportFormat(format).setRegistry(registry);

        ReportStatus status = runner.runAutomated();

        assertThat(status).isEqualTo(ReportStatus.OK);
        Document doc = parse(results());

        List<Element> suites = elements(doc, "CUNIT_RUN_SUITE");
        assertThat(suites).hasSize(2);

        Element x = suites.get(0);
        assertThat(text(x, "SUITE_NAME")).isEqualTo("SuiteX");
        List<Element> passed = elements(x, "CUNIT_RUN_TEST_SUCCESS");
        assertThat(passed).hasSize(1);
        assertThat(text(passed.get(0), "TEST_NAME")).isEqualTo("t1");
        List<Element> failed = elements(x, "CUNIT_RUN_TEST_FAILURE");
        assertThat(failed).hasSize(1);
        assertThat(text(failed.get(0), "TEST_NAME")).isEqualTo("t2");
        assertThat(text(failed.get(0), "CONDITION")).isEqualTo("1 + 1 == 3");
        assertThat(text(failed.get(0), "FILE_NAME")).isEqualTo("CUnitReportFormatTest.java");
        assertThat(Integer.parseInt(text(failed.get(0), "LINE_NUMBER"))).isPositive();

        Element y = suites.get(1);
        assertThat(elements(y, "CUNIT_RUN_SUITE_FAILURE")).hasSize(1);
        assertThat(text(y, "SUITE_NAME")).isEqualTo("SuiteY");
        assertThat(text(y, "FAILURE_REASON")).isEqualTo("Suite Initialization Failed");
        assertThat(elements(y, "CUNIT_RUN_TEST_RECORD")).isEmpty();

        List<Element> summary = elements(doc, "CUNIT_RUN_SUMMARY_RECORD");
        assertThat(summary).hasSize(3);
        assertSummaryRow(summary.get(0), "Suites", "2", "1", "n/a", "1", "0");
        assertSummaryRow(summary.get(1), "Test Cases", "3", "2", "1", "1", "0");
        assertSummaryRow(summary.get(2), "Assertions", "2", "2", "1", "1", "n/a");
    }

    private static void assertSummaryRow(Element row, String type, String total, String run,
                                         String succeeded, String failed, String inactive) {
        assertThat(text(row, "TYPE")).isEqualTo(type);
        assertThat(text(row, "TOTAL")).isEqualTo(total);
        assertThat(text(row, "RUN")).isEqualTo(run);
        assertThat(text(row, "SUCCEEDED")).isEqualTo(succeeded);
        assertThat(text(row, "FAILED")).isEqualTo(failed);
        assertThat(text(row, "INACTIVE")).isEqualTo(inactive);
    }

    // ─── Document structure ───

    @Test
    void shouldWriteHeaderAndFooter() throws Exception {
        open(suiteA);
        format.closeReport();

        String content = Files.readString(results());
        assertThat(content).startsWith("<?xml version=\"1.0\" ?>");
        assertThat(content).contains("<?xml-stylesheet type=\"text/xsl\" href=\"CUnit-Run.xsl\" ?>");
        assertThat(content).contains("<!DOCTYPE CUNIT_TEST_RUN_REPORT SYSTEM \"CUnit-Run.dtd\">");
        assertThat(content).contains("<CUNIT_HEADER/>");
        assertThat(content).contains("File Generated By Tally v1.0.0 - Sat Feb 14 10:00:00 2026");
        assertThat(content.trim()).endsWith("</CUNIT_TEST_RUN_REPORT>");
        parse(results());
    }

    @Test
    void shouldStayWellFormedWhenClosedMidSuite() throws Exception {
        open(suiteA);
        format.onTestStart(t1, suiteA);
        format.onTestComplete(t1, suiteA, List.of());
        format.closeReport();

        Document doc = parse(results());
        assertThat(elements(doc, "CUNIT_RUN_SUITE_SUCCESS")).hasSize(1);
        assertThat(elements(doc, "CUNIT_RUN_SUMMARY")).isEmpty();
    }

    @Test
    void shouldOpenNewSuiteBlockOnEverySuiteTransition() throws Exception {
        TestCase b1 = TestCase.of("b1", ctx -> {});
        Suite suiteB = Suite.builder("SuiteB").test(b1).build();
        open(suiteA, suiteB);

        format.onTestStart(t1, suiteA);
        format.onTestComplete(t1, suiteA, List.of());
        format.onTestStart(b1, suiteB);
        format.onTestComplete(b1, suiteB, List.of());
        format.onTestStart(t2, suiteA);
        format.onTestComplete(t2, suiteA, List.of());
        format.closeReport();

        List<Element> suites = elements(parse(results()), "CUNIT_RUN_SUITE");
        assertThat(suites).extracting(s -> text(s, "SUITE_NAME")).containsExactly("SuiteA", "SuiteB", "SuiteA");
    }

    @Test
    void shouldWriteOneRecordPerFailureOfTheTest() throws Exception {
        open(suiteA);
        List<FailureRecord> failures = List.of(
                FailureRecord.assertion(suiteA, t1, "x == 1", "parser.c", 10),
                FailureRecord.assertion(suiteA, t1, "y == 2", "parser.c", 11),
                FailureRecord.assertion(suiteA, t2, "belongs to t2", "parser.c", 20));

        format.onTestStart(t1, suiteA);
        format.onTestComplete(t1, suiteA, failures);
        format.closeReport();

        List<Element> failed = elements(parse(results()), "CUNIT_RUN_TEST_FAILURE");
        assertThat(failed).extracting(f -> text(f, "CONDITION")).containsExactly("x == 1", "y == 2");
        assertThat(failed).extracting(f -> text(f, "LINE_NUMBER")).containsExactly("10", "11");
    }

    @Test
    void cleanupFailureShouldFollowTheSuiteTests() throws Exception {
        open(suiteA);
        format.onTestStart(t1, suiteA);
        format.onTestComplete(t1, suiteA, List.of());
        format.onSuiteCleanupFailure(suiteA);
        format.onAllTestsComplete(new RunSummary(1, 1, 0, 1, 0, 0, 0, 0), List.of());
        format.closeReport();

        List<Element> suites = elements(parse(results()), "CUNIT_RUN_SUITE");
        assertThat(suites).hasSize(2);
        assertThat(elements(suites.get(0), "CUNIT_RUN_SUITE_SUCCESS")).hasSize(1);
        assertThat(text(suites.get(1), "FAILURE_REASON")).isEqualTo("Suite Cleanup Failed");
    }

    @Test
    void shouldEscapeNamesAndConditions() throws Exception {
        TestCase tricky = TestCase.of("compare<T> & \"friends\"", ctx -> {});
        Suite suite = Suite.builder("Parser<T> & co").test(tricky).build();
        open(suite);

        format.onTestStart(tricky, suite);
        format.onTestComplete(tricky, suite,
                List.of(FailureRecord.assertion(suite, tricky, "a < b && b > \"c\"", "gen<1>.c", 5)));
        format.closeReport();

        Document doc = parse(results());
        Element failure = elements(doc, "CUNIT_RUN_TEST_FAILURE").get(0);
        assertThat(text(doc.getDocumentElement(), "SUITE_NAME")).isEqualTo("Parser<T> & co");
        assertThat(text(failure, "TEST_NAME")).isEqualTo("compare<T> & \"friends\"");
        assertThat(text(failure, "CONDITION")).isEqualTo("a < b && b > \"c\"");
        assertThat(text(failure, "FILE_NAME")).isEqualTo("gen<1>.c");
    }

    @Test
    void shouldStayWellFormedWithIllegalCharacterReferences() throws Exception {
        Suite suite = Suite.builder("Refs")
                .test("nul", ctx -> ctx.check(false, "value == \"&#0;\" && &#xFFFE;"))
                .build();
        var runner = new AutomatedRunner(new DefaultExecutionEngine());
        runner.setReportFormat(format).setRegistry(TestRegistry.builder().add(suite).build());

        ReportStatus status = runner.runAutomated();

        assertThat(status).isEqualTo(ReportStatus.OK);
        Element failure = elements(parse(results()), "CUNIT_RUN_TEST_FAILURE").get(0);
        assertThat(text(failure, "CONDITION")).isEqualTo("value == \"&#0;\" && &#xFFFE;");
    }

    @Test
    void unencodableTestNameShouldNotTruncateReport() throws Exception {
        Suite suite = Suite.builder("Names")
                .test("bad\uD800name", ctx -> {})
                .test("after", ctx -> {})
                .build();
        var runner = new AutomatedRunner(new DefaultExecutionEngine());
        runner.setReportFormat(format).setRegistry(TestRegistry.builder().add(suite).build());

        ReportStatus status = runner.runAutomated();

        assertThat(status).isEqualTo(ReportStatus.OK);
        Document doc = parse(results());
        assertThat(elements(doc, "CUNIT_RUN_TEST_SUCCESS"))
                .extracting(e -> text(e, "TEST_NAME"))
                .containsExactly("bad?name", "after");
        assertThat(elements(doc, "CUNIT_RUN_SUMMARY_RECORD")).hasSize(3);
    }

    // ─── Summary ───

    @Test
    void shouldReportZeroCountsForEmptyRun() throws Exception {
        open();
        format.onAllTestsComplete(RunSummary.EMPTY, List.of());
        format.closeReport();

        List<Element> summary = elements(parse(results()), "CUNIT_RUN_SUMMARY_RECORD");
        assertSummaryRow(summary.get(0), "Suites", "0", "0", "n/a", "0", "0");
        assertSummaryRow(summary.get(1), "Test Cases", "0", "0", "0", "0", "0");
        assertSummaryRow(summary.get(2), "Assertions", "0", "0", "0", "0", "n/a");
    }

    @Test
    void shouldCopySummaryCountsVerbatim() throws Exception {
        open(suiteA);
        format.onAllTestsComplete(new RunSummary(7, 2, 1, 40, 5, 3, 120, 9), List.of());
        format.closeReport();

        List<Element> summary = elements(parse(results()), "CUNIT_RUN_SUMMARY_RECORD");
        assertSummaryRow(summary.get(0), "Suites", "1", "7", "n/a", "2", "1");
        assertSummaryRow(summary.get(1), "Test Cases", "2", "40", "35", "5", "3");
        assertSummaryRow(summary.get(2), "Assertions", "120", "120", "111", "9", "n/a");
    }

    // ─── Lifecycle errors ───

    @Test
    void handlersShouldRequireOpenReport() {
        assertThatThrownBy(() -> format.onTestStart(t1, suiteA))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not open");
        assertThatThrownBy(() -> format.closeReport())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldRejectSecondOpen() throws Exception {
        open(suiteA);

        assertThatThrownBy(() -> open(suiteA)).isInstanceOf(IllegalStateException.class);
        format.closeReport();
    }

    @Test
    void shouldRejectTestEventsAfterAllTestsComplete() throws Exception {
        open(suiteA);
        format.onAllTestsComplete(RunSummary.EMPTY, List.of());

        assertThatThrownBy(() -> format.onTestStart(t1, suiteA)).isInstanceOf(IllegalStateException.class);
        format.closeReport();
        parse(results());
    }

    @Test
    void shouldFailToOpenWhenDirectoryCannotBeCreated() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "not a directory");
        format.setOutputFilename(blocker.resolve("Run").toString());

        assertThatThrownBy(() -> open(suiteA)).isInstanceOf(IOException.class);
        assertThatThrownBy(() -> format.onTestStart(t1, suiteA)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldDeclareEventAndListingCapabilities() {
        assertThat(format.name()).isEqualTo("cunit");
        assertThat(format.supports(ReportCapability.TEST_COMPLETE)).isTrue();
        assertThat(format.supports(ReportCapability.LIST_ALL_TESTS)).isTrue();
        assertThat(format.supports(ReportCapability.SUITE_COMPLETE)).isFalse();
    }

    @Test
    void shouldUseDefaultRootWhenNoneSet() {
        var fresh = new CUnitReportFormat(CLOCK);

        assertThat(fresh.fileNames().results()).isEqualTo("TallyAutomated-Results.xml");
    }

    // ─── Listing ───

    @Test
    void shouldListAllSuitesAndTests() throws Exception {
        TestCase parked = TestCase.inactive("parked", ctx -> {});
        Suite active = Suite.builder("Active")
                .setup(() -> {})
                .teardown(() -> {})
                .test("t1", ctx -> {})
                .test(parked)
                .build();
        Suite dormant = Suite.builder("Dormant").active(false).build();
        TestRegistry registry = TestRegistry.builder().add(active).add(dormant).build();

        ReportStatus status = format.listAllTests(registry);

        assertThat(status).isEqualTo(ReportStatus.OK);
        Path listing = tempDir.resolve("Run-Listing.xml");
        String content = Files.readString(listing);
        assertThat(content).contains("<!DOCTYPE CUNIT_TEST_LIST_REPORT SYSTEM \"CUnit-List.dtd\">");
        assertThat(content).contains("File Generated By Tally v1.0.0 - Sat Feb 14 10:00:00 2026");

        Document doc = parse(listing);
        List<Element> totals = elements(doc, "CUNIT_LIST_TOTAL_SUMMARY_RECORD");
        assertThat(totals).extracting(t -> text(t, "CUNIT_LIST_TOTAL_SUMMARY_RECORD_TEXT"))
                .containsExactly("Total Number of Suites", "Total Number of Test Cases");
        assertThat(totals).extracting(t -> text(t, "CUNIT_LIST_TOTAL_SUMMARY_RECORD_VALUE"))
                .containsExactly("2", "2");

        List<Element> suites = elements(doc, "CUNIT_ALL_TEST_LISTING_SUITE");
        assertThat(suites).hasSize(2);
        Element first = suites.get(0);
        assertThat(text(first, "SUITE_NAME")).isEqualTo("Active");
        assertThat(text(first, "INITIALIZE_VALUE")).isEqualTo("Yes");
        assertThat(text(first, "CLEANUP_VALUE")).isEqualTo("Yes");
        assertThat(text(first, "ACTIVE_VALUE")).isEqualTo("Yes");
        assertThat(text(first, "TEST_COUNT_VALUE")).isEqualTo("2");
        assertThat(elements(first, "TEST_CASE_DEFINITION"))
                .extracting(t -> text(t, "TEST_CASE_NAME") + "=" + text(t, "TEST_ACTIVE_VALUE"))
                .containsExactly("t1=Yes", "parked=No");

        Element second = suites.get(1);
        assertThat(text(second, "INITIALIZE_VALUE")).isEqualTo("No");
        assertThat(text(second, "ACTIVE_VALUE")).isEqualTo("No");
        assertThat(text(second, "TEST_COUNT_VALUE")).isEqualTo("0");
        assertThat(elements(second, "TEST_CASE_DEFINITION")).isEmpty();
    }

    @Test
    void listingShouldNotDisturbOpenRun() throws Exception {
        open(suiteA);
        format.onTestStart(t1, suiteA);

        format.listAllTests(TestRegistry.builder().add(suiteA).build());
        format.onTestComplete(t1, suiteA, List.of());
        format.closeReport();

        parse(results());
        parse(tempDir.resolve("Run-Listing.xml"));
    }

    @Test
    void listingShouldReportOpenFailure() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "not a directory");
        format.setOutputFilename(blocker.resolve("Run").toString());

        ReportStatus status = format.listAllTests(TestRegistry.builder().build());

        assertThat(status).isEqualTo(ReportStatus.OPEN_FAILED);
    }

    @Test
    void listingShouldRejectNullRegistry() {
        assertThatThrownBy(() -> format.listAllTests(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
