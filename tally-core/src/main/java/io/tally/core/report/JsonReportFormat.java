package io.tally.core.report;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.tally.api.registry.Suite;
import io.tally.api.registry.TestCase;
import io.tally.api.report.ReportCapability;
import io.tally.api.report.ReportContext;
import io.tally.api.report.ReportFormat;
import io.tally.api.result.FailureRecord;
import io.tally.api.result.RunSummary;
import io.tally.api.result.SuiteFailures;
import io.tally.api.result.TestStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * JSON report for tooling that prefers structured data over XML.
 * <p>
 * Writes {root}-Results.json as a stream: the {@code suites} array grows one
 * entry per completed suite, classified the same way as the JUnit report, and
 * the run summary plus a generation timestamp follow once all tests complete.
 */
public class JsonReportFormat implements ReportFormat {

    public static final String NAME = "json";

    private static final Logger log = LoggerFactory.getLogger(JsonReportFormat.class);

    private static final Set<ReportCapability> CAPABILITIES = EnumSet.of(
            ReportCapability.SUITE_COMPLETE,
            ReportCapability.ALL_TESTS_COMPLETE);

    private final Clock clock;
    private final ObjectMapper objectMapper;
    private ReportFileNames fileNames;
    private Session session;

    public JsonReportFormat() {
        this(Clock.systemDefaultZone());
    }

    public JsonReportFormat(Clock clock) {
        this.clock = clock;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
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
        this.fileNames = ReportFileNames.derive(root, "-Listing.json", "-Results.json");
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
            throw new IllegalStateException("JSON report is already open: " + session.path());
        }
        Session s = new Session(Path.of(fileNames().results()), objectMapper);
        try {
            s.generator.writeStartObject();
            s.generator.writeStringField("format", NAME);
            s.generator.writeStringField("package", context.packageName());
            s.generator.writeNumberField("totalSuites", context.registry().numberOfSuites());
            s.generator.writeNumberField("totalTests", context.registry().numberOfTests());
            s.generator.writeArrayFieldStart("suites");
        } catch (IOException e) {
            try {
                s.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        session = s;
        log.debug("Opened JSON results file {}", s.path());
    }

    @Override
    public void closeReport() throws IOException {
        Session s = requireSession();
        session = null;
        try {
            s.finish(null, Instant.now(clock));
            s.generator.close();
        } catch (IOException e) {
            s.latch(e);
        } finally {
            s.close();
        }
        log.info("Report generated: {}", s.path().toAbsolutePath());
    }

    @Override
    public void onSuiteComplete(Suite suite, List<FailureRecord> failures) {
        Session s = requireSession();
        if (s.finished) {
            throw new IllegalStateException("Suite '" + suite.name() + "' completed after all tests completed");
        }
        SuiteFailures grouped = SuiteFailures.group(suite, failures);

        List<TestEntry> tests = new ArrayList<>();
        for (TestCase test : suite) {
            List<FailureEntry> details = grouped.failuresFor(test).stream().map(FailureEntry::of).toList();
            tests.add(new TestEntry(test.name(), grouped.statusOf(test), details));
        }
        SuiteEntry entry = new SuiteEntry(
                suite.name(),
                suite.testCount(),
                grouped.setupFailure().map(FailureEntry::of).orElse(null),
                grouped.teardownFailure().map(FailureEntry::of).orElse(null),
                tests);

        s.attempt(() -> s.generator.writeObject(entry));
    }

    @Override
    public void onAllTestsComplete(RunSummary summary, List<FailureRecord> failures) {
        Session s = requireSession();
        s.attempt(() -> s.finish(summary, Instant.now(clock)));
    }

    private Session requireSession() {
        if (session == null) {
            throw new IllegalStateException("JSON report is not open");
        }
        return session;
    }

    public record SuiteEntry(String name, int tests, FailureEntry setupFailure,
                      FailureEntry teardownFailure, List<TestEntry> testcases) {}

    public record TestEntry(String name, TestStatus status, List<FailureEntry> failures) {}

    public record FailureEntry(String type, String condition, String file, int line) {
        static FailureEntry of(FailureRecord record) {
            return new FailureEntry(record.type().name(), record.condition(), record.fileName(), record.lineNumber());
        }
    }

    @FunctionalInterface
    private interface JsonWrite {
        void run() throws IOException;
    }

    private static final class Session extends FormatterSession {

        private final JsonGenerator generator;
        private boolean finished;

        Session(Path path, ObjectMapper objectMapper) throws IOException {
            super(path);
            this.generator = objectMapper.createGenerator(writer());
        }

        void attempt(JsonWrite write) {
            if (failed()) {
                return;
            }
            try {
                write.run();
            } catch (IOException e) {
                latch(e);
            }
        }

        void finish(RunSummary summary, Instant generatedAt) throws IOException {
            if (finished || failed()) {
                return;
            }
            finished = true;
            generator.writeEndArray();
            if (summary != null) {
                generator.writeFieldName("summary");
                generator.writeObject(summary);
            }
            generator.writeFieldName("generatedAt");
            generator.writeObject(generatedAt);
            generator.writeEndObject();
            generator.flush();
        }
    }
}
