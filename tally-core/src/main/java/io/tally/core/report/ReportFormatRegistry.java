package io.tally.core.report;

import io.tally.api.report.ReportFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;
import java.util.function.Supplier;

/**
 * Known report formats by name, plus the single active one.
 * <p>
 * Activating a format replaces the previous one outright. Replacing it while a
 * run is in progress is a programming error and fails.
 */
public class ReportFormatRegistry {

    private static final Logger log = LoggerFactory.getLogger(ReportFormatRegistry.class);

    private final Map<String, Supplier<ReportFormat>> factories = new LinkedHashMap<>();
    private ReportFormat active;
    private boolean runInProgress;

    /**
     * @return a registry with the cunit, junit and json formats, cunit active
     */
    public static ReportFormatRegistry withBuiltins() {
        return withBuiltins(Clock.systemDefaultZone());
    }

    public static ReportFormatRegistry withBuiltins(Clock clock) {
        ReportFormatRegistry registry = new ReportFormatRegistry();
        registry.register(CUnitReportFormat.NAME, () -> new CUnitReportFormat(clock));
        registry.register(JUnitReportFormat.NAME, JUnitReportFormat::new);
        registry.register(JsonReportFormat.NAME, () -> new JsonReportFormat(clock));
        registry.activate(CUnitReportFormat.NAME);
        return registry;
    }

    public ReportFormatRegistry register(String name, Supplier<ReportFormat> factory) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Format name must not be blank");
        }
        factories.put(name.toLowerCase(Locale.ROOT), Objects.requireNonNull(factory, "factory"));
        return this;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(factories.keySet());
    }

    /**
     * Create a fresh instance of a registered format.
     *
     * @throws IllegalArgumentException if no format has that name
     */
    public ReportFormat create(String name) {
        Supplier<ReportFormat> factory = factories.get(name.toLowerCase(Locale.ROOT));
        if (factory == null) {
            throw new IllegalArgumentException("Unknown report format: " + name + " (known: " + factories.keySet() + ")");
        }
        return factory.get();
    }

    /**
     * Create and activate the named format.
     */
    public ReportFormat activate(String name) {
        ReportFormat format = create(name);
        activate(format);
        return format;
    }

    public void activate(ReportFormat format) {
        Objects.requireNonNull(format, "format");
        if (runInProgress) {
            throw new IllegalStateException("Cannot replace the active report format while a run is in progress");
        }
        active = format;
        log.debug("Active report format: {}", format.name());
    }

    public Optional<ReportFormat> active() {
        return Optional.ofNullable(active);
    }

    public ReportFormat requireActive() {
        if (active == null) {
            throw new IllegalStateException("No report format is active");
        }
        return active;
    }

    public boolean isRunInProgress() {
        return runInProgress;
    }

    /**
     * Mark a run as started; the active format is frozen until {@link #endRun()}.
     */
    public void beginRun() {
        if (runInProgress) {
            throw new IllegalStateException("A run is already in progress");
        }
        runInProgress = true;
    }

    public void endRun() {
        runInProgress = false;
    }
}
