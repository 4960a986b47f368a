package io.tally.api.report;

import io.tally.api.registry.TestRegistry;

import java.util.Objects;

/**
 * What a format needs to know about the run it is about to report on.
 *
 * @param registry    the registry being run
 * @param packageName namespace prefix for generated identifiers, empty if unset
 */
public record ReportContext(TestRegistry registry, String packageName) {

    public ReportContext {
        Objects.requireNonNull(registry, "registry");
        packageName = packageName == null ? "" : packageName;
    }

    public static ReportContext of(TestRegistry registry) {
        return new ReportContext(registry, "");
    }
}
