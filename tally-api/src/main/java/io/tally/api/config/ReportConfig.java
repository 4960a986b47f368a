package io.tally.api.config;

/**
 * Configuration for automated report runs.
 * Controls the output filename root, the package name and the report format.
 */
public final class ReportConfig {

    /** Longest package name kept; longer names are truncated. */
    public static final int MAX_PACKAGE_NAME_LENGTH = 49;

    private String outputRoot = null; // null = format default root
    private String packageName = "";
    private String format = "cunit";

    private ReportConfig() {}

    public static ReportConfig create() {
        return new ReportConfig();
    }

    public ReportConfig outputRoot(String outputRoot) {
        this.outputRoot = outputRoot;
        return this;
    }

    /**
     * Set the namespace prefix used in generated identifiers.
     * Null clears it; names longer than {@link #MAX_PACKAGE_NAME_LENGTH} are truncated.
     */
    public ReportConfig packageName(String packageName) {
        this.packageName = normalizePackageName(packageName);
        return this;
    }

    /**
     * Select the report format by name ("cunit", "junit" or "json").
     */
    public ReportConfig format(String format) {
        if (format == null || format.isBlank()) {
            throw new IllegalArgumentException("Format name must not be blank");
        }
        this.format = format;
        return this;
    }

    /**
     * @return {@code packageName} cut to {@link #MAX_PACKAGE_NAME_LENGTH}, or empty for null
     */
    public static String normalizePackageName(String packageName) {
        if (packageName == null) {
            return "";
        }
        return packageName.length() > MAX_PACKAGE_NAME_LENGTH
                ? packageName.substring(0, MAX_PACKAGE_NAME_LENGTH)
                : packageName;
    }

    public String outputRoot() { return outputRoot; }
    public String packageName() { return packageName; }
    public String format() { return format; }
}
