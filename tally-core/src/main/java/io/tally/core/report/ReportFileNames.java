package io.tally.core.report;

/**
 * Output file names derived from a filename root.
 * <p>
 * {@code "Foo"} yields {@code Foo-Listing.xml} and {@code Foo-Results.xml}. A null or
 * empty root falls back to {@link #DEFAULT_ROOT}. The root is truncated so that no
 * derived name is longer than {@link #MAX_FILENAME_LENGTH} - 1 characters.
 *
 * @param listing name of the static listing document
 * @param results name of the run results document
 */
public record ReportFileNames(String listing, String results) {

    public static final String DEFAULT_ROOT = "TallyAutomated";
    public static final int MAX_FILENAME_LENGTH = 1025;

    static final String LISTING_SUFFIX = "-Listing.xml";
    static final String RESULTS_SUFFIX = "-Results.xml";

    public static ReportFileNames derive(String root) {
        return derive(root, LISTING_SUFFIX, RESULTS_SUFFIX);
    }

    /**
     * Derive names with custom suffixes, applying the same default root and truncation rules.
     */
    public static ReportFileNames derive(String root, String listingSuffix, String resultsSuffix) {
        String base = (root == null || root.isEmpty()) ? DEFAULT_ROOT : root;
        return new ReportFileNames(withSuffix(base, listingSuffix), withSuffix(base, resultsSuffix));
    }

    private static String withSuffix(String root, String suffix) {
        int budget = MAX_FILENAME_LENGTH - suffix.length() - 1;
        String truncated = root.length() > budget ? root.substring(0, budget) : root;
        return truncated + suffix;
    }
}
