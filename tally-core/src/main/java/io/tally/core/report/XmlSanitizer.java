package io.tally.core.report;

/**
 * Escapes characters that would break the structure of an XML document.
 * <p>
 * {@code & < > "} become entity references. An {@code &} that already starts a
 * character or entity reference is kept as is, so sanitizing sanitized text is a
 * no-op, provided a numeric reference names a character XML 1.0 allows. Characters
 * XML 1.0 forbids (most control characters, unpaired surrogates, U+FFFE and U+FFFF)
 * are replaced by {@code ?}.
 * <p>
 * The expanded length is a pure function of the input ({@link #translatedLength}),
 * which lets an instance size its scratch buffer once and reuse it across calls.
 * Instances are not thread-safe; each report session owns one.
 */
public final class XmlSanitizer {

    private static final int INITIAL_CAPACITY = 128;

    private final StringBuilder scratch = new StringBuilder(INITIAL_CAPACITY);

    /**
     * Sanitize into the reusable scratch buffer and return the result.
     * The buffer grows only when a value needs more room than it has.
     */
    public String sanitize(CharSequence raw) {
        if (raw == null || raw.length() == 0) {
            return "";
        }
        scratch.setLength(0);
        scratch.ensureCapacity(translatedLength(raw));
        translate(raw, scratch);
        return scratch.toString();
    }

    int capacity() {
        return scratch.capacity();
    }

    /**
     * Sanitize into a freshly allocated string.
     */
    public static String escape(CharSequence raw) {
        if (raw == null || raw.length() == 0) {
            return "";
        }
        StringBuilder sb = new StringBuilder(translatedLength(raw));
        translate(raw, sb);
        return sb.toString();
    }

    /**
     * @return the exact length of {@code raw} after translation (0 for null)
     */
    public static int translatedLength(CharSequence raw) {
        if (raw == null) {
            return 0;
        }
        int length = 0;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            switch (c) {
                case '&' -> length += startsReference(raw, i) ? 1 : 5;
                case '<', '>' -> length += 4;
                case '"' -> length += 6;
                default -> length += 1;
            }
        }
        return length;
    }

    /**
     * Append the translation of {@code raw} to {@code out}.
     */
    public static void translate(CharSequence raw, StringBuilder out) {
        if (raw == null) {
            return;
        }
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            switch (c) {
                case '&' -> out.append(startsReference(raw, i) ? "&" : "&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append("&quot;");
                default -> out.append(isForbidden(raw, i) ? '?' : c);
            }
        }
    }

    /**
     * @return true if the char at {@code index} cannot appear in an XML 1.0 document
     */
    private static boolean isForbidden(CharSequence s, int index) {
        char c = s.charAt(index);
        if (c < 0x20) {
            return c != '\t' && c != '\n' && c != '\r';
        }
        if (c == '\uFFFE' || c == '\uFFFF') {
            return true;
        }
        if (Character.isHighSurrogate(c)) {
            return index + 1 >= s.length() || !Character.isLowSurrogate(s.charAt(index + 1));
        }
        if (Character.isLowSurrogate(c)) {
            return index == 0 || !Character.isHighSurrogate(s.charAt(index - 1));
        }
        return false;
    }

    private static boolean isXmlChar(long codePoint) {
        return codePoint == 0x9 || codePoint == 0xA || codePoint == 0xD
                || (codePoint >= 0x20 && codePoint <= 0xD7FF)
                || (codePoint >= 0xE000 && codePoint <= 0xFFFD)
                || (codePoint >= 0x10000 && codePoint <= 0x10FFFF);
    }

    /**
     * @return true if the {@code &} at {@code index} begins a predefined entity or a reference to a legal character
     */
    private static boolean startsReference(CharSequence s, int index) {
        int semi = -1;
        for (int i = index + 1; i < s.length() && i <= index + 10; i++) {
            if (s.charAt(i) == ';') {
                semi = i;
                break;
            }
        }
        if (semi < 0) {
            return false;
        }
        String name = s.subSequence(index + 1, semi).toString();
        switch (name) {
            case "amp", "lt", "gt", "quot", "apos":
                return true;
            default:
                break;
        }
        if (name.length() > 1 && name.charAt(0) == '#') {
            boolean hex = name.charAt(1) == 'x' || name.charAt(1) == 'X';
            String digits = name.substring(hex ? 2 : 1);
            if (digits.isEmpty()) {
                return false;
            }
            long value = 0;
            for (int i = 0; i < digits.length(); i++) {
                char d = digits.charAt(i);
                int digit = d < 0x80 ? Character.digit(d, hex ? 16 : 10) : -1;
                if (digit < 0) {
                    return false;
                }
                value = value * (hex ? 16 : 10) + digit;
            }
            return isXmlChar(value);
        }
        return false;
    }
}
