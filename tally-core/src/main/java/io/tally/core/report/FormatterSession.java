package io.tally.core.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Per-run state of a report format: the open output document and a scratch
 * sanitizer. Created by {@code openReport}, closed by {@code closeReport}.
 * <p>
 * Event handlers cannot throw checked exceptions, so the first write failure is
 * latched: later writes are skipped and {@link #close()} rethrows it.
 */
abstract class FormatterSession implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(FormatterSession.class);

    private final Path path;
    private final Writer writer;
    private final XmlSanitizer sanitizer = new XmlSanitizer();
    private IOException failure;
    private boolean closed;

    protected FormatterSession(Path path) throws IOException {
        this.path = path;
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
    }

    Path path() {
        return path;
    }

    Writer writer() {
        return writer;
    }

    boolean failed() {
        return failure != null;
    }

    void write(String text) {
        if (failure != null || closed) {
            return;
        }
        try {
            writer.write(text);
        } catch (IOException e) {
            latch(e);
        }
    }

    void writef(String format, Object... args) {
        write(format.formatted(args));
    }

    /**
     * @return {@code raw} made safe for embedding in markup
     */
    String text(CharSequence raw) {
        return sanitizer.sanitize(raw);
    }

    void latch(IOException e) {
        if (failure == null) {
            failure = e;
            log.error("Failed to write report record to {}", path, e);
        }
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        IOException closeFailure = null;
        try {
            writer.close();
        } catch (IOException e) {
            closeFailure = e;
        }
        if (failure != null) {
            if (closeFailure != null) {
                failure.addSuppressed(closeFailure);
            }
            throw failure;
        }
        if (closeFailure != null) {
            throw closeFailure;
        }
    }
}
