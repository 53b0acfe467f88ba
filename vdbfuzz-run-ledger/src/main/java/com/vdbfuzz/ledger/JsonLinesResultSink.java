package com.vdbfuzz.ledger;

import com.vdbfuzz.model.TestResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Writes one {@link TestResult} JSON record per line, in generation order. Each record carries its
 * schema version and round-trips through {@link TestResult#fromJson(String)}. The file is created
 * (or truncated) at run start and flushed after every record.
 */
public final class JsonLinesResultSink implements ResultSink {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesResultSink.class);

    private final Path file;
    private BufferedWriter writer;
    private int written;

    public JsonLinesResultSink(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    public Path getFile() {
        return file;
    }

    @Override
    public synchronized void runStarted(RunInfo run) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            written = 0;
            log.info("Writing results | runId={} | file={}", run.getRunId(), file.toAbsolutePath());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open results file " + file, e);
        }
    }

    @Override
    public synchronized void testCompleted(TestResult result) {
        if (writer == null) {
            throw new IllegalStateException("runStarted was not called or the results file could not be opened");
        }
        try {
            writer.write(result.toJson());
            writer.newLine();
            writer.flush();
            written++;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write result " + result.getTestCase().getId() + " to " + file, e);
        }
    }

    @Override
    public synchronized void runEnded(RunSummary summary) {
        if (writer == null) return;
        try {
            writer.close();
            log.info("Results written | runId={} | records={} | file={}", summary.getRunId(), written, file.toAbsolutePath());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot close results file " + file, e);
        } finally {
            writer = null;
        }
    }
}
