package io.middleware4j.job;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.io.UncheckedIOException;

/**
 * A connected byte-stream pair. One side writes to {@link #writer()}, the other reads from {@link #reader()}.
 *
 * <p>The writing side must close the writer when done; readers see end-of-stream only after that.
 */
public final class Pipe implements AutoCloseable {

    public static final int DEFAULT_BUFFER_SIZE = 64 * 1024;

    private final PipedInputStream reader;
    private final PipedOutputStream writer;

    private Pipe(int bufferSize) {
        this.reader = new PipedInputStream(bufferSize);
        try {
            this.writer = new PipedOutputStream(reader);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Pipe open() {
        return new Pipe(DEFAULT_BUFFER_SIZE);
    }

    public static Pipe open(int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be positive");
        }
        return new Pipe(bufferSize);
    }

    public InputStream reader() {
        return reader;
    }

    public OutputStream writer() {
        return writer;
    }

    @Override
    public void close() throws IOException {
        try {
            writer.close();
        } finally {
            reader.close();
        }
    }
}
