package com.example.apistress.sink;

import com.example.apistress.clients.utils.JsonUtil;
import com.example.apistress.model.ResultRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only JSON Lines log. Serialization happens on the calling thread; the write of the finished line
 * is serialized through a single lock so two records never interleave.
 */
public final class JsonLinesResultSink implements ResultSink, Closeable {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesResultSink.class);

    /** Absolute paths with an open sink in this process; a path has at most one writer. */
    private static final Set<Path> OPEN_PATHS = ConcurrentHashMap.newKeySet();

    private final Path path;
    private final OutputStream out;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicLong linesWritten = new AtomicLong();
    private volatile boolean closed;

    private JsonLinesResultSink(Path path, OutputStream out) {
        this.path = path;
        this.out = out;
    }

    /**
     * Opens the log, creating missing parent directories. {@link LogWriteMode#TRUNCATE} empties an existing
     * file, {@link LogWriteMode#APPEND} keeps it.
     */
    public static JsonLinesResultSink open(Path path, LogWriteMode mode) {
        Objects.requireNonNull(path, "path");
        LogWriteMode writeMode = mode != null ? mode : LogWriteMode.TRUNCATE;
        Path absolute = path.toAbsolutePath().normalize();
        if (!OPEN_PATHS.add(absolute)) {
            throw new SinkException("Result log " + absolute + " is already being written by another run", null);
        }
        try {
            Path parent = absolute.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            OutputStream stream = switch (writeMode) {
                case TRUNCATE -> Files.newOutputStream(absolute,
                        StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
                case APPEND -> Files.newOutputStream(absolute,
                        StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
            };
            log.info("Result log opened at {} (mode={})", absolute, writeMode);
            return new JsonLinesResultSink(absolute, stream);
        } catch (IOException e) {
            OPEN_PATHS.remove(absolute);
            throw new SinkException("Unable to open result log " + absolute + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void append(ResultRecord record) throws SinkException {
        Objects.requireNonNull(record, "record");
        byte[] line = toLine(record);
        writeLock.lock();
        try {
            if (closed) {
                throw new SinkException("Result log " + path + " is closed", null);
            }
            out.write(line);
            out.flush();
            linesWritten.incrementAndGet();
        } catch (IOException e) {
            throw new SinkException("Unable to append to result log " + path + ": " + e.getMessage(), e);
        } finally {
            writeLock.unlock();
        }
    }

    private byte[] toLine(ResultRecord record) {
        try {
            return (JsonUtil.toJsonLine(record) + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new SinkException("Unable to serialize record " + record.requestId() + ": " + e.getOriginalMessage(), e);
        }
    }

    public Path getPath() {
        return path;
    }

    public long getLinesWritten() {
        return linesWritten.get();
    }

    @Override
    public void close() throws IOException {
        writeLock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            try {
                out.close();
            } finally {
                OPEN_PATHS.remove(path);
            }
            log.info("Result log {} closed after {} lines", path, linesWritten.get());
        } finally {
            writeLock.unlock();
        }
    }
}
