package org.calista.lumen.ai.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.lumen.io.FileIO;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Stream;

/**
 * JsonlConversationStore — append-only conversation log on disk, one {@link Turn} per line.
 *
 * <p>
 * Appends hold the write lock for id assignment and the file write together, so ids are
 * strictly increasing and a reader (read lock) never sees a half-written line.
 * On open the next id is recovered from the largest id in the file, and a torn last line
 * left by a crash is terminated so the next append does not merge into it.
 * Broken lines do not fail a read: they are skipped and logged.
 * </p>
 */
public final class JsonlConversationStore implements ConversationStore {

    private static final Logger log = LogManager.getLogger(JsonlConversationStore.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path file;
    private final Clock clock;

    private final ReentrantReadWriteLock rw = new ReentrantReadWriteLock();

    // guarded by rw write lock
    private long nextId;
    private long count;
    private boolean closed;

    public JsonlConversationStore(FileIO io, ObjectMapper mapper, Path file) throws IOException {
        this(io, mapper, file, Clock.systemUTC());
    }

    public JsonlConversationStore(FileIO io, ObjectMapper mapper, Path file, Clock clock) throws IOException {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.file = Objects.requireNonNull(file, "file");
        this.clock = Objects.requireNonNull(clock, "clock");
        recover();
    }

    public Path file() {
        return file;
    }

    // ---------------------------------------------------------------------
    // ConversationStore
    // ---------------------------------------------------------------------

    @Override
    public Turn append(String userText, String aiText) throws IOException {
        Objects.requireNonNull(userText, "userText");
        Objects.requireNonNull(aiText, "aiText");

        rw.writeLock().lock();
        try {
            ensureOpen();
            // ids are never reused, even when a failed append left its line on disk
            Turn t = new Turn(nextId++, Instant.now(clock).toString(), userText, aiText);
            try {
                io.appendJsonl(file, mapper.writeValueAsString(t));
            } catch (IOException | RuntimeException e) {
                resync(e);
                throw e;
            }
            count++;
            log.debug("turn appended: id={}, file={}", t.id(), file);
            return t;
        } finally {
            rw.writeLock().unlock();
        }
    }

    @Override
    public List<Turn> fetchRecent(int limit) throws IOException {
        if (limit < 0) throw new IllegalArgumentException("limit must be >= 0: " + limit);
        if (limit == 0) return List.of();

        rw.readLock().lock();
        try {
            ensureOpen();
            if (!io.exists(file)) return List.of();

            ArrayDeque<Turn> window = new ArrayDeque<>(Math.min(limit, 1024));
            try (Stream<String> lines = io.jsonlStream(file)) {
                Iterator<String> it = lines.iterator();
                while (it.hasNext()) {
                    Turn t = parseOrNull(it.next());
                    if (t == null) continue;
                    if (window.size() == limit) window.pollFirst();
                    window.addLast(t);
                }
            } catch (UncheckedIOException e) {
                throw e.getCause();
            }
            return List.copyOf(window);
        } finally {
            rw.readLock().unlock();
        }
    }

    @Override
    public long size() {
        rw.readLock().lock();
        try {
            return count;
        } finally {
            rw.readLock().unlock();
        }
    }

    @Override
    public void close() {
        rw.writeLock().lock();
        try {
            if (!closed) log.debug("conversation store closed: file={}, turns={}", file, count);
            closed = true;
        } finally {
            rw.writeLock().unlock();
        }
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private void recover() throws IOException {
        rw.writeLock().lock();
        try {
            io.terminateLastLine(file);
            long[] scan = scan();
            nextId = scan[0] + 1;
            count = scan[1];
            log.info("Conversation log opened: file={}, turns={}, nextId={}", file, count, nextId);
        } finally {
            rw.writeLock().unlock();
        }
    }

    /**
     * After a failed append the file may or may not hold the turn: count from the file and
     * never move nextId backwards. Caller holds the write lock.
     */
    private void resync(Exception cause) {
        try {
            long[] scan = scan();
            nextId = Math.max(nextId, scan[0] + 1);
            count = scan[1];
            log.warn("Append failed, log re-read: file={}, turns={}, nextId={}", file, count, nextId, cause);
        } catch (IOException | RuntimeException e) {
            cause.addSuppressed(e);
            log.error("Append failed and the log could not be re-read: {}", file, e);
        }
    }

    /** {maxId, validTurns}. */
    private long[] scan() throws IOException {
        long maxId = 0;
        long n = 0;
        if (!io.exists(file)) return new long[]{maxId, n};

        try (Stream<String> lines = io.jsonlStream(file)) {
            Iterator<String> it = lines.iterator();
            while (it.hasNext()) {
                Turn t = parseOrNull(it.next());
                if (t == null) continue;
                maxId = Math.max(maxId, t.id());
                n++;
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        return new long[]{maxId, n};
    }

    private Turn parseOrNull(String line) {
        try {
            return mapper.readValue(line, Turn.class);
        } catch (JsonProcessingException | RuntimeException e) {
            // one broken row must not hide the rest of the history
            log.warn("Skipping broken conversation line in {}: {}", file, e.getMessage());
            return null;
        }
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("ConversationStore is closed: " + file);
    }
}
