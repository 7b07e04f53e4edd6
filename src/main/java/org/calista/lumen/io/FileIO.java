package org.calista.lumen.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * FileIO — the single point of file I/O in the project.
 *
 * <ul>
 *   <li>safe resolve inside {@code baseDir} (no absolute paths, no {@code ..} escape)</li>
 *   <li>atomic whole-file writes (tmp sibling + move) with optional fsync</li>
 *   <li>append of complete lines in one write call, optionally under an OS file lock</li>
 *   <li>streaming JSONL reads (trim + skip empty)</li>
 * </ul>
 *
 * No external dependencies besides logging.
 */
public final class FileIO {
    private static final Logger log = LogManager.getLogger(FileIO.class);

    // ----------------------------
    // Options / Builder
    // ----------------------------

    public static final class Options {
        public final Charset charset;
        public final boolean atomicWrites;
        public final boolean fsyncOnCommit;
        public final boolean lockWrites;
        public final Duration lockTimeout;

        private Options(Builder b) {
            this.charset = b.charset;
            this.atomicWrites = b.atomicWrites;
            this.fsyncOnCommit = b.fsyncOnCommit;
            this.lockWrites = b.lockWrites;
            this.lockTimeout = b.lockTimeout;
        }

        public static Builder builder() {
            return new Builder();
        }

        public static final class Builder {
            private Charset charset = StandardCharsets.UTF_8;
            private boolean atomicWrites = true;
            private boolean fsyncOnCommit = true;
            private boolean lockWrites = false;   // enable when several processes share a log
            private Duration lockTimeout = Duration.ofSeconds(3);

            public Builder charset(Charset v) {
                this.charset = Objects.requireNonNull(v);
                return this;
            }

            public Builder atomicWrites(boolean v) {
                this.atomicWrites = v;
                return this;
            }

            public Builder fsyncOnCommit(boolean v) {
                this.fsyncOnCommit = v;
                return this;
            }

            public Builder lockWrites(boolean v) {
                this.lockWrites = v;
                return this;
            }

            public Builder lockTimeout(Duration v) {
                this.lockTimeout = Objects.requireNonNull(v);
                return this;
            }

            public Options build() {
                return new Options(this);
            }
        }
    }

    private final Path baseDir;
    private final Options opt;

    public FileIO(Path baseDir) {
        this(baseDir, Options.builder().build());
    }

    public FileIO(Path baseDir, Options options) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.opt = Objects.requireNonNull(options, "options");
        log.debug("FileIO init: baseDir={}, charset={}, atomicWrites={}, fsyncOnCommit={}, lockWrites={}, lockTimeout={}",
                this.baseDir, opt.charset, opt.atomicWrites, opt.fsyncOnCommit, opt.lockWrites, opt.lockTimeout);
        try {
            ensureBaseDir();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to ensure base directory exists: " + this.baseDir, e);
        }
    }

    // ----------------------------
    // Base dir / Resolve
    // ----------------------------

    public Path baseDir() {
        return baseDir;
    }

    public Options options() {
        return opt;
    }

    public void ensureBaseDir() throws IOException {
        Files.createDirectories(baseDir);
    }

    /**
     * Resolves a relative path inside baseDir. Absolute paths and {@code ..} escapes are rejected;
     * backslashes are treated as separators.
     */
    public Path resolve(String relative) {
        Objects.requireNonNull(relative, "relative");
        Path rel = Paths.get(relative.replace('\\', '/'));
        if (rel.isAbsolute()) throw new IllegalArgumentException("resolve(relative) does not accept absolute paths: " + relative);

        Path p = baseDir.resolve(rel).normalize().toAbsolutePath();
        if (!p.startsWith(baseDir)) throw new IllegalArgumentException("Path traversal detected: " + relative);
        return p;
    }

    public void ensureParentDir(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    public boolean exists(Path file) {
        Objects.requireNonNull(file, "file");
        return Files.exists(file);
    }

    // ----------------------------
    // Whole-file text
    // ----------------------------

    public String readString(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return Files.readString(file, opt.charset);
    }

    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(content, "content");
        ensureParentDir(file);

        if (!opt.atomicWrites) {
            Files.writeString(file, content, opt.charset,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            return;
        }

        Path tmp = tempSibling(file);
        Files.writeString(tmp, content, opt.charset,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        atomicCommit(tmp, file);
    }

    // ----------------------------
    // Lines / JSONL
    // ----------------------------

    /**
     * Appends {@code line + lineSeparator} through one APPEND channel, forced to disk when
     * {@code fsyncOnCommit} is set. Callers that read concurrently must still serialize
     * against this (see JsonlConversationStore).
     */
    public void appendLine(Path file, String line) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(line, "line");
        ensureParentDir(file);

        ByteBuffer buf = ByteBuffer.wrap((line + System.lineSeparator()).getBytes(opt.charset));
        try (FileChannel ch = FileChannel.open(file,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            if (!opt.lockWrites) {
                writeFully(ch, buf);
                return;
            }
            withWriteLock(ch, file, () -> writeFully(ch, buf));
        }
    }

    public void appendJsonl(Path file, String jsonLine) throws IOException {
        Objects.requireNonNull(jsonLine, "jsonLine");
        String s = jsonLine.trim();
        if (s.isEmpty()) return;
        if (s.indexOf('\n') >= 0 || s.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("JSONL record must be a single line");
        }
        appendLine(file, s);
    }

    /**
     * Ends a file whose last line has no terminator (a crash mid-append) with a line separator,
     * so the next append starts on a fresh line.
     *
     * @return true if a separator was written
     */
    public boolean terminateLastLine(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.exists(file)) return false;

        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            long size = ch.size();
            if (size == 0) return false;

            ByteBuffer last = ByteBuffer.allocate(1);
            ch.read(last, size - 1);
            if (last.get(0) == '\n') return false;

            ByteBuffer buf = ByteBuffer.wrap(System.lineSeparator().getBytes(opt.charset));
            ch.position(size);
            writeFully(ch, buf);
            log.warn("Unterminated last line in {} ({} bytes); line separator appended", file, size);
            return true;
        }
    }

    /**
     * Stream of JSONL records (trimmed, empty lines skipped). The stream must be closed.
     */
    public Stream<String> jsonlStream(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return Files.lines(file, opt.charset)
                .map(x -> x == null ? "" : x.trim())
                .filter(x -> !x.isEmpty());
    }

    // ----------------------------
    // Internals
    // ----------------------------

    private void writeFully(FileChannel ch, ByteBuffer buf) throws IOException {
        while (buf.hasRemaining()) ch.write(buf);
        if (opt.fsyncOnCommit) ch.force(false);
    }

    private Path tempSibling(Path target) {
        return target.resolveSibling(target.getFileName().toString() + ".tmp");
    }

    private void atomicCommit(Path tmp, Path target) throws IOException {
        // tmp must hit the disk before the rename, otherwise a crash can leave an empty target
        if (opt.fsyncOnCommit) fsyncFile(tmp);

        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.trace("atomicCommit: {} -> {} (ATOMIC)", tmp, target);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            log.trace("atomicCommit: {} -> {} (NON-ATOMIC fallback)", tmp, target);
        } finally {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                log.warn("atomicCommit: failed to delete tmp {}", tmp, e);
            }
        }
    }

    private void fsyncFile(Path file) {
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ)) {
            ch.force(true);
        } catch (IOException e) {
            log.debug("fsyncFile ignored for {}: {}", file, e.toString());
        }
    }

    private void withWriteLock(FileChannel ch, Path file, IoRunnable action) throws IOException {
        long deadlineNs = System.nanoTime() + opt.lockTimeout.toNanos();
        while (true) {
            try {
                FileLock lock = ch.tryLock();
                if (lock != null) {
                    try (lock) {
                        action.run();
                        return;
                    }
                }
            } catch (OverlappingFileLockException ignored) {
                // held by another channel of this JVM; wait for it
            }

            if (System.nanoTime() >= deadlineNs) {
                throw new IOException("Write lock timeout for " + file);
            }
            sleepQuiet(10);
        }
    }

    private static void sleepQuiet(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    @FunctionalInterface
    private interface IoRunnable {
        void run() throws IOException;
    }
}
