package org.calista.lumen.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FileIOTest {

    @TempDir
    Path dir;

    @Test
    void resolveStaysInsideBaseDir() {
        FileIO io = new FileIO(dir);

        assertEquals(dir.toAbsolutePath().normalize().resolve("a/b.txt"), io.resolve("a/b.txt"));
        assertEquals(dir.toAbsolutePath().normalize().resolve("a/b.txt"), io.resolve("a\\b.txt"));
        assertThrows(IllegalArgumentException.class, () -> io.resolve("../escape.txt"));
        assertThrows(IllegalArgumentException.class, () -> io.resolve("a/../../escape.txt"));
        assertThrows(IllegalArgumentException.class, () -> io.resolve(dir.toAbsolutePath().resolve("x").toString()));
    }

    @Test
    void createsBaseDirOnConstruction() {
        Path nested = dir.resolve("one/two");
        new FileIO(nested);
        assertTrue(Files.isDirectory(nested));
    }

    @Test
    void atomicWriteReplacesContentAndLeavesNoTemp() throws Exception {
        FileIO io = new FileIO(dir);
        Path f = io.resolve("cfg/config.json");

        io.writeString(f, "first");
        io.writeString(f, "second");

        assertEquals("second", io.readString(f));
        assertFalse(Files.exists(f.resolveSibling("config.json.tmp")));
    }

    @Test
    void appendJsonlWritesSingleLinesAndSkipsBlank() throws Exception {
        FileIO io = new FileIO(dir, FileIO.Options.builder().fsyncOnCommit(false).build());
        Path f = io.resolve("log.jsonl");

        io.appendJsonl(f, "{\"a\":1}");
        io.appendJsonl(f, "   ");
        io.appendJsonl(f, "  {\"a\":2}  ");

        assertEquals(List.of("{\"a\":1}", "{\"a\":2}"), Files.readAllLines(f));
        assertThrows(IllegalArgumentException.class, () -> io.appendJsonl(f, "{\"a\":\n3}"));
    }

    @Test
    void lockedAppendWorksWithinOneProcess() throws Exception {
        FileIO io = new FileIO(dir, FileIO.Options.builder().lockWrites(true).fsyncOnCommit(false).build());
        Path f = io.resolve("locked.jsonl");

        io.appendLine(f, "one");
        io.appendLine(f, "two");

        assertEquals(List.of("one", "two"), Files.readAllLines(f));
    }

    @Test
    void jsonlStreamTrimsAndDropsEmptyLines() throws Exception {
        FileIO io = new FileIO(dir);
        Path f = io.resolve("rows.jsonl");
        Files.writeString(f, "  {}  \n\n\t\n[1]\n");

        try (Stream<String> rows = io.jsonlStream(f)) {
            assertEquals(List.of("{}", "[1]"), rows.toList());
        }
    }

    @Test
    void terminateLastLineOnlyTouchesUnterminatedFiles() throws Exception {
        FileIO io = new FileIO(dir, FileIO.Options.builder().fsyncOnCommit(false).build());
        Path torn = io.resolve("torn.jsonl");
        Path clean = io.resolve("clean.jsonl");
        Path empty = io.resolve("empty.jsonl");
        Files.writeString(torn, "{\"a\":1}\n{\"a\":");
        Files.writeString(clean, "{\"a\":1}\n");
        Files.writeString(empty, "");

        assertTrue(io.terminateLastLine(torn));
        assertFalse(io.terminateLastLine(torn));
        assertFalse(io.terminateLastLine(clean));
        assertFalse(io.terminateLastLine(empty));
        assertFalse(io.terminateLastLine(io.resolve("missing.jsonl")));

        io.appendLine(torn, "{\"a\":2}");
        assertEquals(List.of("{\"a\":1}", "{\"a\":", "{\"a\":2}"), Files.readAllLines(torn));
        assertEquals("{\"a\":1}\n", Files.readString(clean));
        assertEquals(0, Files.size(empty));
    }
}
