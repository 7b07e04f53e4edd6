package org.calista.lumen.ai.core;

import org.calista.lumen.ai.history.InMemoryConversationStore;
import org.calista.lumen.ai.history.JsonlConversationStore;
import org.calista.lumen.ai.think.ResponseEngine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class AIKernelTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-03-15T20:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path dir;

    @Test
    void buildsJsonlStoreUnderBaseDirByDefault() throws Exception {
        Path cfgFile = Path.of("config/config.json");

        try (AIKernel kernel = AIKernel.builder().configRoot(dir).clock(FIXED).build(cfgFile)) {
            assertTrue(Files.exists(dir.resolve("config/config.json")));
            assertInstanceOf(JsonlConversationStore.class, kernel.store());
            assertEquals(dir.toAbsolutePath().normalize().resolve("data"), kernel.io().baseDir());

            kernel.store().append("2+2", "The result is 4.");
        }

        assertEquals(1, Files.readAllLines(dir.resolve("data/conversation.jsonl")).size());
    }

    @Test
    void memoryStorageFromConfig() throws Exception {
        Files.createDirectories(dir.resolve("config"));
        Files.writeString(dir.resolve("config/config.json"), "{\"history\":{\"storage\":\"memory\"}}");

        try (AIKernel kernel = AIKernel.builder().configRoot(dir).build(Path.of("config/config.json"))) {
            assertInstanceOf(InMemoryConversationStore.class, kernel.store());
        }
        assertFalse(Files.exists(dir.resolve("data/conversation.jsonl")));
    }

    @Test
    void storeOverrideWins() throws Exception {
        InMemoryConversationStore store = new InMemoryConversationStore();
        try (AIKernel kernel = AIKernel.builder().configRoot(dir).store(store).build(dir.resolve("c.json"))) {
            assertSame(store, kernel.store());
        }
    }

    @Test
    void closeIsIdempotentAndClosesStore() throws Exception {
        AIKernel kernel = AIKernel.builder().configRoot(dir).build(Path.of("config.json"));
        assertFalse(kernel.isClosed());

        kernel.close();
        kernel.close();

        assertTrue(kernel.isClosed());
        assertThrows(IllegalStateException.class, () -> kernel.store().append("a", "b"));
    }

    @Test
    void composedEngineUsesConfiguredZoneAndRecallLimit() throws Exception {
        Files.writeString(dir.resolve("config.json"),
                "{\"clock\":{\"zone\":\"Asia/Seoul\"},\"history\":{\"storage\":\"memory\",\"recallLimit\":2}}");

        try (AIKernel kernel = AIKernel.builder().configRoot(dir).clock(FIXED).build(Path.of("config.json"))) {
            ResponseEngine engine = AIComposer.buildEngine(kernel);

            assertEquals("Today's date is 2024-03-16 (local time).", engine.generateResponse("date"));

            kernel.store().append("one", "1");
            kernel.store().append("two", "2");
            kernel.store().append("three", "3");
            String recall = engine.generateResponse("history");
            assertFalse(recall.contains("'one'"));
            assertTrue(recall.contains("1. You said: 'two' | I responded: '2'"));
            assertTrue(recall.contains("2. You said: 'three' | I responded: '3'"));
        }
    }
}
