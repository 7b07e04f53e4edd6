package org.calista.lumen.ai.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.lumen.ai.expr.ExpressionEvaluator;
import org.calista.lumen.ai.think.intent.IntentKeywords;
import org.calista.lumen.io.FileIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AIConfigTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void missingFileIsCreatedWithDefaults() throws Exception {
        FileIO io = new FileIO(dir);
        Path cfgFile = dir.resolve("config/config.json");

        AIConfig cfg = AIConfig.loadOrCreate(io, cfgFile, mapper);

        assertTrue(Files.exists(cfgFile));
        assertEquals("data", cfg.baseDir);
        assertEquals(AIConfig.STORAGE_JSONL, cfg.history.storage);
        assertEquals("conversation.jsonl", cfg.history.logFile);
        assertEquals(10, cfg.history.recallLimit);
        assertEquals(ExpressionEvaluator.DEFAULT_MAX_INPUT_LENGTH, cfg.evaluator.maxInputLength);
        assertEquals(ExpressionEvaluator.DEFAULT_MAX_DEPTH, cfg.evaluator.maxDepth);
        assertEquals(IntentKeywords.defaults(), cfg.keywords());

        AIConfig again = AIConfig.loadOrCreate(io, cfgFile, mapper);
        assertEquals(cfg.history.recallLimit, again.history.recallLimit);
        assertEquals(cfg.keywords(), again.keywords());
    }

    @Test
    void blankFileIsRecreated() throws Exception {
        FileIO io = new FileIO(dir);
        Path cfgFile = dir.resolve("config.json");
        Files.writeString(cfgFile, "  \n");

        AIConfig cfg = AIConfig.loadOrCreate(io, cfgFile, mapper);

        assertEquals(10, cfg.history.recallLimit);
        assertFalse(Files.readString(cfgFile).isBlank());
    }

    @Test
    void partialFileKeepsDefaultsForMissingSections() throws Exception {
        FileIO io = new FileIO(dir);
        Path cfgFile = dir.resolve("config.json");
        Files.writeString(cfgFile, "{\"history\":{\"recallLimit\":3},\"somethingElse\":true}");

        AIConfig cfg = AIConfig.loadOrCreate(io, cfgFile, mapper);

        assertEquals(3, cfg.history.recallLimit);
        assertEquals(AIConfig.STORAGE_JSONL, cfg.history.storage);
        assertTrue(cfg.history.fsync);
        assertEquals(IntentKeywords.DEFAULT_DATE, cfg.intents.date);
    }

    @Test
    void validateClampsAndRepairs() {
        AIConfig cfg = new AIConfig();
        cfg.baseDir = " ";
        cfg.history.storage = " MEMORY ";
        cfg.history.recallLimit = 0;
        cfg.history.logFile = null;
        cfg.evaluator.maxInputLength = 100_000;
        cfg.evaluator.maxDepth = -5;
        cfg.intents.time = null;
        cfg.clock.zone = " Mars/Olympus_Mons ";

        cfg.validate();

        assertEquals("data", cfg.baseDir);
        assertEquals(AIConfig.STORAGE_MEMORY, cfg.history.storage);
        assertEquals(1, cfg.history.recallLimit);
        assertEquals("conversation.jsonl", cfg.history.logFile);
        assertEquals(4096, cfg.evaluator.maxInputLength);
        assertEquals(ExpressionEvaluator.DEFAULT_MAX_DEPTH, cfg.evaluator.maxDepth);
        assertEquals(IntentKeywords.DEFAULT_TIME, cfg.intents.time);
        assertEquals("", cfg.clock.zone);
        assertEquals(ZoneId.systemDefault(), cfg.zoneId());
    }

    @Test
    void unknownStorageFallsBackToJsonl() {
        AIConfig cfg = new AIConfig();
        cfg.history.storage = "postgres";
        cfg.history.recallLimit = 5000;
        cfg.validate();

        assertEquals(AIConfig.STORAGE_JSONL, cfg.history.storage);
        assertEquals(1000, cfg.history.recallLimit);
    }

    @Test
    void configuredZoneAndKeywordsAreUsed() {
        AIConfig cfg = new AIConfig();
        cfg.clock.zone = "Asia/Seoul";
        cfg.intents.recall = List.of("Transcript");
        cfg.validate();

        assertEquals(ZoneId.of("Asia/Seoul"), cfg.zoneId());
        assertEquals(List.of("transcript"), cfg.keywords().recall);
    }

    @Test
    void saveWritesValidatedConfig() throws Exception {
        FileIO io = new FileIO(dir);
        Path cfgFile = dir.resolve("saved.json");
        AIConfig cfg = new AIConfig();
        cfg.history.recallLimit = -1;

        AIConfig.save(io, cfgFile, mapper, cfg);

        AIConfig loaded = AIConfig.loadOrCreate(io, cfgFile, mapper);
        assertEquals(1, loaded.history.recallLimit);
    }
}
