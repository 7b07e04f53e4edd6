package org.calista.lumen.ai.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.lumen.ai.expr.ExpressionEvaluator;
import org.calista.lumen.ai.think.intent.IntentKeywords;
import org.calista.lumen.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * AIConfig — plain POJO config:
 * - defaults live in field initializers
 * - loadOrCreate() writes the defaults when the file is missing or blank
 * - validate() normalizes and clamps values
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AIConfig {

    private static final Logger log = LoggerFactory.getLogger(AIConfig.class);

    public static final String STORAGE_JSONL = "jsonl";
    public static final String STORAGE_MEMORY = "memory";

    public String baseDir = "data";
    public History history = new History();
    public Evaluator evaluator = new Evaluator();
    public Intents intents = new Intents();
    public ClockSection clock = new ClockSection();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class History {
        /** "jsonl" (file under baseDir) or "memory" (lost on exit). */
        public String storage = STORAGE_JSONL;
        public String logFile = "conversation.jsonl";
        /** How many turns a recall shows. */
        public int recallLimit = 10;
        /** OS file lock around each append; only needed when several processes share the log. */
        public boolean lockWrites = false;
        public boolean fsync = true;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Evaluator {
        public int maxInputLength = ExpressionEvaluator.DEFAULT_MAX_INPUT_LENGTH;
        public int maxDepth = ExpressionEvaluator.DEFAULT_MAX_DEPTH;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Intents {
        public List<String> date = new ArrayList<>(IntentKeywords.DEFAULT_DATE);
        public List<String> time = new ArrayList<>(IntentKeywords.DEFAULT_TIME);
        public List<String> recall = new ArrayList<>(IntentKeywords.DEFAULT_RECALL);
        public List<String> identity = new ArrayList<>(IntentKeywords.DEFAULT_IDENTITY);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ClockSection {
        /** Zone for date/time answers, e.g. "Asia/Seoul". Blank: system default. */
        public String zone = "";
    }

    // -------------------- Load / Create --------------------

    public static AIConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            AIConfig created = new AIConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            AIConfig created = new AIConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        AIConfig cfg = mapper.readValue(json, AIConfig.class);
        if (cfg == null) cfg = new AIConfig();

        cfg.validate();
        return cfg;
    }

    public static void save(FileIO io, Path configFile, ObjectMapper mapper, AIConfig cfg) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(cfg, "cfg");

        cfg.validate();
        writePretty(io, configFile, mapper, cfg);
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, AIConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Derived --------------------

    public IntentKeywords keywords() {
        return new IntentKeywords(intents.date, intents.time, intents.recall, intents.identity);
    }

    public ZoneId zoneId() {
        return clock.zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(clock.zone);
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (baseDir == null || baseDir.isBlank()) baseDir = "data";

        if (history == null) history = new History();
        history.storage = (history.storage == null) ? STORAGE_JSONL : history.storage.trim().toLowerCase(Locale.ROOT);
        if (!STORAGE_JSONL.equals(history.storage) && !STORAGE_MEMORY.equals(history.storage)) {
            log.warn("Unknown history.storage '{}', using '{}'", history.storage, STORAGE_JSONL);
            history.storage = STORAGE_JSONL;
        }
        if (history.logFile == null || history.logFile.isBlank()) history.logFile = "conversation.jsonl";
        if (history.recallLimit < 1) history.recallLimit = 1;
        if (history.recallLimit > 1000) history.recallLimit = 1000;

        if (evaluator == null) evaluator = new Evaluator();
        if (evaluator.maxInputLength < 1) evaluator.maxInputLength = ExpressionEvaluator.DEFAULT_MAX_INPUT_LENGTH;
        if (evaluator.maxInputLength > 4096) evaluator.maxInputLength = 4096;
        if (evaluator.maxDepth < 1) evaluator.maxDepth = ExpressionEvaluator.DEFAULT_MAX_DEPTH;
        if (evaluator.maxDepth > 512) evaluator.maxDepth = 512;

        // empty keyword lists fall back to defaults inside IntentKeywords
        if (intents == null) intents = new Intents();
        if (intents.date == null) intents.date = new ArrayList<>(IntentKeywords.DEFAULT_DATE);
        if (intents.time == null) intents.time = new ArrayList<>(IntentKeywords.DEFAULT_TIME);
        if (intents.recall == null) intents.recall = new ArrayList<>(IntentKeywords.DEFAULT_RECALL);
        if (intents.identity == null) intents.identity = new ArrayList<>(IntentKeywords.DEFAULT_IDENTITY);

        if (clock == null) clock = new ClockSection();
        if (clock.zone == null) clock.zone = "";
        clock.zone = clock.zone.trim();
        if (!clock.zone.isEmpty()) {
            try {
                ZoneId.of(clock.zone);
            } catch (DateTimeException e) {
                log.warn("Invalid clock.zone '{}', using system default: {}", clock.zone, e.getMessage());
                clock.zone = "";
            }
        }
    }
}
