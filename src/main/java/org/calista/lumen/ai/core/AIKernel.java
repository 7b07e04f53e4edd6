package org.calista.lumen.ai.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.lumen.ai.history.ConversationStore;
import org.calista.lumen.ai.history.InMemoryConversationStore;
import org.calista.lumen.ai.history.JsonlConversationStore;
import org.calista.lumen.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;

/**
 * AIKernel — instance-owned runtime container.
 *
 * Lifecycle:
 *   1) build(configFile) -> load or create config, open IO and the conversation store
 *   2) use               -> compose the engine (AIComposer), answer turns
 *   3) close()           -> close the store
 *
 * No static singletons: whoever builds the kernel owns it.
 */
public final class AIKernel implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AIKernel.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final AIConfig cfg;
    private final ConversationStore store;
    private final Clock clock;

    private volatile boolean closed = false;

    private AIKernel(FileIO io, ObjectMapper mapper, AIConfig cfg, ConversationStore store, Clock clock) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        /**
         * Root directory where the config lives.
         * The config is read before baseDir is known (baseDir is inside the config).
         */
        private Path configRoot = Path.of(".");

        private ObjectMapper mapper;
        private ConversationStore store;
        private Clock clock = Clock.systemUTC();

        public Builder configRoot(Path configRoot) {
            this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        /** Overrides history.storage; the kernel still closes it. */
        public Builder store(ConversationStore store) {
            this.store = Objects.requireNonNull(store, "store");
            return this;
        }

        /** Time source for turn timestamps and date/time answers. */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public AIKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper om = (this.mapper != null) ? this.mapper : defaultMapper();

            // config IO (outside baseDir)
            Path cfgPath = configFile.isAbsolute() ? configFile : configRoot.resolve(configFile);
            FileIO external = new FileIO(configRoot);
            AIConfig cfg = AIConfig.loadOrCreate(external, cfgPath, om);

            // runtime data dir; relative baseDir is taken from configRoot
            Path base = Path.of(cfg.baseDir);
            if (!base.isAbsolute()) base = configRoot.resolve(base);
            FileIO io = new FileIO(base, FileIO.Options.builder()
                    .lockWrites(cfg.history.lockWrites)
                    .fsyncOnCommit(cfg.history.fsync)
                    .build());

            ConversationStore st = (this.store != null) ? this.store : openStore(cfg, io, om, clock);

            AIKernel k = new AIKernel(io, om, cfg, st, clock);
            k.logCreated(cfgPath);
            return k;
        }

        private static ConversationStore openStore(AIConfig cfg, FileIO io, ObjectMapper om, Clock clock) throws IOException {
            if (AIConfig.STORAGE_MEMORY.equals(cfg.history.storage)) {
                log.warn("history.storage=memory: conversation history will not survive a restart");
                return new InMemoryConversationStore(clock);
            }
            return new JsonlConversationStore(io, om, io.resolve(cfg.history.logFile), clock);
        }

        private static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return om;
        }
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() { return io; }
    public ObjectMapper mapper() { return mapper; }
    public AIConfig config() { return cfg; }
    public ConversationStore store() { return store; }

    /** Clock in the configured "local" zone. */
    public Clock localClock() {
        return clock.withZone(cfg.zoneId());
    }

    public boolean isClosed() {
        return closed;
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        store.close();
        log.info("AIKernel closed");
    }

    private void logCreated(Path cfgPath) {
        if (!log.isInfoEnabled()) return;
        log.info("AIKernel created: config={}, baseDir={}, storage={}, zone={}",
                cfgPath, io.baseDir(), cfg.history.storage, cfg.zoneId());
    }
}
