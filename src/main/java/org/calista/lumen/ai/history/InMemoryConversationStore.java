package org.calista.lumen.ai.history;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * In-process conversation log. Nothing survives a restart; used by tests and by
 * {@code history.storage = "memory"}.
 */
public final class InMemoryConversationStore implements ConversationStore {

    private final Clock clock;
    private final ArrayList<Turn> turns = new ArrayList<>();
    private long nextId = 1;

    public InMemoryConversationStore() {
        this(Clock.systemUTC());
    }

    public InMemoryConversationStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public synchronized Turn append(String userText, String aiText) {
        Turn t = new Turn(nextId++, Instant.now(clock).toString(),
                Objects.requireNonNull(userText, "userText"),
                Objects.requireNonNull(aiText, "aiText"));
        turns.add(t);
        return t;
    }

    @Override
    public synchronized List<Turn> fetchRecent(int limit) {
        if (limit < 0) throw new IllegalArgumentException("limit must be >= 0: " + limit);
        int from = Math.max(0, turns.size() - limit);
        return List.copyOf(turns.subList(from, turns.size()));
    }

    @Override
    public synchronized long size() {
        return turns.size();
    }

    @Override
    public void close() {
        // nothing to release
    }
}
