package org.calista.lumen.ai.think.response;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.lumen.ai.history.ConversationStore;
import org.calista.lumen.ai.history.Turn;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Recalls the last turns from the conversation log. Memory is whatever the log holds;
 * nothing is kept between calls.
 */
public final class HistoryRecallStrategy implements ResponseStrategy {

    private static final Logger log = LogManager.getLogger(HistoryRecallStrategy.class);

    public static final String EMPTY = "There is no previous conversation yet.";
    public static final String UNAVAILABLE = "I couldn't read our conversation history right now.";
    public static final String HEADER = "Here is our recent conversation history:";

    private final ConversationStore store;
    private final int limit;

    public HistoryRecallStrategy(ConversationStore store, int limit) {
        this.store = Objects.requireNonNull(store, "store");
        if (limit < 1) throw new IllegalArgumentException("limit must be >= 1: " + limit);
        this.limit = limit;
    }

    @Override
    public Optional<String> respond(String message) {
        List<Turn> turns;
        try {
            turns = store.fetchRecent(limit);
        } catch (IOException e) {
            log.warn("History recall failed, answering without it", e);
            return Optional.of(UNAVAILABLE);
        }
        if (turns.isEmpty()) return Optional.of(EMPTY);

        StringBuilder sb = new StringBuilder(HEADER);
        int n = 1;
        for (Turn t : turns) {
            sb.append('\n')
                    .append(n++)
                    .append(". You said: '").append(t.userText())
                    .append("' | I responded: '").append(t.aiText())
                    .append('\'');
        }
        return Optional.of(sb.toString());
    }
}
