package org.calista.lumen.ai.history;

import java.io.IOException;
import java.util.List;

/**
 * ConversationStore — append-only log of {@link Turn}s.
 *
 * <p>There is no update and no delete. Implementations serialize {@link #append} so ids are
 * race-free and strictly increasing, and a reader never sees a half-written turn.
 * Within one process a {@link #fetchRecent} issued after an append observes it.</p>
 */
public interface ConversationStore extends AutoCloseable {

    /**
     * Persists a turn with the next id and the current UTC time.
     */
    Turn append(String userText, String aiText) throws IOException;

    /**
     * Up to {@code limit} most recent turns, oldest first.
     *
     * @throws IllegalArgumentException if limit is negative
     */
    List<Turn> fetchRecent(int limit) throws IOException;

    long size() throws IOException;

    @Override
    void close();
}
