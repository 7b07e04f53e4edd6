package org.calista.lumen.ai.think.response;

import org.calista.lumen.ai.history.InMemoryConversationStore;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HistoryRecallStrategyTest {

    @Test
    void showsAtMostLimitTurns() {
        InMemoryConversationStore store = new InMemoryConversationStore();
        for (int i = 1; i <= 12; i++) store.append("q" + i, "a" + i);

        String text = new HistoryRecallStrategy(store, 10).respond("history").orElseThrow();
        String[] lines = text.split("\n");

        assertEquals(11, lines.length);
        assertEquals(HistoryRecallStrategy.HEADER, lines[0]);
        assertEquals("1. You said: 'q3' | I responded: 'a3'", lines[1]);
        assertEquals("10. You said: 'q12' | I responded: 'a12'", lines[10]);
    }

    @Test
    void emptyStoreSaysSo() {
        assertEquals(HistoryRecallStrategy.EMPTY,
                new HistoryRecallStrategy(new InMemoryConversationStore(), 10).respond("log").orElseThrow());
    }

    @Test
    void limitMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new HistoryRecallStrategy(new InMemoryConversationStore(), 0));
    }
}
