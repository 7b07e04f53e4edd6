package org.calista.lumen.ai;

import org.calista.lumen.ai.history.ConversationStore;
import org.calista.lumen.ai.history.InMemoryConversationStore;
import org.calista.lumen.ai.history.Turn;
import org.calista.lumen.ai.think.ResponseEngine;
import org.calista.lumen.ai.think.intent.IntentDispatcher;
import org.calista.lumen.ai.think.response.HistoryRecallStrategy;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TurnProcessorTest {

    private static ResponseEngine engineOver(ConversationStore store) {
        return new ResponseEngine(IntentDispatcher.builder()
                .historyRecall(new HistoryRecallStrategy(store, 10))
                .build());
    }

    @Test
    void blankMessageIsAnsweredAndNotLogged() {
        InMemoryConversationStore store = new InMemoryConversationStore();
        TurnProcessor p = new TurnProcessor(engineOver(store), store);

        assertEquals(TurnProcessor.EMPTY_MESSAGE_REPLY, p.process(""));
        assertEquals(TurnProcessor.EMPTY_MESSAGE_REPLY, p.process("   \t"));
        assertEquals(TurnProcessor.EMPTY_MESSAGE_REPLY, p.process(null));
        assertEquals(0, store.size());
    }

    @Test
    void turnIsLoggedAfterReply() {
        InMemoryConversationStore store = new InMemoryConversationStore();
        TurnProcessor p = new TurnProcessor(engineOver(store), store);

        assertEquals("The result is 4.", p.process("  2+2 "));

        Turn t = store.fetchRecent(1).get(0);
        assertEquals("2+2", t.userText());
        assertEquals("The result is 4.", t.aiText());
    }

    @Test
    void recallDoesNotIncludeTheCurrentTurn() {
        InMemoryConversationStore store = new InMemoryConversationStore();
        TurnProcessor p = new TurnProcessor(engineOver(store), store);

        assertEquals(HistoryRecallStrategy.EMPTY, p.process("History"));

        p.process("2+2");
        String recall = p.process("show history");

        assertEquals(HistoryRecallStrategy.HEADER
                + "\n1. You said: 'History' | I responded: '" + HistoryRecallStrategy.EMPTY + "'"
                + "\n2. You said: '2+2' | I responded: 'The result is 4.'", recall);
        assertEquals(3, store.size());
    }

    @Test
    void failedLoggingStillReturnsReply() {
        ConversationStore broken = new ConversationStore() {
            @Override
            public Turn append(String userText, String aiText) throws IOException {
                throw new IOException("read-only filesystem");
            }

            @Override
            public List<Turn> fetchRecent(int limit) {
                return List.of();
            }

            @Override
            public long size() {
                return 0;
            }

            @Override
            public void close() {
            }
        };
        TurnProcessor p = new TurnProcessor(engineOver(broken), broken);

        assertEquals("The result is 6.", p.process("2*3"));
    }
}
