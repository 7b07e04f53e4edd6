package org.calista.lumen.ai;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.lumen.ai.history.ConversationStore;
import org.calista.lumen.ai.history.Turn;
import org.calista.lumen.ai.think.ResponseEngine;

import java.io.IOException;
import java.util.Objects;

/**
 * One exchange at the transport boundary: check the message, generate the reply,
 * then log the turn. Logging happens strictly after generation and cannot change
 * the reply.
 */
public final class TurnProcessor {

    private static final Logger log = LogManager.getLogger(TurnProcessor.class);

    public static final String EMPTY_MESSAGE_REPLY = "Please provide a message.";

    private final ResponseEngine engine;
    private final ConversationStore store;

    public TurnProcessor(ResponseEngine engine, ConversationStore store) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.store = Objects.requireNonNull(store, "store");
    }

    public String process(String message) {
        if (message == null || message.isBlank()) return EMPTY_MESSAGE_REPLY;

        String userText = message.trim();
        String reply = engine.generateResponse(userText);

        try {
            Turn t = store.append(userText, reply);
            log.debug("turn {} logged", t.id());
        } catch (IOException | RuntimeException e) {
            log.error("Failed to log conversation turn; reply is returned anyway", e);
        }
        return reply;
    }
}
