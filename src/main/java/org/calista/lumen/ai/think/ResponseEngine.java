package org.calista.lumen.ai.think;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.lumen.ai.think.intent.Intent;
import org.calista.lumen.ai.think.intent.IntentDispatcher;
import org.calista.lumen.ai.think.intent.IntentRule;
import org.calista.lumen.ai.think.intent.Reply;
import org.calista.lumen.ai.think.response.FixedTextStrategy;

import java.util.Objects;

/**
 * ResponseEngine — text in, text out.
 *
 * <p>
 * Every call is classified and answered on its own; continuity comes only from the
 * conversation log that the recall rule reads. Persisting the current turn is the
 * caller's job and happens after this returns.
 * </p>
 *
 * <p>{@link #generateResponse} never throws: a failing strategy is logged and answered
 * with the fallback text.</p>
 */
public final class ResponseEngine {

    private static final Logger log = LogManager.getLogger(ResponseEngine.class);

    private final IntentDispatcher dispatcher;
    private final String fallbackText;

    public ResponseEngine(IntentDispatcher dispatcher) {
        this(dispatcher, FixedTextStrategy.APOLOGY);
    }

    public ResponseEngine(IntentDispatcher dispatcher, String fallbackText) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.fallbackText = Objects.requireNonNull(fallbackText, "fallbackText");
        logCreation();
    }

    public String generateResponse(String text) {
        return reply(text).text();
    }

    public Reply reply(String text) {
        long t0 = System.nanoTime();
        try {
            Reply r = dispatcher.dispatch(text);
            if (log.isDebugEnabled()) {
                log.debug("reply: intent={}, inChars={}, outChars={}, tookUs={}",
                        r.intent(), text == null ? 0 : text.length(), r.text().length(),
                        (System.nanoTime() - t0) / 1_000);
            }
            return r;
        } catch (RuntimeException e) {
            log.error("Response generation failed; answering with fallback", e);
            return new Reply(Intent.FALLBACK, fallbackText);
        }
    }

    public IntentDispatcher dispatcher() {
        return dispatcher;
    }

    private void logCreation() {
        if (!log.isInfoEnabled()) return;

        String msg = ThinkLogFmt.box("ResponseEngine initialized", b -> {
            b.kv("dispatcher", dispatcher.getClass().getName());
            b.sep();
            int i = 1;
            for (IntentRule r : dispatcher.rules()) {
                b.kv((i++) + ". " + r.intent(), r.strategy().getClass().getSimpleName());
            }
        });
        log.info("\n{}", msg);
    }
}
