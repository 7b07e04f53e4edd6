package org.calista.lumen.ai.think.intent;

import java.util.Objects;

/**
 * Answer text plus the rule that produced it.
 */
public record Reply(Intent intent, String text) {
    public Reply {
        Objects.requireNonNull(intent, "intent");
        Objects.requireNonNull(text, "text");
    }
}
