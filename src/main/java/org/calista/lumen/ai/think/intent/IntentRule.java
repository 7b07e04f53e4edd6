package org.calista.lumen.ai.think.intent;

import org.calista.lumen.ai.think.response.ResponseStrategy;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * One row of the priority table: when {@code matcher} accepts the normalized message,
 * {@code strategy} is asked for an answer.
 */
public record IntentRule(Intent intent, Predicate<String> matcher, ResponseStrategy strategy) {

    public IntentRule {
        Objects.requireNonNull(intent, "intent");
        Objects.requireNonNull(matcher, "matcher");
        Objects.requireNonNull(strategy, "strategy");
    }

    public boolean matches(String normalizedMessage) {
        return matcher.test(normalizedMessage);
    }
}
