package org.calista.lumen.ai.think.intent;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.lumen.ai.expr.ExpressionEvaluator;
import org.calista.lumen.ai.think.response.ArithmeticStrategy;
import org.calista.lumen.ai.think.response.ClockStrategy;
import org.calista.lumen.ai.think.response.FixedTextStrategy;
import org.calista.lumen.ai.think.response.ResponseStrategy;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * IntentDispatcher — ordered, first-match rule table.
 *
 * <pre>
 *   1. ARITHMETIC      digit + one of "+-*&#47;%"
 *   2. DATE_QUERY      date keyword
 *   3. TIME_QUERY      time keyword
 *   4. HISTORY_RECALL  recall keyword
 *   5. SELF_IDENTIFY   identity keyword
 *   6. FALLBACK        always
 * </pre>
 *
 * <p>
 * {@link #detect} is pure classification: the first rule whose matcher accepts the message.
 * {@link #dispatch} walks the same table but also asks each matching strategy; a strategy
 * that declines (arithmetic that does not evaluate) lets the walk continue with the next
 * rule. The terminal FALLBACK rule always answers.
 * </p>
 *
 * <p>Messages are normalized as {@code trim().toLowerCase(Locale.ROOT)} before matching.</p>
 */
public final class IntentDispatcher implements IntentDetector {

    private static final Logger log = LogManager.getLogger(IntentDispatcher.class);

    static final String ARITHMETIC_OPERATORS = "+-*/%";

    private final List<IntentRule> rules;

    public IntentDispatcher(List<IntentRule> rules) {
        Objects.requireNonNull(rules, "rules");
        if (rules.isEmpty()) throw new IllegalArgumentException("rule table is empty");
        if (rules.get(rules.size() - 1).intent() != Intent.FALLBACK) {
            throw new IllegalArgumentException("last rule must be FALLBACK");
        }
        this.rules = List.copyOf(rules);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------------
    // API
    // ---------------------------------------------------------------------

    @Override
    public Intent detect(String userText) {
        String msg = normalize(userText);
        for (IntentRule r : rules) {
            if (r.matches(msg)) return r.intent();
        }
        return Intent.FALLBACK;
    }

    /** Alias of {@link #detect}. */
    public Intent classify(String userText) {
        return detect(userText);
    }

    public Reply dispatch(String userText) {
        String msg = normalize(userText);
        for (IntentRule r : rules) {
            if (!r.matches(msg)) continue;

            Optional<String> answer = r.strategy().respond(msg);
            if (answer.isPresent()) return new Reply(r.intent(), answer.get());

            log.debug("rule {} matched but declined; falling through", r.intent());
        }
        // unreachable while FALLBACK answers; keep the contract anyway
        return new Reply(Intent.FALLBACK, FixedTextStrategy.APOLOGY);
    }

    /** The table in evaluation order. */
    public List<IntentRule> rules() {
        return rules;
    }

    public static String normalize(String text) {
        return text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
    }

    static boolean looksArithmetic(String msg) {
        boolean digit = false;
        boolean operator = false;
        for (int i = 0; i < msg.length() && !(digit && operator); i++) {
            char c = msg.charAt(i);
            if (Character.isDigit(c)) digit = true;
            else if (ARITHMETIC_OPERATORS.indexOf(c) >= 0) operator = true;
        }
        return digit && operator;
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    /**
     * Builds the standard six-rule table. Only the history strategy has no default,
     * since it needs a store.
     */
    public static final class Builder {
        private IntentKeywords keywords = IntentKeywords.defaults();
        private ResponseStrategy arithmetic;
        private ResponseStrategy date;
        private ResponseStrategy time;
        private ResponseStrategy historyRecall;
        private ResponseStrategy selfIdentify;
        private ResponseStrategy fallback;
        private Clock clock = Clock.systemDefaultZone();

        public Builder keywords(IntentKeywords keywords) {
            this.keywords = Objects.requireNonNull(keywords, "keywords");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder arithmetic(ResponseStrategy s) {
            this.arithmetic = Objects.requireNonNull(s, "arithmetic");
            return this;
        }

        public Builder date(ResponseStrategy s) {
            this.date = Objects.requireNonNull(s, "date");
            return this;
        }

        public Builder time(ResponseStrategy s) {
            this.time = Objects.requireNonNull(s, "time");
            return this;
        }

        public Builder historyRecall(ResponseStrategy s) {
            this.historyRecall = Objects.requireNonNull(s, "historyRecall");
            return this;
        }

        public Builder selfIdentify(ResponseStrategy s) {
            this.selfIdentify = Objects.requireNonNull(s, "selfIdentify");
            return this;
        }

        public Builder fallback(ResponseStrategy s) {
            this.fallback = Objects.requireNonNull(s, "fallback");
            return this;
        }

        public IntentDispatcher build() {
            Objects.requireNonNull(historyRecall, "historyRecall strategy is required");
            IntentKeywords k = keywords;

            return new IntentDispatcher(List.of(
                    new IntentRule(Intent.ARITHMETIC, IntentDispatcher::looksArithmetic,
                            arithmetic != null ? arithmetic : new ArithmeticStrategy(new ExpressionEvaluator())),
                    new IntentRule(Intent.DATE_QUERY, m -> IntentKeywords.containsAny(m, k.date),
                            date != null ? date : ClockStrategy.date(clock)),
                    new IntentRule(Intent.TIME_QUERY, m -> IntentKeywords.containsAny(m, k.time),
                            time != null ? time : ClockStrategy.time(clock)),
                    new IntentRule(Intent.HISTORY_RECALL, m -> IntentKeywords.containsAny(m, k.recall),
                            historyRecall),
                    new IntentRule(Intent.SELF_IDENTIFY, m -> IntentKeywords.containsAny(m, k.identity),
                            selfIdentify != null ? selfIdentify : FixedTextStrategy.selfDescription()),
                    new IntentRule(Intent.FALLBACK, m -> true,
                            fallback != null ? fallback : FixedTextStrategy.apology())
            ));
        }
    }
}
