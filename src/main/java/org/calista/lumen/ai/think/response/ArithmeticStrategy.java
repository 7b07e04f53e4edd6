package org.calista.lumen.ai.think.response;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.lumen.ai.expr.EvalResult;
import org.calista.lumen.ai.expr.ExpressionEvaluator;

import java.util.Objects;
import java.util.Optional;

/**
 * Evaluates the whole message as an arithmetic expression.
 * Any evaluator failure declines, so the next rules get the message.
 */
public final class ArithmeticStrategy implements ResponseStrategy {

    private static final Logger log = LogManager.getLogger(ArithmeticStrategy.class);

    private final ExpressionEvaluator evaluator;

    public ArithmeticStrategy(ExpressionEvaluator evaluator) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    }

    @Override
    public Optional<String> respond(String message) {
        EvalResult r = evaluator.evaluate(message);
        if (!r.isSuccess()) {
            log.debug("arithmetic declined: {} ({})", r.error(), r.message());
            return Optional.empty();
        }
        return Optional.of("The result is " + ResultFormat.format(r.value()) + ".");
    }
}
