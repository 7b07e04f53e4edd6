package org.calista.lumen.ai.core;

import org.calista.lumen.ai.expr.ExpressionEvaluator;
import org.calista.lumen.ai.think.ResponseEngine;
import org.calista.lumen.ai.think.intent.IntentDispatcher;
import org.calista.lumen.ai.think.response.ArithmeticStrategy;
import org.calista.lumen.ai.think.response.ClockStrategy;
import org.calista.lumen.ai.think.response.FixedTextStrategy;
import org.calista.lumen.ai.think.response.HistoryRecallStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Wires the response engine from a kernel: evaluator limits, keyword sets, recall size
 * and clock zone all come from {@link AIConfig}; the recall rule reads the kernel's store.
 */
public final class AIComposer {

    private static final Logger log = LoggerFactory.getLogger(AIComposer.class);

    private AIComposer() {}

    public static ResponseEngine buildEngine(AIKernel kernel) {
        Objects.requireNonNull(kernel, "kernel");
        AIConfig cfg = kernel.config();
        Clock local = kernel.localClock();

        ExpressionEvaluator evaluator = new ExpressionEvaluator(cfg.evaluator.maxInputLength, cfg.evaluator.maxDepth);

        IntentDispatcher dispatcher = IntentDispatcher.builder()
                .keywords(cfg.keywords())
                .clock(local)
                .arithmetic(new ArithmeticStrategy(evaluator))
                .date(ClockStrategy.date(local))
                .time(ClockStrategy.time(local))
                .historyRecall(new HistoryRecallStrategy(kernel.store(), cfg.history.recallLimit))
                .selfIdentify(FixedTextStrategy.selfDescription())
                .fallback(FixedTextStrategy.apology())
                .build();

        log.info("Building ResponseEngine: recallLimit={}, maxInputLength={}, maxDepth={}",
                cfg.history.recallLimit, evaluator.maxInputLength(), evaluator.maxDepth());
        return new ResponseEngine(dispatcher);
    }
}
