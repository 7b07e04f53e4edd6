package org.calista.lumen.ai.expr;

/**
 * Internal unwinding signal for the lexer, parser and tree walk.
 * Never leaves the package: {@link ExpressionEvaluator} turns it into a result value.
 */
final class ExpressionFailure extends RuntimeException {

    final EvalError kind;

    ExpressionFailure(EvalError kind, String message) {
        super(message, null, false, false);
        this.kind = kind;
    }
}
