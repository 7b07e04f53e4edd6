package org.calista.lumen.ai.expr;

import java.util.Objects;

/**
 * Outcome of {@link ExpressionEvaluator#parse(String)}: an AST or an {@link EvalError}.
 */
public final class ParseResult {

    private final Expr expression;
    private final EvalError error;
    private final String message;

    private ParseResult(Expr expression, EvalError error, String message) {
        this.expression = expression;
        this.error = error;
        this.message = message;
    }

    public static ParseResult ok(Expr expression) {
        return new ParseResult(Objects.requireNonNull(expression, "expression"), null, null);
    }

    public static ParseResult failure(EvalError error, String message) {
        Objects.requireNonNull(error, "error");
        return new ParseResult(null, error, message == null ? error.name() : message);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @throws IllegalStateException when called on a failure
     */
    public Expr expression() {
        if (error != null) throw new IllegalStateException("No expression: " + error + " (" + message + ")");
        return expression;
    }

    public EvalError error() {
        return error;
    }

    public String message() {
        return message;
    }

    /** Carries a parse failure over to the evaluation stage. */
    EvalResult asEvalFailure() {
        if (error == null) throw new IllegalStateException("Parse succeeded");
        return EvalResult.failure(error, message);
    }

    @Override
    public String toString() {
        return isSuccess() ? "ParseResult[" + expression + "]" : "ParseResult[" + error + ": " + message + "]";
    }
}
