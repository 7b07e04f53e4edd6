package org.calista.lumen.ai.expr;

import java.util.Objects;

/**
 * Outcome of an evaluation: either a value or an {@link EvalError} with a short reason.
 */
public final class EvalResult {

    private final double value;
    private final EvalError error;
    private final String message;

    private EvalResult(double value, EvalError error, String message) {
        this.value = value;
        this.error = error;
        this.message = message;
    }

    public static EvalResult ok(double value) {
        return new EvalResult(value, null, null);
    }

    public static EvalResult failure(EvalError error, String message) {
        Objects.requireNonNull(error, "error");
        return new EvalResult(Double.NaN, error, message == null ? error.name() : message);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @throws IllegalStateException when called on a failure
     */
    public double value() {
        if (error != null) throw new IllegalStateException("No value: " + error + " (" + message + ")");
        return value;
    }

    /** null on success. */
    public EvalError error() {
        return error;
    }

    public String message() {
        return message;
    }

    @Override
    public String toString() {
        return isSuccess() ? "EvalResult[ok=" + value + "]" : "EvalResult[" + error + ": " + message + "]";
    }
}
