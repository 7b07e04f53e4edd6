package org.calista.lumen.ai.expr;

/**
 * Failure kinds reported by {@link ExpressionEvaluator}.
 */
public enum EvalError {
    /** Malformed syntax, input too long or nested too deep. */
    PARSE_ERROR,
    /** A construct outside the arithmetic node set (names, calls, strings, comparisons...). */
    UNSUPPORTED_EXPRESSION,
    DIVISION_BY_ZERO,
    /** The value is not a finite real number (overflow, negative base with fractional exponent). */
    UNDEFINED_RESULT
}
