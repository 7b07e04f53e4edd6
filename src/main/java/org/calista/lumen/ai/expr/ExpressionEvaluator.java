package org.calista.lumen.ai.expr;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.lumen.ai.expr.Expr.BinaryOp;
import org.calista.lumen.ai.expr.Expr.NumberLiteral;
import org.calista.lumen.ai.expr.Expr.UnaryOp;

/**
 * ExpressionEvaluator — safe arithmetic over a closed grammar.
 *
 * <p>
 * Accepts numeric literals, unary {@code + -}, binary {@code + - * / // % **} and parentheses.
 * There is no name lookup, no call and no reflective path: the tree walk is a
 * {@link Expr.Visitor} over the three node records and nothing else can be constructed.
 * </p>
 *
 * <p>
 * Division semantics follow floor arithmetic: {@code -7 // 2 == -4}, {@code -7 % 2 == 1},
 * and {@code a == (a // b) * b + a % b} holds.
 * </p>
 *
 * <p>Never throws for string input; every failure comes back as an {@link EvalResult} or
 * {@link ParseResult} carrying an {@link EvalError}.</p>
 *
 * <p>Thread-safe: no mutable state.</p>
 */
public final class ExpressionEvaluator {

    private static final Logger log = LogManager.getLogger(ExpressionEvaluator.class);

    public static final int DEFAULT_MAX_INPUT_LENGTH = 256;
    public static final int DEFAULT_MAX_DEPTH = 64;

    private final int maxInputLength;
    private final int maxDepth;

    public ExpressionEvaluator() {
        this(DEFAULT_MAX_INPUT_LENGTH, DEFAULT_MAX_DEPTH);
    }

    public ExpressionEvaluator(int maxInputLength, int maxDepth) {
        if (maxInputLength < 1) throw new IllegalArgumentException("maxInputLength must be >= 1: " + maxInputLength);
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1: " + maxDepth);
        this.maxInputLength = maxInputLength;
        this.maxDepth = maxDepth;
    }

    public int maxInputLength() { return maxInputLength; }

    public int maxDepth() { return maxDepth; }

    // ---------------------------------------------------------------------
    // API
    // ---------------------------------------------------------------------

    public ParseResult parse(String text) {
        if (text == null) return ParseResult.failure(EvalError.PARSE_ERROR, "no input");
        if (text.length() > maxInputLength) {
            return ParseResult.failure(EvalError.PARSE_ERROR,
                    "input longer than " + maxInputLength + " characters");
        }
        try {
            return ParseResult.ok(Parser.parse(text, maxDepth));
        } catch (ExpressionFailure f) {
            log.debug("parse rejected: kind={}, reason={}", f.kind, f.getMessage());
            return ParseResult.failure(f.kind, f.getMessage());
        }
    }

    public EvalResult evaluate(Expr ast) {
        if (ast == null) return EvalResult.failure(EvalError.UNSUPPORTED_EXPRESSION, "no expression");
        try {
            return EvalResult.ok(ast.accept(Walker.INSTANCE));
        } catch (ExpressionFailure f) {
            log.debug("evaluation failed: kind={}, reason={}", f.kind, f.getMessage());
            return EvalResult.failure(f.kind, f.getMessage());
        }
    }

    /** parse + evaluate. */
    public EvalResult evaluate(String text) {
        ParseResult parsed = parse(text);
        if (!parsed.isSuccess()) return parsed.asEvalFailure();
        return evaluate(parsed.expression());
    }

    // ---------------------------------------------------------------------
    // Tree walk
    // ---------------------------------------------------------------------

    private static final class Walker implements Expr.Visitor<Double> {

        static final Walker INSTANCE = new Walker();

        @Override
        public Double visitNumber(NumberLiteral n) {
            return finite(n.value(), "literal");
        }

        @Override
        public Double visitUnary(UnaryOp u) {
            double v = u.operand().accept(this);
            return switch (u.op()) {
                case POS -> v;
                case NEG -> -v;
            };
        }

        @Override
        public Double visitBinary(BinaryOp b) {
            double l = b.left().accept(this);
            double r = b.right().accept(this);
            double out = switch (b.op()) {
                case ADD -> l + r;
                case SUB -> l - r;
                case MUL -> l * r;
                case DIV -> {
                    requireNonZero(r, "division");
                    yield l / r;
                }
                case FLOOR_DIV -> {
                    requireNonZero(r, "floor division");
                    yield floorDiv(l, r);
                }
                case MOD -> {
                    requireNonZero(r, "modulo");
                    yield floorMod(l, r);
                }
                case POW -> pow(l, r);
            };
            return finite(out, b.op().symbol);
        }
    }

    // ---------------------------------------------------------------------
    // Arithmetic
    // ---------------------------------------------------------------------

    static double floorMod(double a, double b) {
        double mod = a % b;
        if (mod != 0.0) {
            if ((b < 0) != (mod < 0)) mod += b;
        } else {
            mod = Math.copySign(0.0, b);
        }
        return mod;
    }

    static double floorDiv(double a, double b) {
        double mod = a % b;
        double div = (a - mod) / b;
        if (mod != 0.0 && (b < 0) != (mod < 0)) {
            div -= 1.0;
        }
        if (div == 0.0) return Math.copySign(0.0, a / b);
        double floor = Math.floor(div);
        if (div - floor > 0.5) floor += 1.0;
        return floor;
    }

    static double pow(double base, double exponent) {
        if (base == 0.0 && exponent < 0.0) {
            throw new ExpressionFailure(EvalError.DIVISION_BY_ZERO, "zero cannot be raised to a negative power");
        }
        return Math.pow(base, exponent);
    }

    private static void requireNonZero(double divisor, String what) {
        if (divisor == 0.0) throw new ExpressionFailure(EvalError.DIVISION_BY_ZERO, what + " by zero");
    }

    private static double finite(double v, String where) {
        if (Double.isNaN(v) || Double.isInfinite(v)) {
            throw new ExpressionFailure(EvalError.UNDEFINED_RESULT, "result of '" + where + "' is not a finite real number");
        }
        return v;
    }
}
