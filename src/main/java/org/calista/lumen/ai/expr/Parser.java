package org.calista.lumen.ai.expr;

import org.calista.lumen.ai.expr.Expr.BinaryOp;
import org.calista.lumen.ai.expr.Expr.BinaryOp.Operator;
import org.calista.lumen.ai.expr.Expr.NumberLiteral;
import org.calista.lumen.ai.expr.Expr.UnaryOp;
import org.calista.lumen.ai.expr.Lexer.Kind;
import org.calista.lumen.ai.expr.Lexer.Token;

import java.util.List;

/**
 * Recursive-descent parser with Python precedence:
 *
 * <pre>
 * expr    := term (('+' | '-') term)*
 * term    := factor (('*' | '/' | '//' | '%') factor)*
 * factor  := ('+' | '-') factor | power
 * power   := primary ('**' factor)?
 * primary := NUMBER | '(' expr ')'
 * </pre>
 *
 * Nesting (parentheses, signs, exponents) is capped by {@code maxDepth}.
 */
final class Parser {

    private final List<Token> tokens;
    private final int maxDepth;
    private int pos;
    private int depth;

    private Parser(List<Token> tokens, int maxDepth) {
        this.tokens = tokens;
        this.maxDepth = maxDepth;
    }

    static Expr parse(String src, int maxDepth) {
        Parser p = new Parser(Lexer.tokenize(src), maxDepth);
        Expr e = p.expr();
        Token rest = p.peek();
        if (rest.kind() == Kind.EOF) return e;
        if (rest.kind() == Kind.LPAREN) {
            throw new ExpressionFailure(EvalError.UNSUPPORTED_EXPRESSION, "call syntax is not allowed");
        }
        throw new ExpressionFailure(EvalError.PARSE_ERROR, "unexpected '" + rest.text() + "' at " + rest.pos());
    }

    private Expr expr() {
        Expr left = term();
        while (true) {
            Kind k = peek().kind();
            if (k == Kind.PLUS) {
                pos++;
                left = new BinaryOp(Operator.ADD, left, term());
            } else if (k == Kind.MINUS) {
                pos++;
                left = new BinaryOp(Operator.SUB, left, term());
            } else {
                return left;
            }
        }
    }

    private Expr term() {
        Expr left = factor();
        while (true) {
            Operator op = switch (peek().kind()) {
                case STAR -> Operator.MUL;
                case SLASH -> Operator.DIV;
                case DOUBLE_SLASH -> Operator.FLOOR_DIV;
                case PERCENT -> Operator.MOD;
                default -> null;
            };
            if (op == null) return left;
            pos++;
            left = new BinaryOp(op, left, factor());
        }
    }

    private Expr factor() {
        Kind k = peek().kind();
        if (k == Kind.PLUS || k == Kind.MINUS) {
            pos++;
            descend();
            Expr operand = factor();
            depth--;
            return new UnaryOp(k == Kind.PLUS ? UnaryOp.Sign.POS : UnaryOp.Sign.NEG, operand);
        }
        return power();
    }

    private Expr power() {
        Expr base = primary();
        if (peek().kind() != Kind.DOUBLE_STAR) return base;
        pos++;
        descend();
        Expr exponent = factor();
        depth--;
        return new BinaryOp(Operator.POW, base, exponent);
    }

    private Expr primary() {
        Token t = next();
        switch (t.kind()) {
            case NUMBER:
                return new NumberLiteral(t.number());
            case LPAREN: {
                descend();
                Expr inner = expr();
                depth--;
                Token close = next();
                if (close.kind() == Kind.RPAREN) return inner;
                if (close.kind() == Kind.EOF) {
                    throw new ExpressionFailure(EvalError.PARSE_ERROR, "missing ')'");
                }
                throw new ExpressionFailure(EvalError.PARSE_ERROR,
                        "expected ')' but found '" + close.text() + "' at " + close.pos());
            }
            case EOF:
                throw new ExpressionFailure(EvalError.PARSE_ERROR, "unexpected end of expression");
            default:
                throw new ExpressionFailure(EvalError.PARSE_ERROR,
                        "unexpected '" + t.text() + "' at " + t.pos());
        }
    }

    private void descend() {
        if (++depth > maxDepth) {
            throw new ExpressionFailure(EvalError.PARSE_ERROR, "expression nested deeper than " + maxDepth);
        }
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token next() {
        Token t = tokens.get(pos);
        if (t.kind() != Kind.EOF) pos++;
        return t;
    }
}
