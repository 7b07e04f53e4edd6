package org.calista.lumen.ai.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer — turns an expression string into arithmetic tokens.
 *
 * <p>Only numbers, the seven operators and parentheses are tokens. Anything that would
 * start a name, a string, a collection or a comparison is reported as
 * {@link EvalError#UNSUPPORTED_EXPRESSION} right here, before a parser ever sees it.</p>
 */
final class Lexer {

    enum Kind { NUMBER, PLUS, MINUS, STAR, DOUBLE_STAR, SLASH, DOUBLE_SLASH, PERCENT, LPAREN, RPAREN, EOF }

    record Token(Kind kind, String text, int pos) {
        double number() {
            return Double.parseDouble(text);
        }
    }

    private static final String FORBIDDEN_SYMBOLS = "[]{},.<>=!&|^~@:;";

    private final String src;
    private int i;

    private Lexer(String src) {
        this.src = src;
    }

    static List<Token> tokenize(String src) {
        return new Lexer(src).run();
    }

    private List<Token> run() {
        ArrayList<Token> out = new ArrayList<>(Math.max(8, src.length() / 2));
        while (i < src.length()) {
            char c = src.charAt(i);

            if (c == ' ' || c == '\t' || c == '\r' || c == '\n' || c == '\f') {
                i++;
                continue;
            }
            if (isDigit(c) || (c == '.' && i + 1 < src.length() && isDigit(src.charAt(i + 1)))) {
                out.add(number());
                continue;
            }

            int start = i;
            switch (c) {
                case '+' -> out.add(single(Kind.PLUS, start));
                case '-' -> out.add(single(Kind.MINUS, start));
                case '%' -> out.add(single(Kind.PERCENT, start));
                case '(' -> out.add(single(Kind.LPAREN, start));
                case ')' -> out.add(single(Kind.RPAREN, start));
                case '*' -> out.add(doubled('*', Kind.STAR, Kind.DOUBLE_STAR, start));
                case '/' -> out.add(doubled('/', Kind.SLASH, Kind.DOUBLE_SLASH, start));
                default -> throw rejected(c, start);
            }
        }
        out.add(new Token(Kind.EOF, "", src.length()));
        return out;
    }

    private Token single(Kind kind, int start) {
        i++;
        return new Token(kind, src.substring(start, i), start);
    }

    private Token doubled(char ch, Kind one, Kind two, int start) {
        i++;
        if (i < src.length() && src.charAt(i) == ch) {
            i++;
            return new Token(two, src.substring(start, i), start);
        }
        return new Token(one, src.substring(start, i), start);
    }

    private Token number() {
        int start = i;
        while (i < src.length() && isDigit(src.charAt(i))) i++;
        if (i < src.length() && src.charAt(i) == '.') {
            i++;
            while (i < src.length() && isDigit(src.charAt(i))) i++;
        }
        if (i < src.length() && (src.charAt(i) == 'e' || src.charAt(i) == 'E')) {
            int mark = i;
            i++;
            if (i < src.length() && (src.charAt(i) == '+' || src.charAt(i) == '-')) i++;
            if (i >= src.length() || !isDigit(src.charAt(i))) {
                throw new ExpressionFailure(EvalError.PARSE_ERROR, "malformed exponent at " + mark);
            }
            while (i < src.length() && isDigit(src.charAt(i))) i++;
        }
        // "2abc", "3.real", "1.2.3"
        if (i < src.length() && (isNameChar(src.charAt(i)) || src.charAt(i) == '.')) {
            throw new ExpressionFailure(EvalError.PARSE_ERROR, "invalid number literal at " + start);
        }
        return new Token(Kind.NUMBER, src.substring(start, i), start);
    }

    private ExpressionFailure rejected(char c, int start) {
        if (isNameStart(c)) {
            int end = start;
            while (end < src.length() && isNameChar(src.charAt(end))) end++;
            return new ExpressionFailure(EvalError.UNSUPPORTED_EXPRESSION,
                    "name '" + src.substring(start, end) + "' is not allowed");
        }
        if (c == '"' || c == '\'') {
            return new ExpressionFailure(EvalError.UNSUPPORTED_EXPRESSION, "string literals are not allowed");
        }
        if (FORBIDDEN_SYMBOLS.indexOf(c) >= 0) {
            return new ExpressionFailure(EvalError.UNSUPPORTED_EXPRESSION,
                    "operator '" + c + "' is not allowed");
        }
        return new ExpressionFailure(EvalError.PARSE_ERROR, "unexpected character '" + c + "' at " + start);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isNameStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private static boolean isNameChar(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }
}
