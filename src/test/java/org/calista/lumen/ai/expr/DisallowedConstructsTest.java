package org.calista.lumen.ai.expr;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Syntactically plausible inputs that reach past arithmetic must be rejected,
 * never evaluated.
 */
class DisallowedConstructsTest {

    private static final Set<EvalError> REJECTIONS = Set.of(EvalError.UNSUPPORTED_EXPRESSION, EvalError.PARSE_ERROR);

    private final ExpressionEvaluator eval = new ExpressionEvaluator();

    @ParameterizedTest
    @ValueSource(strings = {
            "__import__('os').system('ls')",
            "abs(-1)",
            "x + 1",
            "pi * 2",
            "os.system('rm -rf /')",
            "System.exit(0)",
            "Runtime.getRuntime().exec(\"ls\")",
            "[1, 2][0]",
            "{1: 2}",
            "(1, 2)",
            "1 if 1 else 2",
            "1 < 2",
            "1 == 1",
            "1 != 2",
            "1 and 2",
            "not 1",
            "1 or 0",
            "'a' * 3",
            "\"abc\"",
            "lambda: 1",
            "2(3)",
            "(1).real",
            "1 & 2",
            "1 | 2",
            "~1",
            "1 ^ 2",
            "1 << 2",
            "a = 1",
            "print(1)",
            "1; 2",
            "2 @ 3",
            "eval('1+1')",
            "exec('x=1')",
            "getattr(1, 'real')",
            "1 + _",
            "0x10",
            "1j",
            "2 ** x",
            "(2 + 3)(4)",
            "${1+1}",
            "#{7*7}",
            "1 + 1 # comment",
            "٣ + ٤",
            "math.sqrt(4)"
    })
    void rejectsNonArithmeticInput(String input) {
        ParseResult p = eval.parse(input);
        assertFalse(p.isSuccess(), () -> "parsed: " + input + " -> " + p);
        assertTrue(REJECTIONS.contains(p.error()), () -> input + " -> " + p.error());

        EvalResult r = eval.evaluate(input);
        assertFalse(r.isSuccess());
        assertTrue(REJECTIONS.contains(r.error()));
    }

    @ParameterizedTest
    @ValueSource(strings = {"abs(1)", "x", "os.system('ls')", "[1]", "1 < 2", "'s'", "1 and 2"})
    void namesAndForeignOperatorsAreUnsupportedRatherThanMalformed(String input) {
        assertEquals(EvalError.UNSUPPORTED_EXPRESSION, eval.parse(input).error());
    }
}
