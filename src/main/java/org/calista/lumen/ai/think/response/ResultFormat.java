package org.calista.lumen.ai.think.response;

import java.math.BigDecimal;

/**
 * Number rendering for answers: integral values without a fractional part,
 * everything else in plain (non-scientific) shortest form.
 */
public final class ResultFormat {

    private ResultFormat() {}

    public static String format(double v) {
        if (Double.isNaN(v) || Double.isInfinite(v)) return Double.toString(v);

        if (v == Math.rint(v)) {
            if (Math.abs(v) < 1e15) return Long.toString((long) v);
            // exact digits of the double, e.g. 2**100
            return new BigDecimal(v).toBigInteger().toString();
        }
        return BigDecimal.valueOf(v).stripTrailingZeros().toPlainString();
    }
}
