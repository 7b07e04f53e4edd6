package org.calista.lumen.ai.think.response;

import java.util.Optional;

/**
 * ResponseStrategy — produces the answer for one intent.
 *
 * <p>
 * Input is the normalized message (trimmed, lower-cased). An empty result means
 * "not mine after all": the dispatcher then keeps walking the rule table.
 * Strategies must not throw for ordinary input.
 * </p>
 */
public interface ResponseStrategy {

    Optional<String> respond(String message);
}
