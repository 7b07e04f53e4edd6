package org.calista.lumen.ai.think.response;

import java.util.Objects;
import java.util.Optional;

/**
 * Always answers with the same text.
 */
public final class FixedTextStrategy implements ResponseStrategy {

    public static final String SELF_DESCRIPTION =
            "I am a small open-source AI assistant. Unlike large models such as ChatGPT "
                    + "or Gemini, I run entirely on simple logic without access to external APIs "
                    + "or massive datasets. I can perform arithmetic, tell the date and time, and "
                    + "remember our conversation, but I don't pretend to know everything.";

    public static final String APOLOGY =
            "I'm sorry, I don't have enough information to answer that. "
                    + "I'm still learning and rely on simple reasoning rather than vast knowledge.";

    private final String text;

    public FixedTextStrategy(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    public static FixedTextStrategy selfDescription() {
        return new FixedTextStrategy(SELF_DESCRIPTION);
    }

    public static FixedTextStrategy apology() {
        return new FixedTextStrategy(APOLOGY);
    }

    public String text() {
        return text;
    }

    @Override
    public Optional<String> respond(String message) {
        return Optional.of(text);
    }
}
