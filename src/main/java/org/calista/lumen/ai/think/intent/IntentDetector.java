package org.calista.lumen.ai.think.intent;

public interface IntentDetector {
    /**
     * Pure classification: same text, same rules, same intent.
     */
    Intent detect(String userText);
}
