package org.calista.lumen.ai.think.intent;

/**
 * Classification tag of an incoming message. Declaration order is the rule priority.
 */
public enum Intent {
    ARITHMETIC,
    DATE_QUERY,
    TIME_QUERY,
    HISTORY_RECALL,
    SELF_IDENTIFY,
    FALLBACK
}
