package org.calista.lumen.ai.think.intent;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Keyword sets for the substring rules (English and Korean by default).
 *
 * <p>Keywords are stored lower-cased; matching is a plain substring test against the
 * normalized message, so "today's" matches "today" and "yesterday" matches "day".</p>
 */
public final class IntentKeywords {

    public static final List<String> DEFAULT_DATE = List.of("date", "day", "today", "날짜", "요일");
    public static final List<String> DEFAULT_TIME = List.of("time", "현재 시간", "시각", "hour", "minute");
    public static final List<String> DEFAULT_RECALL = List.of("history", "memory", "log", "대화", "내역", "지난", "remember");
    public static final List<String> DEFAULT_IDENTITY = List.of("who are you", "what are you", "이름", "정체", "your difference");

    public final List<String> date;
    public final List<String> time;
    public final List<String> recall;
    public final List<String> identity;

    public IntentKeywords(Collection<String> date, Collection<String> time,
                          Collection<String> recall, Collection<String> identity) {
        this.date = normalize(date, DEFAULT_DATE);
        this.time = normalize(time, DEFAULT_TIME);
        this.recall = normalize(recall, DEFAULT_RECALL);
        this.identity = normalize(identity, DEFAULT_IDENTITY);
    }

    public static IntentKeywords defaults() {
        return new IntentKeywords(DEFAULT_DATE, DEFAULT_TIME, DEFAULT_RECALL, DEFAULT_IDENTITY);
    }

    static boolean containsAny(String message, List<String> keywords) {
        for (String k : keywords) {
            if (message.contains(k)) return true;
        }
        return false;
    }

    /** Empty or missing sets fall back to defaults; blank entries are dropped. */
    private static List<String> normalize(Collection<String> in, List<String> def) {
        if (in == null || in.isEmpty()) return def;
        ArrayList<String> out = new ArrayList<>(in.size());
        for (String s : in) {
            if (s == null) continue;
            String k = s.trim().toLowerCase(Locale.ROOT);
            if (!k.isEmpty() && !out.contains(k)) out.add(k);
        }
        return out.isEmpty() ? def : List.copyOf(out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IntentKeywords k)) return false;
        return date.equals(k.date) && time.equals(k.time) && recall.equals(k.recall) && identity.equals(k.identity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, time, recall, identity);
    }
}
