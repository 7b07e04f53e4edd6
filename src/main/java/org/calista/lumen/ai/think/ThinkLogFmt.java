package org.calista.lumen.ai.think;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Renders key/value lines as a box for startup logs.
 */
public final class ThinkLogFmt {

    private static final String SEP = "--";

    private ThinkLogFmt() {}

    public static String box(String title, Consumer<BoxBuilder> fill) {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(fill, "fill");

        BoxBuilder b = new BoxBuilder();
        fill.accept(b);
        return render(title, b.lines);
    }

    public static final class BoxBuilder {
        private final List<String> lines = new ArrayList<>(16);

        public BoxBuilder kv(String key, Object value) {
            lines.add((key == null ? "" : key) + ": " + value);
            return this;
        }

        public BoxBuilder sep() {
            lines.add(SEP);
            return this;
        }
    }

    private static String render(String title, List<String> lines) {
        int width = title.length();
        for (String l : lines) {
            if (!SEP.equals(l)) width = Math.max(width, l.length());
        }
        int w = Math.max(24, width + 2);
        String bar = "─".repeat(w);

        StringBuilder out = new StringBuilder((lines.size() + 4) * (w + 4));
        out.append('┌').append(bar).append("┐\n");
        out.append("│ ").append(padRight(title, w - 1)).append("│\n");
        out.append('├').append(bar).append("┤\n");
        for (String l : lines) {
            if (SEP.equals(l)) {
                out.append('│').append(bar).append("│\n");
            } else {
                out.append("│ ").append(padRight(l, w - 1)).append("│\n");
            }
        }
        out.append('└').append(bar).append('┘');
        return out.toString();
    }

    private static String padRight(String s, int width) {
        return s.length() >= width ? s : s + " ".repeat(width - s.length());
    }
}
