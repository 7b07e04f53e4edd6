package org.calista.lumen.ai.think.response;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;

/**
 * Wall-clock answers. The clock carries the zone that counts as "local time";
 * output changes with the clock by nature.
 */
public final class ClockStrategy implements ResponseStrategy {

    private final Clock clock;
    private final DateTimeFormatter format;
    private final String prefix;

    private ClockStrategy(Clock clock, String pattern, String prefix) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.format = DateTimeFormatter.ofPattern(pattern);
        this.prefix = prefix;
    }

    /** "Today's date is 2024-05-01 (local time)." */
    public static ClockStrategy date(Clock clock) {
        return new ClockStrategy(clock, "yyyy-MM-dd", "Today's date is ");
    }

    /** "The current time is 13:05:09 (local time)." */
    public static ClockStrategy time(Clock clock) {
        return new ClockStrategy(clock, "HH:mm:ss", "The current time is ");
    }

    @Override
    public Optional<String> respond(String message) {
        return Optional.of(prefix + ZonedDateTime.now(clock).format(format) + " (local time).");
    }
}
