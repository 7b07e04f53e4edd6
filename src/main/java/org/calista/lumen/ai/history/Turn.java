package org.calista.lumen.ai.history;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Turn — one persisted exchange: what the user said and what was answered.
 *
 * <p>Immutable. The id is assigned by the store and grows strictly with insertion order;
 * the timestamp is an ISO-8601 UTC instant taken at append time.</p>
 *
 * <p>Line format (JSONL): {@code {"id":1,"timestamp":"...Z","user_text":"...","ai_text":"..."}}</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"id", "timestamp", "user_text", "ai_text"})
public final class Turn {

    private final long id;
    private final String timestamp;
    private final String userText;
    private final String aiText;

    @JsonCreator
    public Turn(@JsonProperty(value = "id", required = true) long id,
                @JsonProperty(value = "timestamp", required = true) String timestamp,
                @JsonProperty(value = "user_text", required = true) String userText,
                @JsonProperty(value = "ai_text", required = true) String aiText) {
        this.id = id;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.userText = Objects.requireNonNull(userText, "user_text");
        this.aiText = Objects.requireNonNull(aiText, "ai_text");
    }

    @JsonProperty("id")
    public long id() { return id; }

    @JsonProperty("timestamp")
    public String timestamp() { return timestamp; }

    @JsonProperty("user_text")
    public String userText() { return userText; }

    @JsonProperty("ai_text")
    public String aiText() { return aiText; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Turn t)) return false;
        return id == t.id
                && timestamp.equals(t.timestamp)
                && userText.equals(t.userText)
                && aiText.equals(t.aiText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, timestamp, userText, aiText);
    }

    @Override
    public String toString() {
        return "Turn{id=" + id + ", timestamp=" + timestamp + ", user='" + userText + "', ai='" + aiText + "'}";
    }
}
