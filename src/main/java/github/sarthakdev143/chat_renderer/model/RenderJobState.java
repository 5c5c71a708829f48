package github.sarthakdev143.chat_renderer.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RenderJobState {
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
