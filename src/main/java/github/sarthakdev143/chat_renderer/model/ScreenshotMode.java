package github.sarthakdev143.chat_renderer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ScreenshotMode {
    LONG,
    PAGINATED;

    @JsonCreator
    public static ScreenshotMode fromInput(String input) {
        if (input == null || input.isBlank()) {
            return LONG;
        }

        try {
            return ScreenshotMode.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("mode must be one of long, paginated.");
        }
    }

    @JsonValue
    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
