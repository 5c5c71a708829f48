package github.sarthakdev143.chat_renderer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TypingSpeed {
    SLOW(0.20),
    NORMAL(0.12),
    FAST(0.06);

    private final double secondsPerChar;

    TypingSpeed(double secondsPerChar) {
        this.secondsPerChar = secondsPerChar;
    }

    @JsonCreator
    public static TypingSpeed fromInput(String input) {
        if (input == null || input.isBlank()) {
            return NORMAL;
        }

        try {
            return TypingSpeed.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("typing_speed must be one of slow, normal, fast.");
        }
    }

    @JsonValue
    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public double secondsPerChar() {
        return secondsPerChar;
    }

    /**
     * Whole frames spent on each typed character, never less than one.
     */
    public int framesPerChar(int fps) {
        return (int) Math.max(1, Math.round(secondsPerChar * fps));
    }
}
