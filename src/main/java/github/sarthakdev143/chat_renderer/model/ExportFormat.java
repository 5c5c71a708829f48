package github.sarthakdev143.chat_renderer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ExportFormat {
    TIKTOK(1080, 1920),
    INSTAGRAM(1080, 1080),
    YOUTUBE(1920, 1080),
    IPHONE(1284, 2778);

    private final int width;
    private final int height;

    ExportFormat(int width, int height) {
        this.width = width;
        this.height = height;
    }

    @JsonCreator
    public static ExportFormat fromInput(String input) {
        if (input == null || input.isBlank()) {
            return TIKTOK;
        }

        try {
            return ExportFormat.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("format must be one of tiktok, instagram, youtube, iphone.");
        }
    }

    @JsonValue
    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }
}
