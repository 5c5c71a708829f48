package github.sarthakdev143.chat_renderer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ChatTheme {
    IMESSAGE("#007AFF", "#E5E5EA", "#FFFFFF", "#FFFFFF", "#000000"),
    WHATSAPP("#DCF8C6", "#FFFFFF", "#ECE5DD", "#000000", "#000000"),
    MESSENGER("#0084FF", "#E4E6EB", "#FFFFFF", "#FFFFFF", "#000000"),
    DISCORD("#5865F2", "#2F3136", "#36393F", "#FFFFFF", "#DCDDDE");

    private final String senderBubble;
    private final String receiverBubble;
    private final String background;
    private final String senderText;
    private final String receiverText;

    ChatTheme(String senderBubble, String receiverBubble, String background, String senderText, String receiverText) {
        this.senderBubble = senderBubble;
        this.receiverBubble = receiverBubble;
        this.background = background;
        this.senderText = senderText;
        this.receiverText = receiverText;
    }

    @JsonCreator
    public static ChatTheme fromInput(String input) {
        if (input == null || input.isBlank()) {
            return IMESSAGE;
        }

        try {
            return ChatTheme.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("theme must be one of imessage, whatsapp, messenger, discord.");
        }
    }

    @JsonValue
    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String senderBubble() {
        return senderBubble;
    }

    public String receiverBubble() {
        return receiverBubble;
    }

    public String background() {
        return background;
    }

    public String senderText() {
        return senderText;
    }

    public String receiverText() {
        return receiverText;
    }
}
