package github.sarthakdev143.chat_renderer.dto;

import github.sarthakdev143.chat_renderer.model.ExportFormat;
import github.sarthakdev143.chat_renderer.model.TypingSpeed;

public record RenderSettingsRequest(
        ExportFormat format,
        TypingSpeed typingSpeed,
        Boolean showKeyboard,
        Boolean showTypingIndicator,
        Boolean enableSounds,
        Boolean darkMode) {
}
