package github.sarthakdev143.chat_renderer.dto;

import github.sarthakdev143.chat_renderer.model.ChatTheme;

import java.util.List;

public record RenderRequest(
        List<MessageRequest> messages,
        List<CharacterRequest> characters,
        ChatTheme theme,
        RenderSettingsRequest settings,
        String conversationTitle,
        Boolean isGroupChat) {

    public RenderRequest {
        messages = messages == null ? List.of() : messages;
        characters = characters == null ? List.of() : characters;
    }
}
