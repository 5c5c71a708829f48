package github.sarthakdev143.chat_renderer.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Validated, immutable description of one render. Built by the request validator;
 * every message's character id is guaranteed to resolve.
 */
public record RenderSpec(
        List<ChatMessage> messages,
        List<ChatCharacter> characters,
        ChatTheme theme,
        ExportFormat format,
        TypingSpeed typingSpeed,
        RenderToggles toggles,
        String conversationTitle,
        boolean groupChat) {

    public RenderSpec {
        messages = messages == null ? List.of() : List.copyOf(messages);
        characters = characters == null ? List.of() : List.copyOf(characters);
        theme = theme == null ? ChatTheme.IMESSAGE : theme;
        format = format == null ? ExportFormat.TIKTOK : format;
        typingSpeed = typingSpeed == null ? TypingSpeed.NORMAL : typingSpeed;
        toggles = toggles == null ? RenderToggles.defaults() : toggles;
        conversationTitle = conversationTitle == null || conversationTitle.isBlank() ? "Chat" : conversationTitle;
        groupChat = groupChat || characters.size() > 2;
    }

    public Map<String, ChatCharacter> charactersById() {
        Map<String, ChatCharacter> byId = new LinkedHashMap<>();
        for (ChatCharacter character : characters) {
            byId.put(character.id(), character);
        }
        return byId;
    }

    /**
     * The contact shown in a 1:1 header: the first character that is not the device owner.
     */
    public Optional<ChatCharacter> mainContact() {
        return characters.stream().filter(character -> !character.self()).findFirst();
    }
}
