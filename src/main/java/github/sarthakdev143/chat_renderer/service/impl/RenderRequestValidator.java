package github.sarthakdev143.chat_renderer.service.impl;

import github.sarthakdev143.chat_renderer.dto.CharacterRequest;
import github.sarthakdev143.chat_renderer.dto.MessageRequest;
import github.sarthakdev143.chat_renderer.dto.RenderRequest;
import github.sarthakdev143.chat_renderer.dto.RenderSettingsRequest;
import github.sarthakdev143.chat_renderer.model.ChatCharacter;
import github.sarthakdev143.chat_renderer.model.ChatMessage;
import github.sarthakdev143.chat_renderer.model.RenderSpec;
import github.sarthakdev143.chat_renderer.model.RenderToggles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Base64;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns an API request into a {@link RenderSpec}, rejecting anything the engine cannot draw.
 * Undecodable avatar images are dropped with a warning rather than rejected.
 */
@Component
public class RenderRequestValidator {

    private static final Logger logger = LoggerFactory.getLogger(RenderRequestValidator.class);
    private static final int MAX_MESSAGES = 500;
    private static final int MAX_CHARACTERS = 20;
    private static final int MAX_MESSAGE_LENGTH = 2000;
    private static final int MAX_NAME_LENGTH = 50;
    private static final int MAX_TITLE_LENGTH = 100;
    private static final int MAX_AVATAR_BASE64_LENGTH = 4 * 1024 * 1024;
    private static final String DEFAULT_CHARACTER_COLOR = "#8E8E93";
    private static final Pattern HEX_COLOR_PATTERN = Pattern.compile("^#?[0-9a-fA-F]{6}$");

    public RenderSpec normalizeAndValidate(RenderRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request body is required.");
        }

        List<ChatCharacter> characters = normalizeCharacters(request.characters());
        List<ChatMessage> messages = normalizeMessages(request.messages(), characters);

        RenderSettingsRequest settings = request.settings();
        RenderToggles defaults = RenderToggles.defaults();
        RenderToggles toggles = settings == null
                ? defaults
                : new RenderToggles(
                        orDefault(settings.showKeyboard(), defaults.showKeyboard()),
                        orDefault(settings.showTypingIndicator(), defaults.showTypingIndicator()),
                        orDefault(settings.enableSounds(), defaults.enableSound()),
                        orDefault(settings.darkMode(), defaults.darkMode()));

        String title = request.conversationTitle();
        if (title != null && title.length() > MAX_TITLE_LENGTH) {
            throw new IllegalArgumentException("conversation_title must be at most " + MAX_TITLE_LENGTH + " characters.");
        }

        return new RenderSpec(
                messages,
                characters,
                request.theme(),
                settings == null ? null : settings.format(),
                settings == null ? null : settings.typingSpeed(),
                toggles,
                title,
                Boolean.TRUE.equals(request.isGroupChat()));
    }

    private List<ChatCharacter> normalizeCharacters(List<CharacterRequest> characters) {
        if (characters == null || characters.isEmpty()) {
            throw new IllegalArgumentException("characters must contain at least one character.");
        }
        if (characters.size() > MAX_CHARACTERS) {
            throw new IllegalArgumentException("characters supports at most " + MAX_CHARACTERS + " entries.");
        }

        List<ChatCharacter> normalized = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        for (int index = 0; index < characters.size(); index++) {
            CharacterRequest character = characters.get(index);
            if (character == null) {
                throw new IllegalArgumentException("characters[" + index + "] must not be null.");
            }

            String id = requireId(character.id(), "characters[" + index + "].id");
            if (!seenIds.add(id)) {
                throw new IllegalArgumentException("Duplicate character id: " + id + ".");
            }

            String name = character.name() == null ? "" : character.name().trim();
            if (name.length() > MAX_NAME_LENGTH) {
                throw new IllegalArgumentException(
                        "characters[" + index + "].name must be at most " + MAX_NAME_LENGTH + " characters.");
            }

            String color = character.colorHex();
            if (color == null || color.isBlank()) {
                color = DEFAULT_CHARACTER_COLOR;
            } else if (!HEX_COLOR_PATTERN.matcher(color.trim()).matches()) {
                throw new IllegalArgumentException("characters[" + index + "].color_hex must be a #RRGGBB color.");
            }

            normalized.add(new ChatCharacter(
                    id,
                    name,
                    Boolean.TRUE.equals(character.isMe()),
                    color.trim(),
                    character.avatarEmoji(),
                    decodeAvatar(id, character.avatarImageBase64())));
        }
        return normalized;
    }

    private List<ChatMessage> normalizeMessages(List<MessageRequest> messages, List<ChatCharacter> characters) {
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("messages must contain at least one message.");
        }
        if (messages.size() > MAX_MESSAGES) {
            throw new IllegalArgumentException("messages supports at most " + MAX_MESSAGES + " entries.");
        }

        Set<String> characterIds = new HashSet<>();
        for (ChatCharacter character : characters) {
            characterIds.add(character.id());
        }

        List<ChatMessage> normalized = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        for (int index = 0; index < messages.size(); index++) {
            MessageRequest message = messages.get(index);
            if (message == null) {
                throw new IllegalArgumentException("messages[" + index + "] must not be null.");
            }

            String id = requireId(message.id(), "messages[" + index + "].id");
            if (!seenIds.add(id)) {
                throw new IllegalArgumentException("Duplicate message id: " + id + ".");
            }

            String characterId = requireId(message.characterId(), "messages[" + index + "].character_id");
            if (!characterIds.contains(characterId)) {
                throw new IllegalArgumentException(
                        "messages[" + index + "] references unknown character " + characterId + ".");
            }

            String text = message.text() == null ? "" : message.text();
            if (text.length() > MAX_MESSAGE_LENGTH) {
                throw new IllegalArgumentException(
                        "messages[" + index + "].text must be at most " + MAX_MESSAGE_LENGTH + " characters.");
            }

            normalized.add(new ChatMessage(id, text, characterId));
        }
        return normalized;
    }

    private byte[] decodeAvatar(String characterId, String base64) {
        if (base64 == null || base64.isBlank()) {
            return null;
        }
        if (base64.length() > MAX_AVATAR_BASE64_LENGTH) {
            throw new IllegalArgumentException("Avatar image for character " + characterId + " is too large.");
        }

        String payload = base64.trim();
        int dataUriSeparator = payload.indexOf(',');
        if (payload.startsWith("data:") && dataUriSeparator > 0) {
            payload = payload.substring(dataUriSeparator + 1);
        }
        try {
            return Base64.getDecoder().decode(payload.replaceAll("\\s+", ""));
        } catch (IllegalArgumentException ex) {
            logger.warn("Ignoring undecodable avatar image for character {}", characterId);
            return null;
        }
    }

    private String requireId(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " is required.");
        }
        return value.trim();
    }

    private static boolean orDefault(Boolean value, boolean fallback) {
        return value == null ? fallback : value;
    }
}
