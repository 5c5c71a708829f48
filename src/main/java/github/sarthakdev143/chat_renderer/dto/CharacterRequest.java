package github.sarthakdev143.chat_renderer.dto;

public record CharacterRequest(
        String id,
        String name,
        Boolean isMe,
        String colorHex,
        String avatarEmoji,
        String avatarImageBase64) {
}
