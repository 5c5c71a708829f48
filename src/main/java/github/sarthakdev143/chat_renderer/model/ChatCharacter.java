package github.sarthakdev143.chat_renderer.model;

public record ChatCharacter(
        String id,
        String name,
        boolean self,
        String colorHex,
        String avatarEmoji,
        byte[] avatarImage) {

    public ChatCharacter {
        name = name == null ? "" : name;
        avatarEmoji = avatarEmoji == null || avatarEmoji.isBlank() ? null : avatarEmoji;
        avatarImage = avatarImage == null || avatarImage.length == 0 ? null : avatarImage.clone();
    }

    public String initial() {
        String trimmed = name.trim();
        if (trimmed.isEmpty()) {
            return "?";
        }
        return trimmed.substring(0, trimmed.offsetByCodePoints(0, 1)).toUpperCase(java.util.Locale.ROOT);
    }
}
