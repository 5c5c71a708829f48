package github.sarthakdev143.chat_renderer.dto;

public record MessageRequest(
        String id,
        String text,
        String characterId) {
}
