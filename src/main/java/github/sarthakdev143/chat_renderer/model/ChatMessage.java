package github.sarthakdev143.chat_renderer.model;

public record ChatMessage(String id, String text, String characterId) {

    public ChatMessage {
        text = text == null ? "" : text;
    }
}
