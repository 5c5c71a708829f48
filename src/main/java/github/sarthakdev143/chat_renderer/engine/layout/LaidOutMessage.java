package github.sarthakdev143.chat_renderer.engine.layout;

import github.sarthakdev143.chat_renderer.model.ChatCharacter;
import github.sarthakdev143.chat_renderer.model.ChatMessage;
import github.sarthakdev143.chat_renderer.model.layout.LayoutMetrics;

public record LaidOutMessage(ChatMessage message, ChatCharacter sender, LayoutMetrics metrics) {

    public boolean self() {
        return sender.self();
    }

    public int totalHeight() {
        return metrics.totalHeight();
    }
}
