package github.sarthakdev143.chat_renderer.model;

public record RenderToggles(
        boolean showKeyboard,
        boolean showTypingIndicator,
        boolean enableSound,
        boolean darkMode) {

    public static RenderToggles defaults() {
        return new RenderToggles(true, true, true, false);
    }
}
