package github.sarthakdev143.chat_renderer.model.timeline;

/**
 * Everything the frame renderer needs to draw one picture.
 *
 * @param visibleCount       number of leading messages already in the conversation
 * @param typingCharacterId  sender whose typing indicator is shown, or null
 * @param draftText          text in the input field, or null for the placeholder
 * @param pressedKey         highlighted keyboard key, or null
 */
public record FrameState(
        int visibleCount,
        String typingCharacterId,
        String draftText,
        String pressedKey) {

    public static FrameState idle(int visibleCount) {
        return new FrameState(visibleCount, null, null, null);
    }

    public boolean showsTypingIndicator() {
        return typingCharacterId != null;
    }
}
