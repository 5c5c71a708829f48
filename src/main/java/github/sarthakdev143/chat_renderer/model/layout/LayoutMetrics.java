package github.sarthakdev143.chat_renderer.model.layout;

import java.util.List;

/**
 * Pixel geometry of one message, in supersampled phone coordinates.
 *
 * @param lines         wrapped text lines, never empty
 * @param bubbleWidth   widest line plus horizontal padding
 * @param bubbleHeight  line count times line height plus vertical padding
 * @param nameRowHeight sender name row above the bubble, zero unless group-received
 * @param spacing       gap below the bubble before the next message
 * @param avatarRow     whether the sender avatar and name are drawn
 */
public record LayoutMetrics(
        List<String> lines,
        int bubbleWidth,
        int bubbleHeight,
        int nameRowHeight,
        int spacing,
        boolean avatarRow) {

    public LayoutMetrics {
        lines = lines == null || lines.isEmpty() ? List.of("") : List.copyOf(lines);
    }

    public int totalHeight() {
        return nameRowHeight + bubbleHeight + spacing;
    }
}
