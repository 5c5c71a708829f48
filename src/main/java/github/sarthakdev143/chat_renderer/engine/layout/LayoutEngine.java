package github.sarthakdev143.chat_renderer.engine.layout;

import github.sarthakdev143.chat_renderer.model.ChatCharacter;
import github.sarthakdev143.chat_renderer.model.ChatMessage;
import github.sarthakdev143.chat_renderer.model.RenderSpec;
import github.sarthakdev143.chat_renderer.model.layout.LayoutMetrics;
import github.sarthakdev143.chat_renderer.model.layout.PhoneGeometry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Wraps message text into bubble lines and sizes the bubble. Heights computed here drive both
 * the scroll window and the drawing, so a message occupies exactly what the viewport budgets for it.
 */
public class LayoutEngine {

    private final PhoneGeometry geometry;
    private final TextMeasurer measurer;

    public LayoutEngine(PhoneGeometry geometry, TextMeasurer measurer) {
        this.geometry = geometry;
        this.measurer = measurer;
    }

    public LayoutMetrics layout(String text, boolean self, boolean groupChat) {
        List<String> lines = wrap(text);

        int widestLine = 0;
        for (String line : lines) {
            widestLine = Math.max(widestLine, measurer.width(line));
        }

        boolean avatarRow = groupChat && !self;
        return new LayoutMetrics(
                lines,
                widestLine + geometry.textHorizontalPadding(),
                lines.size() * geometry.lineHeight() + geometry.bubbleVerticalPadding(),
                avatarRow ? geometry.nameRowHeight() : 0,
                geometry.messageSpacing(),
                avatarRow);
    }

    public List<LaidOutMessage> layoutAll(RenderSpec spec) {
        Map<String, ChatCharacter> characters = spec.charactersById();
        List<LaidOutMessage> laidOut = new ArrayList<>(spec.messages().size());
        for (ChatMessage message : spec.messages()) {
            ChatCharacter sender = characters.get(message.characterId());
            if (sender == null) {
                throw new IllegalArgumentException(
                        "Message " + message.id() + " references unknown character " + message.characterId() + ".");
            }
            laidOut.add(new LaidOutMessage(message, sender, layout(message.text(), sender.self(), spec.groupChat())));
        }
        return laidOut;
    }

    /**
     * Greedy word wrap on whitespace. A single word wider than the limit stays on its own line
     * unbroken; blank text yields one empty line.
     */
    List<String> wrap(String text) {
        List<String> lines = new ArrayList<>();
        if (text == null || text.isBlank()) {
            lines.add("");
            return lines;
        }

        int maxWidth = geometry.maxTextWidth();
        StringBuilder current = new StringBuilder();
        for (String word : text.trim().split("\\s+")) {
            if (current.length() == 0) {
                current.append(word);
                continue;
            }
            String candidate = current + " " + word;
            if (measurer.width(candidate) <= maxWidth) {
                current.append(' ').append(word);
            } else {
                lines.add(current.toString());
                current.setLength(0);
                current.append(word);
            }
        }
        lines.add(current.toString());
        return lines;
    }

    public static List<Integer> heights(List<LaidOutMessage> messages) {
        List<Integer> heights = new ArrayList<>(messages.size());
        for (LaidOutMessage message : messages) {
            heights.add(message.totalHeight());
        }
        return heights;
    }
}
