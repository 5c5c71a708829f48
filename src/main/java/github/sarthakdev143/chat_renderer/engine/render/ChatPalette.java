package github.sarthakdev143.chat_renderer.engine.render;

import github.sarthakdev143.chat_renderer.model.ChatTheme;

import java.awt.Color;

/**
 * Resolved colors for one render. Dark mode replaces the theme background and the received bubble.
 */
record ChatPalette(
        Color background,
        Color senderBubble,
        Color senderText,
        Color receiverBubble,
        Color receiverText,
        Color headerText,
        Color secondaryText,
        Color separator,
        Color typingDot,
        boolean dark) {

    static final Color ACCENT_BLUE = new Color(0x007AFF);
    private static final Color IMESSAGE_GRAY = new Color(0x8E8E93);
    private static final Color IMESSAGE_SEPARATOR = new Color(0xC6C6C8);

    static ChatPalette of(ChatTheme theme, boolean darkMode) {
        Color senderBubble = Graphics2DSupport.color(theme.senderBubble(), ACCENT_BLUE);
        Color senderText = Graphics2DSupport.color(theme.senderText(), Color.WHITE);
        if (darkMode) {
            return new ChatPalette(
                    Color.BLACK,
                    senderBubble,
                    senderText,
                    new Color(0x3A3A3C),
                    Color.WHITE,
                    Color.WHITE,
                    IMESSAGE_GRAY,
                    IMESSAGE_SEPARATOR,
                    new Color(155, 155, 155),
                    true);
        }
        Color background = Graphics2DSupport.color(theme.background(), Color.WHITE);
        return new ChatPalette(
                background,
                senderBubble,
                senderText,
                Graphics2DSupport.color(theme.receiverBubble(), new Color(0xE5E5EA)),
                Graphics2DSupport.color(theme.receiverText(), Color.BLACK),
                isDark(background) ? Color.WHITE : Color.BLACK,
                IMESSAGE_GRAY,
                IMESSAGE_SEPARATOR,
                new Color(128, 128, 128),
                false);
    }

    private static boolean isDark(Color color) {
        double luminance = 0.299 * color.getRed() + 0.587 * color.getGreen() + 0.114 * color.getBlue();
        return luminance < 128;
    }
}
