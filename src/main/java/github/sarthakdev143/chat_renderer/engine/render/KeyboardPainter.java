package github.sarthakdev143.chat_renderer.engine.render;

import github.sarthakdev143.chat_renderer.engine.assets.RenderAssets;
import github.sarthakdev143.chat_renderer.model.layout.PhoneGeometry;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.geom.Ellipse2D;
import java.awt.geom.RoundRectangle2D;

/**
 * QWERTY keyboard and the message input field above it.
 */
class KeyboardPainter {

    private static final String[] LETTER_ROWS = {"qwertyuiop", "asdfghjkl", "zxcvbnm"};
    private static final Color HIGHLIGHT = new Color(128, 128, 128);
    private static final Color PLACEHOLDER = new Color(128, 128, 128);
    private static final String PLACEHOLDER_TEXT = "iMessage";

    private final PhoneGeometry geometry;
    private final RenderAssets assets;
    private final Color keyboardBackground;
    private final Color keyColor;
    private final Color specialKeyColor;
    private final Color keyText;
    private final Color inputBackground;
    private final Color inputBorder;

    KeyboardPainter(PhoneGeometry geometry, RenderAssets assets, boolean darkMode) {
        this.geometry = geometry;
        this.assets = assets;
        if (darkMode) {
            keyboardBackground = new Color(30, 30, 30);
            keyColor = new Color(89, 89, 89);
            specialKeyColor = new Color(64, 64, 64);
            keyText = Color.WHITE;
            inputBackground = new Color(51, 51, 51);
            inputBorder = new Color(100, 100, 100);
        } else {
            keyboardBackground = new Color(209, 213, 219);
            keyColor = Color.WHITE;
            specialKeyColor = new Color(173, 176, 182);
            keyText = Color.BLACK;
            inputBackground = Color.WHITE;
            inputBorder = new Color(200, 200, 200);
        }
    }

    void paint(Graphics2D graphics, String draftText, String pressedKey) {
        int keyboardTop = geometry.keyboardTop();
        paintInputField(graphics, keyboardTop, draftText);

        graphics.setColor(keyboardBackground);
        graphics.fillRect(0, keyboardTop, geometry.phoneWidth(), geometry.keyboardHeight());

        int keyHeight = geometry.px(38);
        int keySpacing = geometry.px(5);
        int rowSpacing = geometry.px(8);
        int sideMargin = geometry.px(3);
        int keyboardWidth = geometry.phoneWidth() - sideMargin * 2;
        Font keyFont = assets.font(geometry.px(16));
        Font smallFont = assets.font(geometry.px(11));
        int rowTop = keyboardTop + geometry.px(8);

        String topRow = LETTER_ROWS[0];
        int topKeyWidth = (keyboardWidth - (topRow.length() - 1) * keySpacing) / topRow.length();
        paintLetterRow(graphics, topRow, sideMargin, rowTop, topKeyWidth, keyHeight, keySpacing, keyFont, pressedKey);
        rowTop += keyHeight + rowSpacing;

        String middleRow = LETTER_ROWS[1];
        int indent = geometry.px(16);
        int middleKeyWidth = (keyboardWidth - (middleRow.length() - 1) * keySpacing - indent) / middleRow.length();
        paintLetterRow(graphics, middleRow, sideMargin + indent / 2, rowTop, middleKeyWidth, keyHeight, keySpacing, keyFont, pressedKey);
        rowTop += keyHeight + rowSpacing;

        String bottomRow = LETTER_ROWS[2];
        int specialWidth = geometry.px(38);
        int bottomKeyWidth = (keyboardWidth - (bottomRow.length() - 1) * keySpacing - specialWidth * 2 - keySpacing * 2)
                / bottomRow.length();
        paintKey(graphics, sideMargin, rowTop, specialWidth, keyHeight, specialKeyColor, "⇧", smallFont);
        paintLetterRow(graphics, bottomRow, sideMargin + specialWidth + keySpacing, rowTop, bottomKeyWidth, keyHeight,
                keySpacing, keyFont, pressedKey);
        paintKey(graphics, geometry.phoneWidth() - sideMargin - specialWidth, rowTop, specialWidth, keyHeight,
                specialKeyColor, "⌫", smallFont);
        rowTop += keyHeight + rowSpacing;

        int numberWidth = geometry.px(38);
        int emojiWidth = geometry.px(36);
        int returnWidth = geometry.px(60);
        int spaceWidth = geometry.phoneWidth() - numberWidth - emojiWidth - returnWidth - keySpacing * 4 - sideMargin * 2;
        int x = sideMargin;
        paintKey(graphics, x, rowTop, numberWidth, keyHeight, specialKeyColor, "123", smallFont);
        x += numberWidth + keySpacing;
        paintKey(graphics, x, rowTop, emojiWidth, keyHeight, specialKeyColor, "☺", smallFont);
        x += emojiWidth + keySpacing;
        Color spaceColor = " ".equals(pressedKey) ? HIGHLIGHT : keyColor;
        paintKey(graphics, x, rowTop, spaceWidth, keyHeight, spaceColor, "space", smallFont);
        x += spaceWidth + keySpacing;
        paintKey(graphics, x, rowTop, geometry.phoneWidth() - sideMargin - x, keyHeight, specialKeyColor, "return", smallFont);
    }

    private void paintInputField(Graphics2D graphics, int keyboardTop, String draftText) {
        int inputHeight = geometry.px(32);
        int inputMargin = geometry.px(8);
        int inputTop = keyboardTop - inputHeight - geometry.px(10);
        int inputWidth = geometry.phoneWidth() - geometry.px(54);
        int radius = geometry.px(16);

        RoundRectangle2D field = new RoundRectangle2D.Double(inputMargin, inputTop, inputWidth, inputHeight, radius * 2.0, radius * 2.0);
        graphics.setColor(inputBackground);
        graphics.fill(field);
        graphics.setColor(inputBorder);
        graphics.setStroke(new BasicStroke(Math.max(1, geometry.px(0.5))));
        graphics.draw(field);

        graphics.setFont(assets.font(geometry.px(15)));
        FontMetrics metrics = graphics.getFontMetrics();
        int baseline = inputTop + (inputHeight - metrics.getHeight()) / 2 + metrics.getAscent();
        int textX = inputMargin + geometry.px(12);
        if (draftText != null && !draftText.isEmpty()) {
            graphics.setColor(keyText);
            graphics.drawString(draftText + "|", textX, baseline);
        } else {
            graphics.setColor(PLACEHOLDER);
            graphics.drawString(PLACEHOLDER_TEXT, textX, baseline);
        }

        int sendSize = geometry.px(28);
        int sendX = geometry.phoneWidth() - sendSize - geometry.px(12);
        int sendY = inputTop + (inputHeight - sendSize) / 2;
        graphics.setColor(ChatPalette.ACCENT_BLUE);
        graphics.fill(new Ellipse2D.Double(sendX, sendY, sendSize, sendSize));
        graphics.setFont(assets.boldFont(geometry.px(16)));
        graphics.setColor(Color.WHITE);
        FontMetrics arrowMetrics = graphics.getFontMetrics();
        graphics.drawString(
                "↑",
                sendX + (sendSize - arrowMetrics.stringWidth("↑")) / 2,
                sendY + (sendSize - arrowMetrics.getHeight()) / 2 + arrowMetrics.getAscent());
    }

    private void paintLetterRow(
            Graphics2D graphics,
            String letters,
            int startX,
            int top,
            int keyWidth,
            int keyHeight,
            int keySpacing,
            Font font,
            String pressedKey) {
        int x = startX;
        for (int index = 0; index < letters.length(); index++) {
            String letter = String.valueOf(letters.charAt(index));
            Color color = letter.equals(pressedKey) ? HIGHLIGHT : keyColor;
            paintKey(graphics, x, top, keyWidth, keyHeight, color, letter, font);
            x += keyWidth + keySpacing;
        }
    }

    private void paintKey(Graphics2D graphics, int x, int y, int width, int height, Color fill, String label, Font font) {
        int radius = geometry.px(5);
        graphics.setColor(fill);
        graphics.fill(new RoundRectangle2D.Double(x, y, width, height, radius * 2.0, radius * 2.0));

        graphics.setFont(font);
        graphics.setColor(keyText);
        FontMetrics metrics = graphics.getFontMetrics();
        graphics.drawString(
                label,
                x + (width - metrics.stringWidth(label)) / 2,
                y + (height - metrics.getHeight()) / 2 + metrics.getAscent());
    }
}
