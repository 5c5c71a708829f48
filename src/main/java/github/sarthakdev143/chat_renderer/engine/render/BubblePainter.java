package github.sarthakdev143.chat_renderer.engine.render;

import github.sarthakdev143.chat_renderer.engine.assets.RenderAssets;
import github.sarthakdev143.chat_renderer.engine.layout.LaidOutMessage;
import github.sarthakdev143.chat_renderer.model.ChatCharacter;
import github.sarthakdev143.chat_renderer.model.layout.LayoutMetrics;
import github.sarthakdev143.chat_renderer.model.layout.PhoneGeometry;

import java.awt.Color;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.Polygon;
import java.awt.geom.Ellipse2D;
import java.awt.geom.RoundRectangle2D;

/**
 * Message bubbles and the typing indicator. Sent bubbles sit on the right with the tail on the
 * right; received ones on the left, shifted past the avatar column in a group chat.
 */
class BubblePainter {

    private final PhoneGeometry geometry;
    private final ChatPalette palette;
    private final RenderAssets assets;
    private final AvatarPainter avatarPainter;

    BubblePainter(PhoneGeometry geometry, ChatPalette palette, RenderAssets assets, AvatarPainter avatarPainter) {
        this.geometry = geometry;
        this.palette = palette;
        this.assets = assets;
        this.avatarPainter = avatarPainter;
    }

    /**
     * Paints the message with its top edge at {@code top} and returns the top of the next one.
     */
    int paintMessage(Graphics2D graphics, LaidOutMessage message, int top) {
        LayoutMetrics metrics = message.metrics();
        ChatCharacter sender = message.sender();
        int bubbleTop = top;
        int bubbleX;

        if (metrics.avatarRow()) {
            int nameX = receivedBubbleX(true);
            graphics.setFont(assets.font(geometry.nameFontSize()));
            graphics.setColor(palette.secondaryText());
            FontMetrics nameMetrics = graphics.getFontMetrics();
            graphics.drawString(sender.name(), nameX, top + nameMetrics.getAscent());
            bubbleTop += metrics.nameRowHeight();

            int avatarY = bubbleTop + metrics.bubbleHeight() - geometry.avatarSize();
            avatarPainter.paint(graphics, sender, geometry.bubbleSidePadding(), avatarY, geometry.avatarSize());
            bubbleX = nameX;
        } else if (message.self()) {
            bubbleX = geometry.phoneWidth() - metrics.bubbleWidth() - geometry.bubbleSidePadding();
        } else {
            bubbleX = receivedBubbleX(false);
        }

        Color bubbleColor = message.self() ? palette.senderBubble() : palette.receiverBubble();
        Color textColor = message.self() ? palette.senderText() : palette.receiverText();
        paintBubble(graphics, bubbleX, bubbleTop, metrics.bubbleWidth(), metrics.bubbleHeight(), bubbleColor, message.self());

        graphics.setFont(assets.font(geometry.fontSize()));
        graphics.setColor(textColor);
        FontMetrics textMetrics = graphics.getFontMetrics();
        int textX = bubbleX + geometry.textHorizontalPadding() / 2;
        int lineTop = bubbleTop + geometry.bubbleVerticalPadding() / 2;
        int baselineOffset = (geometry.lineHeight() - textMetrics.getHeight()) / 2 + textMetrics.getAscent();
        for (String line : metrics.lines()) {
            graphics.drawString(line, textX, lineTop + baselineOffset);
            lineTop += geometry.lineHeight();
        }

        return bubbleTop + metrics.bubbleHeight() + metrics.spacing();
    }

    void paintTypingIndicator(Graphics2D graphics, ChatCharacter typist, int top) {
        int bubbleWidth = geometry.px(60);
        int bubbleHeight = geometry.px(36);
        int bubbleX = receivedBubbleX(geometry.groupChat());

        if (geometry.groupChat()) {
            int avatarY = top + bubbleHeight - geometry.avatarSize();
            avatarPainter.paint(graphics, typist, geometry.bubbleSidePadding(), avatarY, geometry.avatarSize());
        }

        paintBubble(graphics, bubbleX, top, bubbleWidth, bubbleHeight, palette.receiverBubble(), false);

        int dotSize = geometry.px(8);
        int dotY = top + bubbleHeight / 2 - dotSize / 2;
        graphics.setColor(palette.typingDot());
        for (int dot = 0; dot < 3; dot++) {
            int dotCenterX = bubbleX + geometry.px(15) + dot * geometry.px(12);
            graphics.fill(new Ellipse2D.Double(dotCenterX - dotSize / 2.0, dotY, dotSize, dotSize));
        }
    }

    void paintBubble(Graphics2D graphics, int x, int y, int width, int height, Color color, boolean sender) {
        int radius = geometry.bubbleRadius();
        int tail = geometry.tailSize();
        int tailDrop = geometry.px(4);
        int inset = geometry.px(2);

        graphics.setColor(color);
        graphics.fill(new RoundRectangle2D.Double(x, y, width, height, radius * 2.0, radius * 2.0));

        int tailY = y + height - radius;
        int tailX = sender ? x + width - inset : x + inset;
        int tipX = sender ? tailX + tail : tailX - tail;
        Polygon tailShape = new Polygon(
                new int[] {tailX, tipX, tailX},
                new int[] {tailY, tailY + tail + tailDrop, tailY + tail},
                3);
        graphics.fillPolygon(tailShape);
    }

    private int receivedBubbleX(boolean withAvatar) {
        if (withAvatar) {
            return geometry.bubbleSidePadding() + geometry.avatarSize() + geometry.avatarMargin();
        }
        return geometry.bubbleSidePadding();
    }
}
