package github.sarthakdev143.chat_renderer.engine.render;

import github.sarthakdev143.chat_renderer.engine.assets.RenderAssets;
import github.sarthakdev143.chat_renderer.model.ChatCharacter;
import github.sarthakdev143.chat_renderer.model.layout.PhoneGeometry;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.Optional;

/**
 * Top bar of the phone. A 1:1 chat shows the contact with back arrow and video icon; a group
 * chat only shows the service label and a timestamp.
 */
class HeaderPainter {

    static final String SERVICE_LABEL = "iMessage";
    static final String DIRECT_TIMESTAMP = "Today 9:41 AM";
    static final String GROUP_TIMESTAMP = "Today 9:40 PM";

    private final PhoneGeometry geometry;
    private final ChatPalette palette;
    private final RenderAssets assets;
    private final AvatarPainter avatarPainter;

    HeaderPainter(PhoneGeometry geometry, ChatPalette palette, RenderAssets assets, AvatarPainter avatarPainter) {
        this.geometry = geometry;
        this.palette = palette;
        this.assets = assets;
        this.avatarPainter = avatarPainter;
    }

    void paint(Graphics2D graphics, Optional<ChatCharacter> contact, String conversationTitle) {
        graphics.setColor(palette.background());
        graphics.fillRect(0, 0, geometry.phoneWidth(), geometry.headerHeight());

        if (geometry.groupChat()) {
            paintGroupHeader(graphics);
        } else {
            paintDirectHeader(graphics, contact, conversationTitle);
        }
    }

    private void paintDirectHeader(Graphics2D graphics, Optional<ChatCharacter> contact, String conversationTitle) {
        int avatarSize = geometry.px(40);
        int avatarX = (geometry.phoneWidth() - avatarSize) / 2;
        int avatarY = geometry.px(8);
        if (contact.isPresent()) {
            avatarPainter.paint(graphics, contact.get(), avatarX, avatarY, avatarSize);
        } else {
            avatarPainter.paintPlaceholder(graphics, avatarX, avatarY, avatarSize);
        }
        String contactName = contact.map(ChatCharacter::name).orElse(conversationTitle);

        int iconRowCenter = avatarY + avatarSize / 2;
        Font arrowFont = assets.font(geometry.px(38));
        graphics.setFont(arrowFont);
        graphics.setColor(ChatPalette.ACCENT_BLUE);
        FontMetrics arrowMetrics = graphics.getFontMetrics();
        graphics.drawString("‹", geometry.px(10), iconRowCenter - arrowMetrics.getHeight() / 2 + arrowMetrics.getAscent());

        Optional<BufferedImage> videoIcon = assets.videoIcon();
        if (videoIcon.isPresent()) {
            BufferedImage icon = videoIcon.get();
            int iconHeight = geometry.px(18);
            int iconWidth = (int) (iconHeight * ((double) icon.getWidth() / icon.getHeight()));
            int iconX = geometry.phoneWidth() - iconWidth - geometry.px(16);
            graphics.drawImage(icon, iconX, iconRowCenter - iconHeight / 2, iconWidth, iconHeight, null);
        }

        int nameTop = avatarY + avatarSize + geometry.px(2);
        drawCentered(graphics, contactName + " ›", assets.font(geometry.px(13)), nameTop, palette.headerText());

        int separatorY = nameTop + geometry.px(20);
        paintSeparator(graphics, separatorY);

        int labelTop = separatorY + geometry.px(8);
        drawCentered(graphics, SERVICE_LABEL, assets.font(geometry.px(11)), labelTop, palette.secondaryText());
        drawCentered(graphics, DIRECT_TIMESTAMP, assets.font(geometry.px(11)), labelTop + geometry.px(14), palette.secondaryText());
    }

    private void paintGroupHeader(Graphics2D graphics) {
        int labelTop = geometry.px(8);
        drawCentered(graphics, SERVICE_LABEL, assets.font(geometry.px(11)), labelTop, palette.secondaryText());
        drawCentered(graphics, GROUP_TIMESTAMP, assets.font(geometry.px(11)), labelTop + geometry.px(16), palette.secondaryText());
        paintSeparator(graphics, geometry.headerHeight() - 1);
    }

    private void paintSeparator(Graphics2D graphics, int y) {
        graphics.setColor(palette.separator());
        graphics.setStroke(new BasicStroke(Math.max(1, geometry.px(0.5))));
        graphics.drawLine(0, y, geometry.phoneWidth(), y);
    }

    private void drawCentered(Graphics2D graphics, String text, Font font, int top, Color color) {
        graphics.setFont(font);
        graphics.setColor(color);
        FontMetrics metrics = graphics.getFontMetrics();
        int x = (geometry.phoneWidth() - metrics.stringWidth(text)) / 2;
        graphics.drawString(text, x, top + metrics.getAscent());
    }
}
