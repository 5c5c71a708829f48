package github.sarthakdev143.chat_renderer.engine.render;

import github.sarthakdev143.chat_renderer.engine.assets.RenderAssets;
import github.sarthakdev143.chat_renderer.model.ChatCharacter;

import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.Shape;
import java.awt.geom.Ellipse2D;
import java.awt.image.BufferedImage;
import java.util.Optional;

/**
 * Circular avatar: the uploaded picture when it decodes, else the emoji on the character color,
 * else the first letter of the name.
 */
class AvatarPainter {

    private static final Color FALLBACK_AVATAR_COLOR = new Color(0xC7C7CC);

    private final RenderAssets assets;

    AvatarPainter(RenderAssets assets) {
        this.assets = assets;
    }

    void paint(Graphics2D graphics, ChatCharacter character, int x, int y, int size) {
        Ellipse2D circle = new Ellipse2D.Double(x, y, size, size);

        Optional<BufferedImage> picture = assets.avatarImage(character);
        if (picture.isPresent()) {
            Shape previousClip = graphics.getClip();
            graphics.clip(circle);
            graphics.drawImage(picture.get(), x, y, size, size, null);
            graphics.setClip(previousClip);
            return;
        }

        graphics.setColor(Graphics2DSupport.color(character.colorHex(), FALLBACK_AVATAR_COLOR));
        graphics.fill(circle);

        if (character.avatarEmoji() != null) {
            drawCentered(graphics, character.avatarEmoji(), assets.font((int) (size * 0.55)), x, y, size, Color.BLACK);
            return;
        }
        drawCentered(graphics, character.initial(), assets.boldFont((int) (size * 0.45)), x, y, size, Color.WHITE);
    }

    void paintPlaceholder(Graphics2D graphics, int x, int y, int size) {
        graphics.setColor(FALLBACK_AVATAR_COLOR);
        graphics.fill(new Ellipse2D.Double(x, y, size, size));
    }

    private void drawCentered(Graphics2D graphics, String text, Font font, int x, int y, int size, Color color) {
        graphics.setFont(font);
        graphics.setColor(color);
        FontMetrics metrics = graphics.getFontMetrics();
        int textX = x + (size - metrics.stringWidth(text)) / 2;
        int baseline = y + (size - metrics.getHeight()) / 2 + metrics.getAscent();
        graphics.drawString(text, textX, baseline);
    }
}
