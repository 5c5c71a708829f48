package github.sarthakdev143.chat_renderer.engine.layout;

import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Measures text with the same font and hints the frame renderer draws with, so wrapping
 * decisions match the pixels on screen.
 */
public class FontTextMeasurer implements TextMeasurer {

    private final FontMetrics metrics;

    public FontTextMeasurer(Font font) {
        BufferedImage scratch = new BufferedImage(1, 1, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = scratch.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            graphics.setRenderingHint(RenderingHints.KEY_FRACTIONALMETRICS, RenderingHints.VALUE_FRACTIONALMETRICS_ON);
            this.metrics = graphics.getFontMetrics(font);
        } finally {
            graphics.dispose();
        }
    }

    @Override
    public synchronized int width(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return metrics.stringWidth(text);
    }
}
