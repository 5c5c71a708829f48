package github.sarthakdev143.chat_renderer.engine.screenshot;

import java.awt.image.BufferedImage;

public record ScreenshotImage(BufferedImage image, int startIndex, int endIndex) {

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }
}
