package github.sarthakdev143.chat_renderer.engine.pipeline;

import java.awt.image.BufferedImage;

/**
 * A rendered picture and the number of consecutive video frames that show it.
 */
public record FrameRun(BufferedImage image, int repeat) {

    public FrameRun {
        if (repeat < 0) {
            throw new IllegalArgumentException("repeat must not be negative.");
        }
    }
}
