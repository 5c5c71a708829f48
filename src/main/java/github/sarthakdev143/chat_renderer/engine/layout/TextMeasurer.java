package github.sarthakdev143.chat_renderer.engine.layout;

/**
 * Advance width of a single line of text in supersampled pixels.
 */
@FunctionalInterface
public interface TextMeasurer {

    int width(String text);
}
