package github.sarthakdev143.chat_renderer.engine.viewport;

/**
 * Messages {@code [startIndex, endIndex)} placed on one screenshot page.
 * {@code height} may exceed the viewport when a single message does.
 */
public record PageRange(int startIndex, int endIndex, int height) {

    public int size() {
        return endIndex - startIndex;
    }
}
