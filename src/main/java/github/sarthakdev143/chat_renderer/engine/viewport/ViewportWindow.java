package github.sarthakdev143.chat_renderer.engine.viewport;

/**
 * Contiguous message range {@code [startIndex, endIndex)} drawn in the viewport.
 */
public record ViewportWindow(int startIndex, int endIndex, int usedHeight) {

    public int size() {
        return endIndex - startIndex;
    }

    public boolean isEmpty() {
        return endIndex <= startIndex;
    }
}
