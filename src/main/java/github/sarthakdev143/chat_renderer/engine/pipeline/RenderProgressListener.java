package github.sarthakdev143.chat_renderer.engine.pipeline;

/**
 * Receives render progress as a fraction in [0, 1].
 */
@FunctionalInterface
public interface RenderProgressListener {

    RenderProgressListener NONE = fraction -> {
    };

    void onProgress(double fraction);

    /**
     * Maps this listener's [0, 1] onto the sub-range {@code [from, to]} of the returned one.
     */
    default RenderProgressListener scaled(double from, double to) {
        return fraction -> onProgress(from + (to - from) * Math.min(Math.max(fraction, 0.0), 1.0));
    }
}
