package github.sarthakdev143.chat_renderer.engine.pipeline;

public class FrameRenderException extends RuntimeException {

    public FrameRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
