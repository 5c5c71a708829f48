package github.sarthakdev143.chat_renderer.service;

public record VideoEncodeSettings(int width, int height, int fps, int totalFrames) {

    public VideoEncodeSettings {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Video dimensions must be positive.");
        }
        if (fps <= 0) {
            throw new IllegalArgumentException("fps must be positive.");
        }
    }
}
