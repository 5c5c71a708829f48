package github.sarthakdev143.chat_renderer.dto;

public record ScreenshotPage(
        int index,
        int width,
        int height,
        int firstMessageIndex,
        int messageCount,
        String pngBase64) {
}
