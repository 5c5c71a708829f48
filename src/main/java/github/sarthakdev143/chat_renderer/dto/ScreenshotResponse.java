package github.sarthakdev143.chat_renderer.dto;

import github.sarthakdev143.chat_renderer.model.ScreenshotMode;

import java.util.List;

public record ScreenshotResponse(
        ScreenshotMode mode,
        int pageCount,
        List<ScreenshotPage> images) {

    public ScreenshotResponse {
        images = images == null ? List.of() : List.copyOf(images);
    }
}
