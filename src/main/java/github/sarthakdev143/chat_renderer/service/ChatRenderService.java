package github.sarthakdev143.chat_renderer.service;

import github.sarthakdev143.chat_renderer.dto.ScreenshotResponse;
import github.sarthakdev143.chat_renderer.model.RenderJobStatus;
import github.sarthakdev143.chat_renderer.model.RenderSpec;
import github.sarthakdev143.chat_renderer.model.ScreenshotMode;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

public interface ChatRenderService {

    String submitJob(RenderSpec spec);

    Optional<RenderJobStatus> getJobStatus(String jobId);

    Optional<Path> findArtifact(String jobId);

    ScreenshotResponse renderScreenshots(RenderSpec spec, ScreenshotMode mode) throws IOException;
}
