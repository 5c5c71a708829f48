package github.sarthakdev143.chat_renderer.service.impl;

import github.sarthakdev143.chat_renderer.service.ArtifactSink;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Leaves the video where it was rendered and points clients at the download endpoint.
 */
@Component
public class LocalArtifactSink implements ArtifactSink {

    @Override
    public String publish(String jobId, Path artifact) throws IOException {
        if (!Files.isRegularFile(artifact)) {
            throw new IOException("Rendered video is missing: " + artifact);
        }
        return RenderJobStore.downloadPath(jobId);
    }
}
