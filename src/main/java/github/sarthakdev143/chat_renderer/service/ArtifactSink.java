package github.sarthakdev143.chat_renderer.service;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Publishes a finished video somewhere clients can fetch it from.
 */
public interface ArtifactSink {

    /**
     * @return the URL the artifact can be downloaded from
     */
    String publish(String jobId, Path artifact) throws IOException;
}
