package github.sarthakdev143.chat_renderer.model;

import java.time.Instant;

public record RenderJobStatus(
        String jobId,
        RenderJobState state,
        double progress,
        String message,
        String error,
        String videoUrl,
        String warningMessage,
        Instant createdAt,
        Instant updatedAt) {
}
