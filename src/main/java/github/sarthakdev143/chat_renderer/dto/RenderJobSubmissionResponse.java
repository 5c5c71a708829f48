package github.sarthakdev143.chat_renderer.dto;

import github.sarthakdev143.chat_renderer.model.RenderJobState;

public record RenderJobSubmissionResponse(
        String jobId,
        RenderJobState state,
        String message) {
}
