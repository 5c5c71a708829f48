package github.sarthakdev143.chat_renderer.controller;

import github.sarthakdev143.chat_renderer.dto.RenderJobSubmissionResponse;
import github.sarthakdev143.chat_renderer.dto.RenderRequest;
import github.sarthakdev143.chat_renderer.model.RenderJobState;
import github.sarthakdev143.chat_renderer.model.RenderJobStatus;
import github.sarthakdev143.chat_renderer.model.RenderSpec;
import github.sarthakdev143.chat_renderer.model.ScreenshotMode;
import github.sarthakdev143.chat_renderer.service.ChatRenderService;
import github.sarthakdev143.chat_renderer.service.impl.RenderRequestValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.Optional;

@RestController
@RequestMapping("/api/render")
public class RenderController {

    private static final Logger logger = LoggerFactory.getLogger(RenderController.class);
    private static final MediaType VIDEO_MP4 = MediaType.parseMediaType("video/mp4");

    private final ChatRenderService chatRenderService;
    private final RenderRequestValidator renderRequestValidator;

    public RenderController(ChatRenderService chatRenderService, RenderRequestValidator renderRequestValidator) {
        this.chatRenderService = chatRenderService;
        this.renderRequestValidator = renderRequestValidator;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> submitRender(@RequestBody RenderRequest request) {
        try {
            RenderSpec spec = renderRequestValidator.normalizeAndValidate(request);
            String jobId = chatRenderService.submitJob(spec);
            return ResponseEntity.accepted()
                    .body(new RenderJobSubmissionResponse(
                            jobId,
                            RenderJobState.QUEUED,
                            "Render job accepted. Poll /api/render/status/{jobId} for progress."));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Render submission failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to submit render job. Please try again.");
        }
    }

    @GetMapping("/status/{jobId}")
    public ResponseEntity<?> getStatus(@PathVariable String jobId) {
        return chatRenderService.getJobStatus(jobId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body("Job not found for id: " + jobId));
    }

    @GetMapping("/download/{jobId}")
    public ResponseEntity<?> download(@PathVariable String jobId) {
        Optional<RenderJobStatus> status = chatRenderService.getJobStatus(jobId);
        if (status.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Job not found for id: " + jobId);
        }
        if (status.get().state() != RenderJobState.COMPLETED) {
            return ResponseEntity.badRequest()
                    .body("Video is not ready. Current state: " + status.get().state().toApiValue());
        }

        Optional<Path> artifact = chatRenderService.findArtifact(jobId);
        if (artifact.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Video file not found for id: " + jobId);
        }

        return ResponseEntity.ok()
                .contentType(VIDEO_MP4)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename("chat_story_" + jobId + ".mp4")
                        .build()
                        .toString())
                .body(new FileSystemResource(artifact.get()));
    }

    @PostMapping(value = "/screenshot", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> renderScreenshot(
            @RequestParam(value = "mode", required = false) String modeInput,
            @RequestBody RenderRequest request) {
        try {
            ScreenshotMode mode = ScreenshotMode.fromInput(modeInput);
            RenderSpec spec = renderRequestValidator.normalizeAndValidate(request);
            return ResponseEntity.ok(chatRenderService.renderScreenshots(spec, mode));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Screenshot rendering failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to render screenshot. Please try again.");
        }
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<String> handleUnreadableBody(HttpMessageNotReadableException e) {
        Throwable cause = e.getMostSpecificCause();
        String detail = cause instanceof IllegalArgumentException && cause.getMessage() != null
                ? cause.getMessage()
                : "request body is not valid JSON for this endpoint.";
        return ResponseEntity.badRequest().body("Invalid request: " + detail);
    }
}
