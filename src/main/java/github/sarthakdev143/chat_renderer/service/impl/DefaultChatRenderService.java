package github.sarthakdev143.chat_renderer.service.impl;

import github.sarthakdev143.chat_renderer.config.RenderEngineConfig;
import github.sarthakdev143.chat_renderer.config.RenderProperties;
import github.sarthakdev143.chat_renderer.dto.ScreenshotPage;
import github.sarthakdev143.chat_renderer.dto.ScreenshotResponse;
import github.sarthakdev143.chat_renderer.engine.assets.RenderAssetsFactory;
import github.sarthakdev143.chat_renderer.engine.pipeline.ProgressTracker;
import github.sarthakdev143.chat_renderer.engine.screenshot.ScreenshotImage;
import github.sarthakdev143.chat_renderer.engine.screenshot.ScreenshotRenderer;
import github.sarthakdev143.chat_renderer.model.RenderJobState;
import github.sarthakdev143.chat_renderer.model.RenderJobStatus;
import github.sarthakdev143.chat_renderer.model.RenderSpec;
import github.sarthakdev143.chat_renderer.model.ScreenshotMode;
import github.sarthakdev143.chat_renderer.service.ArtifactSink;
import github.sarthakdev143.chat_renderer.service.ChatRenderService;
import github.sarthakdev143.chat_renderer.service.ChatVideoRenderer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
public class DefaultChatRenderService implements ChatRenderService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultChatRenderService.class);
    private static final String FAILURE_MESSAGE = "Video rendering failed. Check server logs.";

    private final ChatVideoRenderer videoRenderer;
    private final ScreenshotRenderer screenshotRenderer;
    private final RenderAssetsFactory assetsFactory;
    private final ArtifactSink artifactSink;
    private final RenderJobStore jobStore;
    private final TaskExecutor taskExecutor;
    private final Path outputDir;
    private final Counter jobsSubmittedCounter;
    private final Counter jobsCompletedCounter;
    private final Counter jobsFailedCounter;
    private final Counter publishFailureCounter;
    private final Counter screenshotCounter;

    public DefaultChatRenderService(
            ChatVideoRenderer videoRenderer,
            ScreenshotRenderer screenshotRenderer,
            RenderAssetsFactory assetsFactory,
            ArtifactSink artifactSink,
            RenderJobStore jobStore,
            @Qualifier(RenderEngineConfig.RENDER_JOB_EXECUTOR) TaskExecutor taskExecutor,
            RenderProperties properties,
            MeterRegistry meterRegistry) {
        this.videoRenderer = videoRenderer;
        this.screenshotRenderer = screenshotRenderer;
        this.assetsFactory = assetsFactory;
        this.artifactSink = artifactSink;
        this.jobStore = jobStore;
        this.taskExecutor = taskExecutor;
        this.outputDir = properties.outputDir();
        this.jobsSubmittedCounter = meterRegistry.counter("chat_renderer.jobs.submitted");
        this.jobsCompletedCounter = meterRegistry.counter("chat_renderer.jobs.completed");
        this.jobsFailedCounter = meterRegistry.counter("chat_renderer.jobs.failed");
        this.publishFailureCounter = meterRegistry.counter("chat_renderer.publish.failures");
        this.screenshotCounter = meterRegistry.counter("chat_renderer.screenshots");
    }

    @Override
    public String submitJob(RenderSpec spec) {
        String jobId = UUID.randomUUID().toString();
        jobStore.create(jobId, "Job queued.");
        jobsSubmittedCounter.increment();
        logger.info(
                "Accepted render job {} messages={} characters={} format={} groupChat={}",
                jobId,
                spec.messages().size(),
                spec.characters().size(),
                spec.format().toApiValue(),
                spec.groupChat());

        taskExecutor.execute(() -> processJob(jobId, spec));
        return jobId;
    }

    @Override
    public Optional<RenderJobStatus> getJobStatus(String jobId) {
        return jobStore.find(jobId);
    }

    @Override
    public Optional<Path> findArtifact(String jobId) {
        return jobStore.artifact(jobId).filter(Files::isRegularFile);
    }

    @Override
    public ScreenshotResponse renderScreenshots(RenderSpec spec, ScreenshotMode mode) throws IOException {
        List<ScreenshotImage> images = screenshotRenderer.render(spec, mode, assetsFactory.create());
        List<ScreenshotPage> pages = new ArrayList<>(images.size());
        for (int index = 0; index < images.size(); index++) {
            ScreenshotImage image = images.get(index);
            pages.add(new ScreenshotPage(
                    index,
                    image.width(),
                    image.height(),
                    image.startIndex(),
                    image.endIndex() - image.startIndex(),
                    encodePng(image)));
        }
        screenshotCounter.increment();
        logger.info("Rendered {} screenshot with {} page(s)", mode.toApiValue(), pages.size());
        return new ScreenshotResponse(mode, pages.size(), pages);
    }

    private void processJob(String jobId, RenderSpec spec) {
        ProgressTracker tracker = new ProgressTracker();
        tracker.subscribe(progress -> jobStore.update(jobId, current -> withProgress(current, progress)));
        jobStore.update(jobId, current -> withState(current, RenderJobState.PROCESSING, "Rendering video."));

        Path outputVideoPath = outputDir.resolve(jobId + ".mp4");
        try {
            Files.createDirectories(outputDir);
            videoRenderer.render(spec, outputVideoPath, tracker);
            jobStore.attachArtifact(jobId, outputVideoPath);

            String videoUrl;
            String warningMessage = null;
            try {
                videoUrl = artifactSink.publish(jobId, outputVideoPath);
            } catch (Exception publishError) {
                publishFailureCounter.increment();
                logger.error("Publishing video for job {} failed, serving the local file", jobId, publishError);
                videoUrl = RenderJobStore.downloadPath(jobId);
                warningMessage = "Video rendered, but publishing failed. Download it from the server instead.";
            }

            markJobCompleted(jobId, videoUrl, warningMessage);
            jobsCompletedCounter.increment();
            logger.info("Completed render job {} videoUrl={} warning={}", jobId, videoUrl, warningMessage != null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failJob(jobId, outputVideoPath, e);
        } catch (Exception e) {
            failJob(jobId, outputVideoPath, e);
        } catch (Error e) {
            failJob(jobId, outputVideoPath, e);
            throw e;
        }
    }

    private void failJob(String jobId, Path outputVideoPath, Throwable cause) {
        logger.error("Render job {} failed", jobId, cause);
        jobsFailedCounter.increment();
        deleteFile(outputVideoPath);
        String error = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        jobStore.update(jobId, current -> new RenderJobStatus(
                current.jobId(),
                RenderJobState.FAILED,
                1.0,
                FAILURE_MESSAGE,
                error,
                null,
                current.warningMessage(),
                current.createdAt(),
                current.updatedAt()));
    }

    private void markJobCompleted(String jobId, String videoUrl, String warningMessage) {
        String completionMessage = warningMessage == null
                ? "Video rendered successfully."
                : "Video rendered with warnings.";
        jobStore.update(jobId, current -> new RenderJobStatus(
                current.jobId(),
                RenderJobState.COMPLETED,
                1.0,
                completionMessage,
                null,
                videoUrl,
                warningMessage,
                current.createdAt(),
                current.updatedAt()));
    }

    private RenderJobStatus withState(RenderJobStatus current, RenderJobState state, String message) {
        return new RenderJobStatus(
                current.jobId(),
                state,
                current.progress(),
                message,
                current.error(),
                current.videoUrl(),
                current.warningMessage(),
                current.createdAt(),
                current.updatedAt());
    }

    private RenderJobStatus withProgress(RenderJobStatus current, double progress) {
        return new RenderJobStatus(
                current.jobId(),
                current.state(),
                Math.max(current.progress(), progress),
                current.message(),
                current.error(),
                current.videoUrl(),
                current.warningMessage(),
                current.createdAt(),
                current.updatedAt());
    }

    private String encodePng(ScreenshotImage image) throws IOException {
        ByteArrayOutputStream png = new ByteArrayOutputStream();
        if (!ImageIO.write(image.image(), "png", png)) {
            throw new IOException("No PNG writer available.");
        }
        return Base64.getEncoder().encodeToString(png.toByteArray());
    }

    private void deleteFile(Path filePath) {
        try {
            Files.deleteIfExists(filePath);
        } catch (IOException e) {
            logger.debug("Could not delete partial output {}: {}", filePath, e.getMessage());
        }
    }
}
