package github.sarthakdev143.chat_renderer.service.impl;

import github.sarthakdev143.chat_renderer.config.RenderProperties;
import github.sarthakdev143.chat_renderer.dto.ScreenshotResponse;
import github.sarthakdev143.chat_renderer.engine.assets.RenderAssetsFactory;
import github.sarthakdev143.chat_renderer.engine.pipeline.RenderProgressListener;
import github.sarthakdev143.chat_renderer.engine.screenshot.ScreenshotImage;
import github.sarthakdev143.chat_renderer.engine.screenshot.ScreenshotRenderer;
import github.sarthakdev143.chat_renderer.model.ChatCharacter;
import github.sarthakdev143.chat_renderer.model.ChatMessage;
import github.sarthakdev143.chat_renderer.model.RenderJobState;
import github.sarthakdev143.chat_renderer.model.RenderJobStatus;
import github.sarthakdev143.chat_renderer.model.RenderSpec;
import github.sarthakdev143.chat_renderer.model.ScreenshotMode;
import github.sarthakdev143.chat_renderer.service.ArtifactSink;
import github.sarthakdev143.chat_renderer.service.ChatVideoRenderer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DefaultChatRenderServiceTest {

    @Mock
    private ChatVideoRenderer videoRenderer;

    @Mock
    private ScreenshotRenderer screenshotRenderer;

    @Mock
    private RenderAssetsFactory assetsFactory;

    @Mock
    private ArtifactSink artifactSink;

    @TempDir
    Path outputDir;

    private SimpleMeterRegistry meterRegistry;
    private DefaultChatRenderService service;

    @BeforeEach
    void setUp() {
        TaskExecutor directExecutor = Runnable::run;
        meterRegistry = new SimpleMeterRegistry();
        RenderProperties properties = new RenderProperties(null, null, null, outputDir, 1, 2, Duration.ofHours(1));
        service = new DefaultChatRenderService(
                videoRenderer,
                screenshotRenderer,
                assetsFactory,
                artifactSink,
                new RenderJobStore(properties),
                directExecutor,
                properties,
                meterRegistry);
    }

    @Test
    void submitJobCompletesSuccessfully() throws Exception {
        doAnswer(invocation -> {
            Path output = invocation.getArgument(1);
            RenderProgressListener progress = invocation.getArgument(2);
            progress.onProgress(0.4);
            Files.writeString(output, "mp4");
            return null;
        }).when(videoRenderer).render(any(RenderSpec.class), any(Path.class), any(RenderProgressListener.class));
        when(artifactSink.publish(anyString(), any(Path.class)))
                .thenAnswer(invocation -> RenderJobStore.downloadPath(invocation.getArgument(0)));

        String jobId = service.submitJob(spec());
        RenderJobStatus status = service.getJobStatus(jobId).orElseThrow();

        assertThat(status.state()).isEqualTo(RenderJobState.COMPLETED);
        assertThat(status.progress()).isEqualTo(1.0);
        assertThat(status.message()).isEqualTo("Video rendered successfully.");
        assertThat(status.videoUrl()).isEqualTo("/api/render/download/" + jobId);
        assertThat(status.warningMessage()).isNull();
        assertThat(status.error()).isNull();
        assertThat(service.findArtifact(jobId)).contains(outputDir.resolve(jobId + ".mp4"));
        verify(artifactSink).publish(eq(jobId), eq(outputDir.resolve(jobId + ".mp4")));
        assertThat(meterRegistry.counter("chat_renderer.jobs.submitted").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("chat_renderer.jobs.completed").count()).isEqualTo(1.0);
    }

    @Test
    void submitJobMarksFailureAndRemovesPartialOutput() throws Exception {
        doAnswer(invocation -> {
            Path output = invocation.getArgument(1);
            Files.writeString(output, "partial");
            throw new IOException("FFmpeg encode failed with exit code 1.");
        }).when(videoRenderer).render(any(RenderSpec.class), any(Path.class), any(RenderProgressListener.class));

        String jobId = service.submitJob(spec());
        RenderJobStatus status = service.getJobStatus(jobId).orElseThrow();

        assertThat(status.state()).isEqualTo(RenderJobState.FAILED);
        assertThat(status.progress()).isEqualTo(1.0);
        assertThat(status.message()).isEqualTo("Video rendering failed. Check server logs.");
        assertThat(status.error()).isEqualTo("FFmpeg encode failed with exit code 1.");
        assertThat(status.videoUrl()).isNull();
        assertThat(outputDir.resolve(jobId + ".mp4")).doesNotExist();
        assertThat(service.findArtifact(jobId)).isEmpty();
        verify(artifactSink, never()).publish(anyString(), any(Path.class));
        assertThat(meterRegistry.counter("chat_renderer.jobs.failed").count()).isEqualTo(1.0);
    }

    @Test
    void errorDuringRenderStillFailsTheJob() throws Exception {
        List<Throwable> escaped = new ArrayList<>();
        TaskExecutor recordingExecutor = task -> {
            try {
                task.run();
            } catch (Throwable t) {
                escaped.add(t);
            }
        };
        RenderProperties properties = new RenderProperties(null, null, null, outputDir, 1, 2, Duration.ofHours(1));
        DefaultChatRenderService errorService = new DefaultChatRenderService(
                videoRenderer,
                screenshotRenderer,
                assetsFactory,
                artifactSink,
                new RenderJobStore(properties),
                recordingExecutor,
                properties,
                meterRegistry);
        doAnswer(invocation -> {
            RenderProgressListener progress = invocation.getArgument(2);
            progress.onProgress(0.3);
            throw new OutOfMemoryError("Java heap space");
        }).when(videoRenderer).render(any(RenderSpec.class), any(Path.class), any(RenderProgressListener.class));

        String jobId = errorService.submitJob(spec());
        RenderJobStatus status = errorService.getJobStatus(jobId).orElseThrow();

        assertThat(status.state()).isEqualTo(RenderJobState.FAILED);
        assertThat(status.progress()).isEqualTo(1.0);
        assertThat(status.error()).isEqualTo("Java heap space");
        assertThat(escaped).singleElement().isInstanceOf(OutOfMemoryError.class);
        verify(artifactSink, never()).publish(anyString(), any(Path.class));
        assertThat(meterRegistry.counter("chat_renderer.jobs.failed").count()).isEqualTo(1.0);
    }

    @Test
    void publishFailureStillCompletesWithWarning() throws Exception {
        doAnswer(invocation -> {
            Files.writeString(invocation.getArgument(1), "mp4");
            return null;
        }).when(videoRenderer).render(any(RenderSpec.class), any(Path.class), any(RenderProgressListener.class));
        doThrow(new IOException("bucket unavailable")).when(artifactSink).publish(anyString(), any(Path.class));

        String jobId = service.submitJob(spec());
        RenderJobStatus status = service.getJobStatus(jobId).orElseThrow();

        assertThat(status.state()).isEqualTo(RenderJobState.COMPLETED);
        assertThat(status.message()).isEqualTo("Video rendered with warnings.");
        assertThat(status.videoUrl()).isEqualTo("/api/render/download/" + jobId);
        assertThat(status.warningMessage()).contains("publishing failed");
        assertThat(service.findArtifact(jobId)).isPresent();
        assertThat(meterRegistry.counter("chat_renderer.publish.failures").count()).isEqualTo(1.0);
    }

    @Test
    void unknownJobHasNoStatus() {
        assertThat(service.getJobStatus("missing")).isEmpty();
        assertThat(service.findArtifact("missing")).isEmpty();
    }

    @Test
    void renderScreenshotsEncodesEveryPageAsPng() throws Exception {
        RenderSpec spec = spec();
        when(screenshotRenderer.render(eq(spec), eq(ScreenshotMode.PAGINATED), any())).thenReturn(List.of(
                new ScreenshotImage(new BufferedImage(30, 40, BufferedImage.TYPE_3BYTE_BGR), 0, 3),
                new ScreenshotImage(new BufferedImage(30, 40, BufferedImage.TYPE_3BYTE_BGR), 3, 5)));

        ScreenshotResponse response = service.renderScreenshots(spec, ScreenshotMode.PAGINATED);

        assertThat(response.mode()).isEqualTo(ScreenshotMode.PAGINATED);
        assertThat(response.pageCount()).isEqualTo(2);
        assertThat(response.images().get(1).index()).isEqualTo(1);
        assertThat(response.images().get(1).firstMessageIndex()).isEqualTo(3);
        assertThat(response.images().get(1).messageCount()).isEqualTo(2);

        byte[] png = Base64.getDecoder().decode(response.images().get(0).pngBase64());
        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(png));
        assertThat(decoded.getWidth()).isEqualTo(30);
        assertThat(decoded.getHeight()).isEqualTo(40);
    }

    private static RenderSpec spec() {
        return new RenderSpec(
                List.of(new ChatMessage("m1", "hey", "sam"), new ChatMessage("m2", "hi", "me")),
                List.of(
                        new ChatCharacter("me", "Me", true, "#007AFF", null, null),
                        new ChatCharacter("sam", "Sam", false, "#34C759", null, null)),
                null, null, null, null, "Sam", false);
    }
}
