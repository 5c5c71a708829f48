package github.sarthakdev143.chat_renderer.service.impl;

import github.sarthakdev143.chat_renderer.config.RenderProperties;
import github.sarthakdev143.chat_renderer.engine.assets.RenderAssets;
import github.sarthakdev143.chat_renderer.engine.assets.RenderAssetsFactory;
import github.sarthakdev143.chat_renderer.engine.audio.AudioSyncComposer;
import github.sarthakdev143.chat_renderer.engine.audio.WavWriter;
import github.sarthakdev143.chat_renderer.engine.pipeline.FrameSource;
import github.sarthakdev143.chat_renderer.engine.pipeline.RenderProgressListener;
import github.sarthakdev143.chat_renderer.engine.render.FrameRenderer;
import github.sarthakdev143.chat_renderer.engine.render.FrameRendererFactory;
import github.sarthakdev143.chat_renderer.engine.timeline.TimelineBuilder;
import github.sarthakdev143.chat_renderer.model.RenderSpec;
import github.sarthakdev143.chat_renderer.model.layout.PhoneGeometry;
import github.sarthakdev143.chat_renderer.model.timeline.RenderTimeline;
import github.sarthakdev143.chat_renderer.service.ChatVideoRenderer;
import github.sarthakdev143.chat_renderer.service.VideoAssembler;
import github.sarthakdev143.chat_renderer.service.VideoEncodeSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Timeline, audio and frames for one conversation, streamed into the video assembler.
 */
@Service
public class DefaultChatVideoRenderer implements ChatVideoRenderer {

    private static final Logger logger = LoggerFactory.getLogger(DefaultChatVideoRenderer.class);
    private static final double PREPARED_PROGRESS = 0.02;
    private static final double AUDIO_PROGRESS = 0.05;

    private final RenderAssetsFactory assetsFactory;
    private final FrameRendererFactory frameRendererFactory;
    private final AudioSyncComposer audioComposer;
    private final WavWriter wavWriter;
    private final VideoAssembler videoAssembler;
    private final TimelineBuilder timelineBuilder;
    private final int parallelism;

    public DefaultChatVideoRenderer(
            RenderAssetsFactory assetsFactory,
            FrameRendererFactory frameRendererFactory,
            AudioSyncComposer audioComposer,
            WavWriter wavWriter,
            VideoAssembler videoAssembler,
            RenderProperties properties) {
        this.assetsFactory = assetsFactory;
        this.frameRendererFactory = frameRendererFactory;
        this.audioComposer = audioComposer;
        this.wavWriter = wavWriter;
        this.videoAssembler = videoAssembler;
        this.timelineBuilder = new TimelineBuilder();
        this.parallelism = properties.parallelism();
    }

    @Override
    public void render(RenderSpec spec, Path outputVideoPath, RenderProgressListener progress)
            throws IOException, InterruptedException {
        RenderAssets assets = assetsFactory.create();
        RenderTimeline timeline = timelineBuilder.build(spec);
        FrameRenderer frameRenderer = frameRendererFactory.create(spec, assets, spec.toggles().showKeyboard());
        PhoneGeometry geometry = frameRenderer.geometry();
        progress.onProgress(PREPARED_PROGRESS);
        logger.info(
                "Rendering {} messages into {} frames ({} events, {} cues) at {}x{}",
                spec.messages().size(),
                timeline.totalFrames(),
                timeline.events().size(),
                timeline.cues().size(),
                geometry.outputWidth(),
                geometry.outputHeight());

        Path audioTrack = null;
        try {
            if (spec.toggles().enableSound()) {
                Optional<float[]> mix = audioComposer.compose(timeline, assets);
                if (mix.isPresent()) {
                    audioTrack = Files.createTempFile("chat-renderer-audio-", ".wav");
                    wavWriter.write(mix.get(), AudioSyncComposer.SAMPLE_RATE, audioTrack);
                }
            }
            progress.onProgress(AUDIO_PROGRESS);

            VideoEncodeSettings settings = new VideoEncodeSettings(
                    geometry.outputWidth(),
                    geometry.outputHeight(),
                    timeline.fps(),
                    timeline.totalFrames());
            try (FrameSource frames = new FrameSource(timeline.events(), frameRenderer::render, parallelism)) {
                videoAssembler.assemble(settings, frames, audioTrack, outputVideoPath, progress.scaled(AUDIO_PROGRESS, 1.0));
            }
        } finally {
            deleteTempFile(audioTrack);
        }
    }

    private void deleteTempFile(Path filePath) {
        if (filePath == null) {
            return;
        }
        try {
            Files.deleteIfExists(filePath);
        } catch (IOException e) {
            logger.debug("Could not delete temporary file {}: {}", filePath, e.getMessage());
        }
    }
}
