package github.sarthakdev143.chat_renderer.service;

import github.sarthakdev143.chat_renderer.engine.pipeline.FrameRun;
import github.sarthakdev143.chat_renderer.engine.pipeline.RenderProgressListener;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;

public interface VideoAssembler {

    /**
     * Encodes the frame runs, in order, into an MP4 at {@code outputVideoPath}.
     *
     * @param audioTrack WAV file to mux in, or null for a silent video
     */
    void assemble(
            VideoEncodeSettings settings,
            Iterator<FrameRun> frames,
            Path audioTrack,
            Path outputVideoPath,
            RenderProgressListener progress) throws IOException, InterruptedException;
}
