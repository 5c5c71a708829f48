package github.sarthakdev143.chat_renderer.service;

import github.sarthakdev143.chat_renderer.engine.pipeline.RenderProgressListener;
import github.sarthakdev143.chat_renderer.model.RenderSpec;

import java.io.IOException;
import java.nio.file.Path;

public interface ChatVideoRenderer {

    void render(RenderSpec spec, Path outputVideoPath, RenderProgressListener progress)
            throws IOException, InterruptedException;
}
