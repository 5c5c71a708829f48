package github.sarthakdev143.chat_renderer.engine.screenshot;

import github.sarthakdev143.chat_renderer.engine.assets.RenderAssets;
import github.sarthakdev143.chat_renderer.engine.render.FrameRenderer;
import github.sarthakdev143.chat_renderer.engine.render.FrameRendererFactory;
import github.sarthakdev143.chat_renderer.engine.viewport.PageRange;
import github.sarthakdev143.chat_renderer.model.RenderSpec;
import github.sarthakdev143.chat_renderer.model.ScreenshotMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Static captures of a whole conversation. {@link ScreenshotMode#LONG} draws every message on one
 * tall strip; {@link ScreenshotMode#PAGINATED} splits them into export-sized pages using the same
 * height budget the video uses for scrolling. Screenshots never show the keyboard.
 */
@Component
public class ScreenshotRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ScreenshotRenderer.class);

    private final FrameRendererFactory frameRendererFactory;

    public ScreenshotRenderer(FrameRendererFactory frameRendererFactory) {
        this.frameRendererFactory = frameRendererFactory;
    }

    public List<ScreenshotImage> render(RenderSpec spec, ScreenshotMode mode, RenderAssets assets) {
        FrameRenderer frameRenderer = frameRendererFactory.create(spec, assets, false);
        if (mode == ScreenshotMode.LONG) {
            return List.of(new ScreenshotImage(frameRenderer.renderStrip(), 0, spec.messages().size()));
        }

        List<PageRange> pages = frameRendererFactory.windowCalculator()
                .paginate(frameRenderer.messageHeights(), frameRenderer.geometry().viewportHeight());
        if (pages.isEmpty()) {
            pages = List.of(new PageRange(0, 0, 0));
        }

        List<ScreenshotImage> images = new ArrayList<>(pages.size());
        for (PageRange page : pages) {
            images.add(new ScreenshotImage(
                    frameRenderer.renderRange(page.startIndex(), page.endIndex()),
                    page.startIndex(),
                    page.endIndex()));
        }
        logger.debug("Paginated {} messages into {} pages", spec.messages().size(), images.size());
        return images;
    }
}
