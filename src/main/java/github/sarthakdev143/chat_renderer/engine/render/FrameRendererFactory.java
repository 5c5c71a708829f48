package github.sarthakdev143.chat_renderer.engine.render;

import github.sarthakdev143.chat_renderer.engine.assets.RenderAssets;
import github.sarthakdev143.chat_renderer.engine.layout.FontTextMeasurer;
import github.sarthakdev143.chat_renderer.engine.layout.LaidOutMessage;
import github.sarthakdev143.chat_renderer.engine.layout.LayoutEngine;
import github.sarthakdev143.chat_renderer.engine.viewport.ViewportWindowCalculator;
import github.sarthakdev143.chat_renderer.model.RenderSpec;
import github.sarthakdev143.chat_renderer.model.layout.PhoneGeometry;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Wires geometry, measured layout and painters for one render.
 */
@Component
public class FrameRendererFactory {

    private final ViewportWindowCalculator windowCalculator = new ViewportWindowCalculator();

    public FrameRenderer create(RenderSpec spec, RenderAssets assets, boolean showKeyboard) {
        PhoneGeometry geometry = PhoneGeometry.forFormat(spec.format(), spec.groupChat(), showKeyboard);
        FontTextMeasurer measurer = new FontTextMeasurer(assets.font(geometry.fontSize()));
        List<LaidOutMessage> messages = new LayoutEngine(geometry, measurer).layoutAll(spec);
        return new FrameRenderer(spec, geometry, messages, assets, windowCalculator);
    }

    public ViewportWindowCalculator windowCalculator() {
        return windowCalculator;
    }
}
