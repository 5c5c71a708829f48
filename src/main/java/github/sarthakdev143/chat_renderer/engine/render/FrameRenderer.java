package github.sarthakdev143.chat_renderer.engine.render;

import github.sarthakdev143.chat_renderer.engine.assets.RenderAssets;
import github.sarthakdev143.chat_renderer.engine.layout.LaidOutMessage;
import github.sarthakdev143.chat_renderer.engine.layout.LayoutEngine;
import github.sarthakdev143.chat_renderer.engine.viewport.ViewportWindow;
import github.sarthakdev143.chat_renderer.engine.viewport.ViewportWindowCalculator;
import github.sarthakdev143.chat_renderer.model.ChatCharacter;
import github.sarthakdev143.chat_renderer.model.RenderSpec;
import github.sarthakdev143.chat_renderer.model.layout.PhoneGeometry;
import github.sarthakdev143.chat_renderer.model.timeline.FrameState;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Map;

/**
 * Draws the phone UI for a given conversation state. Rendering happens on a supersampled canvas
 * which is then reduced to the export resolution, so text and curves come out anti-aliased.
 * Instances hold no per-frame state and may render several frames concurrently.
 */
public class FrameRenderer {

    private final RenderSpec spec;
    private final PhoneGeometry geometry;
    private final List<LaidOutMessage> messages;
    private final List<Integer> messageHeights;
    private final Map<String, ChatCharacter> characters;
    private final ViewportWindowCalculator windowCalculator;
    private final ChatPalette palette;
    private final HeaderPainter headerPainter;
    private final KeyboardPainter keyboardPainter;
    private final BubblePainter bubblePainter;

    public FrameRenderer(
            RenderSpec spec,
            PhoneGeometry geometry,
            List<LaidOutMessage> messages,
            RenderAssets assets,
            ViewportWindowCalculator windowCalculator) {
        this.spec = spec;
        this.geometry = geometry;
        this.messages = List.copyOf(messages);
        this.messageHeights = LayoutEngine.heights(this.messages);
        this.characters = spec.charactersById();
        this.windowCalculator = windowCalculator;
        this.palette = ChatPalette.of(spec.theme(), spec.toggles().darkMode());
        AvatarPainter avatarPainter = new AvatarPainter(assets);
        this.headerPainter = new HeaderPainter(geometry, palette, assets, avatarPainter);
        this.keyboardPainter = new KeyboardPainter(geometry, assets, spec.toggles().darkMode());
        this.bubblePainter = new BubblePainter(geometry, palette, assets, avatarPainter);
    }

    public PhoneGeometry geometry() {
        return geometry;
    }

    public List<Integer> messageHeights() {
        return messageHeights;
    }

    /**
     * One video frame at export resolution in {@code TYPE_3BYTE_BGR}.
     */
    public BufferedImage render(FrameState state) {
        int visibleCount = Math.min(Math.max(state.visibleCount(), 0), messages.size());
        ChatCharacter typist = state.showsTypingIndicator() ? characters.get(state.typingCharacterId()) : null;
        int indicatorHeight = typist != null ? geometry.typingIndicatorRowHeight() : 0;
        ViewportWindow window = windowCalculator.visibleWindow(
                messageHeights.subList(0, visibleCount),
                indicatorHeight,
                geometry.viewportHeight());

        return renderPhone(window.startIndex(), window.endIndex(), typist, state.draftText(), state.pressedKey());
    }

    /**
     * A full-size frame holding exactly the messages in {@code [startIndex, endIndex)}, no indicator.
     */
    public BufferedImage renderRange(int startIndex, int endIndex) {
        return renderPhone(startIndex, endIndex, null, null, null);
    }

    /**
     * Every message on one tall strip as wide as the phone, header on top, no keyboard.
     */
    public BufferedImage renderStrip() {
        int contentHeight = 0;
        for (int height : messageHeights) {
            contentHeight += height;
        }
        int stripWidth = geometry.phoneWidth();
        int stripHeight = geometry.messageAreaTop() + contentHeight + geometry.px(20);

        BufferedImage canvas = new BufferedImage(stripWidth, stripHeight, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = canvas.createGraphics();
        try {
            Graphics2DSupport.configure(graphics);
            graphics.setColor(palette.background());
            graphics.fillRect(0, 0, stripWidth, stripHeight);
            headerPainter.paint(graphics, spec.mainContact(), spec.conversationTitle());
            int top = geometry.messageAreaTop();
            for (LaidOutMessage message : messages) {
                top = bubblePainter.paintMessage(graphics, message, top);
            }
        } finally {
            graphics.dispose();
        }

        return Graphics2DSupport.downscale(
                canvas,
                Math.max(1, stripWidth / PhoneGeometry.SUPERSAMPLE),
                Math.max(1, stripHeight / PhoneGeometry.SUPERSAMPLE));
    }

    private BufferedImage renderPhone(
            int startIndex,
            int endIndex,
            ChatCharacter typist,
            String draftText,
            String pressedKey) {
        BufferedImage canvas = new BufferedImage(geometry.canvasWidth(), geometry.canvasHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = canvas.createGraphics();
        try {
            Graphics2DSupport.configure(graphics);
            graphics.setColor(Color.BLACK);
            graphics.fillRect(0, 0, geometry.canvasWidth(), geometry.canvasHeight());

            graphics.translate(geometry.phoneX(), geometry.phoneY());
            graphics.clipRect(0, 0, geometry.phoneWidth(), geometry.phoneHeight());
            graphics.setColor(palette.background());
            graphics.fillRect(0, 0, geometry.phoneWidth(), geometry.phoneHeight());

            headerPainter.paint(graphics, spec.mainContact(), spec.conversationTitle());
            if (geometry.showKeyboard()) {
                keyboardPainter.paint(graphics, draftText, pressedKey);
            }

            int top = geometry.messageAreaTop();
            for (int index = startIndex; index < endIndex; index++) {
                top = bubblePainter.paintMessage(graphics, messages.get(index), top);
            }
            if (typist != null) {
                bubblePainter.paintTypingIndicator(graphics, typist, top);
            }
        } finally {
            graphics.dispose();
        }

        return Graphics2DSupport.downscale(canvas, geometry.outputWidth(), geometry.outputHeight());
    }
}
