package github.sarthakdev143.chat_renderer.engine.render;

import github.sarthakdev143.chat_renderer.engine.assets.AssetLoader;
import github.sarthakdev143.chat_renderer.engine.assets.RenderAssets;
import github.sarthakdev143.chat_renderer.model.ChatCharacter;
import github.sarthakdev143.chat_renderer.model.ChatMessage;
import github.sarthakdev143.chat_renderer.model.ExportFormat;
import github.sarthakdev143.chat_renderer.model.RenderSpec;
import github.sarthakdev143.chat_renderer.model.RenderToggles;
import github.sarthakdev143.chat_renderer.model.timeline.FrameState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FrameRendererTest {

    @TempDir
    Path assetsDir;

    private final FrameRendererFactory factory = new FrameRendererFactory();

    @Test
    void rendersAtExportResolutionInBgrLayout() {
        FrameRenderer renderer = factory.create(spec(ExportFormat.INSTAGRAM, RenderToggles.defaults()), assets(), true);

        BufferedImage frame = renderer.render(new FrameState(1, "sam", "Hel", "l"));

        assertThat(frame.getWidth()).isEqualTo(1080);
        assertThat(frame.getHeight()).isEqualTo(1080);
        assertThat(frame.getType()).isEqualTo(BufferedImage.TYPE_3BYTE_BGR);
    }

    @Test
    void landscapeFormatLetterboxesPhoneOnBlack() {
        FrameRenderer renderer = factory.create(spec(ExportFormat.YOUTUBE, RenderToggles.defaults()), assets(), false);

        BufferedImage frame = renderer.render(FrameState.idle(2));

        assertThat(frame.getWidth()).isEqualTo(1920);
        assertThat(frame.getHeight()).isEqualTo(1080);
        assertThat(frame.getRGB(5, 540) & 0xFFFFFF).isZero();
        assertThat(frame.getRGB(1914, 540) & 0xFFFFFF).isZero();
        assertThat(frame.getRGB(960, 1000) & 0xFFFFFF).isNotZero();
    }

    @Test
    void visibleCountBeyondConversationIsClamped() {
        FrameRenderer renderer = factory.create(spec(ExportFormat.INSTAGRAM, RenderToggles.defaults()), assets(), false);

        BufferedImage frame = renderer.render(FrameState.idle(99));

        assertThat(frame.getWidth()).isEqualTo(1080);
    }

    @Test
    void heightsMatchOneEntryPerMessage() {
        FrameRenderer renderer = factory.create(spec(ExportFormat.TIKTOK, RenderToggles.defaults()), assets(), true);

        assertThat(renderer.messageHeights()).hasSize(2).allSatisfy(height -> assertThat(height).isPositive());
        assertThat(renderer.geometry().showKeyboard()).isTrue();
    }

    @Test
    void keyboardShrinksTheViewport() {
        RenderSpec spec = spec(ExportFormat.TIKTOK, RenderToggles.defaults());

        int withKeyboard = factory.create(spec, assets(), true).geometry().viewportHeight();
        int withoutKeyboard = factory.create(spec, assets(), false).geometry().viewportHeight();

        assertThat(withKeyboard).isLessThan(withoutKeyboard);
    }

    @Test
    void darkModeAndGroupChatRenderWithoutAssets() {
        ChatCharacter me = new ChatCharacter("me", "Me", true, "#007AFF", null, null);
        ChatCharacter sam = new ChatCharacter("sam", "Sam", false, "#34C759", "😀", null);
        ChatCharacter kim = new ChatCharacter("kim", "Kim", false, "#AF52DE", null, new byte[]{1, 2, 3});
        RenderSpec spec = new RenderSpec(
                List.of(new ChatMessage("m1", "hey all", "sam"), new ChatMessage("m2", "hi", "kim")),
                List.of(me, sam, kim), null, ExportFormat.INSTAGRAM, null,
                new RenderToggles(true, true, true, true), "Friends", true);

        BufferedImage frame = factory.create(spec, assets(), true).render(new FrameState(2, "sam", null, null));

        assertThat(frame.getType()).isEqualTo(BufferedImage.TYPE_3BYTE_BGR);
    }

    private RenderAssets assets() {
        return new RenderAssets(new AssetLoader(), assetsDir, List.of(), List.of());
    }

    private static RenderSpec spec(ExportFormat format, RenderToggles toggles) {
        ChatCharacter me = new ChatCharacter("me", "Me", true, "#007AFF", null, null);
        ChatCharacter sam = new ChatCharacter("sam", "Sam", false, "#34C759", null, null);
        return new RenderSpec(
                List.of(new ChatMessage("m1", "Are you up?", "sam"), new ChatMessage("m2", "Hell yes", "me")),
                List.of(me, sam), null, format, null, toggles, "Sam", false);
    }
}
