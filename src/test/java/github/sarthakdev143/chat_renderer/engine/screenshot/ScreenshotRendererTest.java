package github.sarthakdev143.chat_renderer.engine.screenshot;

import github.sarthakdev143.chat_renderer.engine.assets.AssetLoader;
import github.sarthakdev143.chat_renderer.engine.assets.RenderAssets;
import github.sarthakdev143.chat_renderer.engine.render.FrameRendererFactory;
import github.sarthakdev143.chat_renderer.model.ChatCharacter;
import github.sarthakdev143.chat_renderer.model.ChatMessage;
import github.sarthakdev143.chat_renderer.model.ExportFormat;
import github.sarthakdev143.chat_renderer.model.RenderSpec;
import github.sarthakdev143.chat_renderer.model.ScreenshotMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ScreenshotRendererTest {

    @TempDir
    Path assetsDir;

    private final ScreenshotRenderer renderer = new ScreenshotRenderer(new FrameRendererFactory());

    @Test
    void longModeDrawsOneStripAtHalfPhoneWidth() {
        List<ScreenshotImage> images = renderer.render(conversation(12), ScreenshotMode.LONG, assets());

        assertThat(images).hasSize(1);
        ScreenshotImage strip = images.get(0);
        assertThat(strip.width()).isEqualTo(1080);
        assertThat(strip.height()).isGreaterThan(0);
        assertThat(strip.startIndex()).isZero();
        assertThat(strip.endIndex()).isEqualTo(12);
    }

    @Test
    void longStripGrowsWithTheConversation() {
        int shortHeight = renderer.render(conversation(3), ScreenshotMode.LONG, assets()).get(0).height();
        int tallHeight = renderer.render(conversation(20), ScreenshotMode.LONG, assets()).get(0).height();

        assertThat(tallHeight).isGreaterThan(shortHeight);
    }

    @Test
    void paginatedModeCoversEveryMessageInExportSizedPages() {
        List<ScreenshotImage> pages = renderer.render(conversation(40), ScreenshotMode.PAGINATED, assets());

        assertThat(pages.size()).isGreaterThan(1);
        int expectedStart = 0;
        for (ScreenshotImage page : pages) {
            assertThat(page.width()).isEqualTo(1080);
            assertThat(page.height()).isEqualTo(1920);
            assertThat(page.startIndex()).isEqualTo(expectedStart);
            assertThat(page.endIndex()).isGreaterThan(page.startIndex());
            expectedStart = page.endIndex();
        }
        assertThat(expectedStart).isEqualTo(40);
    }

    @Test
    void emptyConversationStillProducesOnePage() {
        List<ScreenshotImage> pages = renderer.render(conversation(0), ScreenshotMode.PAGINATED, assets());

        assertThat(pages).hasSize(1);
        assertThat(pages.get(0).startIndex()).isZero();
        assertThat(pages.get(0).endIndex()).isZero();
    }

    private RenderAssets assets() {
        return new RenderAssets(new AssetLoader(), assetsDir, List.of(), List.of());
    }

    private static RenderSpec conversation(int messageCount) {
        ChatCharacter me = new ChatCharacter("me", "Me", true, "#007AFF", null, null);
        ChatCharacter sam = new ChatCharacter("sam", "Sam", false, "#34C759", null, null);
        List<ChatMessage> messages = new ArrayList<>();
        for (int index = 0; index < messageCount; index++) {
            String sender = index % 2 == 0 ? "sam" : "me";
            messages.add(new ChatMessage("m" + index, "Message number " + index + " with a little more text", sender));
        }
        return new RenderSpec(messages, List.of(me, sam), null, ExportFormat.TIKTOK, null, null, "Sam", false);
    }
}
