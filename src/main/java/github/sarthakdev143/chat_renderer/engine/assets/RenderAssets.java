package github.sarthakdev143.chat_renderer.engine.assets;

import github.sarthakdev143.chat_renderer.model.ChatCharacter;
import github.sarthakdev143.chat_renderer.model.SoundKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Font;
import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decoded fonts, icons, avatars and sound clips for one render. Built once per job and dropped with
 * it; nothing here is shared between jobs. Frames may be painted from several threads, so the
 * lazily filled maps are concurrent.
 */
public class RenderAssets {

    private static final Logger logger = LoggerFactory.getLogger(RenderAssets.class);
    private static final String VIDEO_ICON_FILE = "video_icon.png";
    private static final String[] SOUND_EXTENSIONS = {".wav", ".aiff", ".au"};

    private final AssetLoader loader;
    private final Path assetsDirectory;
    private final Font regularFont;
    private final Font boldFont;
    private final Optional<BufferedImage> videoIcon;
    private final Map<String, Font> derivedFonts = new ConcurrentHashMap<>();
    private final Map<String, Optional<BufferedImage>> avatars = new ConcurrentHashMap<>();
    private final Map<SoundKind, Optional<float[]>> clips = new EnumMap<>(SoundKind.class);

    public RenderAssets(AssetLoader loader, Path assetsDirectory, List<Path> regularFontPaths, List<Path> boldFontPaths) {
        this.loader = loader;
        this.assetsDirectory = assetsDirectory;
        this.regularFont = firstLoadable(regularFontPaths)
                .orElseGet(() -> {
                    logger.warn("No configured regular font found, using the default sans-serif font.");
                    return new Font(Font.SANS_SERIF, Font.PLAIN, 1);
                });
        this.boldFont = firstLoadable(boldFontPaths)
                .orElseGet(() -> regularFont.deriveFont(Font.BOLD));
        this.videoIcon = assetsDirectory == null
                ? Optional.empty()
                : loader.loadImage(assetsDirectory.resolve(VIDEO_ICON_FILE));
    }

    public Font font(int pixelSize) {
        return derivedFonts.computeIfAbsent("r" + pixelSize, ignored -> regularFont.deriveFont((float) pixelSize));
    }

    public Font boldFont(int pixelSize) {
        return derivedFonts.computeIfAbsent("b" + pixelSize, ignored -> boldFont.deriveFont((float) pixelSize));
    }

    public Optional<BufferedImage> videoIcon() {
        return videoIcon;
    }

    public Optional<BufferedImage> avatarImage(ChatCharacter character) {
        if (character.avatarImage() == null) {
            return Optional.empty();
        }
        return avatars.computeIfAbsent(character.id(), ignored -> loader.decodeImage(character.avatarImage()));
    }

    /**
     * Clip from {@code send.*} or {@code receive.*} in the assets directory, read on first use.
     */
    public synchronized Optional<float[]> soundClip(SoundKind kind, int sampleRate) {
        return clips.computeIfAbsent(kind, ignored -> findClip(kind, sampleRate));
    }

    private Optional<float[]> findClip(SoundKind kind, int sampleRate) {
        if (assetsDirectory == null) {
            return Optional.empty();
        }
        for (String extension : SOUND_EXTENSIONS) {
            Optional<float[]> clip = loader.loadClip(assetsDirectory.resolve(kind.assetName() + extension), sampleRate);
            if (clip.isPresent()) {
                logger.debug("Loaded {} sound: {} samples", kind, clip.get().length);
                return clip;
            }
        }
        return Optional.empty();
    }

    private Optional<Font> firstLoadable(List<Path> fontPaths) {
        if (fontPaths == null) {
            return Optional.empty();
        }
        for (Path fontPath : fontPaths) {
            Optional<Font> font = loader.loadFont(fontPath);
            if (font.isPresent()) {
                return font;
            }
        }
        return Optional.empty();
    }
}
