package github.sarthakdev143.chat_renderer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

@ConfigurationProperties(prefix = "chat-renderer")
public record RenderProperties(
        Path assetsDir,
        List<Path> fontPaths,
        List<Path> boldFontPaths,
        Path outputDir,
        int parallelism,
        int maxConcurrentJobs,
        Duration jobTtl) {

    private static final List<Path> DEFAULT_FONT_PATHS = List.of(
            Path.of("/System/Library/Fonts/SFNS.ttf"),
            Path.of("/Library/Fonts/SF-Pro-Text-Regular.otf"),
            Path.of("/usr/share/fonts/truetype/dejavu/DejaVuSans.ttf"),
            Path.of("/usr/share/fonts/TTF/DejaVuSans.ttf"));
    private static final List<Path> DEFAULT_BOLD_FONT_PATHS = List.of(
            Path.of("/Library/Fonts/SF-Pro-Text-Semibold.otf"),
            Path.of("/usr/share/fonts/truetype/dejavu/DejaVuSans-Bold.ttf"),
            Path.of("/usr/share/fonts/TTF/DejaVuSans-Bold.ttf"));

    public RenderProperties {
        assetsDir = assetsDir == null ? Path.of("assets") : assetsDir;
        fontPaths = fontPaths == null || fontPaths.isEmpty() ? DEFAULT_FONT_PATHS : List.copyOf(fontPaths);
        boldFontPaths = boldFontPaths == null || boldFontPaths.isEmpty()
                ? DEFAULT_BOLD_FONT_PATHS
                : List.copyOf(boldFontPaths);
        outputDir = outputDir == null ? Path.of(System.getProperty("java.io.tmpdir"), "chat-renderer") : outputDir;
        parallelism = Math.max(1, parallelism);
        maxConcurrentJobs = maxConcurrentJobs <= 0 ? 2 : maxConcurrentJobs;
        jobTtl = jobTtl == null || jobTtl.isNegative() || jobTtl.isZero() ? Duration.ofHours(1) : jobTtl;
    }

    public static RenderProperties defaults() {
        return new RenderProperties(null, null, null, null, 1, 2, null);
    }
}
