package github.sarthakdev143.chat_renderer.engine.assets;

import github.sarthakdev143.chat_renderer.config.RenderProperties;
import org.springframework.stereotype.Component;

/**
 * Builds a fresh {@link RenderAssets} for each job from the configured asset locations.
 */
@Component
public class RenderAssetsFactory {

    private final RenderProperties properties;
    private final AssetLoader loader = new AssetLoader();

    public RenderAssetsFactory(RenderProperties properties) {
        this.properties = properties;
    }

    public RenderAssets create() {
        return new RenderAssets(
                loader,
                properties.assetsDir(),
                properties.fontPaths(),
                properties.boldFontPaths());
    }
}
