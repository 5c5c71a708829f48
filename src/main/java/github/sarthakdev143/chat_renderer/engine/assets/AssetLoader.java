package github.sarthakdev143.chat_renderer.engine.assets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.awt.Font;
import java.awt.FontFormatException;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads fonts, images and sound clips from disk or memory. Every method reports "not usable" as an
 * empty result; picking the fallback is the caller's decision.
 */
public class AssetLoader {

    private static final Logger logger = LoggerFactory.getLogger(AssetLoader.class);

    public Optional<Font> loadFont(Path fontPath) {
        if (fontPath == null || !Files.isRegularFile(fontPath)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Font.createFont(Font.TRUETYPE_FONT, fontPath.toFile()));
        } catch (FontFormatException | IOException e) {
            logger.warn("Font {} could not be loaded: {}", fontPath, e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<BufferedImage> loadImage(Path imagePath) {
        if (imagePath == null || !Files.isRegularFile(imagePath)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(ImageIO.read(imagePath.toFile()));
        } catch (IOException e) {
            logger.warn("Image {} could not be loaded: {}", imagePath, e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<BufferedImage> decodeImage(byte[] imageBytes) {
        if (imageBytes == null || imageBytes.length == 0) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(ImageIO.read(new ByteArrayInputStream(imageBytes)));
        } catch (IOException e) {
            logger.warn("Avatar image could not be decoded: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Loads a clip as mono float samples in [-1, 1] at {@code targetSampleRate}.
     */
    public Optional<float[]> loadClip(Path clipPath, int targetSampleRate) {
        if (clipPath == null || !Files.isRegularFile(clipPath)) {
            return Optional.empty();
        }

        try (AudioInputStream source = AudioSystem.getAudioInputStream(clipPath.toFile())) {
            AudioFormat sourceFormat = source.getFormat();
            AudioFormat pcmFormat = new AudioFormat(
                    AudioFormat.Encoding.PCM_SIGNED,
                    sourceFormat.getSampleRate(),
                    16,
                    sourceFormat.getChannels(),
                    sourceFormat.getChannels() * 2,
                    sourceFormat.getSampleRate(),
                    false);
            if (!AudioSystem.isConversionSupported(pcmFormat, sourceFormat)) {
                logger.warn("Sound {} uses unsupported encoding {}", clipPath, sourceFormat.getEncoding());
                return Optional.empty();
            }

            byte[] data;
            try (AudioInputStream pcm = AudioSystem.getAudioInputStream(pcmFormat, source)) {
                data = pcm.readAllBytes();
            }

            float[] mono = toMono(data, pcmFormat.getChannels());
            return Optional.of(resample(mono, Math.round(pcmFormat.getSampleRate()), targetSampleRate));
        } catch (UnsupportedAudioFileException | IOException e) {
            logger.warn("Sound {} could not be loaded: {}", clipPath, e.getMessage());
            return Optional.empty();
        }
    }

    private float[] toMono(byte[] data, int channels) {
        int frameCount = data.length / (2 * channels);
        float[] mono = new float[frameCount];
        for (int frame = 0; frame < frameCount; frame++) {
            float sum = 0f;
            for (int channel = 0; channel < channels; channel++) {
                int offset = (frame * channels + channel) * 2;
                short sample = (short) ((data[offset] & 0xFF) | (data[offset + 1] << 8));
                sum += sample / 32768f;
            }
            mono[frame] = sum / channels;
        }
        return mono;
    }

    float[] resample(float[] samples, int sourceRate, int targetRate) {
        if (sourceRate == targetRate || samples.length == 0) {
            return samples;
        }
        int targetLength = (int) ((long) samples.length * targetRate / sourceRate);
        float[] resampled = new float[targetLength];
        double step = (double) sourceRate / targetRate;
        for (int index = 0; index < targetLength; index++) {
            double position = index * step;
            int left = (int) position;
            int right = Math.min(left + 1, samples.length - 1);
            double fraction = position - left;
            resampled[index] = (float) (samples[left] * (1.0 - fraction) + samples[right] * fraction);
        }
        return resampled;
    }
}
