package github.sarthakdev143.chat_renderer.engine.audio;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes a mono float track as 16-bit little-endian PCM WAV. Samples are clipped to [-1, 1].
 */
public class WavWriter {

    public void write(float[] samples, int sampleRate, Path target) throws IOException {
        byte[] pcm = new byte[samples.length * 2];
        for (int index = 0; index < samples.length; index++) {
            float value = Math.max(-1.0f, Math.min(1.0f, samples[index]));
            short sample = (short) (value * 32767);
            pcm[index * 2] = (byte) (sample & 0xFF);
            pcm[index * 2 + 1] = (byte) (sample >> 8);
        }

        AudioFormat format = new AudioFormat(sampleRate, 16, 1, true, false);
        try (AudioInputStream stream = new AudioInputStream(new ByteArrayInputStream(pcm), format, samples.length)) {
            AudioSystem.write(stream, AudioFileFormat.Type.WAVE, target.toFile());
        }
    }
}
