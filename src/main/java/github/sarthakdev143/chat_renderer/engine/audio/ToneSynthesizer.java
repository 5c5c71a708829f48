package github.sarthakdev143.chat_renderer.engine.audio;

import github.sarthakdev143.chat_renderer.model.SoundKind;

/**
 * Built-in notification tones used when no sound file is available.
 */
public class ToneSynthesizer {

    private static final double SEND_SECONDS = 0.15;
    private static final double RECEIVE_SECONDS = 0.2;

    public float[] tone(SoundKind kind, int sampleRate) {
        return kind == SoundKind.SEND ? sendTone(sampleRate) : receiveTone(sampleRate);
    }

    /**
     * Rising 800 to 1200 Hz swoosh.
     */
    float[] sendTone(int sampleRate) {
        int count = (int) (sampleRate * SEND_SECONDS);
        float[] samples = new float[count];
        for (int index = 0; index < count; index++) {
            double t = time(index, count, SEND_SECONDS);
            double frequency = 800.0 + 400.0 * t / SEND_SECONDS;
            double envelope = Math.exp(-3.0 * t / SEND_SECONDS);
            samples[index] = (float) (0.3 * Math.sin(2 * Math.PI * frequency * t) * envelope);
        }
        return samples;
    }

    /**
     * Two-partial ding at 1200 and 1500 Hz.
     */
    float[] receiveTone(int sampleRate) {
        int count = (int) (sampleRate * RECEIVE_SECONDS);
        float[] samples = new float[count];
        for (int index = 0; index < count; index++) {
            double t = time(index, count, RECEIVE_SECONDS);
            double envelope = Math.exp(-5.0 * t / RECEIVE_SECONDS);
            double wave = 0.2 * Math.sin(2 * Math.PI * 1200 * t) + 0.15 * Math.sin(2 * Math.PI * 1500 * t);
            samples[index] = (float) (wave * envelope);
        }
        return samples;
    }

    // Sample times span [0, duration] inclusive.
    private static double time(int index, int count, double duration) {
        return count <= 1 ? 0.0 : duration * index / (count - 1);
    }
}
