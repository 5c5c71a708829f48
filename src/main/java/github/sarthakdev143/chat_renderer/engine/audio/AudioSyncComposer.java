package github.sarthakdev143.chat_renderer.engine.audio;

import github.sarthakdev143.chat_renderer.engine.assets.RenderAssets;
import github.sarthakdev143.chat_renderer.model.SoundKind;
import github.sarthakdev143.chat_renderer.model.timeline.AudioCue;
import github.sarthakdev143.chat_renderer.model.timeline.RenderTimeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Mixes the send and receive sounds into one mono track as long as the video, each clip starting
 * on the sample that matches its cue frame.
 */
public class AudioSyncComposer {

    public static final int SAMPLE_RATE = 44_100;

    private static final Logger logger = LoggerFactory.getLogger(AudioSyncComposer.class);

    private final ToneSynthesizer synthesizer;

    public AudioSyncComposer(ToneSynthesizer synthesizer) {
        this.synthesizer = synthesizer;
    }

    /**
     * Returns the mixed track, or empty when the timeline has no cues.
     */
    public Optional<float[]> compose(RenderTimeline timeline, RenderAssets assets) {
        if (timeline.cues().isEmpty()) {
            return Optional.empty();
        }

        Map<SoundKind, float[]> clips = new EnumMap<>(SoundKind.class);
        float[] track = new float[trackLength(timeline.totalFrames(), timeline.fps())];
        for (AudioCue cue : timeline.cues()) {
            float[] clip = clips.computeIfAbsent(cue.kind(), kind -> resolveClip(kind, assets));
            mixInto(track, clip, sampleOffset(cue.frameIndex(), timeline.fps()));
        }
        return Optional.of(track);
    }

    static int trackLength(int totalFrames, int fps) {
        return (int) ((long) totalFrames * SAMPLE_RATE / fps);
    }

    static int sampleOffset(int frameIndex, int fps) {
        return (int) ((long) frameIndex * SAMPLE_RATE / fps);
    }

    /**
     * Adds {@code clip} at {@code offset}, truncating whatever runs past the end of the track.
     */
    static void mixInto(float[] track, float[] clip, int offset) {
        int end = Math.min(track.length, offset + clip.length);
        for (int index = Math.max(offset, 0); index < end; index++) {
            track[index] += clip[index - offset];
        }
    }

    private float[] resolveClip(SoundKind kind, RenderAssets assets) {
        Optional<float[]> fromFile = assets == null ? Optional.empty() : assets.soundClip(kind, SAMPLE_RATE);
        if (fromFile.isPresent()) {
            return fromFile.get();
        }
        logger.debug("No {} sound file available, using the synthesized tone.", kind.assetName());
        return synthesizer.tone(kind, SAMPLE_RATE);
    }
}
