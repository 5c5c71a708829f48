package github.sarthakdev143.chat_renderer.model.timeline;

import github.sarthakdev143.chat_renderer.model.SoundKind;

public record AudioCue(SoundKind kind, int frameIndex, int fps, String messageId) {

    public double timeSeconds() {
        return (double) frameIndex / fps;
    }
}
