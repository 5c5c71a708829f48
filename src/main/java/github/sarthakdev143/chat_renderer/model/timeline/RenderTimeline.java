package github.sarthakdev143.chat_renderer.model.timeline;

import java.util.List;

public record RenderTimeline(
        List<TimelineEvent> events,
        List<AudioCue> cues,
        int fps,
        int totalFrames) {

    public static final int FPS = 30;

    public RenderTimeline {
        events = events == null ? List.of() : List.copyOf(events);
        cues = cues == null ? List.of() : List.copyOf(cues);
    }

    public double durationSeconds() {
        return (double) totalFrames / fps;
    }
}
