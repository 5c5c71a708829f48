package github.sarthakdev143.chat_renderer.model.timeline;

public record TimelineEvent(
        TimelineEventKind kind,
        int startFrame,
        int durationFrames,
        String messageId,
        FrameState state) {

    public int endFrame() {
        return startFrame + durationFrames;
    }
}
