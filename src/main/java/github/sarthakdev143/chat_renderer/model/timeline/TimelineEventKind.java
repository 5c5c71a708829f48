package github.sarthakdev143.chat_renderer.model.timeline;

public enum TimelineEventKind {
    CHAR_REVEAL,
    TYPING_HOLD,
    REVEAL_COMPLETE,
    READING_PAUSE,
    TRAILING_HOLD
}
