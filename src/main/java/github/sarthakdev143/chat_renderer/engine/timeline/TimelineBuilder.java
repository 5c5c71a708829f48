package github.sarthakdev143.chat_renderer.engine.timeline;

import github.sarthakdev143.chat_renderer.model.ChatCharacter;
import github.sarthakdev143.chat_renderer.model.ChatMessage;
import github.sarthakdev143.chat_renderer.model.RenderSpec;
import github.sarthakdev143.chat_renderer.model.SoundKind;
import github.sarthakdev143.chat_renderer.model.timeline.AudioCue;
import github.sarthakdev143.chat_renderer.model.timeline.FrameState;
import github.sarthakdev143.chat_renderer.model.timeline.RenderTimeline;
import github.sarthakdev143.chat_renderer.model.timeline.TimelineEvent;
import github.sarthakdev143.chat_renderer.model.timeline.TimelineEventKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Expands a conversation into the ordered animation events and the sound cues that go with them.
 * The result depends only on the messages, the senders and the typing speed.
 */
public class TimelineBuilder {

    static final int REVEAL_COMPLETE_FRAMES = 10;
    static final int TRAILING_HOLD_FRAMES = 60;
    private static final double TYPING_CHARS_PER_SECOND = 20.0;
    private static final double MIN_TYPING_SECONDS = 1.5;
    private static final double MAX_TYPING_SECONDS = 2.5;
    private static final double READING_CHARS_PER_SECOND = 25.0;
    private static final double MIN_READING_SECONDS = 1.5;
    private static final double MAX_READING_SECONDS = 3.0;
    private static final double FRAME_EPSILON = 1e-9;

    private final int fps;

    public TimelineBuilder() {
        this(RenderTimeline.FPS);
    }

    public TimelineBuilder(int fps) {
        if (fps <= 0) {
            throw new IllegalArgumentException("fps must be positive.");
        }
        this.fps = fps;
    }

    public RenderTimeline build(RenderSpec spec) {
        Map<String, ChatCharacter> characters = spec.charactersById();
        int framesPerChar = spec.typingSpeed().framesPerChar(fps);
        boolean indicatorEnabled = spec.toggles().showTypingIndicator();

        List<TimelineEvent> events = new ArrayList<>();
        List<AudioCue> cues = new ArrayList<>();
        int frame = 0;

        for (int index = 0; index < spec.messages().size(); index++) {
            ChatMessage message = spec.messages().get(index);
            ChatCharacter sender = characters.get(message.characterId());
            if (sender == null) {
                throw new IllegalArgumentException(
                        "Message " + message.id() + " references unknown character " + message.characterId() + ".");
            }
            String text = message.text();
            int length = text.codePointCount(0, text.length());

            if (sender.self()) {
                int offset = 0;
                while (offset < text.length()) {
                    int next = text.offsetByCodePoints(offset, 1);
                    String prefix = text.substring(0, next);
                    String pressedKey = text.substring(offset, next).toLowerCase(Locale.ROOT);
                    events.add(new TimelineEvent(
                            TimelineEventKind.CHAR_REVEAL,
                            frame,
                            framesPerChar,
                            message.id(),
                            new FrameState(index, null, prefix, pressedKey)));
                    frame += framesPerChar;
                    offset = next;
                }

                cues.add(new AudioCue(SoundKind.SEND, frame, fps, message.id()));
                events.add(new TimelineEvent(
                        TimelineEventKind.REVEAL_COMPLETE,
                        frame,
                        REVEAL_COMPLETE_FRAMES,
                        message.id(),
                        new FrameState(index, null, text, null)));
                frame += REVEAL_COMPLETE_FRAMES;
            } else {
                int typingFrames = toFrames(clamp(
                        length / TYPING_CHARS_PER_SECOND,
                        MIN_TYPING_SECONDS,
                        MAX_TYPING_SECONDS));
                String typingCharacterId = indicatorEnabled ? sender.id() : null;
                events.add(new TimelineEvent(
                        TimelineEventKind.TYPING_HOLD,
                        frame,
                        typingFrames,
                        message.id(),
                        new FrameState(index, typingCharacterId, null, null)));
                frame += typingFrames;
                cues.add(new AudioCue(SoundKind.RECEIVE, frame, fps, message.id()));
            }

            int readingFrames = toFrames(clamp(
                    length / READING_CHARS_PER_SECOND,
                    MIN_READING_SECONDS,
                    MAX_READING_SECONDS));
            events.add(new TimelineEvent(
                    TimelineEventKind.READING_PAUSE,
                    frame,
                    readingFrames,
                    message.id(),
                    FrameState.idle(index + 1)));
            frame += readingFrames;
        }

        events.add(new TimelineEvent(
                TimelineEventKind.TRAILING_HOLD,
                frame,
                TRAILING_HOLD_FRAMES,
                null,
                FrameState.idle(spec.messages().size())));
        frame += TRAILING_HOLD_FRAMES;

        return new RenderTimeline(events, cues, fps, frame);
    }

    private int toFrames(double seconds) {
        return (int) Math.floor(seconds * fps + FRAME_EPSILON);
    }

    private static double clamp(double value, double min, double max) {
        return Math.min(Math.max(value, min), max);
    }
}
