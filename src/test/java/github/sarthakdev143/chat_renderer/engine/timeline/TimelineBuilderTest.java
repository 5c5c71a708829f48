package github.sarthakdev143.chat_renderer.engine.timeline;

import github.sarthakdev143.chat_renderer.model.ChatCharacter;
import github.sarthakdev143.chat_renderer.model.ChatMessage;
import github.sarthakdev143.chat_renderer.model.RenderSpec;
import github.sarthakdev143.chat_renderer.model.RenderToggles;
import github.sarthakdev143.chat_renderer.model.SoundKind;
import github.sarthakdev143.chat_renderer.model.TypingSpeed;
import github.sarthakdev143.chat_renderer.model.timeline.AudioCue;
import github.sarthakdev143.chat_renderer.model.timeline.RenderTimeline;
import github.sarthakdev143.chat_renderer.model.timeline.TimelineEvent;
import github.sarthakdev143.chat_renderer.model.timeline.TimelineEventKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimelineBuilderTest {

    private static final ChatCharacter ME = new ChatCharacter("me", "Me", true, "#007AFF", null, null);
    private static final ChatCharacter ALEX = new ChatCharacter("alex", "Alex", false, "#FF9500", null, null);

    private final TimelineBuilder builder = new TimelineBuilder();

    @Test
    void threeMessageConversationPlacesCuesOnExpectedFrames() {
        RenderTimeline timeline = builder.build(spec(TypingSpeed.NORMAL, RenderToggles.defaults(),
                new ChatMessage("m1", "a".repeat(5), "me"),
                new ChatMessage("m2", "b".repeat(40), "alex"),
                new ChatMessage("m3", "c".repeat(12), "me")));

        assertThat(timeline.cues())
                .extracting(AudioCue::frameIndex)
                .containsExactly(20, 135, 231);
        assertThat(timeline.cues())
                .extracting(AudioCue::kind)
                .containsExactly(SoundKind.SEND, SoundKind.RECEIVE, SoundKind.SEND);
        assertThat(timeline.totalFrames()).isEqualTo(346);
        assertThat(timeline.cues().get(1).timeSeconds()).isEqualTo(4.5);
    }

    @Test
    void selfMessageRevealsOneCharacterPerEventWithPressedKey() {
        RenderTimeline timeline = builder.build(spec(TypingSpeed.NORMAL, RenderToggles.defaults(),
                new ChatMessage("m1", "Hi!", "me")));

        List<TimelineEvent> reveals = timeline.events().stream()
                .filter(event -> event.kind() == TimelineEventKind.CHAR_REVEAL)
                .toList();
        assertThat(reveals).hasSize(3);
        assertThat(reveals).allSatisfy(event -> assertThat(event.durationFrames()).isEqualTo(4));
        assertThat(reveals).extracting(event -> event.state().draftText()).containsExactly("H", "Hi", "Hi!");
        assertThat(reveals).extracting(event -> event.state().pressedKey()).containsExactly("h", "i", "!");
        assertThat(reveals).allSatisfy(event -> assertThat(event.state().visibleCount()).isZero());

        TimelineEvent complete = timeline.events().get(3);
        assertThat(complete.kind()).isEqualTo(TimelineEventKind.REVEAL_COMPLETE);
        assertThat(complete.durationFrames()).isEqualTo(TimelineBuilder.REVEAL_COMPLETE_FRAMES);
        assertThat(complete.state().draftText()).isEqualTo("Hi!");
        assertThat(complete.state().pressedKey()).isNull();
    }

    @Test
    void receivedMessageHoldsTypingIndicatorThenShowsMessage() {
        RenderTimeline timeline = builder.build(spec(TypingSpeed.NORMAL, RenderToggles.defaults(),
                new ChatMessage("m1", "short", "alex")));

        TimelineEvent hold = timeline.events().get(0);
        assertThat(hold.kind()).isEqualTo(TimelineEventKind.TYPING_HOLD);
        assertThat(hold.durationFrames()).isEqualTo(45);
        assertThat(hold.state().typingCharacterId()).isEqualTo("alex");
        assertThat(hold.state().visibleCount()).isZero();

        TimelineEvent pause = timeline.events().get(1);
        assertThat(pause.kind()).isEqualTo(TimelineEventKind.READING_PAUSE);
        assertThat(pause.state().visibleCount()).isEqualTo(1);
        assertThat(pause.state().showsTypingIndicator()).isFalse();
    }

    @Test
    void disabledIndicatorKeepsHoldDurationButHidesIndicator() {
        RenderToggles noIndicator = new RenderToggles(true, false, true, false);
        ChatMessage message = new ChatMessage("m1", "x".repeat(50), "alex");

        RenderTimeline withIndicator = builder.build(spec(TypingSpeed.NORMAL, RenderToggles.defaults(), message));
        RenderTimeline withoutIndicator = builder.build(spec(TypingSpeed.NORMAL, noIndicator, message));

        assertThat(withoutIndicator.totalFrames()).isEqualTo(withIndicator.totalFrames());
        assertThat(withoutIndicator.events().get(0).durationFrames()).isEqualTo(75);
        assertThat(withoutIndicator.events().get(0).state().showsTypingIndicator()).isFalse();
    }

    @Test
    void eventsAreContiguousAndEndWithTrailingHold() {
        RenderTimeline timeline = builder.build(spec(TypingSpeed.FAST, RenderToggles.defaults(),
                new ChatMessage("m1", "hey there", "me"),
                new ChatMessage("m2", "hello back to you", "alex"),
                new ChatMessage("m3", "", "me")));

        int expectedStart = 0;
        for (TimelineEvent event : timeline.events()) {
            assertThat(event.startFrame()).isEqualTo(expectedStart);
            expectedStart = event.endFrame();
        }
        assertThat(expectedStart).isEqualTo(timeline.totalFrames());

        TimelineEvent last = timeline.events().get(timeline.events().size() - 1);
        assertThat(last.kind()).isEqualTo(TimelineEventKind.TRAILING_HOLD);
        assertThat(last.durationFrames()).isEqualTo(TimelineBuilder.TRAILING_HOLD_FRAMES);
        assertThat(last.state().visibleCount()).isEqualTo(3);
    }

    @Test
    void cuesAreOrderedAndOnePerMessage() {
        RenderTimeline timeline = builder.build(spec(TypingSpeed.SLOW, RenderToggles.defaults(),
                new ChatMessage("m1", "one", "alex"),
                new ChatMessage("m2", "two", "me"),
                new ChatMessage("m3", "three", "alex"),
                new ChatMessage("m4", "four", "me")));

        assertThat(timeline.cues()).hasSize(4);
        assertThat(timeline.cues()).extracting(AudioCue::messageId).containsExactly("m1", "m2", "m3", "m4");
        assertThat(timeline.cues()).extracting(AudioCue::frameIndex).isSorted();
    }

    @Test
    void buildIsDeterministic() {
        RenderSpec spec = spec(TypingSpeed.NORMAL, RenderToggles.defaults(),
                new ChatMessage("m1", "Are you coming tonight?", "alex"),
                new ChatMessage("m2", "Yes 🎉 see you", "me"));

        assertThat(builder.build(spec)).isEqualTo(builder.build(spec));
    }

    @Test
    void emojiCountsAsOneTypedCharacter() {
        RenderTimeline timeline = builder.build(spec(TypingSpeed.NORMAL, RenderToggles.defaults(),
                new ChatMessage("m1", "ok🎉", "me")));

        long reveals = timeline.events().stream()
                .filter(event -> event.kind() == TimelineEventKind.CHAR_REVEAL)
                .count();
        assertThat(reveals).isEqualTo(3);
        assertThat(timeline.events().get(2).state().draftText()).isEqualTo("ok🎉");
    }

    @Test
    void unknownCharacterIsRejected() {
        RenderSpec spec = spec(TypingSpeed.NORMAL, RenderToggles.defaults(),
                new ChatMessage("m1", "hello", "ghost"));

        assertThatThrownBy(() -> builder.build(spec))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ghost");
    }

    private static RenderSpec spec(TypingSpeed speed, RenderToggles toggles, ChatMessage... messages) {
        return new RenderSpec(List.of(messages), List.of(ME, ALEX), null, null, speed, toggles, "Chat", false);
    }
}
