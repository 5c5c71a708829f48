package github.sarthakdev143.chat_renderer.engine.pipeline;

import github.sarthakdev143.chat_renderer.model.timeline.FrameState;
import github.sarthakdev143.chat_renderer.model.timeline.TimelineEvent;
import github.sarthakdev143.chat_renderer.model.timeline.TimelineEventKind;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FrameSourceTest {

    // Encodes visibleCount into the image width so order can be checked on the output.
    private static final Function<FrameState, BufferedImage> WIDTH_BY_COUNT =
            state -> new BufferedImage(state.visibleCount() + 1, 1, BufferedImage.TYPE_3BYTE_BGR);

    @Test
    void sequentialSourceYieldsEventsInOrderWithDurations() {
        List<TimelineEvent> events = events(5);

        List<FrameRun> runs = drain(new FrameSource(events, WIDTH_BY_COUNT, 1));

        assertThat(runs).extracting(run -> run.image().getWidth()).containsExactly(1, 2, 3, 4, 5);
        assertThat(runs).extracting(FrameRun::repeat).containsExactly(1, 2, 3, 4, 5);
    }

    @Test
    void parallelSourceKeepsEventOrderDespiteUnevenRenderTimes() {
        List<TimelineEvent> events = events(40);
        Function<FrameState, BufferedImage> slowAndUneven = state -> {
            try {
                Thread.sleep(ThreadLocalRandom.current().nextInt(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return WIDTH_BY_COUNT.apply(state);
        };

        List<FrameRun> runs = drain(new FrameSource(events, slowAndUneven, 4));

        assertThat(runs).hasSize(40);
        for (int index = 0; index < runs.size(); index++) {
            assertThat(runs.get(index).image().getWidth()).isEqualTo(index + 1);
        }
    }

    @Test
    void renderFailureSurfacesAsFrameRenderException() {
        Function<FrameState, BufferedImage> failing = state -> {
            throw new IllegalStateException("font missing");
        };

        try (FrameSource source = new FrameSource(events(3), failing, 2)) {
            assertThatThrownBy(source::next)
                    .isInstanceOf(FrameRenderException.class)
                    .hasRootCauseMessage("font missing");
        }
    }

    @Test
    void exhaustedSourceThrowsNoSuchElement() {
        try (FrameSource source = new FrameSource(List.of(), WIDTH_BY_COUNT, 1)) {
            assertThat(source.hasNext()).isFalse();
            assertThatThrownBy(source::next).isInstanceOf(NoSuchElementException.class);
        }
    }

    @Test
    void negativeRepeatIsRejected() {
        assertThatThrownBy(() -> new FrameRun(new BufferedImage(1, 1, BufferedImage.TYPE_3BYTE_BGR), -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static List<TimelineEvent> events(int count) {
        List<TimelineEvent> events = new ArrayList<>();
        int frame = 0;
        for (int index = 0; index < count; index++) {
            int duration = index + 1;
            events.add(new TimelineEvent(TimelineEventKind.READING_PAUSE, frame, duration, "m" + index,
                    FrameState.idle(index)));
            frame += duration;
        }
        return events;
    }

    private static List<FrameRun> drain(FrameSource source) {
        List<FrameRun> runs = new ArrayList<>();
        try (source) {
            while (source.hasNext()) {
                runs.add(source.next());
            }
        }
        return runs;
    }
}
