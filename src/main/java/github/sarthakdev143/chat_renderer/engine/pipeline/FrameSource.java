package github.sarthakdev143.chat_renderer.engine.pipeline;

import github.sarthakdev143.chat_renderer.model.timeline.FrameState;
import github.sarthakdev143.chat_renderer.model.timeline.TimelineEvent;

import java.awt.image.BufferedImage;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Yields one {@link FrameRun} per timeline event, strictly in event order. With a parallelism
 * above one, a fixed pool renders up to {@code 2 * parallelism} events ahead of the consumer;
 * otherwise each frame is rendered on demand by the calling thread.
 */
public class FrameSource implements Iterator<FrameRun>, AutoCloseable {

    private final List<TimelineEvent> events;
    private final Function<FrameState, BufferedImage> renderer;
    private final ExecutorService pool;
    private final int lookahead;
    private final Deque<Future<BufferedImage>> pending = new ArrayDeque<>();
    private int nextToSubmit;
    private int nextToYield;

    public FrameSource(List<TimelineEvent> events, Function<FrameState, BufferedImage> renderer, int parallelism) {
        this.events = List.copyOf(events);
        this.renderer = renderer;
        if (parallelism > 1) {
            this.pool = Executors.newFixedThreadPool(parallelism, runnable -> {
                Thread thread = new Thread(runnable, "frame-render");
                thread.setDaemon(true);
                return thread;
            });
            this.lookahead = parallelism * 2;
        } else {
            this.pool = null;
            this.lookahead = 0;
        }
    }

    @Override
    public boolean hasNext() {
        return nextToYield < events.size();
    }

    @Override
    public FrameRun next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        TimelineEvent event = events.get(nextToYield);
        BufferedImage image = pool == null ? renderer.apply(event.state()) : awaitNext(event);
        nextToYield++;
        return new FrameRun(image, event.durationFrames());
    }

    private BufferedImage awaitNext(TimelineEvent event) {
        while (nextToSubmit < events.size() && nextToSubmit < nextToYield + lookahead) {
            FrameState state = events.get(nextToSubmit).state();
            pending.addLast(pool.submit(() -> renderer.apply(state)));
            nextToSubmit++;
        }

        Future<BufferedImage> head = pending.removeFirst();
        try {
            return head.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FrameRenderException("Interrupted while rendering frame at " + event.startFrame(), e);
        } catch (ExecutionException e) {
            throw new FrameRenderException("Failed to render frame at " + event.startFrame(), e.getCause());
        }
    }

    @Override
    public void close() {
        if (pool == null) {
            return;
        }
        for (Future<BufferedImage> future : pending) {
            future.cancel(true);
        }
        pending.clear();
        pool.shutdownNow();
    }
}
