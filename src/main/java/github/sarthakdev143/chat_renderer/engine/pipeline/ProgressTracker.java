package github.sarthakdev143.chat_renderer.engine.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.DoubleConsumer;

/**
 * Monotonic progress value for one job. Lower or out-of-range reports are clamped so observers
 * never see progress go backwards.
 */
public class ProgressTracker implements RenderProgressListener {

    private static final Logger logger = LoggerFactory.getLogger(ProgressTracker.class);

    private final List<DoubleConsumer> subscribers = new CopyOnWriteArrayList<>();
    private double current;

    public void subscribe(DoubleConsumer subscriber) {
        subscribers.add(subscriber);
    }

    public synchronized double current() {
        return current;
    }

    @Override
    public void onProgress(double fraction) {
        double published;
        synchronized (this) {
            double clamped = Math.min(Math.max(fraction, 0.0), 1.0);
            if (clamped <= current) {
                return;
            }
            current = clamped;
            published = clamped;
        }
        for (DoubleConsumer subscriber : subscribers) {
            try {
                subscriber.accept(published);
            } catch (RuntimeException e) {
                logger.warn("Progress subscriber failed", e);
            }
        }
    }
}
