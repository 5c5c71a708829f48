package github.sarthakdev143.chat_renderer.service.impl;

import github.sarthakdev143.chat_renderer.config.RenderProperties;
import github.sarthakdev143.chat_renderer.model.RenderJobState;
import github.sarthakdev143.chat_renderer.model.RenderJobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * In-memory job table. Entries older than the configured TTL are swept together with their
 * rendered file.
 */
@Component
public class RenderJobStore {

    private static final Logger logger = LoggerFactory.getLogger(RenderJobStore.class);
    private static final String DOWNLOAD_PATH_PREFIX = "/api/render/download/";

    private final Map<String, StoredJob> jobs = new ConcurrentHashMap<>();
    private final Duration jobTtl;
    private final Clock clock;

    @Autowired
    public RenderJobStore(RenderProperties properties) {
        this(properties.jobTtl(), Clock.systemUTC());
    }

    RenderJobStore(Duration jobTtl, Clock clock) {
        this.jobTtl = jobTtl;
        this.clock = clock;
    }

    public static String downloadPath(String jobId) {
        return DOWNLOAD_PATH_PREFIX + jobId;
    }

    public RenderJobStatus create(String jobId, String message) {
        Instant now = clock.instant();
        RenderJobStatus status = new RenderJobStatus(
                jobId,
                RenderJobState.QUEUED,
                0.0,
                message,
                null,
                null,
                null,
                now,
                now);
        jobs.put(jobId, new StoredJob(status, null));
        return status;
    }

    public Optional<RenderJobStatus> find(String jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(StoredJob::status);
    }

    public Optional<Path> artifact(String jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(StoredJob::artifact);
    }

    /**
     * Applies {@code change} atomically and stamps the update time. Terminal states are final.
     */
    public void update(String jobId, UnaryOperator<RenderJobStatus> change) {
        jobs.computeIfPresent(jobId, (ignored, current) -> {
            if (current.status().state().isTerminal()) {
                return current;
            }
            RenderJobStatus changed = change.apply(current.status());
            return new StoredJob(withUpdatedAt(changed), current.artifact());
        });
    }

    public void attachArtifact(String jobId, Path artifact) {
        jobs.computeIfPresent(jobId, (ignored, current) -> new StoredJob(current.status(), artifact));
    }

    @Scheduled(
            fixedDelayString = "${chat-renderer.sweep-interval-ms:300000}",
            initialDelayString = "${chat-renderer.sweep-interval-ms:300000}")
    public void sweepExpired() {
        Instant cutoff = clock.instant().minus(jobTtl);
        int removed = 0;
        for (Map.Entry<String, StoredJob> entry : jobs.entrySet()) {
            StoredJob job = entry.getValue();
            if (!job.status().state().isTerminal() || !job.status().updatedAt().isBefore(cutoff)) {
                continue;
            }
            if (jobs.remove(entry.getKey(), job)) {
                deleteArtifact(job.artifact());
                removed++;
            }
        }
        if (removed > 0) {
            logger.info("Swept {} expired render jobs", removed);
        }
    }

    private RenderJobStatus withUpdatedAt(RenderJobStatus status) {
        return new RenderJobStatus(
                status.jobId(),
                status.state(),
                status.progress(),
                status.message(),
                status.error(),
                status.videoUrl(),
                status.warningMessage(),
                status.createdAt(),
                clock.instant());
    }

    private void deleteArtifact(Path artifact) {
        if (artifact == null) {
            return;
        }
        try {
            Files.deleteIfExists(artifact);
        } catch (IOException e) {
            logger.warn("Could not delete expired artifact {}: {}", artifact, e.getMessage());
        }
    }

    private record StoredJob(RenderJobStatus status, Path artifact) {
    }
}
