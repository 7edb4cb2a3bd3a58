package com.eyelevel.pdftoolkit.scheduler;

import com.eyelevel.pdftoolkit.config.ToolkitProcessingConfig;
import com.eyelevel.pdftoolkit.service.storage.ArtifactStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * A scheduler that evicts download artifacts once they outlive the configured time-to-live.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.scheduler.artifact-sweep.enabled", havingValue = "true", matchIfMissing = true)
public class ArtifactSweepScheduler {

    private final ArtifactStore artifactStore;
    private final ToolkitProcessingConfig config;

    /**
     * Periodically deletes artifacts older than {@code app.processing.artifacts.ttl}. Runs with a fixed
     * delay so that a slow sweep never overlaps the next one.
     */
    @Scheduled(fixedDelayString = "${app.processing.artifacts.sweep-interval:PT1M}",
               initialDelayString = "${app.processing.artifacts.sweep-interval:PT1M}")
    public void sweepExpiredArtifacts() {
        Duration ttl = config.getArtifacts().getTtl();
        log.debug("Running artifact sweep. Evicting files older than {}.", ttl);

        int deleted = artifactStore.sweep(ttl);
        if (deleted == 0) {
            log.debug("No expired artifacts found.");
            return;
        }
        log.info("Finished artifact sweep. Evicted {} expired artifact(s).", deleted);
    }
}
