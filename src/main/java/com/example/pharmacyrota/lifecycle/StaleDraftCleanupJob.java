package com.example.pharmacyrota.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Daily retention sweep for drafts nobody published. Set {@code rota.cleanup.cron=-}
 * to turn it off.
 */
@Component
public class StaleDraftCleanupJob {

    private static final Logger logger = LoggerFactory.getLogger(StaleDraftCleanupJob.class);

    private final RotaLifecycleService lifecycleService;

    public StaleDraftCleanupJob(RotaLifecycleService lifecycleService) {
        this.lifecycleService = lifecycleService;
    }

    @Scheduled(cron = "${rota.cleanup.cron:0 0 3 * * *}", zone = "UTC")
    public void run() {
        SweepResult result = lifecycleService.sweepStaleDrafts(lifecycleService.defaultCutoff());
        if (result.failed() > 0) {
            logger.warn("Scheduled stale draft sweep finished with {} failures", result.failed());
        }
    }
}
