package com.eyelevel.bordereaux.scheduler;

import com.eyelevel.bordereaux.config.BordereauxProcessingConfig;
import com.eyelevel.bordereaux.model.BordereauxFile;
import com.eyelevel.bordereaux.model.FileStatus;
import com.eyelevel.bordereaux.repository.BordereauxFileRepository;
import com.eyelevel.bordereaux.service.pipeline.FileStatusService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;

import java.time.LocalDateTime;
import java.util.List;

/**
 * A scheduler that fails files whose run stopped midway, for example because the instance processing them
 * was shut down. Such files would otherwise stay in an in-progress status forever.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaleClaimRecoveryScheduler {

    private final BordereauxFileRepository fileRepository;
    private final FileStatusService fileStatusService;
    private final BordereauxProcessingConfig processingConfig;

    @Scheduled(cron = "${app.scheduler.stale-claim}")
    public void failStaleClaims() {
        recoverStaleClaims();
    }

    /**
     * Marks files FAILED that have not moved out of an in-progress status within the configured threshold. The
     * write is conditional on the status seen here, so a run that is still making progress is left alone.
     *
     * @return the number of files marked FAILED
     */
    public int recoverStaleClaims() {
        final long thresholdMinutes = processingConfig.getStaleClaim().getThresholdMinutes();
        final LocalDateTime threshold = LocalDateTime.now().minusMinutes(thresholdMinutes);
        log.info("Running stale claim recovery. Finding in-progress files not updated since {}.", threshold);

        final List<BordereauxFile> staleFiles = fileRepository.findByStatusInAndUpdatedAtBefore(
                FileStatus.inProgressStatuses(), threshold);

        if (CollectionUtils.isEmpty(staleFiles)) {
            log.info("No stale claims found.");
            return 0;
        }

        log.warn("Found {} stale claims to mark as FAILED.", staleFiles.size());
        int failed = 0;
        for (final BordereauxFile file : staleFiles) {
            final String message = String.format(
                    "Processing stopped in %s and did not progress within the %d-minute time limit.",
                    file.getStatus(), thresholdMinutes);
            if (fileStatusService.markFailed(file.getId(), file.getStatus(), message)) {
                failed++;
            }
        }
        log.info("Finished stale claim recovery. Marked {} of {} files as FAILED.", failed, staleFiles.size());
        return failed;
    }
}
