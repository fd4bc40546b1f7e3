package com.eyelevel.bordereaux.scheduler;

import com.eyelevel.bordereaux.service.pipeline.BatchProcessingService;
import com.eyelevel.bordereaux.service.pipeline.BatchRunSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically runs every RECEIVED file through the pipeline. Several instances may run this at once; the
 * claim on each file decides which one processes it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BordereauxProcessingScheduler {

    private final BatchProcessingService batchProcessingService;

    @Scheduled(cron = "${app.scheduler.process-files}")
    public void processReceivedFiles() {
        log.debug("Scheduled batch run triggered.");
        final BatchRunSummary summary = batchProcessingService.processReceivedFiles();
        if (summary.total() > 0) {
            log.info("Scheduled batch run handled {} files.", summary.total());
        }
    }
}
