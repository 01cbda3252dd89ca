package com.boxofficeintel.daily.scheduler;

import com.boxofficeintel.daily.config.BoxOfficeProperties;
import com.boxofficeintel.daily.output.FeatureTableWriter;
import com.boxofficeintel.daily.output.RawRecordStore;
import com.boxofficeintel.daily.service.CollectionOrchestrator;
import com.boxofficeintel.daily.service.FatalCollectionException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup collection.
 *
 * Default schedule: every day at 06:00 UTC, collecting everything up to yesterday. Dates already
 * stored or skipped are not fetched again, so each run only picks up the new day.
 *
 * Override with the boxoffice.scheduling.cron property.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CollectionScheduler {

    private final CollectionOrchestrator orchestrator;
    private final RawRecordStore store;
    private final FeatureTableWriter featureTableWriter;
    private final BoxOfficeProperties properties;

    @PostConstruct
    public void onStartup() {
        store.ensureSchema();
        featureTableWriter.ensureSchema();

        if (properties.getScheduling().isRunOnStartup()) {
            log.info("run-on-startup enabled, collecting configured range");
            runCollection("startup");
        } else {
            log.info("Collector ready. Next scheduled run: {}", properties.getScheduling().getCron());
        }
    }

    @Scheduled(cron = "${boxoffice.scheduling.cron:0 0 6 * * ?}", zone = "UTC")
    public void scheduledCollection() {
        log.info("Scheduled collection triggered");
        runCollection("schedule");
    }

    private void runCollection(String trigger) {
        if (orchestrator.isRunning()) {
            log.warn("Skipping {} collection: a run is already in progress", trigger);
            return;
        }
        try {
            orchestrator.collectConfiguredRange(trigger);
        } catch (FatalCollectionException e) {
            log.error("{} collection halted, operator action needed: {}", trigger, e.getMessage());
        } catch (Exception e) {
            log.error("{} collection failed: {}", trigger, e.getMessage(), e);
        }
    }
}
