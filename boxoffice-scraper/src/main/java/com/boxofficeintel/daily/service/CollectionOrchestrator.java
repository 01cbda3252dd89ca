package com.boxofficeintel.daily.service;

import com.boxofficeintel.daily.config.BoxOfficeProperties;
import com.boxofficeintel.daily.model.CollectionCheckpoint;
import com.boxofficeintel.daily.model.CollectionRun;
import com.boxofficeintel.daily.output.CheckpointRepository;
import com.boxofficeintel.daily.output.RawRecordStore;
import com.boxofficeintel.daily.service.dates.DateSelectionPolicies;
import com.boxofficeintel.daily.service.dates.DateSelectionPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Drives a collection run over a date range.
 *
 * Each selected date goes PENDING, FETCHING, then STORED or SKIPPED. A date is fetched unless the
 * store already holds it as STORED (or as SKIPPED, outside a retry), so a rerun resumes at the
 * first unfinished date and an earlier or denser range is backfilled. The checkpoint is written in
 * the same transaction as the date's outcome and carries the failure count across runs. Too many
 * failed dates in a row halt the run without recording the date that tripped the breaker.
 * Cancellation and thread interrupts are honoured between dates.
 *
 * Only one run (collection or aggregation) executes at a time. The start* methods claim the run
 * slot before returning, so a cancel sent right after them is never lost.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CollectionOrchestrator {

    private final DailyReportFetcher fetcher;
    private final RawRecordStore store;
    private final CheckpointRepository checkpointRepository;
    private final FeatureAggregationService aggregationService;
    private final BoxOfficeProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    private volatile LocalDate currentDate;
    private volatile CollectionState currentState;
    private volatile CollectionReport lastReport;

    /**
     * Collect the configured range: collection.start-date through collection.end-date, or
     * through yesterday when no end date is configured.
     */
    public CollectionReport collectConfiguredRange(String trigger) {
        return collect(properties.getCollection().getStartDate(), configuredEnd(), trigger);
    }

    /**
     * @throws FatalCollectionException when the circuit breaker trips or the checkpoint is corrupt
     * @throws IllegalStateException    when another run is in progress
     */
    public CollectionReport collect(LocalDate start, LocalDate end, String trigger) {
        List<LocalDate> dates = selectDates(start, end, trigger);
        return exclusively(() -> run(trigger, start, end, dates, false));
    }

    /**
     * Re-attempt every date previously marked SKIPPED, oldest first. Dates that fail again stay
     * SKIPPED and count towards the circuit breaker.
     */
    public CollectionReport retrySkipped() {
        return exclusively(this::runRetry);
    }

    /**
     * Rebuild the feature table from the raw store without fetching anything.
     */
    public AggregationSummary aggregateOnly() {
        return exclusively(aggregationService::aggregateAll);
    }

    /**
     * Collect on a background thread. Null start and end mean the configured range.
     *
     * @return false when another run holds the slot
     * @throws IllegalArgumentException when the range is inverted or only half given
     */
    public boolean startCollect(LocalDate start, LocalDate end, String trigger) {
        if ((start == null) != (end == null)) {
            throw new IllegalArgumentException("start and end must be given together");
        }
        LocalDate from = start != null ? start : properties.getCollection().getStartDate();
        LocalDate to = end != null ? end : configuredEnd();
        List<LocalDate> dates = selectDates(from, to, trigger);
        return inBackground(trigger + "-collect", () -> run(trigger, from, to, dates, false));
    }

    public boolean startRetrySkipped() {
        return inBackground("retry-skipped", this::runRetry);
    }

    public boolean startAggregateOnly() {
        return inBackground("aggregate", aggregationService::aggregateAll);
    }

    /** Request cancellation; the current date finishes first. */
    public boolean cancel() {
        if (!running.get()) {
            return false;
        }
        log.info("Cancellation requested");
        cancelRequested.set(true);
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }

    public CollectionReport lastReport() {
        return lastReport;
    }

    public Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("running", running.get());
        status.put("currentDate", currentDate);
        status.put("currentState", currentState);
        try {
            CollectionCheckpoint checkpoint = checkpointRepository.load();
            status.put("lastCompletedDate", checkpoint.lastCompletedDate());
            status.put("consecutiveFailures", checkpoint.consecutiveFailureCount());
        } catch (CheckpointCorruptionException e) {
            status.put("checkpointError", e.getMessage());
        }
        status.put("store", store.summary());
        status.put("lastReport", lastReport);
        return status;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<LocalDate> selectDates(LocalDate start, LocalDate end, String trigger) {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Range end " + end + " is before start " + start);
        }
        DateSelectionPolicy policy = DateSelectionPolicies.fromConfig(properties.getCollection());
        log.info("Collection requested for {} to {} ({} policy, trigger={})", start, end, policy.name(), trigger);
        return policy.select(start, end);
    }

    private LocalDate configuredEnd() {
        LocalDate end = properties.getCollection().getEndDate();
        return end != null ? end : LocalDate.now(clock).minusDays(1);
    }

    private CollectionReport runRetry() {
        List<LocalDate> skipped = store.skippedDates();
        if (skipped.isEmpty()) {
            log.info("No skipped dates to retry");
        }
        LocalDate first = skipped.isEmpty() ? null : skipped.get(0);
        LocalDate last = skipped.isEmpty() ? null : skipped.get(skipped.size() - 1);
        return run("retry-skipped", first, last, skipped, true);
    }

    private <T> T exclusively(Supplier<T> work) {
        if (!tryAcquire()) {
            throw new IllegalStateException("A collection run is already in progress");
        }
        try {
            return work.get();
        } finally {
            release();
        }
    }

    private boolean inBackground(String threadName, Supplier<?> work) {
        if (!tryAcquire()) {
            return false;
        }
        new Thread(() -> {
            try {
                work.get();
            } catch (FatalCollectionException e) {
                log.error("{} halted, operator action needed: {}", threadName, e.getMessage());
            } catch (RuntimeException e) {
                log.error("{} failed: {}", threadName, e.getMessage(), e);
            } finally {
                release();
            }
        }, threadName).start();
        return true;
    }

    private boolean tryAcquire() {
        if (!running.compareAndSet(false, true)) {
            return false;
        }
        cancelRequested.set(false);
        return true;
    }

    private void release() {
        currentDate = null;
        running.set(false);
    }

    private CollectionReport run(String trigger, LocalDate start, LocalDate end,
                                 List<LocalDate> dates, boolean retryingSkipped) {
        Progress progress = new Progress(UUID.randomUUID().toString(), start, end, dates.size());
        CollectionRun runLog = CollectionRun.builder()
                .runId(progress.runId)
                .trigger(trigger)
                .rangeStart(start)
                .rangeEnd(end)
                .startedAt(LocalDateTime.now(clock))
                .status("RUNNING")
                .build();
        store.writeRun(runLog);

        try {
            CollectionCheckpoint checkpoint = loadCheckpoint();
            log.info("Run {}: {} dates selected, checkpoint at {} ({} consecutive failures)",
                    progress.runId, dates.size(), checkpoint.lastCompletedDate(),
                    checkpoint.consecutiveFailureCount());

            CollectionState outcome = CollectionState.COLLECTED;
            for (LocalDate date : dates) {
                if (cancelRequested.get() || Thread.currentThread().isInterrupted()) {
                    log.info("Run {} cancelled before {}", progress.runId, date);
                    outcome = CollectionState.CANCELLED;
                    break;
                }
                if (store.has(date) || (!retryingSkipped && store.isSkipped(date))) {
                    progress.alreadyCollected++;
                    continue;
                }
                checkpoint = processDate(date, checkpoint, progress);
            }

            AggregationSummary aggregation = null;
            if (outcome == CollectionState.COLLECTED && properties.getCollection().isAggregateOnCompletion()) {
                aggregation = aggregationService.aggregateAll();
            }

            CollectionReport report = progress.toReport(outcome, aggregation, null);
            finish(runLog, report, outcome.name());
            log.info("Run {} finished {}: {} stored, {} skipped, {} already collected",
                    progress.runId, outcome, report.datesStored(), report.datesSkipped(),
                    report.datesAlreadyCollected());
            return report;

        } catch (CollectionInterruptedException e) {
            log.warn("Run {} interrupted: {}", progress.runId, e.getMessage());
            CollectionReport report = progress.toReport(CollectionState.CANCELLED, null, e.getMessage());
            finish(runLog, report, CollectionState.CANCELLED.name());
            return report;

        } catch (FatalCollectionException e) {
            log.error("Run {} halted: {}", progress.runId, e.getMessage());
            finish(runLog, progress.toReport(CollectionState.HALTED, null, e.getMessage()), "HALTED");
            throw e;
        } catch (RuntimeException e) {
            log.error("Run {} failed: {}", progress.runId, e.getMessage(), e);
            finish(runLog, progress.toReport(CollectionState.HALTED, null, e.getMessage()), "FAILED");
            throw e;
        }
    }

    private CollectionCheckpoint processDate(LocalDate date, CollectionCheckpoint checkpoint, Progress progress) {
        currentDate = date;
        currentState = CollectionState.FETCHING;

        FetchResult result = fetcher.fetchAndParse(date);

        if (result.isSuccess()) {
            ParsedReport report = result.report();
            CollectionCheckpoint next = checkpoint.afterSuccess(date);
            int stored = store.append(date, report.records(), report.rejects().size(), next);
            progress.datesStored++;
            progress.recordsStored += stored;
            progress.rejectedRows += report.rejects().size();
            currentState = CollectionState.STORED;
            log.info("{} stored: {} records, {} rejected rows", date, stored, report.rejects().size());
            return next;
        }

        FetchError error = result.error();
        if (Thread.currentThread().isInterrupted()) {
            throw new CollectionInterruptedException("Interrupted while fetching " + date + ": " + error.reason());
        }
        CollectionCheckpoint next = checkpoint.afterSkip(date);
        int threshold = properties.getCollection().getFailureThreshold();
        if (next.consecutiveFailureCount() > threshold) {
            throw new SystemicBlockException(date, next.consecutiveFailureCount(), threshold);
        }

        store.markSkipped(date, error.reason(), next);
        progress.skipped.add(date);
        currentState = CollectionState.SKIPPED;
        log.warn("{} skipped after {} attempts ({} consecutive failures): {}",
                date, error.attempts(), next.consecutiveFailureCount(), error.reason());
        return next;
    }

    private CollectionCheckpoint loadCheckpoint() {
        try {
            return checkpointRepository.load();
        } catch (CheckpointCorruptionException e) {
            LocalDate resumeFrom = properties.getCollection().getResumeFrom();
            if (resumeFrom == null) {
                throw e;
            }
            log.warn("Checkpoint corrupt ({}); resuming from {} as configured", e.getMessage(), resumeFrom);
            checkpointRepository.reset(resumeFrom.minusDays(1));
            return checkpointRepository.load();
        }
    }

    private void finish(CollectionRun runLog, CollectionReport report, String status) {
        runLog.setCompletedAt(LocalDateTime.now(clock));
        runLog.setStatus(status);
        runLog.setDatesStored(report.datesStored());
        runLog.setDatesSkipped(report.datesSkipped());
        runLog.setRecordsStored(report.recordsStored());
        if (report.aggregation() != null) {
            runLog.setMoviesAggregated(report.aggregation().movies());
            runLog.setUnmatchedRecords(report.aggregation().unmatched());
        }
        runLog.setErrorMessage(report.errorMessage());
        store.writeRun(runLog);
        currentState = report.outcome();
        lastReport = report;
    }

    private static final class Progress {
        private final String runId;
        private final LocalDate start;
        private final LocalDate end;
        private final int selected;
        private final List<LocalDate> skipped = new ArrayList<>();
        private int alreadyCollected;
        private int datesStored;
        private int recordsStored;
        private int rejectedRows;

        private Progress(String runId, LocalDate start, LocalDate end, int selected) {
            this.runId = runId;
            this.start = start;
            this.end = end;
            this.selected = selected;
        }

        private CollectionReport toReport(CollectionState outcome, AggregationSummary aggregation, String error) {
            return new CollectionReport(runId, start, end, outcome, selected, alreadyCollected,
                    datesStored, recordsStored, rejectedRows, skipped, aggregation, error);
        }
    }
}
