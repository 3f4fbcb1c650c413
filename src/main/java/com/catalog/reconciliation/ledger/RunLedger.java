package com.catalog.reconciliation.ledger;

import com.catalog.reconciliation.core.model.CollectionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Accumulates the outcome of one reconciliation run across collections.
 *
 * <p>Starts {@link RunStatus#IN_PROGRESS}. Each reconciled record increments exactly one of
 * created, updated or archived; a skipped record only adds an error. {@link #finish()} fixes
 * the terminal status and returns an immutable {@link RunReport}:</p>
 * <ul>
 *   <li>{@code FAILED} if every collection has an error, whether skipped records or a failed step,</li>
 *   <li>{@code SUCCESS} if no collection has any error,</li>
 *   <li>{@code PARTIAL} otherwise.</li>
 * </ul>
 *
 * <p>Thread-safe: collections reconciled concurrently report into the same ledger.</p>
 */
public class RunLedger {
    private static final Logger log = LoggerFactory.getLogger(RunLedger.class);

    private final String runId;
    private final String source;
    private final String triggeredBy;
    private final Clock clock;
    private final Instant startedAt;
    private final Map<CollectionType, Tally> tallies = new EnumMap<>(CollectionType.class);
    private final List<String> issues = new ArrayList<>();
    private RunReport report;

    public RunLedger(String source, String triggeredBy) {
        this(UUID.randomUUID().toString(), source, triggeredBy, Clock.systemUTC());
    }

    public RunLedger(String runId, String source, String triggeredBy, Clock clock) {
        this.runId = runId;
        this.source = source;
        this.triggeredBy = triggeredBy;
        this.clock = clock;
        this.startedAt = clock.instant();
        log.info("run.started runId={} source={} triggeredBy={}", runId, source, triggeredBy);
    }

    /**
     * Registers a collection so it appears in the report even if it yields no records.
     */
    public synchronized void begin(CollectionType type) {
        tally(type);
    }

    public synchronized void recordCreated(CollectionType type) {
        tally(type).created++;
    }

    public synchronized void recordUpdated(CollectionType type) {
        tally(type).updated++;
    }

    public synchronized void recordArchived(CollectionType type) {
        tally(type).archived++;
    }

    /**
     * Records a skipped record. It does not count towards any other counter.
     */
    public synchronized void recordError(CollectionType type, Object record, String reason) {
        tally(type).errors.add(new RecordError(record, reason));
        log.warn("run.record-error runId={} collection={} reason={}", runId, type.getKey(), reason);
    }

    /**
     * Marks a whole collection step as failed. Counters already recorded for it are discarded.
     */
    public synchronized void markFailed(CollectionType type, String reason) {
        Tally tally = tally(type);
        tally.created = 0;
        tally.updated = 0;
        tally.archived = 0;
        tally.failed = true;
        tally.errors.add(new RecordError(null, reason));
        log.error("run.collection-failed runId={} collection={} reason={}", runId, type.getKey(), reason);
    }

    /**
     * Adds a free-form, non-fatal issue (warning) to the report.
     */
    public synchronized void addIssue(String issue) {
        checkOpen();
        issues.add(issue);
    }

    public synchronized RunStatus getStatus() {
        return report != null ? report.status() : RunStatus.IN_PROGRESS;
    }

    public synchronized CollectionTally snapshot(CollectionType type) {
        Tally tally = tallies.get(type);
        return tally != null ? tally.freeze() : CollectionTally.empty();
    }

    public String getRunId() {
        return runId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public synchronized boolean isFinished() {
        return report != null;
    }

    /**
     * Finalizes the run. Later calls return the same report; later mutations fail.
     */
    public synchronized RunReport finish() {
        if (report != null) {
            return report;
        }
        Map<CollectionType, CollectionTally> perType = new EnumMap<>(CollectionType.class);
        tallies.forEach((type, tally) -> perType.put(type, tally.freeze()));

        report = new RunReport(runId, terminalStatus(perType), perType, startedAt, clock.instant(),
                issues, source, triggeredBy);
        log.info("run.finished {} durationMs={}", report, report.duration().toMillis());
        return report;
    }

    private static RunStatus terminalStatus(Map<CollectionType, CollectionTally> perType) {
        if (perType.isEmpty()) {
            return RunStatus.SUCCESS;
        }
        boolean allErrored = perType.values().stream().allMatch(CollectionTally::hasErrors);
        if (allErrored) {
            return RunStatus.FAILED;
        }
        boolean anyErrors = perType.values().stream().anyMatch(CollectionTally::hasErrors);
        return anyErrors ? RunStatus.PARTIAL : RunStatus.SUCCESS;
    }

    private Tally tally(CollectionType type) {
        checkOpen();
        return tallies.computeIfAbsent(type, t -> new Tally());
    }

    private void checkOpen() {
        if (report != null) {
            throw new IllegalStateException("Run " + runId + " is already finished");
        }
    }

    private static final class Tally {
        private int created;
        private int updated;
        private int archived;
        private boolean failed;
        private final List<RecordError> errors = new ArrayList<>();

        private CollectionTally freeze() {
            return new CollectionTally(created, updated, archived, errors, failed);
        }
    }
}
