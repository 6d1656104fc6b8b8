package reaper.worker;

import reaper.ReaperConfig;
import reaper.cleanup.CatalogCleaner;
import reaper.cleanup.CatalogCommitException;
import reaper.cleanup.CleanupCommitter;
import reaper.cleanup.CleanupCommitters;
import reaper.cleanup.CleanupProgress;
import reaper.model.BatchReport;
import reaper.model.DeletionOutcome;
import reaper.model.Replica;
import reaper.model.ReplicaBatch;
import reaper.model.ReplicaRef;
import reaper.refresh.LeaseRefresher;
import reaper.spi.MetricsExporter;
import reaper.spi.PhysicalDeleter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives physical deletion of one claimed batch.
 *
 * <p>Replicas are processed strictly in batch order, in sub-chunks of
 * {@link ReaperConfig#deletionChunkSize()}. After every sub-chunk the worker
 * <ol>
 *   <li>hands the sub-chunk's successes to the {@link CleanupCommitter}, then</li>
 *   <li>asks the {@link LeaseRefresher} whether the leases on the replicas not yet
 *       processed need extending, measured from the last successful stamp.</li>
 * </ol>
 *
 * <p>A failed deletion never aborts the batch: the replica keeps its lease, is not retried
 * here, and becomes claimable again once the lease expires. A failed catalog commit does
 * abort the batch with a {@link CatalogCommitException}, since deleting more data would
 * only grow the set of dangling catalog rows.
 *
 * <p>Instances are stateless between batches and may be reused; a single batch is always
 * processed on the calling thread.
 */
public final class DeletionWorker {
    private static final Logger logger = Logger.getLogger(DeletionWorker.class.getName());

    private final PhysicalDeleter deleter;
    private final LeaseRefresher refresher;
    private final CatalogCleaner catalogCleaner;
    private final Clock clock;
    private final MetricsExporter metrics;

    public DeletionWorker(PhysicalDeleter deleter, LeaseRefresher refresher, CatalogCleaner catalogCleaner,
                          Clock clock, MetricsExporter metrics) {
        this.deleter = Objects.requireNonNull(deleter, "deleter");
        this.refresher = Objects.requireNonNull(refresher, "refresher");
        this.catalogCleaner = Objects.requireNonNull(catalogCleaner, "catalogCleaner");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    }

    /**
     * Processes {@code batch} with the committer selected by {@code config}.
     */
    public BatchReport process(ReplicaBatch batch, ReaperConfig config) {
        Objects.requireNonNull(config, "config");
        return process(batch, config, CleanupCommitters.forConfig(config, catalogCleaner));
    }

    /**
     * Processes {@code batch}, feeding successes to {@code committer}.
     *
     * @return the batch report; in deferred mode {@link BatchReport#remainder()} lists the
     *         successes the caller still has to remove from the catalog
     * @throws CatalogCommitException if the committer fails to remove rows
     */
    public BatchReport process(ReplicaBatch batch, ReaperConfig config, CleanupCommitter committer) {
        Objects.requireNonNull(batch, "batch");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(committer, "committer");

        String rseId = batch.rseId();
        List<Replica> replicas = batch.replicas();
        int subChunk = config.deletionChunkSize();
        logger.log(Level.INFO, "Reaping batch rse={0} size={1} mode={2} config={3}",
                new Object[]{rseId, replicas.size(), config.mode(), config});

        Tally tally = new Tally(replicas.size());
        Instant leaseStampedAt = batch.claimedAt();
        // Lease stamp of the oldest success not yet removed from the catalog
        Instant oldestPendingStamp = null;

        for (int from = 0; from < replicas.size(); from += subChunk) {
            int to = Math.min(from + subChunk, replicas.size());
            List<Replica> successes = deleteChunk(replicas.subList(from, to), tally);

            int flushed;
            try {
                flushed = committer.commit(successes);
            } catch (CatalogCommitException e) {
                throw abort(batch, committer, tally, e);
            }
            CleanupProgress progress = committer.progress();
            if (progress.pendingCount() == 0) {
                oldestPendingStamp = null;
            } else if (flushed > 0 || oldestPendingStamp == null) {
                // After a flush only this chunk's successes can still be pending
                oldestPendingStamp = leaseStampedAt;
            }

            List<ReplicaRef> outstanding = refs(replicas.subList(to, replicas.size()));
            Duration elapsed = Duration.between(leaseStampedAt, clock.instant());
            Optional<Instant> stamped = refresher.refreshIfDue(rseId, elapsed, outstanding, config);
            if (stamped.isPresent()) {
                tally.refreshes++;
                leaseStampedAt = stamped.get();
            }
        }

        checkPendingLeases(rseId, committer.progress(), oldestPendingStamp, config);

        List<Replica> remainder;
        try {
            remainder = committer.finish();
        } catch (CatalogCommitException e) {
            throw abort(batch, committer, tally, e);
        }

        BatchReport report = tally.toReport(rseId, committer.progress(), remainder);
        logger.log(Level.INFO,
                "Reaped batch rse={0} processed={1} succeeded={2} failed={3} immediateCommitted={4} remainder={5} refreshes={6}",
                new Object[]{rseId, report.processed(), report.succeeded(), report.failed(),
                        report.immediateCommitted(), report.remainderCount(), report.refreshes()});
        return report;
    }

    private List<Replica> deleteChunk(List<Replica> chunk, Tally tally) {
        List<Replica> successes = new ArrayList<>(chunk.size());
        for (Replica replica : chunk) {
            DeletionOutcome outcome = deleteOne(replica);
            tally.outcomes.add(outcome);
            if (outcome.succeeded()) {
                successes.add(replica);
                tally.bytes += replica.bytes();
            }
        }
        return successes;
    }

    private DeletionOutcome deleteOne(Replica replica) {
        try {
            if (deleter.delete(replica)) {
                metrics.incrementDeletionSuccess();
                metrics.addBytesReclaimed(replica.bytes());
                return DeletionOutcome.succeeded(replica);
            }
            metrics.incrementDeletionFailure();
            logger.log(Level.WARNING, "Physical deletion of {0} reported failure; lease left to expire",
                    replica.ref());
            return DeletionOutcome.failed(replica, "deletion not confirmed by storage endpoint");
        } catch (RuntimeException e) {
            metrics.incrementDeletionFailure();
            logger.log(Level.WARNING, "Physical deletion of " + replica.ref() + " failed; lease left to expire", e);
            return DeletionOutcome.failed(replica, e.getMessage());
        }
    }

    private void checkPendingLeases(String rseId, CleanupProgress progress, Instant oldestPendingStamp,
                                    ReaperConfig config) {
        if (oldestPendingStamp == null || progress.pendingCount() == 0) {
            return;
        }
        Duration age = Duration.between(oldestPendingStamp, clock.instant());
        if (age.compareTo(config.leaseDuration()) > 0) {
            logger.log(Level.SEVERE,
                    "Lease on {0} deleted but uncommitted replicas at rse={1} expired {2} ms ago; "
                            + "other workers may re-claim them",
                    new Object[]{progress.pendingCount(), rseId, age.minus(config.leaseDuration()).toMillis()});
        }
    }

    private CatalogCommitException abort(ReplicaBatch batch, CleanupCommitter committer, Tally tally,
                                         CatalogCommitException cause) {
        CleanupProgress progress = committer.progress();
        BatchReport partial = tally.toReport(batch.rseId(), progress, List.of());
        logger.log(Level.SEVERE, "Aborting batch at rse=" + batch.rseId() + " after " + partial.processed() +
                " of " + batch.size() + " replicas: " + progress.pendingCount() +
                " deleted replicas are still in the catalog", cause);
        return new CatalogCommitException(cause.getMessage(), cause.getCause(),
                cause.committedCount(), cause.uncommitted(), partial);
    }

    private static List<ReplicaRef> refs(List<Replica> replicas) {
        List<ReplicaRef> refs = new ArrayList<>(replicas.size());
        for (Replica replica : replicas) {
            refs.add(replica.ref());
        }
        return refs;
    }

    private static final class Tally {
        final int claimed;
        final List<DeletionOutcome> outcomes;
        long bytes;
        int refreshes;

        Tally(int claimed) {
            this.claimed = claimed;
            this.outcomes = new ArrayList<>(claimed);
        }

        BatchReport toReport(String rseId, CleanupProgress progress, List<Replica> remainder) {
            int succeeded = (int) outcomes.stream().filter(DeletionOutcome::succeeded).count();
            return new BatchReport(rseId, claimed, outcomes.size(), succeeded, outcomes.size() - succeeded,
                    progress.commitSizes(), progress.finalFlushSize(), remainder, refreshes, bytes, outcomes);
        }
    }
}
