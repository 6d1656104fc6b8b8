package reaper.cleanup;

import reaper.model.Replica;

import java.util.List;
import java.util.Objects;

/**
 * Removes successes from the catalog in slices of exactly {@code dbBatchSize} as soon as
 * that many are pending, and flushes the smaller remainder in {@link #finish()}.
 *
 * <p>No single catalog delete exceeds {@code dbBatchSize} rows. On failure the pending
 * set is kept intact and a {@link CatalogCommitException} reports what was and was not
 * committed.
 */
public final class IncrementalCleanupCommitter implements CleanupCommitter {
    private final CatalogCleaner catalogCleaner;
    private final int dbBatchSize;
    private final CleanupProgress progress = new CleanupProgress();

    public IncrementalCleanupCommitter(CatalogCleaner catalogCleaner, int dbBatchSize) {
        this.catalogCleaner = Objects.requireNonNull(catalogCleaner, "catalogCleaner");
        if (dbBatchSize <= 0) {
            throw new IllegalArgumentException("dbBatchSize must be > 0");
        }
        this.dbBatchSize = dbBatchSize;
    }

    @Override
    public int commit(List<Replica> successes) {
        progress.addPending(successes);
        int committed = 0;
        while (progress.pendingCount() >= dbBatchSize) {
            List<Replica> slice = progress.peekPending(dbBatchSize);
            delete(slice);
            progress.removeCommitted(slice.size());
            progress.recordCommit(slice.size());
            committed += slice.size();
        }
        return committed;
    }

    @Override
    public List<Replica> finish() {
        int remainder = progress.pendingCount();
        if (remainder > 0) {
            delete(progress.peekPending(remainder));
            progress.removeCommitted(remainder);
            progress.recordFinalFlush(remainder);
        }
        return List.of();
    }

    private void delete(List<Replica> slice) {
        try {
            catalogCleaner.deleteRows(slice);
        } catch (RuntimeException e) {
            throw new CatalogCommitException(
                    "Catalog delete of " + slice.size() + " replicas failed",
                    e, progress.committedCount(), progress.pending(), null);
        }
    }

    @Override
    public CleanupProgress progress() {
        return progress;
    }

    @Override
    public boolean immediate() {
        return true;
    }
}
