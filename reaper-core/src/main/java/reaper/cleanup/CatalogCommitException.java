package reaper.cleanup;

import reaper.ReaperException;
import reaper.model.BatchReport;
import reaper.model.Replica;

import java.util.List;

/**
 * Raised when succeeded replicas could not be removed from the catalog.
 *
 * <p>Unlike deletion or refresh failures this one is never absorbed: the physical copies
 * are gone, so the rows left behind are dangling references. The exception keeps what
 * was committed and what was not, so the caller can retry {@link #uncommitted()}.
 */
public final class CatalogCommitException extends ReaperException {
    private final int committedCount;
    private final transient List<Replica> uncommitted;
    private final transient BatchReport report;

    public CatalogCommitException(String message, Throwable cause, int committedCount,
                                  List<Replica> uncommitted, BatchReport report) {
        super(message, cause);
        this.committedCount = committedCount;
        this.uncommitted = List.copyOf(uncommitted);
        this.report = report;
    }

    /** Succeeded replicas of the batch removed from the catalog before the failure. */
    public int committedCount() {
        return committedCount;
    }

    /** Succeeded replicas still referenced by the catalog. */
    public List<Replica> uncommitted() {
        return uncommitted;
    }

    /** Batch state at the time of the failure, or {@code null} if raised outside a worker. */
    public BatchReport report() {
        return report;
    }
}
