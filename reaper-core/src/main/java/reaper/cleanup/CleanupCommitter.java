package reaper.cleanup;

import reaper.model.Replica;

import java.util.List;

/**
 * Decides when successfully deleted replicas are removed from the catalog.
 *
 * <p>The worker calls {@link #commit} after every sub-chunk and {@link #finish} once at
 * the end of the batch. A committer instance is bound to one batch.
 *
 * @see DeferredCleanupCommitter
 * @see IncrementalCleanupCommitter
 * @see CleanupCommitters
 */
public interface CleanupCommitter {

    /**
     * Accepts newly succeeded replicas.
     *
     * @param successes replicas whose physical copy was deleted, in processing order
     * @return the number of rows removed from the catalog by this call
     * @throws CatalogCommitException if a catalog delete fails
     */
    int commit(List<Replica> successes);

    /**
     * Ends the batch.
     *
     * @return successes the caller still has to remove from the catalog
     * @throws CatalogCommitException if the final catalog delete fails
     */
    List<Replica> finish();

    CleanupProgress progress();

    /** Whether this committer removes rows while the batch is processed. */
    boolean immediate();
}
