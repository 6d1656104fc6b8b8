package reaper.cleanup;

import reaper.model.Replica;

import java.util.List;

/**
 * Keeps every success and touches the catalog not at all; {@link #finish()} hands the
 * full list back to the caller, which performs the delete.
 */
public final class DeferredCleanupCommitter implements CleanupCommitter {
    private final CleanupProgress progress = new CleanupProgress();

    @Override
    public int commit(List<Replica> successes) {
        progress.addPending(successes);
        return 0;
    }

    @Override
    public List<Replica> finish() {
        return progress.pending();
    }

    @Override
    public CleanupProgress progress() {
        return progress;
    }

    @Override
    public boolean immediate() {
        return false;
    }
}
