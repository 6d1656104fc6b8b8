package reaper.cleanup;

import reaper.model.Replica;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Worker-local record of which successes have been removed from the catalog and
 * which are still pending.
 *
 * <p>Not thread-safe; a progress instance belongs to a single batch.
 */
public final class CleanupProgress {
    private final List<Replica> pending = new ArrayList<>();
    private final List<Integer> commitSizes = new ArrayList<>();
    private int finalFlushSize;
    private int totalSuccesses;

    void addPending(List<Replica> successes) {
        pending.addAll(successes);
        totalSuccesses += successes.size();
    }

    List<Replica> peekPending(int count) {
        return List.copyOf(pending.subList(0, Math.min(count, pending.size())));
    }

    void removeCommitted(int count) {
        pending.subList(0, count).clear();
    }

    void recordCommit(int size) {
        commitSizes.add(size);
    }

    void recordFinalFlush(int size) {
        finalFlushSize = size;
    }

    /** Successes not yet removed from the catalog, oldest first. */
    public List<Replica> pending() {
        return List.copyOf(pending);
    }

    public int pendingCount() {
        return pending.size();
    }

    /** Sizes of the catalog deletes issued while the batch was processed. */
    public List<Integer> commitSizes() {
        return Collections.unmodifiableList(commitSizes);
    }

    public int finalFlushSize() {
        return finalFlushSize;
    }

    /** Rows removed from the catalog so far, including the final flush. */
    public int committedCount() {
        return commitSizes.stream().mapToInt(Integer::intValue).sum() + finalFlushSize;
    }

    public int totalSuccesses() {
        return totalSuccesses;
    }
}
