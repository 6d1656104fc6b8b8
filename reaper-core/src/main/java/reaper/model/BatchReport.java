package reaper.model;

import java.util.List;
import java.util.Objects;

/**
 * Summary of one processed batch.
 *
 * <p>In deferred cleanup mode {@code remainder} holds every successfully deleted
 * replica and nothing was removed from the catalog by the worker. In immediate mode
 * {@code incrementalCommitSizes} lists each threshold flush and {@code finalFlushed}
 * the size of the closing flush; {@code remainder} is then empty.
 *
 * @param rseId                  storage location the batch was claimed at
 * @param claimed                number of replicas in the batch
 * @param processed              number of replicas a deletion was attempted for
 * @param succeeded              physical deletions that succeeded
 * @param failed                 physical deletions that failed
 * @param incrementalCommitSizes sizes of catalog deletes issued while processing
 * @param finalFlushed           rows removed by the closing flush (immediate mode)
 * @param remainder              successes handed back to the caller (deferred mode)
 * @param refreshes              lease refreshes issued during the batch
 * @param bytesReclaimed         sum of {@code bytes} over succeeded replicas
 * @param outcomes               per-replica outcomes in processing order
 */
public record BatchReport(
    String rseId,
    int claimed,
    int processed,
    int succeeded,
    int failed,
    List<Integer> incrementalCommitSizes,
    int finalFlushed,
    List<Replica> remainder,
    int refreshes,
    long bytesReclaimed,
    List<DeletionOutcome> outcomes
) {

  public BatchReport {
    Objects.requireNonNull(rseId, "rseId");
    incrementalCommitSizes = List.copyOf(incrementalCommitSizes);
    remainder = List.copyOf(remainder);
    outcomes = List.copyOf(outcomes);
  }

  public static BatchReport empty(String rseId) {
    return new BatchReport(rseId, 0, 0, 0, 0, List.of(), 0, List.of(), 0, 0L, List.of());
  }

  /** Rows removed from the catalog by threshold flushes while processing. */
  public int immediateCommitted() {
    return incrementalCommitSizes.stream().mapToInt(Integer::intValue).sum();
  }

  /** Successes not covered by threshold flushes: the closing flush or the returned list. */
  public int remainderCount() {
    return finalFlushed + remainder.size();
  }

  /** Rows the worker itself removed from the catalog. */
  public int committedByWorker() {
    return immediateCommitted() + finalFlushed;
  }
}
