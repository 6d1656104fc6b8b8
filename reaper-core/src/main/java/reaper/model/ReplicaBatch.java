package reaper.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, immutable set of replicas claimed by a single selector call.
 *
 * <p>A batch belongs to exactly one worker. {@code claimedAt} is the lease stamp
 * written to every row in the batch.
 */
public record ReplicaBatch(String rseId, List<Replica> replicas, Instant claimedAt) {

  public ReplicaBatch {
    Objects.requireNonNull(rseId, "rseId");
    Objects.requireNonNull(claimedAt, "claimedAt");
    replicas = List.copyOf(Objects.requireNonNull(replicas, "replicas"));
  }

  public static ReplicaBatch empty(String rseId, Instant claimedAt) {
    return new ReplicaBatch(rseId, List.of(), claimedAt);
  }

  public boolean isEmpty() {
    return replicas.isEmpty();
  }

  public int size() {
    return replicas.size();
  }

  public List<ReplicaRef> refs() {
    return replicas.stream().map(Replica::ref).toList();
  }
}
