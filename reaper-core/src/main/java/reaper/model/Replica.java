package reaper.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Read-only view of a catalog row, as returned by the lease store when claiming.
 *
 * <p>{@code bytes} and {@code path} are opaque to the reaper and only handed to the
 * {@link reaper.spi.PhysicalDeleter}. {@code updatedAt} is the last lease stamp.
 *
 * @see reaper.spi.ReplicaStore#claimBatch
 */
public record Replica(
    ReplicaRef ref,
    ReplicaState state,
    Instant updatedAt,
    long bytes,
    String path
) {

  public Replica {
    Objects.requireNonNull(ref, "ref");
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(updatedAt, "updatedAt");
    if (bytes < 0) {
      throw new IllegalArgumentException("bytes must be >= 0");
    }
  }

  public String scope() {
    return ref.scope();
  }

  public String name() {
    return ref.name();
  }

  public String rseId() {
    return ref.rseId();
  }

  /** Returns a copy with a new state and lease stamp. */
  public Replica withLease(ReplicaState newState, Instant stampedAt) {
    return new Replica(ref, newState, stampedAt, bytes, path);
  }
}
