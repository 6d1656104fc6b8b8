package reaper;

import reaper.model.Replica;
import reaper.model.ReplicaRef;
import reaper.model.ReplicaState;
import reaper.spi.ReplicaStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory lease table for unit tests that don't need real JDBC. Records every
 * refresh and delete call and can be told to fail them.
 */
public class StubReplicaStore implements ReplicaStore {
  public static final String SCOPE = "user.test";

  private final Map<ReplicaRef, Replica> rows = new LinkedHashMap<>();
  public final List<List<ReplicaRef>> refreshCalls = new ArrayList<>();
  public final List<List<ReplicaRef>> deleteCalls = new ArrayList<>();
  public final AtomicInteger refreshFailures = new AtomicInteger();
  public final AtomicInteger deleteFailures = new AtomicInteger();
  /** Delete calls that succeed before {@link #deleteFailures} starts counting down. */
  public final AtomicInteger deletesBeforeFailure = new AtomicInteger();
  public volatile boolean failClaims;

  public synchronized List<Replica> seed(String rseId, int count, Instant updatedAt) {
    List<Replica> seeded = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      ReplicaRef ref = new ReplicaRef(SCOPE, String.format("file-%04d", i), rseId);
      Replica replica = new Replica(ref, ReplicaState.AVAILABLE, updatedAt, 1024L, "/data/" + ref.name());
      rows.put(ref, replica);
      seeded.add(replica);
    }
    return seeded;
  }

  public synchronized void put(Replica replica) {
    rows.put(replica.ref(), replica);
  }

  public synchronized Replica row(ReplicaRef ref) {
    return rows.get(ref);
  }

  public synchronized List<Replica> rows() {
    return List.copyOf(rows.values());
  }

  public synchronized int size() {
    return rows.size();
  }

  public synchronized List<ReplicaRef> deletedRefs() {
    List<ReplicaRef> all = new ArrayList<>();
    deleteCalls.forEach(all::addAll);
    return all;
  }

  @Override
  public synchronized List<Replica> claimBatch(Connection conn, String rseId, String claimToken,
      Instant now, Instant leaseExpiry, int limit) {
    if (failClaims) {
      throw new IllegalStateException("claim unavailable");
    }
    List<Replica> eligible = rows.values().stream()
        .filter(r -> r.rseId().equals(rseId))
        .filter(r -> r.state() == ReplicaState.AVAILABLE
            || (r.state() == ReplicaState.BEING_DELETED && r.updatedAt().isBefore(leaseExpiry)))
        .sorted(Comparator.comparing(Replica::updatedAt)
            .thenComparing(Replica::scope)
            .thenComparing(Replica::name))
        .limit(limit)
        .toList();
    List<Replica> claimed = new ArrayList<>(eligible.size());
    for (Replica replica : eligible) {
      Replica leased = replica.withLease(ReplicaState.BEING_DELETED, now);
      rows.put(leased.ref(), leased);
      claimed.add(leased);
    }
    claimed.sort(Comparator.comparing(Replica::scope).thenComparing(Replica::name));
    return claimed;
  }

  @Override
  public synchronized int refreshLeases(Connection conn, String rseId, List<ReplicaRef> refs, Instant now) {
    if (refreshFailures.get() > 0) {
      refreshFailures.decrementAndGet();
      throw new IllegalStateException("refresh unavailable");
    }
    refreshCalls.add(List.copyOf(refs));
    int touched = 0;
    for (ReplicaRef ref : refs) {
      Replica row = rows.get(ref);
      if (row != null && row.rseId().equals(rseId) && row.state() == ReplicaState.BEING_DELETED) {
        rows.put(ref, row.withLease(ReplicaState.BEING_DELETED, now));
        touched++;
      }
    }
    return touched;
  }

  @Override
  public synchronized int deleteReplicas(Connection conn, List<ReplicaRef> refs) {
    if (deletesBeforeFailure.get() > 0) {
      deletesBeforeFailure.decrementAndGet();
    } else if (deleteFailures.get() > 0) {
      deleteFailures.decrementAndGet();
      throw new IllegalStateException("catalog unavailable");
    }
    deleteCalls.add(List.copyOf(refs));
    int deleted = 0;
    for (ReplicaRef ref : refs) {
      if (rows.remove(ref) != null) {
        deleted++;
      }
    }
    return deleted;
  }

  @Override
  public synchronized Optional<Replica> findReplica(Connection conn, ReplicaRef ref) {
    return Optional.ofNullable(rows.get(ref));
  }
}
